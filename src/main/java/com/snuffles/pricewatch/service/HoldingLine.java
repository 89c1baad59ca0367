package com.snuffles.pricewatch.service;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One holding valued at the latest known fund price.
 */
@Value
@Builder
public class HoldingLine {
    String code;
    String name;
    BigDecimal costPrice;
    BigDecimal shares;
    String note;
    BigDecimal currentPrice;
    BigDecimal changePercent;
    BigDecimal costAmount;
    BigDecimal marketValue;
    BigDecimal profit;
    BigDecimal profitRate;
    String source;
    String timeStr;
}
