package com.snuffles.pricewatch.web.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class HoldingLineDto {
    private String code;
    private String name;
    private BigDecimal costPrice;
    private BigDecimal shares;
    private String note;
    private BigDecimal currentPrice;
    private BigDecimal changePercent;
    private BigDecimal costAmount;
    private BigDecimal marketValue;
    private BigDecimal profit;
    private BigDecimal profitRate;
    private String source;
    private String timeStr;
}
