package com.snuffles.pricewatch.web.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class PriceSummaryDto {
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal average;
    private BigDecimal volatility;
    private int count;
}
