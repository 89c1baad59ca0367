package com.snuffles.pricewatch.service;

import java.math.BigDecimal;

public record HoldingsSummary(
    BigDecimal totalCost,
    BigDecimal totalValue,
    BigDecimal totalProfit,
    BigDecimal totalProfitRate,
    int count
) {

    public static HoldingsSummary empty() {
        return new HoldingsSummary(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0);
    }
}
