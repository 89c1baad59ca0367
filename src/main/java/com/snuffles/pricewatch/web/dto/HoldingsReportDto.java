package com.snuffles.pricewatch.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class HoldingsReportDto {

    private List<HoldingLineDto> holdings;
    private SummaryDto summary;
    private String lastUpdate;
    private boolean stale;

    @Data
    public static class SummaryDto {
        private BigDecimal totalCost;
        private BigDecimal totalValue;
        private BigDecimal totalProfit;
        private BigDecimal totalProfitRate;
        private int count;
    }
}
