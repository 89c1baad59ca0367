package com.snuffles.pricewatch.web.dto;

import lombok.Data;

@Data
public class PriceDto {
    private QuoteDto quote;
    private PriceSummaryDto summary;
}
