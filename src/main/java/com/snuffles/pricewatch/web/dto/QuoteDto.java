package com.snuffles.pricewatch.web.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
public class QuoteDto {
    private String code;
    private String name;
    private BigDecimal price;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal previousClose;
    private BigDecimal change;
    private BigDecimal changePercent;
    private Instant timestamp;
    private String timeStr;
    private String source;
}
