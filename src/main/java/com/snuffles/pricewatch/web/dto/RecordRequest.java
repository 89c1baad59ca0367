package com.snuffles.pricewatch.web.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class RecordRequest {
    private BigDecimal price;
    private BigDecimal buyPrice;
    private BigDecimal profit;
    private String note;
}
