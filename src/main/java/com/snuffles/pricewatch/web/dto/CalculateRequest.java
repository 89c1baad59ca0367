package com.snuffles.pricewatch.web.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CalculateRequest {

    @NotNull
    private BigDecimal buyPrice;

    private BigDecimal currentPrice;
}
