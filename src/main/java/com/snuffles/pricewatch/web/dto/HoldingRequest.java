package com.snuffles.pricewatch.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class HoldingRequest {

    @NotBlank
    private String code;

    @NotNull
    private BigDecimal costPrice;

    @NotNull
    private BigDecimal shares;

    private String note;
}
