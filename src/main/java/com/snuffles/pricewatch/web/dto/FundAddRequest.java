package com.snuffles.pricewatch.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class FundAddRequest {

    @NotBlank
    private String code;
}
