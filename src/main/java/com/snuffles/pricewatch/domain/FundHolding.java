package com.snuffles.pricewatch.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class FundHolding {
    String code;
    String name;
    @JsonAlias("cost_price")
    BigDecimal costPrice;
    BigDecimal shares;
    String note;
}
