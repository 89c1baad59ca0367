package com.snuffles.pricewatch.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A price snapshot the user recorded by hand, with the buy price it was compared against.
 */
@Value
@Builder
@Jacksonized
public class ManualRecord {
    BigDecimal price;
    @JsonAlias("buy_price")
    BigDecimal buyPrice;
    BigDecimal profit;
    String note;
    Instant timestamp;
    @JsonAlias("time_str")
    String timeStr;
}
