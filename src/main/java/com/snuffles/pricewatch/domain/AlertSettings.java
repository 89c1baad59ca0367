package com.snuffles.pricewatch.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertSettings {
    @Builder.Default
    BigDecimal high = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal low = BigDecimal.ZERO;
    boolean enabled;
    @Builder.Default
    @JsonAlias("trading_events_enabled")
    boolean tradingEventsEnabled = true;

    public static AlertSettings defaults() {
        return AlertSettings.builder().build();
    }
}
