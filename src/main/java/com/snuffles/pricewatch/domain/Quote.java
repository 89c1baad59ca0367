package com.snuffles.pricewatch.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Normalized price snapshot from one provider at one point in time.
 * <p>
 * Every quote produced by an adapter or stored in a cache has a positive price. The only
 * exception is the placeholder built by {@link #failed(String)}, which is returned to callers
 * but never cached.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Quote {

    public static final String STALE_MARKER = "(stale)";
    public static final String EXPIRED_MARKER = "(expired)";
    public static final String ERROR_SOURCE = "Error";

    String code;
    String name;
    BigDecimal price;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    @JsonAlias("yesterday_close")
    BigDecimal previousClose;
    BigDecimal change;
    @JsonAlias("change_percent")
    BigDecimal changePercent;
    Instant timestamp;
    @JsonAlias("time_str")
    String timeStr;
    String source;

    @JsonIgnore
    public boolean isValid() {
        return price != null && price.signum() > 0;
    }

    /**
     * Returns a copy whose source carries the given marker. The marker is appended once only.
     */
    public Quote withSourceMarker(String marker) {
        String current = source != null ? source : "";
        if (current.contains(marker)) {
            return this;
        }
        return toBuilder().source(current + marker).build();
    }

    public static Quote failed(String code) {
        return Quote.builder()
            .code(code)
            .name("Load failed")
            .price(BigDecimal.ZERO)
            .change(BigDecimal.ZERO)
            .changePercent(BigDecimal.ZERO)
            .timeStr("--")
            .source(ERROR_SOURCE)
            .build();
    }
}
