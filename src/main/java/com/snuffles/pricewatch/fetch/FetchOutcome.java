package com.snuffles.pricewatch.fetch;

import com.snuffles.pricewatch.domain.Quote;
import lombok.Value;

/**
 * Result of one failover fetch: either a quote or the terminal failure, plus how many
 * sources were skipped because their breaker was open.
 */
@Value
public class FetchOutcome {
    Quote quote;
    FetchFailure failure;
    int mutedCount;

    public static FetchOutcome success(Quote quote, int mutedCount) {
        return new FetchOutcome(quote, null, mutedCount);
    }

    public static FetchOutcome failure(FetchFailure failure, int mutedCount) {
        return new FetchOutcome(null, failure, mutedCount);
    }

    public boolean isSuccess() {
        return quote != null;
    }

    public String getErrorMessage() {
        return failure != null ? failure.getMessage() : null;
    }
}
