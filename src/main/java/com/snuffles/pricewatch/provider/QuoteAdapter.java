package com.snuffles.pricewatch.provider;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.registry.SourceDescriptor;

import java.util.Optional;

/**
 * One upstream provider. Implementations are stateless and never throw: network errors,
 * malformed payloads and non-positive prices all come back as {@link Optional#empty()}.
 */
public interface QuoteAdapter {

    /**
     * Source type this adapter serves, matched against {@link SourceDescriptor#getType()}.
     */
    String type();

    Optional<Quote> fetch(SourceDescriptor source, String code);
}
