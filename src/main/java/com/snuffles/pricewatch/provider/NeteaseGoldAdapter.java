package com.snuffles.pricewatch.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.registry.SourceDescriptor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * NetEase money API, a JSONP object keyed by the instrument id. {@code percent} is a ratio.
 */
@Component
public class NeteaseGoldAdapter extends HttpQuoteAdapter {

    public static final String TYPE = "netease";

    private static final String URL_TEMPLATE = "http://api.money.126.net/data/feed/118%s,money.api";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public NeteaseGoldAdapter(Clock clock) {
        super(clock);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected Optional<Quote> fetchQuote(SourceDescriptor source, String code)
        throws IOException, InterruptedException, QuoteFetchException {
        String instrumentId = "118" + code;
        String body = get(String.format(URL_TEMPLATE, code), source.getTimeout());
        JsonNode d = objectMapper.readTree(callbackPayload(body)).path(instrumentId);
        if (!d.isObject()) {
            throw new QuoteFetchException("No record for " + instrumentId);
        }

        BigDecimal price = Quotes.asBigDecimal(d, "price");
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal open = Quotes.firstNonNull(Quotes.asBigDecimal(d, "open"), price);
        BigDecimal high = Quotes.firstNonNull(Quotes.asBigDecimal(d, "high"), price);
        BigDecimal low = Quotes.firstNonNull(Quotes.asBigDecimal(d, "low"), price);
        BigDecimal previousClose = Quotes.firstNonNull(Quotes.asBigDecimal(d, "yestclose"), price);
        BigDecimal change = Quotes.firstNonNull(Quotes.asBigDecimal(d, "updown"), BigDecimal.ZERO);
        BigDecimal changePercent = Quotes.firstNonNull(
            Quotes.ratioToPercent(Quotes.asBigDecimal(d, "percent")), BigDecimal.ZERO);

        Instant now = clock.instant();
        return Optional.of(Quote.builder()
            .code(code)
            .name(Quotes.textOrNull(d, "name"))
            .price(Quotes.scale2(price))
            .open(Quotes.scale2(open))
            .high(Quotes.scale2(high))
            .low(Quotes.scale2(low))
            .previousClose(Quotes.scale2(previousClose))
            .change(Quotes.scale2(change))
            .changePercent(Quotes.scale2(changePercent))
            .timestamp(now)
            .timeStr(formatTime(now))
            .source(source.getName())
            .build());
    }
}
