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
 * Intraday fund valuation feed: {@code jsonpgz({"fundcode":..,"gsz":..,"dwjz":..,"gszzl":..});}.
 * The estimate ({@code gsz}) is the price and the last published NAV ({@code dwjz}) the previous close.
 */
@Component
public class FundEstimateAdapter extends HttpQuoteAdapter {

    public static final String TYPE = "fundgz";

    private static final String URL_TEMPLATE = "https://fundgz.1234567.com.cn/js/%s.js?rt=%d";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public FundEstimateAdapter(Clock clock) {
        super(clock);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected Optional<Quote> fetchQuote(SourceDescriptor source, String code)
        throws IOException, InterruptedException, QuoteFetchException {
        Instant now = clock.instant();
        String body = get(String.format(URL_TEMPLATE, code, now.toEpochMilli()), source.getTimeout());
        JsonNode d = objectMapper.readTree(callbackPayload(body));

        BigDecimal estimate = Quotes.asBigDecimal(d, "gsz");
        BigDecimal nav = Quotes.asBigDecimal(d, "dwjz");
        BigDecimal price = Quotes.firstNonNull(estimate, nav);
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal previousClose = Quotes.firstNonNull(nav, price);
        BigDecimal change = price.subtract(previousClose);
        BigDecimal changePercent = Quotes.asBigDecimal(d, "gszzl");
        if (changePercent == null) {
            changePercent = Quotes.percentOf(change, previousClose);
        }
        String time = Quotes.textOrNull(d, "gztime");
        String fundCode = Quotes.textOrNull(d, "fundcode");

        return Optional.of(Quote.builder()
            .code(fundCode != null ? fundCode : code)
            .name(Quotes.textOrNull(d, "name"))
            .price(Quotes.scale4(price))
            .previousClose(Quotes.scale4(previousClose))
            .change(Quotes.scale4(change))
            .changePercent(Quotes.scale2(changePercent))
            .timestamp(now)
            .timeStr(time != null ? time : formatTime(now))
            .source(source.getName())
            .build());
    }
}
