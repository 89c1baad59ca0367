package com.snuffles.pricewatch.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.registry.SourceDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Eastmoney push API. Prices arrive as integer cents and the change percent as percent x 100.
 */
@Component
@Slf4j
public class EastmoneyGoldAdapter extends HttpQuoteAdapter {

    public static final String TYPE = "eastmoney";

    private static final String URL_TEMPLATE =
        "https://push2.eastmoney.com/api/qt/stock/get?secid=118.%s&fields=f43,f44,f45,f46,f60,f170";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public EastmoneyGoldAdapter(Clock clock) {
        super(clock);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected Optional<Quote> fetchQuote(SourceDescriptor source, String code)
        throws IOException, InterruptedException, QuoteFetchException {
        String body = get(String.format(URL_TEMPLATE, code), source.getTimeout(), StandardCharsets.UTF_8,
            HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        JsonNode data = objectMapper.readTree(body).path("data");
        if (!data.isObject()) {
            log.info("[{}] no data block for {}", source.getName(), code);
            return Optional.empty();
        }

        BigDecimal price = Quotes.fromCents(Quotes.asBigDecimal(data, "f43"));
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal open = zeroIfNull(Quotes.fromCents(Quotes.asBigDecimal(data, "f46")));
        BigDecimal high = zeroIfNull(Quotes.fromCents(Quotes.asBigDecimal(data, "f44")));
        BigDecimal low = zeroIfNull(Quotes.fromCents(Quotes.asBigDecimal(data, "f45")));
        BigDecimal previousClose = zeroIfNull(Quotes.fromCents(Quotes.asBigDecimal(data, "f60")));
        BigDecimal changePercent = zeroIfNull(Quotes.fromCents(Quotes.asBigDecimal(data, "f170")));
        BigDecimal change = price.subtract(previousClose);

        Instant now = clock.instant();
        return Optional.of(Quote.builder()
            .code(code)
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

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
