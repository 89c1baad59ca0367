package com.snuffles.pricewatch.provider;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.registry.SourceDescriptor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Sina quote feed: {@code var hq_str_gds_AU9999="...";}, a GBK comma-delimited record.
 * Field 1 is the price, then previous close, open, high and low. Blank fields fall back to the price.
 */
@Component
public class SinaGoldAdapter extends HttpQuoteAdapter {

    public static final String TYPE = "sina";

    private static final String URL_TEMPLATE = "https://hq.sinajs.cn/list=gds_%s";
    private static final int MIN_FIELDS = 8;

    public SinaGoldAdapter(Clock clock) {
        super(clock);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected Optional<Quote> fetchQuote(SourceDescriptor source, String code)
        throws IOException, InterruptedException, QuoteFetchException {
        String body = get(String.format(URL_TEMPLATE, code.toLowerCase()), source.getTimeout(), GBK,
            HttpHeaders.REFERER, "https://finance.sina.com.cn");
        String[] parts = quotedPayload(body).split(",", -1);
        if (parts.length < MIN_FIELDS) {
            throw new QuoteFetchException("Expected at least " + MIN_FIELDS + " fields but got " + parts.length);
        }

        BigDecimal price = Quotes.parseDecimal(parts[1]);
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal previousClose = Quotes.parseDecimalOr(parts[2], price);
        BigDecimal open = Quotes.parseDecimalOr(parts[3], price);
        BigDecimal high = Quotes.parseDecimalOr(parts[4], price);
        BigDecimal low = Quotes.parseDecimalOr(parts[5], price);
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
            .changePercent(Quotes.scale2(Quotes.percentOf(change, previousClose)))
            .timestamp(now)
            .timeStr(formatTime(now))
            .source(source.getName())
            .build());
    }
}
