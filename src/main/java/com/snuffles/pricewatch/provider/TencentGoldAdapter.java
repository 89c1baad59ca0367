package com.snuffles.pricewatch.provider;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.registry.SourceDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Tencent quote feed, tilde-delimited. The short record ({@code s_sh...}) carries price, change
 * and percent; the full record adds previous close, open, high and low and is best effort.
 */
@Component
@Slf4j
public class TencentGoldAdapter extends HttpQuoteAdapter {

    public static final String TYPE = "tencent";

    private static final String SHORT_URL_TEMPLATE = "http://qt.gtimg.cn/q=s_sh%s";
    private static final String FULL_URL_TEMPLATE = "http://qt.gtimg.cn/q=sh%s";
    private static final Duration FULL_RECORD_TIMEOUT = Duration.ofSeconds(2);
    private static final int MIN_SHORT_FIELDS = 6;
    private static final int MIN_FULL_FIELDS = 35;

    public TencentGoldAdapter(Clock clock) {
        super(clock);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected Optional<Quote> fetchQuote(SourceDescriptor source, String code)
        throws IOException, InterruptedException, QuoteFetchException {
        String lowerCode = code.toLowerCase();
        String body = get(String.format(SHORT_URL_TEMPLATE, lowerCode), source.getTimeout(), GBK);
        String[] parts = quotedPayload(body).split("~", -1);
        if (parts.length < MIN_SHORT_FIELDS) {
            throw new QuoteFetchException("Expected at least " + MIN_SHORT_FIELDS + " fields but got " + parts.length);
        }

        BigDecimal price = Quotes.parseDecimal(parts[3]);
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal change = Quotes.parseDecimalOr(parts[4], BigDecimal.ZERO);
        BigDecimal changePercent = Quotes.parseDecimalOr(parts[5], BigDecimal.ZERO);

        BigDecimal previousClose = price.subtract(change);
        BigDecimal open = price;
        BigDecimal high = price;
        BigDecimal low = price;

        String[] full = fetchFullRecord(source, lowerCode);
        if (full != null) {
            previousClose = Quotes.parseDecimalOr(full[4], previousClose);
            open = Quotes.parseDecimalOr(full[5], open);
            high = Quotes.parseDecimalOr(full[33], high);
            low = Quotes.parseDecimalOr(full[34], low);
        }

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

    private String[] fetchFullRecord(SourceDescriptor source, String lowerCode) throws InterruptedException {
        try {
            String body = get(String.format(FULL_URL_TEMPLATE, lowerCode), FULL_RECORD_TIMEOUT, GBK);
            String[] parts = quotedPayload(body).split("~", -1);
            return parts.length >= MIN_FULL_FIELDS ? parts : null;
        } catch (IOException | QuoteFetchException ex) {
            log.debug("[{}] full record unavailable, using short record only: {}", source.getName(), ex.toString());
            return null;
        }
    }
}
