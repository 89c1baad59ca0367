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
 * Sina fund valuation feed: {@code var hq_str_fu_000001="name,time,estimate,nav,accumulated,_,percent,date";}.
 */
@Component
public class SinaFundAdapter extends HttpQuoteAdapter {

    public static final String TYPE = "sina-fund";

    private static final String URL_TEMPLATE = "https://hq.sinajs.cn/list=fu_%s";
    private static final int MIN_FIELDS = 7;

    public SinaFundAdapter(Clock clock) {
        super(clock);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected Optional<Quote> fetchQuote(SourceDescriptor source, String code)
        throws IOException, InterruptedException, QuoteFetchException {
        String body = get(String.format(URL_TEMPLATE, code), source.getTimeout(), GBK,
            HttpHeaders.REFERER, "https://finance.sina.com.cn");
        String[] parts = quotedPayload(body).split(",", -1);
        if (parts.length < MIN_FIELDS) {
            throw new QuoteFetchException("Expected at least " + MIN_FIELDS + " fields but got " + parts.length);
        }

        BigDecimal estimate = Quotes.parseDecimal(parts[2]);
        BigDecimal nav = Quotes.parseDecimal(parts[3]);
        BigDecimal price = Quotes.firstNonNull(estimate, nav);
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal previousClose = Quotes.firstNonNull(nav, price);
        BigDecimal change = price.subtract(previousClose);
        BigDecimal changePercent = Quotes.parseDecimal(parts[6]);
        if (changePercent == null) {
            changePercent = Quotes.percentOf(change, previousClose);
        }

        Instant now = clock.instant();
        String time = parts.length > 7 && !parts[7].isBlank()
            ? parts[7].trim() + " " + parts[1].trim()
            : parts[1].trim();

        return Optional.of(Quote.builder()
            .code(code)
            .name(parts[0].trim())
            .price(Quotes.scale4(price))
            .previousClose(Quotes.scale4(previousClose))
            .change(Quotes.scale4(change))
            .changePercent(Quotes.scale2(changePercent))
            .timestamp(now)
            .timeStr(time.isBlank() ? formatTime(now) : time)
            .source(source.getName())
            .build());
    }
}
