package com.snuffles.pricewatch.provider;

import com.snuffles.pricewatch.domain.FundPortfolio;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes a fund's disclosed top stock positions from the Eastmoney F10 archive fragment.
 * The response is a JavaScript assignment whose {@code content} string holds an HTML table.
 */
@Component
@Slf4j
public class FundPortfolioProvider {

    static class RateLimitException extends RuntimeException {
        RateLimitException(String message) {
            super(message);
        }
    }

    private static final Pattern CONTENT_PATTERN = Pattern.compile("content:\"(.*?)\",\\s*arryear", Pattern.DOTALL);
    private static final Pattern PERIOD_PATTERN = Pattern.compile("(\\d{4}年\\d季度)");
    private static final int TIMEOUT_MILLIS = 8000;

    @Value("${pricewatch.fund.portfolio-base-url:https://fundf10.eastmoney.com}")
    private String baseUrl;

    @Value("${pricewatch.fund.portfolio-top-positions:10}")
    private int topPositions;

    private final Clock clock;

    public FundPortfolioProvider(Clock clock) {
        this.clock = clock;
    }

    @Retryable(value = {RateLimitException.class}, backoff = @Backoff(delay = 1000, multiplier = 2, maxDelay = 10000), maxAttempts = 3)
    public Optional<FundPortfolio> fetchPortfolio(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            String content = fetchContent(code);
            if (content == null) {
                log.info("Fund archive returned no holdings fragment for {}", code);
                return Optional.empty();
            }
            return parsePortfolio(Jsoup.parse(content), code);
        } catch (HttpStatusException ex) {
            if (ex.getStatusCode() == 429) {
                throw new RateLimitException("Rate limited by fund archive for " + code);
            }
            log.warn("Fund archive HTTP {} for {}", ex.getStatusCode(), code);
        } catch (IOException ex) {
            log.warn("Fund archive request failed for {}: {}", code, ex.toString());
        }
        return Optional.empty();
    }

    @Recover
    public Optional<FundPortfolio> recoverFromRateLimit(RateLimitException ex, String code) {
        log.warn("Giving up on fund portfolio for {} after retries: {}", code, ex.getMessage());
        return Optional.empty();
    }

    protected String fetchContent(String code) throws IOException {
        String url = baseUrl + "/FundArchivesDatas.aspx?type=jjcc&code=" + code + "&topline=" + topPositions;
        if (log.isDebugEnabled()) {
            log.debug("Fetching fund portfolio for {}: {}", code, url);
        }
        Connection.Response response = Jsoup.connect(url)
            .userAgent(HttpQuoteAdapter.USER_AGENT)
            .referrer("https://fundf10.eastmoney.com/")
            .ignoreContentType(true)
            .timeout(TIMEOUT_MILLIS)
            .execute();
        Matcher matcher = CONTENT_PATTERN.matcher(response.body());
        return matcher.find() ? matcher.group(1) : null;
    }

    Optional<FundPortfolio> parsePortfolio(Document doc, String code) {
        Element table = doc.selectFirst("table");
        if (table == null) {
            log.info("No holdings table in fund archive for {}", code);
            return Optional.empty();
        }

        List<FundPortfolio.Position> positions = new ArrayList<>();
        for (Element row : table.select("tbody tr")) {
            Elements cells = row.select("td");
            if (cells.size() < 3) {
                continue;
            }
            String stockCode = cells.get(1).text().trim();
            String stockName = cells.get(2).text().trim();
            if (stockCode.isEmpty()) {
                continue;
            }
            positions.add(FundPortfolio.Position.builder()
                .stockCode(stockCode)
                .stockName(stockName)
                .weightPercent(parseWeight(cells))
                .build());
        }
        if (positions.isEmpty()) {
            log.info("Holdings table for {} has no rows", code);
            return Optional.empty();
        }

        return Optional.of(FundPortfolio.builder()
            .code(code)
            .reportPeriod(parseReportPeriod(doc))
            .positions(positions)
            .fetchedAt(clock.instant())
            .build());
    }

    private BigDecimal parseWeight(Elements cells) {
        for (int i = 3; i < cells.size(); i++) {
            String text = cells.get(i).text().trim();
            if (text.endsWith("%")) {
                return Quotes.parseDecimal(text.substring(0, text.length() - 1).replace(",", ""));
            }
        }
        return null;
    }

    private String parseReportPeriod(Document doc) {
        Element heading = doc.selectFirst("h4");
        if (heading == null) {
            return "";
        }
        Matcher matcher = PERIOD_PATTERN.matcher(heading.text());
        if (matcher.find()) {
            return matcher.group(1);
        }
        Element date = heading.selectFirst("font");
        return date != null ? date.text().trim() : "";
    }
}
