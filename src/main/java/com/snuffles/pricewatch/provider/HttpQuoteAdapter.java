package com.snuffles.pricewatch.provider;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.registry.SourceDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for adapters that issue plain HTTP GETs. Handles the request, the status check and the
 * conversion of every failure into an empty result so that nothing crosses the adapter boundary.
 */
@Slf4j
public abstract class HttpQuoteAdapter implements QuoteAdapter {

    protected static final String USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    protected static final Charset GBK = Charset.forName("GBK");

    private static final Pattern QUOTED_PAYLOAD = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern CALLBACK_PAYLOAD = Pattern.compile("\\((.*)\\)", Pattern.DOTALL);
    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    protected final Clock clock;
    private HttpClient httpClient;

    protected HttpQuoteAdapter(Clock clock) {
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    // For testing
    void setHttpClient(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Optional<Quote> fetch(SourceDescriptor source, String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase();
        try {
            Optional<Quote> quote = fetchQuote(source, normalized);
            if (quote.isPresent() && !quote.get().isValid()) {
                log.info("[{}] discarded non-positive price {} for {}", source.getName(), quote.get().getPrice(), normalized);
                return Optional.empty();
            }
            return quote;
        } catch (QuoteFetchException | IOException ex) {
            log.warn("[{}] fetch failed for {}: {}", source.getName(), normalized, ex.toString());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("[{}] fetch interrupted for {}", source.getName(), normalized);
        } catch (RuntimeException ex) {
            log.warn("[{}] unusable payload for {}: {}", source.getName(), normalized, ex.toString());
        }
        return Optional.empty();
    }

    protected abstract Optional<Quote> fetchQuote(SourceDescriptor source, String code)
        throws IOException, InterruptedException, QuoteFetchException;

    protected String get(String url, Duration timeout, Charset charset, String... headers)
        throws IOException, InterruptedException, QuoteFetchException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
            .GET()
            .timeout(timeout)
            .header(HttpHeaders.USER_AGENT, USER_AGENT);
        if (headers.length > 0) {
            builder.headers(headers);
        }
        if (log.isDebugEnabled()) {
            log.debug("GET {} (timeout={}ms)", url, timeout.toMillis());
        }
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(charset));
        if (response.statusCode() == 429) {
            throw new QuoteFetchException("Rate limited by " + url);
        }
        if (response.statusCode() / 100 != 2) {
            throw new QuoteFetchException("HTTP " + response.statusCode() + " from " + url);
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            throw new QuoteFetchException("Empty body from " + url);
        }
        return body;
    }

    protected String get(String url, Duration timeout) throws IOException, InterruptedException, QuoteFetchException {
        return get(url, timeout, StandardCharsets.UTF_8);
    }

    /**
     * Extracts the content of the first double-quoted string, as in {@code var x="a,b,c";}.
     */
    protected static String quotedPayload(String body) throws QuoteFetchException {
        Matcher matcher = QUOTED_PAYLOAD.matcher(body);
        if (!matcher.find()) {
            throw new QuoteFetchException("No quoted payload in response");
        }
        return matcher.group(1);
    }

    /**
     * Extracts the argument of a JSONP callback, as in {@code callback({...});}.
     */
    protected static String callbackPayload(String body) throws QuoteFetchException {
        Matcher matcher = CALLBACK_PAYLOAD.matcher(body);
        if (!matcher.find() || matcher.group(1).isBlank()) {
            throw new QuoteFetchException("No callback payload in response");
        }
        return matcher.group(1);
    }

    protected String formatTime(Instant instant) {
        return TIME_FORMATTER.format(instant.atZone(clock.getZone()));
    }
}
