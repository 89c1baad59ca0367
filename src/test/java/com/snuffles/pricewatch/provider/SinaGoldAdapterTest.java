package com.snuffles.pricewatch.provider;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.registry.SourceDescriptor;
import com.snuffles.pricewatch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SinaGoldAdapterTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    private final SourceDescriptor source = new SourceDescriptor("Sina Finance", "sina", true, Duration.ofSeconds(5));
    private SinaGoldAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new SinaGoldAdapter(new MutableClock(Instant.parse("2024-03-01T02:00:00Z")));
        adapter.setHttpClient(httpClient);
    }

    @Test
    void parsesQuotedCommaRecord() throws Exception {
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(
            "var hq_str_gds_AU9999=\"Au99.99,550.00,540.00,541.00,552.00,539.50,10:00:00,550.00,0\";");
        doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());

        Optional<Quote> result = adapter.fetch(source, "AU9999");

        assertThat(result).isPresent();
        Quote quote = result.get();
        assertThat(quote.getPrice()).isEqualByComparingTo("550.00");
        assertThat(quote.getPreviousClose()).isEqualByComparingTo("540.00");
        assertThat(quote.getOpen()).isEqualByComparingTo("541.00");
        assertThat(quote.getHigh()).isEqualByComparingTo("552.00");
        assertThat(quote.getLow()).isEqualByComparingTo("539.50");
        assertThat(quote.getChange()).isEqualByComparingTo("10.00");
        assertThat(quote.getChangePercent()).isEqualByComparingTo("1.85");

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).endsWith("list=gds_au9999");
        assertThat(request.getValue().headers().firstValue("Referer")).contains("https://finance.sina.com.cn");
    }

    @Test
    void blankFieldsFallBackToPrice() throws Exception {
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn("var hq_str_gds_AU9999=\"Au99.99,550.00,,,,,10:00:00,0\";");
        doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());

        Quote quote = adapter.fetch(source, "AU9999").orElseThrow();

        assertThat(quote.getPreviousClose()).isEqualByComparingTo("550.00");
        assertThat(quote.getHigh()).isEqualByComparingTo("550.00");
        assertThat(quote.getChangePercent()).isEqualByComparingTo("0");
    }

    @Test
    void shortRecordIsRejected() throws Exception {
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn("var hq_str_gds_AU9999=\"Au99.99,550.00,540.00\";");
        doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());

        assertThat(adapter.fetch(source, "AU9999")).isEmpty();
    }

    @Test
    void emptyQuotedStringIsRejected() throws Exception {
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn("var hq_str_gds_AU9999=\"\";");
        doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());

        assertThat(adapter.fetch(source, "AU9999")).isEmpty();
    }
}
