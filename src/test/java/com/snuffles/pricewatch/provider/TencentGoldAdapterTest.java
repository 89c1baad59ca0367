package com.snuffles.pricewatch.provider;

import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.registry.SourceDescriptor;
import com.snuffles.pricewatch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TencentGoldAdapterTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> shortResponse;

    @Mock
    private HttpResponse<String> fullResponse;

    private final SourceDescriptor source = new SourceDescriptor("Tencent Finance", "tencent", true, Duration.ofSeconds(5));
    private TencentGoldAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new TencentGoldAdapter(new MutableClock(Instant.parse("2024-03-01T02:00:00Z")));
        adapter.setHttpClient(httpClient);
    }

    @Test
    void enrichesShortRecordFromFullRecord() throws Exception {
        when(shortResponse.statusCode()).thenReturn(200);
        when(shortResponse.body()).thenReturn("v_s_shau9999=\"1~Au99.99~AU9999~550.00~4.00~0.73~1000~550~\";");
        when(fullResponse.statusCode()).thenReturn(200);
        when(fullResponse.body()).thenReturn("v_shau9999=\"" + fullRecord() + "\";");
        doReturn(shortResponse).doReturn(fullResponse).when(httpClient).send(any(HttpRequest.class), any());

        Quote quote = adapter.fetch(source, "AU9999").orElseThrow();

        assertThat(quote.getPrice()).isEqualByComparingTo("550.00");
        assertThat(quote.getChange()).isEqualByComparingTo("4.00");
        assertThat(quote.getChangePercent()).isEqualByComparingTo("0.73");
        assertThat(quote.getPreviousClose()).isEqualByComparingTo("546.00");
        assertThat(quote.getOpen()).isEqualByComparingTo("547.00");
        assertThat(quote.getHigh()).isEqualByComparingTo("551.50");
        assertThat(quote.getLow()).isEqualByComparingTo("545.20");
    }

    @Test
    void fullRecordFailureIsTolerated() throws Exception {
        when(shortResponse.statusCode()).thenReturn(200);
        when(shortResponse.body()).thenReturn("v_s_shau9999=\"1~Au99.99~AU9999~550.00~4.00~0.73~1000~550~\";");
        doReturn(shortResponse).doThrow(new IOException("timeout")).when(httpClient).send(any(HttpRequest.class), any());

        Quote quote = adapter.fetch(source, "AU9999").orElseThrow();

        assertThat(quote.getPrice()).isEqualByComparingTo("550.00");
        assertThat(quote.getPreviousClose()).isEqualByComparingTo("546.00");
        assertThat(quote.getHigh()).isEqualByComparingTo("550.00");
    }

    @Test
    void shortRecordFailureReturnsEmpty() throws Exception {
        doThrow(new IOException("refused")).when(httpClient).send(any(HttpRequest.class), any());

        assertThat(adapter.fetch(source, "AU9999")).isEmpty();
    }

    private static String fullRecord() {
        String[] fields = new String[40];
        for (int i = 0; i < fields.length; i++) {
            fields[i] = "";
        }
        fields[3] = "550.00";
        fields[4] = "546.00";
        fields[5] = "547.00";
        fields[33] = "551.50";
        fields[34] = "545.20";
        return String.join("~", fields);
    }
}
