package com.snuffles.pricewatch.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.pricewatch.config.PriceWatchProperties;
import com.snuffles.pricewatch.domain.AlertSettings;
import com.snuffles.pricewatch.domain.FundHolding;
import com.snuffles.pricewatch.domain.ManualRecord;
import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.history.TimeSeriesBuffer;
import com.snuffles.pricewatch.state.MarketStateLock;
import com.snuffles.pricewatch.state.UserDataStore;
import com.snuffles.pricewatch.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StatePersistenceServiceTest {

    // 10:00 in Asia/Shanghai; local midnight is 2024-02-29T16:00:00Z
    private static final Instant NOW = Instant.parse("2024-03-01T02:00:00Z");
    private static final Instant MIDNIGHT = Instant.parse("2024-02-29T16:00:00Z");

    @Mock
    private SnapshotRepository repository;

    private TimeSeriesBuffer buffer;
    private UserDataStore userData;
    private StatePersistenceService service;

    @BeforeEach
    void setUp() {
        MarketStateLock lock = new MarketStateLock();
        buffer = new TimeSeriesBuffer(720, lock);
        userData = new UserDataStore(lock);
        service = new StatePersistenceService(repository, buffer, userData, lock, new PriceWatchProperties(), new MutableClock(NOW));
    }

    @Test
    void persistPrunesYesterdayAndExpiredRecords() throws IOException {
        buffer.append(gold("540", MIDNIGHT.minusSeconds(30)));
        buffer.append(gold("550", MIDNIGHT.plusSeconds(30)));
        userData.addRecord(record(NOW.minus(Duration.ofDays(8))));
        userData.addRecord(record(NOW.minus(Duration.ofDays(2))));
        userData.addToWatchlist("161725");

        assertThat(service.persist()).isTrue();

        ArgumentCaptor<StateSnapshot> captor = ArgumentCaptor.forClass(StateSnapshot.class);
        verify(repository).save(captor.capture());
        StateSnapshot saved = captor.getValue();
        assertThat(saved.priceHistory()).extracting(Quote::getPrice).containsExactly(new BigDecimal("550"));
        assertThat(saved.manualRecords()).hasSize(1);
        assertThat(saved.fundWatchlist()).containsExactly("161725");
        assertThat(buffer.size()).isEqualTo(1);
    }

    @Test
    void persistFailureIsReportedNotThrown() throws IOException {
        doThrow(new IOException("disk full")).when(repository).save(any());

        assertThat(service.persist()).isFalse();
    }

    @Test
    void restoreReplacesStateAndPrunes() throws IOException {
        FundHolding holding = FundHolding.builder()
            .code("161725").name("Liquor Index").costPrice(BigDecimal.ONE).shares(BigDecimal.TEN).note("")
            .build();
        AlertSettings settings = AlertSettings.builder().high(new BigDecimal("600")).enabled(true).build();
        given(repository.load()).willReturn(Optional.of(new StateSnapshot(
            List.of(gold("540", MIDNIGHT.minusSeconds(30)), gold("551", NOW.minusSeconds(60))),
            List.of(record(NOW.minus(Duration.ofDays(1)))),
            settings,
            List.of("161725", "110011"),
            List.of(holding),
            Map.of())));

        assertThat(service.restore()).isTrue();

        assertThat(buffer.snapshot()).extracting(Quote::getPrice).containsExactly(new BigDecimal("551"));
        assertThat(userData.getWatchlist()).containsExactly("161725", "110011");
        assertThat(userData.getHoldings()).containsExactly(holding);
        assertThat(userData.getRecords()).hasSize(1);
        assertThat(userData.getSettings()).isEqualTo(settings);
    }

    @Test
    void unreadableStoreStartsEmpty() throws IOException {
        given(repository.load()).willThrow(new IOException("corrupt"));
        userData.addToWatchlist("161725");

        assertThat(service.restore()).isFalse();
        assertThat(userData.getWatchlist()).containsExactly("161725");
    }

    @Test
    void nothingSavedYet() throws IOException {
        given(repository.load()).willReturn(Optional.empty());

        assertThat(service.restore()).isFalse();
    }

    @Test
    void laterPersistIsNeverOverwrittenByAnEarlierSnapshot(@TempDir Path dir) throws Exception {
        JsonFileSnapshotRepository file = new JsonFileSnapshotRepository(
            new ObjectMapper().findAndRegisterModules(), dir.resolve("data.json").toString(), "");
        CountDownLatch firstSaveStarted = new CountDownLatch(1);
        CountDownLatch releaseFirstSave = new CountDownLatch(1);
        AtomicInteger saves = new AtomicInteger();
        SnapshotRepository blockingFirstSave = new SnapshotRepository() {
            @Override
            public void save(StateSnapshot snapshot) throws IOException {
                if (saves.getAndIncrement() == 0) {
                    firstSaveStarted.countDown();
                    try {
                        releaseFirstSave.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                }
                file.save(snapshot);
            }

            @Override
            public Optional<StateSnapshot> load() throws IOException {
                return file.load();
            }
        };
        MarketStateLock lock = new MarketStateLock();
        UserDataStore store = new UserDataStore(lock);
        StatePersistenceService persistence = new StatePersistenceService(blockingFirstSave,
            new TimeSeriesBuffer(720, lock), store, lock, new PriceWatchProperties(), new MutableClock(NOW));
        FundHolding holding = FundHolding.builder()
            .code("161725").name("Liquor Index").costPrice(BigDecimal.ONE).shares(BigDecimal.TEN).note("")
            .build();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            // poller thread snapshots an empty state and stalls inside save
            Future<Boolean> pollerPersist = executor.submit(persistence::persist);
            assertThat(firstSaveStarted.await(5, TimeUnit.SECONDS)).isTrue();

            store.putHolding(holding);
            Future<Boolean> requestPersist = executor.submit(persistence::persist);
            Thread.sleep(200);
            assertThat(requestPersist).isNotDone();

            releaseFirstSave.countDown();
            assertThat(pollerPersist.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(requestPersist.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            releaseFirstSave.countDown();
            executor.shutdownNow();
        }

        assertThat(file.load().orElseThrow().fundHoldings()).containsExactly(holding);
    }

    private static Quote gold(String price, Instant at) {
        return Quote.builder().code("AU9999").price(new BigDecimal(price)).timestamp(at).source("Eastmoney").build();
    }

    private static ManualRecord record(Instant at) {
        return ManualRecord.builder()
            .price(new BigDecimal("550"))
            .buyPrice(new BigDecimal("500"))
            .profit(new BigDecimal("9.45"))
            .note("")
            .timestamp(at)
            .timeStr("")
            .build();
    }
}
