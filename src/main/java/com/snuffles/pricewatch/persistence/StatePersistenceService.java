package com.snuffles.pricewatch.persistence;

import com.snuffles.pricewatch.config.PriceWatchProperties;
import com.snuffles.pricewatch.history.TimeSeriesBuffer;
import com.snuffles.pricewatch.state.MarketStateLock;
import com.snuffles.pricewatch.state.UserDataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Snapshots in-memory state to the {@link SnapshotRepository} and restores it at startup.
 * Before each snapshot the price history is trimmed to the current local day and manual
 * records to the configured retention. Storage errors are logged, never rethrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatePersistenceService {

    private final SnapshotRepository repository;
    private final TimeSeriesBuffer buffer;
    private final UserDataStore userData;
    private final MarketStateLock lock;
    private final PriceWatchProperties properties;
    private final Clock clock;

    // Never taken while holding the market state lock.
    private final ReentrantLock saveLock = new ReentrantLock();

    /**
     * Builds and saves a snapshot. Concurrent calls are serialized across both steps so a
     * snapshot taken earlier can never overwrite one taken later.
     */
    public boolean persist() {
        saveLock.lock();
        try {
            StateSnapshot snapshot = lock.withLock(() -> {
                prune();
                return new StateSnapshot(
                    buffer.snapshot(),
                    userData.getRecords(),
                    userData.getSettings(),
                    userData.getWatchlist(),
                    userData.getHoldings(),
                    userData.getPortfolios()
                );
            });
            repository.save(snapshot);
            return true;
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to save state snapshot: {}", ex.toString(), ex);
            return false;
        } finally {
            saveLock.unlock();
        }
    }

    public boolean restore() {
        Optional<StateSnapshot> loaded;
        try {
            loaded = repository.load();
        } catch (IOException | RuntimeException ex) {
            log.error("Failed to load state snapshot; starting empty: {}", ex.toString(), ex);
            return false;
        }
        if (loaded.isEmpty()) {
            return false;
        }
        StateSnapshot snapshot = loaded.get();
        lock.runLocked(() -> {
            buffer.replaceAll(snapshot.priceHistory());
            userData.replaceAll(
                snapshot.fundWatchlist(),
                snapshot.fundHoldings(),
                snapshot.manualRecords(),
                snapshot.alertSettings(),
                snapshot.fundPortfolios()
            );
            prune();
        });
        log.info("Restored state: {} price point(s), {} record(s), {} watched fund(s), {} holding(s)",
            buffer.size(), userData.getRecords().size(), userData.getWatchlist().size(), userData.getHoldings().size());
        return true;
    }

    private void prune() {
        Instant startOfDay = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
        int prices = buffer.pruneBefore(startOfDay);
        Duration keep = Duration.ofDays(properties.getRecords().getKeepDays());
        int records = userData.pruneRecordsBefore(clock.instant().minus(keep));
        if (prices > 0 || records > 0) {
            log.debug("Pruned {} price point(s) before {} and {} expired record(s)", prices, startOfDay, records);
        }
    }
}
