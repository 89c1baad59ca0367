package com.snuffles.pricewatch.state;

import com.snuffles.pricewatch.domain.AlertSettings;
import com.snuffles.pricewatch.domain.FundHolding;
import com.snuffles.pricewatch.domain.FundPortfolio;
import com.snuffles.pricewatch.domain.ManualRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * User-owned state: fund watchlist, holdings, manual records, alert settings and scraped
 * fund portfolios. Reads return copies taken under the market state lock.
 */
@Component
@RequiredArgsConstructor
public class UserDataStore {

    private final MarketStateLock lock;

    private final List<String> watchlist = new ArrayList<>();
    private final Map<String, FundHolding> holdings = new LinkedHashMap<>();
    private final List<ManualRecord> records = new ArrayList<>();
    private final Map<String, FundPortfolio> portfolios = new LinkedHashMap<>();
    private AlertSettings settings = AlertSettings.defaults();

    public List<String> getWatchlist() {
        return lock.withLock(() -> List.copyOf(watchlist));
    }

    public boolean addToWatchlist(String code) {
        return lock.withLock(() -> {
            if (watchlist.contains(code)) {
                return false;
            }
            watchlist.add(code);
            return true;
        });
    }

    public boolean removeFromWatchlist(String code) {
        return lock.withLock(() -> watchlist.remove(code));
    }

    public List<FundHolding> getHoldings() {
        return lock.withLock(() -> List.copyOf(holdings.values()));
    }

    public Optional<FundHolding> getHolding(String code) {
        return lock.withLock(() -> Optional.ofNullable(holdings.get(code)));
    }

    public void putHolding(FundHolding holding) {
        lock.runLocked(() -> holdings.put(holding.getCode(), holding));
    }

    public boolean removeHolding(String code) {
        return lock.withLock(() -> holdings.remove(code) != null);
    }

    public List<ManualRecord> getRecords() {
        return lock.withLock(() -> List.copyOf(records));
    }

    public void addRecord(ManualRecord record) {
        lock.runLocked(() -> records.add(record));
    }

    public void clearRecords() {
        lock.runLocked(records::clear);
    }

    public int pruneRecordsBefore(Instant cutoff) {
        return lock.withLock(() -> {
            int before = records.size();
            records.removeIf(r -> r.getTimestamp() == null || r.getTimestamp().isBefore(cutoff));
            return before - records.size();
        });
    }

    public AlertSettings getSettings() {
        return lock.withLock(() -> settings);
    }

    public void setSettings(AlertSettings settings) {
        lock.runLocked(() -> this.settings = settings);
    }

    public Optional<FundPortfolio> getPortfolio(String code) {
        return lock.withLock(() -> Optional.ofNullable(portfolios.get(code)));
    }

    public void putPortfolio(FundPortfolio portfolio) {
        lock.runLocked(() -> portfolios.put(portfolio.getCode(), portfolio));
    }

    public void removePortfolio(String code) {
        lock.runLocked(() -> portfolios.remove(code));
    }

    public Map<String, FundPortfolio> getPortfolios() {
        return lock.withLock(() -> Map.copyOf(portfolios));
    }

    /**
     * Replaces all user state at once, used when restoring a snapshot.
     */
    public void replaceAll(
        List<String> watchlist,
        List<FundHolding> holdings,
        List<ManualRecord> records,
        AlertSettings settings,
        Map<String, FundPortfolio> portfolios
    ) {
        lock.runLocked(() -> {
            this.watchlist.clear();
            this.watchlist.addAll(watchlist);
            this.holdings.clear();
            holdings.forEach(h -> this.holdings.put(h.getCode(), h));
            this.records.clear();
            this.records.addAll(records);
            this.settings = settings != null ? settings : AlertSettings.defaults();
            this.portfolios.clear();
            this.portfolios.putAll(portfolios);
        });
    }
}
