package com.snuffles.pricewatch.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.pricewatch.domain.AlertSettings;
import com.snuffles.pricewatch.domain.FundHolding;
import com.snuffles.pricewatch.domain.FundPortfolio;
import com.snuffles.pricewatch.domain.Quote;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileSnapshotRepositoryTest {

    private static final String LEGACY_DATA = """
        {
          "manual_records": [
            {"price": 550.0, "buy_price": 500.0, "profit": 9.45, "timestamp": 1709258400.5,
             "time_str": "2024-03-01 10:00:00", "note": ""}
          ],
          "price_history": [
            {"price": 550.12, "open": 549.0, "high": 551.0, "low": 548.5, "yesterday_close": 548.2,
             "change": 1.92, "change_percent": 0.35, "timestamp": 1709258400.0, "time_str": "10:00:00",
             "source": "Eastmoney"}
          ],
          "alert_settings": {"high": 600, "low": 0, "enabled": true, "trading_events_enabled": false},
          "fund_watchlist": ["161725"],
          "fund_holdings": [
            {"code": "161725", "name": "Liquor Index", "cost_price": 1.05, "shares": 1000, "note": "long term"}
          ],
          "fund_portfolios": {
            "161725": {"timestamp": 1709258400.0, "report_period": "2023Q4",
                       "holdings_info": {"600519": {"name": "Kweichow Moutai", "weight": 15.2}}}
          }
        }
        """;

    // configured like the application's mapper: unknown properties are ignored
    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();

    @TempDir
    Path dir;

    @Test
    void loadWithoutFileIsEmpty() throws IOException {
        JsonFileSnapshotRepository repository = repository(dir.resolve("data/data.json"), "");

        assertThat(repository.load()).isEmpty();
    }

    @Test
    void saveThenLoadRestoresState() throws IOException {
        Path dataFile = dir.resolve("data/data.json");
        JsonFileSnapshotRepository repository = repository(dataFile, "");
        Quote point = Quote.builder()
            .code("AU9999")
            .price(new BigDecimal("550.12"))
            .timestamp(Instant.parse("2024-03-01T02:00:00Z"))
            .source("Eastmoney")
            .build();
        FundHolding holding = FundHolding.builder()
            .code("161725").name("Liquor Index").costPrice(new BigDecimal("1.05")).shares(new BigDecimal("1000")).note("")
            .build();

        repository.save(new StateSnapshot(List.of(point), null, AlertSettings.defaults(), List.of("161725"), List.of(holding), null));

        assertThat(dataFile).exists();
        assertThat(dataFile.resolveSibling("data.json.tmp")).doesNotExist();

        StateSnapshot loaded = repository.load().orElseThrow();
        assertThat(loaded.priceHistory()).containsExactly(point);
        assertThat(loaded.fundWatchlist()).containsExactly("161725");
        assertThat(loaded.fundHoldings()).containsExactly(holding);
        assertThat(loaded.manualRecords()).isEmpty();
        assertThat(loaded.fundPortfolios()).isEmpty();
    }

    @Test
    void saveOverwritesPreviousSnapshot() throws IOException {
        JsonFileSnapshotRepository repository = repository(dir.resolve("data.json"), "");

        repository.save(new StateSnapshot(null, null, null, List.of("161725"), null, null));
        repository.save(new StateSnapshot(null, null, null, List.of("110011"), null, null));

        assertThat(repository.load().orElseThrow().fundWatchlist()).containsExactly("110011");
    }

    @Test
    void missingSectionsLoadAsEmpty() throws IOException {
        Path dataFile = dir.resolve("data.json");
        Files.writeString(dataFile, "{\"fundWatchlist\":[\"161725\"]}", StandardCharsets.UTF_8);

        StateSnapshot loaded = repository(dataFile, "").load().orElseThrow();

        assertThat(loaded.fundWatchlist()).containsExactly("161725");
        assertThat(loaded.priceHistory()).isEmpty();
        assertThat(loaded.alertSettings().isTradingEventsEnabled()).isTrue();
    }

    @Test
    void legacyFileIsMovedIntoDataDirectory() throws IOException {
        Path legacy = dir.resolve("data.json");
        Path dataFile = dir.resolve("data/data.json");
        Files.writeString(legacy, LEGACY_DATA, StandardCharsets.UTF_8);

        Optional<StateSnapshot> loaded = repository(dataFile, legacy.toString()).load();

        assertThat(loaded).hasValueSatisfying(s -> assertThat(s.fundWatchlist()).containsExactly("161725"));
        assertThat(legacy).doesNotExist();
        assertThat(dataFile).exists();
    }

    @Test
    void legacySnakeCaseKeysAreRead() throws IOException {
        Path legacy = dir.resolve("data.json");
        Path dataFile = dir.resolve("data/data.json");
        Files.writeString(legacy, LEGACY_DATA, StandardCharsets.UTF_8);
        JsonFileSnapshotRepository repository = repository(dataFile, legacy.toString());

        StateSnapshot loaded = repository.load().orElseThrow();

        assertThat(loaded.fundWatchlist()).containsExactly("161725");
        assertThat(loaded.fundHoldings()).singleElement().satisfies(h -> {
            assertThat(h.getCode()).isEqualTo("161725");
            assertThat(h.getCostPrice()).isEqualByComparingTo("1.0500");
            assertThat(h.getShares()).isEqualByComparingTo("1000");
            assertThat(h.getNote()).isEqualTo("long term");
        });
        assertThat(loaded.alertSettings().getHigh()).isEqualByComparingTo("600");
        assertThat(loaded.alertSettings().isEnabled()).isTrue();
        assertThat(loaded.alertSettings().isTradingEventsEnabled()).isFalse();
        assertThat(loaded.manualRecords()).singleElement().satisfies(r -> {
            assertThat(r.getBuyPrice()).isEqualByComparingTo("500");
            assertThat(r.getTimeStr()).isEqualTo("2024-03-01 10:00:00");
            assertThat(r.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T02:00:00.500Z"));
        });
        assertThat(loaded.priceHistory()).singleElement().satisfies(q -> {
            assertThat(q.getPreviousClose()).isEqualByComparingTo("548.2");
            assertThat(q.getChangePercent()).isEqualByComparingTo("0.35");
            assertThat(q.getTimeStr()).isEqualTo("10:00:00");
            assertThat(q.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T02:00:00Z"));
        });
        FundPortfolio portfolio = loaded.fundPortfolios().get("161725");
        assertThat(portfolio.getReportPeriod()).isEqualTo("2023Q4");
        assertThat(portfolio.getFetchedAt()).isEqualTo(Instant.parse("2024-03-01T02:00:00Z"));
        assertThat(portfolio.getPositions()).singleElement().satisfies(p -> {
            assertThat(p.getStockCode()).isEqualTo("600519");
            assertThat(p.getStockName()).isEqualTo("Kweichow Moutai");
            assertThat(p.getWeightPercent()).isEqualByComparingTo("15.2");
        });

        // the next save rewrites the migrated file in the current layout without losing anything
        repository.save(loaded);
        StateSnapshot reloaded = repository.load().orElseThrow();
        assertThat(reloaded.fundHoldings()).isEqualTo(loaded.fundHoldings());
        assertThat(reloaded.alertSettings()).isEqualTo(loaded.alertSettings());
        assertThat(Files.readString(dataFile)).contains("costPrice").doesNotContain("cost_price");
    }

    @Test
    void legacyFileIsIgnoredOnceDataFileExists() throws IOException {
        Path legacy = dir.resolve("data.json");
        Path dataFile = dir.resolve("data/data.json");
        Files.createDirectories(dataFile.getParent());
        Files.writeString(dataFile, "{\"fundWatchlist\":[\"161725\"]}", StandardCharsets.UTF_8);
        Files.writeString(legacy, "{\"fundWatchlist\":[\"000001\"]}", StandardCharsets.UTF_8);

        StateSnapshot loaded = repository(dataFile, legacy.toString()).load().orElseThrow();

        assertThat(loaded.fundWatchlist()).containsExactly("161725");
        assertThat(legacy).exists();
    }

    @Test
    void corruptFileFailsToLoad() throws IOException {
        Path dataFile = dir.resolve("data.json");
        Files.writeString(dataFile, "{not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> repository(dataFile, "").load()).isInstanceOf(IOException.class);
    }

    private JsonFileSnapshotRepository repository(Path dataFile, String legacy) {
        return new JsonFileSnapshotRepository(objectMapper, dataFile.toString(), legacy);
    }
}
