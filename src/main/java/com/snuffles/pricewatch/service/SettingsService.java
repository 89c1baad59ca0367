package com.snuffles.pricewatch.service;

import com.snuffles.pricewatch.domain.AlertSettings;
import com.snuffles.pricewatch.domain.ManualRecord;
import com.snuffles.pricewatch.persistence.StatePersistenceService;
import com.snuffles.pricewatch.state.UserDataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Alert thresholds and manually recorded price snapshots.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsService {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final UserDataStore userData;
    private final StatePersistenceService persistence;
    private final Clock clock;

    public AlertSettings getSettings() {
        return userData.getSettings();
    }

    public AlertSettings updateSettings(AlertSettings settings) {
        AlertSettings updated = AlertSettings.builder()
            .high(settings.getHigh() != null ? settings.getHigh() : BigDecimal.ZERO)
            .low(settings.getLow() != null ? settings.getLow() : BigDecimal.ZERO)
            .enabled(settings.isEnabled())
            .tradingEventsEnabled(settings.isTradingEventsEnabled())
            .build();
        userData.setSettings(updated);
        log.info("Alert settings updated: high={}, low={}, enabled={}", updated.getHigh(), updated.getLow(), updated.isEnabled());
        persistence.persist();
        return updated;
    }

    public ManualRecord addRecord(BigDecimal price, BigDecimal buyPrice, BigDecimal profit, String note) {
        Instant now = clock.instant();
        ManualRecord record = ManualRecord.builder()
            .price(price)
            .buyPrice(buyPrice)
            .profit(profit)
            .note(note != null ? note : "")
            .timestamp(now)
            .timeStr(LocalDateTime.ofInstant(now, clock.getZone()).format(TIME_FORMAT))
            .build();
        userData.addRecord(record);
        persistence.persist();
        return record;
    }

    public List<ManualRecord> getRecords() {
        return userData.getRecords();
    }

    public void clearRecords() {
        userData.clearRecords();
        log.info("Manual records cleared");
        persistence.persist();
    }
}
