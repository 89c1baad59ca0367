package com.snuffles.pricewatch.web.controller;

import com.snuffles.pricewatch.domain.AlertSettings;
import com.snuffles.pricewatch.domain.ManualRecord;
import com.snuffles.pricewatch.service.SettingsService;
import com.snuffles.pricewatch.web.dto.ApiEnvelope;
import com.snuffles.pricewatch.web.dto.RecordRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Settings", description = "Alert thresholds and manual price records")
public class SettingsController {

    private final SettingsService settingsService;

    @GetMapping("/settings")
    @Operation(summary = "Get alert settings")
    public ApiEnvelope<AlertSettings> getSettings() {
        return ApiEnvelope.ok(settingsService.getSettings());
    }

    @PostMapping("/settings")
    @Operation(summary = "Update alert settings")
    public ApiEnvelope<AlertSettings> updateSettings(@RequestBody AlertSettings settings) {
        return ApiEnvelope.ok(settingsService.updateSettings(settings));
    }

    @PostMapping("/record")
    @Operation(summary = "Record a price", description = "Stores a manual snapshot of the price, buy price and profit.")
    public ApiEnvelope<ManualRecord> addRecord(@RequestBody RecordRequest request) {
        return ApiEnvelope.ok(settingsService.addRecord(request.getPrice(), request.getBuyPrice(), request.getProfit(), request.getNote()));
    }

    @GetMapping("/records")
    @Operation(summary = "List manual records")
    public ApiEnvelope<List<ManualRecord>> getRecords() {
        return ApiEnvelope.ok(settingsService.getRecords());
    }

    @PostMapping("/records/clear")
    @Operation(summary = "Clear manual records")
    public ApiEnvelope<Void> clearRecords() {
        settingsService.clearRecords();
        return ApiEnvelope.ok(null);
    }
}
