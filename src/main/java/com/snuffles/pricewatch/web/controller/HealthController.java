package com.snuffles.pricewatch.web.controller;

import com.snuffles.pricewatch.registry.SourceRegistry;
import com.snuffles.pricewatch.registry.SourceStatus;
import com.snuffles.pricewatch.web.dto.ApiEnvelope;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class HealthController {

    private final SourceRegistry goldSources;
    private final SourceRegistry fundSources;

    public HealthController(
        @Qualifier("goldSourceRegistry") SourceRegistry goldSources,
        @Qualifier("fundSourceRegistry") SourceRegistry fundSources
    ) {
        this.goldSources = goldSources;
        this.fundSources = fundSources;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "UP");
    }

    @GetMapping("/api/sources")
    public ApiEnvelope<Map<String, List<SourceStatus>>> sources() {
        return ApiEnvelope.ok(Map.of(
            goldSources.getScope(), goldSources.describe(),
            fundSources.getScope(), fundSources.describe()
        ));
    }
}
