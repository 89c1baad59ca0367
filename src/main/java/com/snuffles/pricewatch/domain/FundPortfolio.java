package com.snuffles.pricewatch.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Top stock positions of a fund as disclosed in its latest periodic report.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FundPortfolio {
    String code;
    @JsonAlias("report_period")
    String reportPeriod;
    List<Position> positions;
    @JsonAlias("timestamp")
    Instant fetchedAt;

    public static class FundPortfolioBuilder {

        /**
         * Reads the legacy {@code {stockCode: {name, weight}}} layout into positions.
         */
        @JsonProperty("holdings_info")
        public FundPortfolioBuilder holdingsInfo(Map<String, Map<String, Object>> info) {
            List<Position> legacy = new ArrayList<>();
            if (info != null) {
                info.forEach((stockCode, entry) -> legacy.add(Position.builder()
                    .stockCode(stockCode)
                    .stockName(entry.get("name") != null ? entry.get("name").toString() : null)
                    .weightPercent(entry.get("weight") != null ? new BigDecimal(entry.get("weight").toString()) : null)
                    .build()));
            }
            return positions(legacy);
        }
    }

    @Value
    @Builder
    @Jacksonized
    public static class Position {
        String stockCode;
        String stockName;
        BigDecimal weightPercent;
    }
}
