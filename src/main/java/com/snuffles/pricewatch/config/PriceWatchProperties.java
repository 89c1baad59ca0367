package com.snuffles.pricewatch.config;

import com.snuffles.pricewatch.cache.CacheTtl;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Static configuration for data sources, breaker thresholds, cache TTLs and the poller.
 */
@Data
@ConfigurationProperties(prefix = "pricewatch")
public class PriceWatchProperties {

    private Breaker breaker = new Breaker();
    private Gold gold = new Gold();
    private Fund fund = new Fund();
    private Holdings holdings = new Holdings();
    private History history = new History();
    private Fetch fetch = new Fetch();
    private Poller poller = new Poller();
    private Records records = new Records();

    @Data
    public static class Breaker {
        /**
         * Consecutive failures before a source is muted.
         */
        private int maxFailCount = 3;

        /**
         * How long a tripped source is skipped.
         */
        private Duration muteDuration = Duration.ofSeconds(60);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Source {
        private String name;
        private String type;
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Ttl {
        private Duration fresh;
        private Duration staleMax;

        public CacheTtl toCacheTtl() {
            return new CacheTtl(fresh, staleMax);
        }
    }

    @Data
    public static class Gold {
        private String code = "AU9999";
        private List<Source> sources = new ArrayList<>();

        /**
         * Age after which the latest buffered price is refetched on request.
         */
        private Duration staleThreshold = Duration.ofSeconds(30);
    }

    @Data
    public static class Fund {
        private List<Source> sources = new ArrayList<>();
        private Ttl cache = new Ttl(Duration.ofSeconds(60), Duration.ofSeconds(600));
        private Duration portfolioTtl = Duration.ofHours(24);
    }

    @Data
    public static class Holdings {
        private Ttl cache = new Ttl(Duration.ofSeconds(30), Duration.ofSeconds(300));
    }

    @Data
    public static class History {
        private int capacity = 720;
    }

    @Data
    public static class Fetch {
        private int workers = 5;
    }

    @Data
    public static class Poller {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(5);
        private Duration errorBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Records {
        private int keepDays = 7;
    }
}
