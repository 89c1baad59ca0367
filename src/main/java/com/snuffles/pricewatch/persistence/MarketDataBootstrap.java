package com.snuffles.pricewatch.persistence;

import com.snuffles.pricewatch.config.PriceWatchProperties;
import com.snuffles.pricewatch.history.PricePoller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Restores persisted state, then starts the background price poller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarketDataBootstrap implements ApplicationRunner {

    private final StatePersistenceService persistence;
    private final PricePoller poller;
    private final PriceWatchProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        persistence.restore();
        if (properties.getPoller().isEnabled()) {
            poller.start();
        } else {
            log.info("Background price poller disabled");
        }
    }
}
