package com.snuffles.pricewatch.config;

import com.snuffles.pricewatch.fetch.FailoverFetcher;
import com.snuffles.pricewatch.history.TimeSeriesBuffer;
import com.snuffles.pricewatch.provider.QuoteAdapter;
import com.snuffles.pricewatch.refresh.RefreshScope;
import com.snuffles.pricewatch.registry.SourceDescriptor;
import com.snuffles.pricewatch.registry.SourceRegistry;
import com.snuffles.pricewatch.state.MarketStateLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wires source registries, failover fetchers and the executors behind them.
 * The refresh executor is separate from the fetch pool: refresh tasks block on fetch tasks.
 */
@Configuration
@EnableConfigurationProperties(PriceWatchProperties.class)
@EnableRetry
@Slf4j
public class MarketDataConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SourceRegistry goldSourceRegistry(PriceWatchProperties properties, MarketStateLock lock, Clock clock) {
        return registry("gold", properties.getGold().getSources(), properties.getBreaker(), lock, clock);
    }

    @Bean
    public SourceRegistry fundSourceRegistry(PriceWatchProperties properties, MarketStateLock lock, Clock clock) {
        return registry("fund", properties.getFund().getSources(), properties.getBreaker(), lock, clock);
    }

    @Bean
    public FailoverFetcher goldFetcher(@Qualifier("goldSourceRegistry") SourceRegistry registry, List<QuoteAdapter> adapters) {
        return new FailoverFetcher(registry, byType(adapters));
    }

    @Bean
    public FailoverFetcher fundFetcher(@Qualifier("fundSourceRegistry") SourceRegistry registry, List<QuoteAdapter> adapters) {
        return new FailoverFetcher(registry, byType(adapters));
    }

    @Bean
    public TimeSeriesBuffer timeSeriesBuffer(PriceWatchProperties properties, MarketStateLock lock) {
        return new TimeSeriesBuffer(properties.getHistory().getCapacity(), lock);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(PriceWatchProperties properties) {
        int workers = Math.max(1, properties.getFetch().getWorkers());
        return Executors.newFixedThreadPool(workers, daemonThreads("quote-fetch"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService refreshExecutor() {
        return Executors.newFixedThreadPool(RefreshScope.values().length, daemonThreads("cache-refresh"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService pollerScheduler() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("price-poller"));
    }

    private static SourceRegistry registry(
        String scope,
        List<PriceWatchProperties.Source> configured,
        PriceWatchProperties.Breaker breaker,
        MarketStateLock lock,
        Clock clock
    ) {
        List<SourceDescriptor> sources = configured.stream()
            .map(s -> new SourceDescriptor(s.getName(), s.getType(), s.isEnabled(), s.getTimeout()))
            .collect(Collectors.toList());
        log.info("Configured {} {} source(s): {}", sources.size(), scope,
            sources.stream().map(SourceDescriptor::getName).collect(Collectors.joining(", ")));
        return new SourceRegistry(scope, sources, breaker.getMaxFailCount(), breaker.getMuteDuration(), lock, clock);
    }

    private static Map<String, QuoteAdapter> byType(List<QuoteAdapter> adapters) {
        return adapters.stream().collect(Collectors.toMap(QuoteAdapter::type, Function.identity()));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
