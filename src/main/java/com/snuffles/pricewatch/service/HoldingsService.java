package com.snuffles.pricewatch.service;

import com.snuffles.pricewatch.cache.CacheEntry;
import com.snuffles.pricewatch.cache.CacheTtl;
import com.snuffles.pricewatch.cache.Freshness;
import com.snuffles.pricewatch.cache.HoldingsCache;
import com.snuffles.pricewatch.config.PriceWatchProperties;
import com.snuffles.pricewatch.domain.FundHolding;
import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.fetch.FetchOutcome;
import com.snuffles.pricewatch.persistence.StatePersistenceService;
import com.snuffles.pricewatch.refresh.RefreshCoordinator;
import com.snuffles.pricewatch.refresh.RefreshScope;
import com.snuffles.pricewatch.service.exception.ResourceNotFoundException;
import com.snuffles.pricewatch.service.exception.ValidationException;
import com.snuffles.pricewatch.state.MarketStateLock;
import com.snuffles.pricewatch.state.UserDataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
@Slf4j
public class HoldingsService {

    static final Pattern FUND_CODE = Pattern.compile("\\d{6}");
    private static final DateTimeFormatter LAST_UPDATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final UserDataStore userData;
    private final HoldingsCache holdingsCache;
    private final FundQuoteService fundQuotes;
    private final RefreshCoordinator coordinator;
    private final StatePersistenceService persistence;
    private final MarketStateLock lock;
    private final CacheTtl ttl;
    private final Clock clock;

    private record Basis(long generation, List<FundHolding> holdings) {
    }

    public HoldingsService(
        UserDataStore userData,
        HoldingsCache holdingsCache,
        FundQuoteService fundQuotes,
        RefreshCoordinator coordinator,
        StatePersistenceService persistence,
        MarketStateLock lock,
        PriceWatchProperties properties,
        Clock clock
    ) {
        this.userData = userData;
        this.holdingsCache = holdingsCache;
        this.fundQuotes = fundQuotes;
        this.coordinator = coordinator;
        this.persistence = persistence;
        this.lock = lock;
        this.ttl = properties.getHoldings().getCache().toCacheTtl();
        this.clock = clock;
    }

    /**
     * Cached report in fast mode (stale copies trigger a background recompute); otherwise
     * recomputed from live quotes.
     */
    public QueryResult<HoldingsReport> getHoldings(boolean fast, boolean refresh) {
        if (fast && !refresh) {
            Optional<CacheEntry<HoldingsReport>> cached = holdingsCache.get();
            if (cached.isPresent()) {
                Freshness freshness = cached.get().classify(clock.instant(), ttl);
                if (freshness == Freshness.FRESH) {
                    log.debug("Serving fresh holdings report");
                    return QueryResult.ok(cached.get().value());
                }
                if (freshness == Freshness.STALE) {
                    coordinator.schedule(RefreshScope.HOLDINGS, this::recompute);
                    return QueryResult.ok(cached.get().value().asStale());
                }
            }
        }
        return QueryResult.ok(recompute());
    }

    /**
     * Builds a report from live quotes and caches it unless the holdings changed meanwhile.
     */
    public HoldingsReport recompute() {
        Basis basis = lock.withLock(() -> new Basis(holdingsCache.generation(), userData.getHoldings()));
        String lastUpdate = LocalDateTime.now(clock).format(LAST_UPDATE_FORMAT);

        HoldingsReport report;
        if (basis.holdings().isEmpty()) {
            report = HoldingsReport.empty(lastUpdate);
        } else {
            List<String> codes = basis.holdings().stream().map(FundHolding::getCode).collect(Collectors.toList());
            Map<String, Optional<Quote>> quotes = fundQuotes.fetchAndStore(codes);
            report = build(basis.holdings(), quotes, lastUpdate);
        }

        if (!holdingsCache.storeIfCurrent(report, clock.instant(), basis.generation())) {
            log.info("Holdings changed during recompute; result not cached");
        }
        return report;
    }

    public FundHolding saveHolding(String code, BigDecimal costPrice, BigDecimal shares, String note) {
        String normalized = code != null ? code.trim() : "";
        if (!FUND_CODE.matcher(normalized).matches()) {
            throw new ValidationException("Invalid fund code (6 digits required)");
        }
        if (costPrice == null || shares == null || costPrice.signum() <= 0 || shares.signum() <= 0) {
            throw new ValidationException("Cost price and shares must be greater than 0");
        }

        FetchOutcome outcome = fundQuotes.fetchAndCache(normalized);
        String name = outcome.isSuccess() && outcome.getQuote().getName() != null
            ? outcome.getQuote().getName()
            : "Fund " + normalized;

        FundHolding holding = FundHolding.builder()
            .code(normalized)
            .name(name)
            .costPrice(costPrice)
            .shares(shares)
            .note(note != null ? note.trim() : "")
            .build();
        lock.runLocked(() -> {
            userData.putHolding(holding);
            holdingsCache.invalidate();
        });
        log.info("Saved holding {} ({} shares at {})", normalized, shares, costPrice);
        persistence.persist();
        return holding;
    }

    public void deleteHolding(String code) {
        boolean removed = lock.withLock(() -> {
            boolean r = userData.removeHolding(code);
            if (r) {
                holdingsCache.invalidate();
            }
            return r;
        });
        if (!removed) {
            throw new ResourceNotFoundException("Holding not found: " + code);
        }
        log.info("Deleted holding {}", code);
        persistence.persist();
    }

    private HoldingsReport build(List<FundHolding> holdings, Map<String, Optional<Quote>> quotes, String lastUpdate) {
        List<HoldingLine> lines = new ArrayList<>();
        BigDecimal totalCost = BigDecimal.ZERO;
        BigDecimal totalValue = BigDecimal.ZERO;

        for (FundHolding h : holdings) {
            Optional<Quote> quote = quotes.getOrDefault(h.getCode(), Optional.empty());
            // no quote at all: value at cost
            BigDecimal price = quote.map(Quote::getPrice).orElse(h.getCostPrice());
            BigDecimal cost = h.getCostPrice().multiply(h.getShares()).setScale(2, RoundingMode.HALF_UP);
            BigDecimal value = price.multiply(h.getShares()).setScale(2, RoundingMode.HALF_UP);
            BigDecimal profit = value.subtract(cost);

            lines.add(HoldingLine.builder()
                .code(h.getCode())
                .name(quote.map(Quote::getName).filter(n -> !n.isBlank()).orElse(h.getName()))
                .costPrice(h.getCostPrice())
                .shares(h.getShares())
                .note(h.getNote())
                .currentPrice(price)
                .changePercent(quote.map(Quote::getChangePercent).orElse(BigDecimal.ZERO))
                .costAmount(cost)
                .marketValue(value)
                .profit(profit)
                .profitRate(rate(profit, cost))
                .source(quote.map(Quote::getSource).orElse(null))
                .timeStr(quote.map(Quote::getTimeStr).orElse("--"))
                .build());
            totalCost = totalCost.add(cost);
            totalValue = totalValue.add(value);
        }

        BigDecimal totalProfit = totalValue.subtract(totalCost);
        HoldingsSummary summary = new HoldingsSummary(totalCost, totalValue, totalProfit, rate(totalProfit, totalCost), lines.size());
        return new HoldingsReport(List.copyOf(lines), summary, lastUpdate, false);
    }

    private static BigDecimal rate(BigDecimal profit, BigDecimal cost) {
        if (cost.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return profit.multiply(HUNDRED).divide(cost, 2, RoundingMode.HALF_UP);
    }
}
