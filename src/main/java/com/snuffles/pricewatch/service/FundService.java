package com.snuffles.pricewatch.service;

import com.snuffles.pricewatch.config.PriceWatchProperties;
import com.snuffles.pricewatch.domain.FundPortfolio;
import com.snuffles.pricewatch.domain.Quote;
import com.snuffles.pricewatch.fetch.FetchOutcome;
import com.snuffles.pricewatch.persistence.StatePersistenceService;
import com.snuffles.pricewatch.provider.FundPortfolioProvider;
import com.snuffles.pricewatch.service.exception.ResourceNotFoundException;
import com.snuffles.pricewatch.service.exception.ValidationException;
import com.snuffles.pricewatch.state.UserDataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fund watchlist and per-fund portfolio lookups.
 */
@Service
@Slf4j
public class FundService {

    private final UserDataStore userData;
    private final FundQuoteService fundQuotes;
    private final FundPortfolioProvider portfolioProvider;
    private final StatePersistenceService persistence;
    private final Duration portfolioTtl;
    private final Clock clock;

    public FundService(
        UserDataStore userData,
        FundQuoteService fundQuotes,
        FundPortfolioProvider portfolioProvider,
        StatePersistenceService persistence,
        PriceWatchProperties properties,
        Clock clock
    ) {
        this.userData = userData;
        this.fundQuotes = fundQuotes;
        this.portfolioProvider = portfolioProvider;
        this.persistence = persistence;
        this.portfolioTtl = properties.getFund().getPortfolioTtl();
        this.clock = clock;
    }

    public QueryResult<List<Quote>> getFunds(boolean fast) {
        List<String> watchlist = userData.getWatchlist();
        return QueryResult.ok(new ArrayList<>(fundQuotes.getMany(watchlist, fast).values()));
    }

    public Quote addFund(String code) {
        String normalized = code != null ? code.trim() : "";
        if (!HoldingsService.FUND_CODE.matcher(normalized).matches()) {
            throw new ValidationException("Invalid fund code (6 digits required)");
        }
        if (userData.getWatchlist().contains(normalized)) {
            throw new ValidationException("Fund " + normalized + " is already in the watchlist");
        }

        FetchOutcome outcome = fundQuotes.fetchAndCache(normalized);
        if (!outcome.isSuccess()) {
            log.warn("Rejecting fund {}: {}", normalized, outcome.getErrorMessage());
            throw new ValidationException("Could not load data for fund " + normalized + ", check the code");
        }
        if (!userData.addToWatchlist(normalized)) {
            throw new ValidationException("Fund " + normalized + " is already in the watchlist");
        }
        log.info("Added fund {} to watchlist", normalized);
        persistence.persist();
        return outcome.getQuote();
    }

    public void deleteFund(String code) {
        if (!userData.removeFromWatchlist(code)) {
            throw new ResourceNotFoundException("Fund not found: " + code);
        }
        fundQuotes.evict(code);
        log.info("Removed fund {} from watchlist", code);
        persistence.persist();
    }

    /**
     * Cached portfolio while younger than the portfolio TTL, otherwise a fresh scrape. A failed
     * scrape falls back to whatever was cached before.
     */
    public QueryResult<FundPortfolio> getFundPortfolio(String code, boolean refresh) {
        Optional<FundPortfolio> cached = userData.getPortfolio(code);
        if (!refresh && cached.isPresent() && isCurrent(cached.get())) {
            log.debug("Serving cached portfolio for {}", code);
            return QueryResult.ok(cached.get());
        }

        Optional<FundPortfolio> fetched;
        try {
            fetched = portfolioProvider.fetchPortfolio(code);
        } catch (RuntimeException ex) {
            log.error("Portfolio scrape for {} failed: {}", code, ex.toString());
            fetched = Optional.empty();
        }
        if (fetched.isPresent()) {
            userData.putPortfolio(fetched.get());
            persistence.persist();
            return QueryResult.ok(fetched.get());
        }
        if (cached.isPresent()) {
            log.warn("Portfolio scrape for {} returned nothing; serving cached copy", code);
            return QueryResult.ok(cached.get());
        }
        return QueryResult.error("Failed to load fund portfolio");
    }

    private boolean isCurrent(FundPortfolio portfolio) {
        return portfolio.getFetchedAt() != null
            && Duration.between(portfolio.getFetchedAt(), clock.instant()).compareTo(portfolioTtl) < 0;
    }
}
