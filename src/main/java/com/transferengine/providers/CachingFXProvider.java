package com.transferengine.providers;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.transferengine.common.Currency;
import com.transferengine.common.exception.RateUnavailableException;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * FX provider backed by a primary and a fallback rate source, with a short-lived
 * cache in front of them.
 *
 * A cache miss runs PRIMARY_ATTEMPT, then FALLBACK_ATTEMPT, then FAIL. The cache
 * computes each missing pair at most once at a time: concurrent callers asking
 * for the same pair wait for the single upstream lookup in flight and share its
 * result. Failures are not cached, and an entry past its TTL is never served.
 */
@Slf4j
public class CachingFXProvider implements FXProvider {

    private final RateSource primary;
    private final RateSource fallback;
    private final Duration cacheTtl;
    private final Clock clock;
    private final Cache<CurrencyPair, ExchangeRate> cache;
    private volatile RateSource activeSource;

    public CachingFXProvider(RateSource primary, RateSource fallback, Duration cacheTtl, long maxSize) {
        this(primary, fallback, cacheTtl, maxSize, Ticker.systemTicker(), Clock.systemUTC());
    }

    CachingFXProvider(RateSource primary, RateSource fallback, Duration cacheTtl, long maxSize,
                      Ticker ticker, Clock clock) {
        this.primary = primary;
        this.fallback = fallback;
        this.cacheTtl = cacheTtl;
        this.clock = clock;
        this.activeSource = primary;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(cacheTtl)
            .ticker(ticker)
            .build();

        log.info("FX provider initialized: primary={}, fallback={}, cacheTtl={}",
            primary.getName(), fallback.getName(), cacheTtl);
    }

    @Override
    public ExchangeRate getRate(Currency from, Currency to) {
        if (from == to) {
            return ExchangeRate.identity(from, clock.instant());
        }
        return cache.get(new CurrencyPair(from, to), this::resolve);
    }

    @Override
    public Set<Currency> getSupportedCurrencies() {
        return EnumSet.allOf(Currency.class);
    }

    @Override
    public String getActiveSourceName() {
        return activeSource.getName();
    }

    private ExchangeRate resolve(CurrencyPair pair) {
        RateResolution step = RateResolution.PRIMARY_ATTEMPT;
        RateSourceException lastFailure = null;

        while (true) {
            switch (step) {
                case PRIMARY_ATTEMPT -> {
                    try {
                        return toExchangeRate(primary, pair, RateSourceType.PRIMARY);
                    } catch (RateSourceException e) {
                        log.warn("Primary rate source failed for {} -> {}: {}",
                            pair.getFrom(), pair.getTo(), e.getMessage());
                        lastFailure = e;
                        step = RateResolution.FALLBACK_ATTEMPT;
                    }
                }
                case FALLBACK_ATTEMPT -> {
                    try {
                        return toExchangeRate(fallback, pair, RateSourceType.FALLBACK);
                    } catch (RateSourceException e) {
                        log.warn("Fallback rate source failed for {} -> {}: {}",
                            pair.getFrom(), pair.getTo(), e.getMessage());
                        if (lastFailure != null) {
                            e.addSuppressed(lastFailure);
                        }
                        lastFailure = e;
                        step = RateResolution.FAIL;
                    }
                }
                case FAIL -> throw new RateUnavailableException(pair.getFrom(), pair.getTo(), lastFailure);
            }
        }
    }

    private ExchangeRate toExchangeRate(RateSource source, CurrencyPair pair, RateSourceType sourceType) {
        RateQuote quote = source.fetchRate(pair.getFrom(), pair.getTo());
        if (activeSource != source) {
            log.info("Rates now served by {} source {}", sourceType, source.getName());
            activeSource = source;
        }
        Instant now = clock.instant();
        log.debug("FX rate {} -> {}: {} from {}", quote.getFrom(), quote.getTo(), quote.getRate(), sourceType);
        return new ExchangeRate(quote.getFrom(), quote.getTo(), quote.getRate(), sourceType, now, now.plus(cacheTtl));
    }

    @Value
    static class CurrencyPair {
        Currency from;
        Currency to;
    }
}
