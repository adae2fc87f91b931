package com.transferengine.providers;

import com.transferengine.common.Currency;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rate source with a fixed rate table, for running without network access.
 *
 * Pairs only listed in the other direction are served as the reciprocal;
 * pairs missing in both directions fail like an unreachable upstream would.
 */
@Slf4j
public class MockRateSource implements RateSource {

    private static final Map<Currency, Map<Currency, BigDecimal>> RATES = new EnumMap<>(Currency.class);

    static {
        put(Currency.PEN, Currency.USD, "0.27");
        put(Currency.USD, Currency.PEN, "3.70");
        put(Currency.EUR, Currency.USD, "1.08");
        put(Currency.USD, Currency.EUR, "0.92");
        put(Currency.PEN, Currency.EUR, "0.25");
        put(Currency.EUR, Currency.PEN, "4.00");
        put(Currency.GBP, Currency.USD, "1.27");
        put(Currency.USD, Currency.JPY, "151.00");
    }

    private final String name;

    public MockRateSource(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public RateQuote fetchRate(Currency from, Currency to) {
        BigDecimal direct = lookup(from, to);
        if (direct != null) {
            return new RateQuote(from, to, direct, Instant.now());
        }
        BigDecimal inverse = lookup(to, from);
        if (inverse != null) {
            BigDecimal reciprocal = BigDecimal.ONE.divide(inverse, HttpRateSource.DERIVED_RATE_SCALE,
                RoundingMode.HALF_EVEN);
            return new RateQuote(from, to, reciprocal, Instant.now());
        }
        log.debug("No mock rate for {} -> {}", from, to);
        throw new RateSourceException(name, "no rate for " + from + " -> " + to);
    }

    private static BigDecimal lookup(Currency from, Currency to) {
        Map<Currency, BigDecimal> row = RATES.get(from);
        return row == null ? null : row.get(to);
    }

    private static void put(Currency from, Currency to, String rate) {
        RATES.computeIfAbsent(from, c -> new EnumMap<>(Currency.class)).put(to, new BigDecimal(rate));
    }
}
