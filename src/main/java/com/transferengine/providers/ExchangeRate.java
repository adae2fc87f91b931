package com.transferengine.providers;

import com.transferengine.common.Currency;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A resolved exchange rate. Ephemeral: it lives in the rate cache at most until
 * {@link #expiresAt}; the audit record of a transaction is what keeps the rate
 * that was actually applied.
 */
@Value
public class ExchangeRate {
    Currency from;
    Currency to;
    BigDecimal rate;
    RateSourceType source;
    Instant fetchedAt;
    Instant expiresAt;

    public static ExchangeRate identity(Currency currency, Instant now) {
        return new ExchangeRate(currency, currency, BigDecimal.ONE, RateSourceType.IDENTITY, now, null);
    }
}
