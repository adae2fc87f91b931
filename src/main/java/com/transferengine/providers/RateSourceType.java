package com.transferengine.providers;

/**
 * Where an applied exchange rate came from.
 */
public enum RateSourceType {
    /** Same-currency pair, rate is exactly one. */
    IDENTITY,
    PRIMARY,
    FALLBACK
}
