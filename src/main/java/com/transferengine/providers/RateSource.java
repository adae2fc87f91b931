package com.transferengine.providers;

import com.transferengine.common.Currency;

/**
 * A single upstream exchange-rate source.
 */
public interface RateSource {

    String getName();

    /**
     * Fetch the rate for {@code from -> to}.
     *
     * @throws RateSourceException on timeout, transport error, non-2xx response
     *         or a payload that does not describe the requested pair
     */
    RateQuote fetchRate(Currency from, Currency to);
}
