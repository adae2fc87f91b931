package com.transferengine.providers;

import com.transferengine.common.Currency;
import com.transferengine.common.Money;

import java.util.Set;

/**
 * Foreign exchange provider interface.
 *
 * Rates are directional: {@code getRate(A, B)} is the number of B one unit of A
 * buys. Implementations must never answer with a stale or guessed rate; when no
 * rate can be obtained they throw
 * {@link com.transferengine.common.exception.RateUnavailableException}.
 */
public interface FXProvider {

    /**
     * Get the exchange rate from one currency to another. A same-currency pair
     * yields exactly one without consulting any source.
     */
    ExchangeRate getRate(Currency from, Currency to);

    /**
     * Convert money into another currency, rounding HALF_EVEN to the target scale.
     */
    default Money convert(Money money, Currency toCurrency) {
        return money.convert(getRate(money.getCurrency(), toCurrency).getRate(), toCurrency);
    }

    /**
     * Currencies this provider can quote.
     */
    Set<Currency> getSupportedCurrencies();

    /**
     * Name of the rate source that answered the most recent upstream lookup.
     */
    String getActiveSourceName();
}
