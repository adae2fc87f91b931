package com.transferengine.common.exception;

import com.transferengine.common.Currency;

/**
 * Thrown when neither the primary nor the fallback rate source could supply a rate.
 */
public class RateUnavailableException extends TransferEngineException {

    private final Currency from;
    private final Currency to;

    public RateUnavailableException(Currency from, Currency to, Throwable cause) {
        super(String.format("Could not get exchange rate from %s to %s from any source", from, to),
            null, null, TransactionStage.RATE_RESOLUTION, cause);
        this.from = from;
        this.to = to;
    }

    public Currency getFrom() {
        return from;
    }

    public Currency getTo() {
        return to;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
