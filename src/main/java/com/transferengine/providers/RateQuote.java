package com.transferengine.providers;

import com.transferengine.common.Currency;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A rate as returned by a single upstream source, already oriented in the
 * requested direction.
 */
@Value
public class RateQuote {
    Currency from;
    Currency to;
    BigDecimal rate;
    Instant quotedAt;
}
