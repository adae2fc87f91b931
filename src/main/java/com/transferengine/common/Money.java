package com.transferengine.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Immutable value object representing a monetary amount with currency.
 *
 * Amounts are always held at the scale of their currency. {@link #of} rejects
 * amounts carrying more fractional digits than the currency allows; the only
 * place rounding happens is {@link #convert}, which rounds HALF_EVEN.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Money {

    /** Integer digits a stored amount may carry (NUMERIC(19,4) columns). */
    public static final int MAX_INTEGER_DIGITS = 15;

    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    private Currency currency;

    public static Money of(BigDecimal amount, Currency currency) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (currency == null) {
            throw new IllegalArgumentException("Currency cannot be null");
        }
        BigDecimal scaled;
        try {
            scaled = amount.setScale(currency.getScale(), RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                String.format("Amount %s has more than %d decimal places allowed for %s",
                    amount.toPlainString(), currency.getScale(), currency));
        }
        return bounded(scaled, currency);
    }

    public static Money of(String amount, Currency currency) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return of(new BigDecimal(amount), currency);
    }

    public static Money zero(Currency currency) {
        return of(BigDecimal.ZERO, currency);
    }

    /**
     * Amount at the currency scale. Values loaded from wider database columns
     * are brought back to the currency scale here.
     */
    public BigDecimal getAmount() {
        if (amount == null || currency == null) {
            return amount;
        }
        return amount.setScale(currency.getScale(), RoundingMode.UNNECESSARY);
    }

    public Money add(Money other) {
        validateSameCurrency(other);
        return bounded(getAmount().add(other.getAmount()), currency);
    }

    public Money subtract(Money other) {
        validateSameCurrency(other);
        return bounded(getAmount().subtract(other.getAmount()), currency);
    }

    /**
     * Converts this amount into the target currency using the given rate,
     * rounding HALF_EVEN to the target currency's scale.
     */
    public Money convert(BigDecimal rate, Currency target) {
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalArgumentException("Exchange rate must be positive: " + rate);
        }
        BigDecimal converted = getAmount()
            .multiply(rate)
            .setScale(target.getScale(), RoundingMode.HALF_EVEN);
        return bounded(converted, target);
    }

    /**
     * Whether a value fits the supported range of {@value #MAX_INTEGER_DIGITS}
     * integer digits.
     */
    public static boolean isWithinRange(BigDecimal amount) {
        return amount.precision() - amount.scale() <= MAX_INTEGER_DIGITS;
    }

    public boolean isGreaterThanOrEqual(Money other) {
        validateSameCurrency(other);
        return getAmount().compareTo(other.getAmount()) >= 0;
    }

    public boolean isLessThan(Money other) {
        validateSameCurrency(other);
        return getAmount().compareTo(other.getAmount()) < 0;
    }

    @JsonIgnore
    public boolean isPositive() {
        return amount.signum() > 0;
    }

    @JsonIgnore
    public boolean isNegative() {
        return amount.signum() < 0;
    }

    @Override
    public String toString() {
        return getAmount().toPlainString() + " " + currency;
    }

    private static Money bounded(BigDecimal amount, Currency currency) {
        if (!isWithinRange(amount)) {
            throw new IllegalArgumentException(
                String.format("Amount %s exceeds the supported range of %d integer digits",
                    amount.toPlainString(), MAX_INTEGER_DIGITS));
        }
        return new Money(amount, currency);
    }

    private void validateSameCurrency(Money other) {
        if (!this.currency.equals(other.currency)) {
            throw new IllegalArgumentException(
                String.format("Cannot perform operation on different currencies: %s and %s",
                    this.currency, other.currency)
            );
        }
    }
}
