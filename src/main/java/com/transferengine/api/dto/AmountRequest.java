package com.transferengine.api.dto;

import com.transferengine.common.Currency;
import com.transferengine.common.Money;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for deposits and withdrawals.
 */
@Data
public class AmountRequest {

    @NotBlank(message = "Account ID is required")
    private String accountId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    @Digits(integer = 15, fraction = 4, message = "Amount exceeds the supported range")
    private BigDecimal amount;

    @NotNull(message = "Currency is required")
    private Currency currency;

    public Money toMoney() {
        return Money.of(amount, currency);
    }
}
