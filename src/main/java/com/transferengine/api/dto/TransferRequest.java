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
 * DTO for a transfer between two accounts. The amount is in the source
 * account's currency.
 */
@Data
public class TransferRequest {

    @NotBlank(message = "Source account ID is required")
    private String sourceAccountId;

    @NotBlank(message = "Destination account ID is required")
    private String destinationAccountId;

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
