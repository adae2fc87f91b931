package com.transferengine.api.dto;

import com.transferengine.common.Currency;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for opening a new account.
 */
@Data
public class CreateAccountRequest {

    @NotBlank(message = "Owner ID is required")
    private String ownerId;

    @NotNull(message = "Currency is required")
    private Currency currency;

    @PositiveOrZero(message = "Initial deposit cannot be negative")
    @Digits(integer = 15, fraction = 4, message = "Amount exceeds the supported range")
    private BigDecimal initialDeposit;
}
