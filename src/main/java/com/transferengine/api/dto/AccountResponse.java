package com.transferengine.api.dto;

import com.transferengine.accounts.Account;
import com.transferengine.accounts.AccountStatus;
import com.transferengine.common.Money;
import lombok.Value;

import java.time.Instant;

/**
 * Account as exposed over the API.
 */
@Value
public class AccountResponse {
    String accountId;
    String ownerId;
    Money balance;
    AccountStatus status;
    Long version;
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return new AccountResponse(
            account.getAccountId(),
            account.getOwnerId(),
            account.getBalance(),
            account.getStatus(),
            account.getVersion(),
            account.getCreatedAt()
        );
    }
}
