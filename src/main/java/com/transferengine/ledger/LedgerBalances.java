package com.transferengine.ledger;

import com.transferengine.common.Money;
import lombok.Value;

/**
 * Post-mutation balances of the two accounts touched by a transfer.
 */
@Value
public class LedgerBalances {
    Money sourceBalance;
    Money destinationBalance;
}
