package com.transferengine.transactions;

import com.transferengine.accounts.AccountService;
import com.transferengine.audit.AuditLog;
import com.transferengine.audit.AuditRecord;
import com.transferengine.common.Currency;
import com.transferengine.common.IdempotencyKey;
import com.transferengine.common.Money;
import com.transferengine.common.exception.AccountClosedException;
import com.transferengine.common.exception.AccountNotFoundException;
import com.transferengine.common.exception.InsufficientFundsException;
import com.transferengine.common.exception.InvalidTransferException;
import com.transferengine.common.exception.RateUnavailableException;
import com.transferengine.common.exception.TransactionStage;
import com.transferengine.providers.RateSourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for deposits, withdrawals and transfers.
 *
 * Runs against the mock rate table (USD -> PEN 3.70, USD -> JPY 151.00; no
 * GBP/JPY pair). Not transactional: the engine commits its own units of work.
 */
@SpringBootTest
@ActiveProfiles("test")
class TransactionEngineTest {

    @Autowired
    private TransactionEngine transactionEngine;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AuditLog auditLog;

    private String usdA;
    private String usdB;
    private String pen;

    @BeforeEach
    void setUp() {
        usdA = openFunded(Currency.USD, "100.00");
        usdB = openFunded(Currency.USD, "0");
        pen = openFunded(Currency.PEN, "0");
    }

    @Test
    void testSameCurrencyTransferConservesValue() {
        TransferResult result = transactionEngine.transfer(usdA, usdB, usd("30.00"), IdempotencyKey.generate());

        assertEquals(usd("30.00"), result.getDebited());
        assertEquals(usd("30.00"), result.getCredited());
        assertEquals(RateSourceType.IDENTITY, result.getRateSource());
        assertEquals(0, BigDecimal.ONE.compareTo(result.getAppliedRate()));
        assertEquals(usd("70.00"), result.getSourceBalance());
        assertEquals(usd("30.00"), result.getDestinationBalance());

        assertEquals(usd("70.00"), balanceOf(usdA));
        assertEquals(usd("30.00"), balanceOf(usdB));
    }

    @Test
    void testCrossCurrencyTransferAppliesRate() {
        TransferResult result = transactionEngine.transfer(usdA, pen, usd("10.00"), IdempotencyKey.generate());

        assertEquals(usd("10.00"), result.getDebited());
        assertEquals(Money.of("37.00", Currency.PEN), result.getCredited());
        assertEquals(0, new BigDecimal("3.70").compareTo(result.getAppliedRate()));
        assertEquals(RateSourceType.PRIMARY, result.getRateSource());
        assertEquals(usd("90.00"), balanceOf(usdA));
        assertEquals(Money.of("37.00", Currency.PEN), balanceOf(pen));
    }

    @Test
    void testConversionToZeroDecimalCurrencyRoundsHalfEven() {
        String jpy = openFunded(Currency.JPY, "0");

        // 1.50 * 151 = 226.5 -> 226
        TransferResult result = transactionEngine.transfer(usdA, jpy, usd("1.50"), IdempotencyKey.generate());

        assertEquals(Money.of("226", Currency.JPY), result.getCredited());
        assertEquals(usd("98.50"), balanceOf(usdA));
    }

    @Test
    void testForeignCurrencyDepositIsConverted() {
        BalanceResult result = transactionEngine.deposit(pen, usd("10.00"), IdempotencyKey.generate());

        assertEquals(Money.of("37.00", Currency.PEN), result.getAmount());
        assertEquals(Money.of("37.00", Currency.PEN), result.getNewBalance());
        assertEquals(TransactionType.DEPOSIT, result.getType());
    }

    @Test
    void testWithdrawal() {
        BalanceResult result = transactionEngine.withdraw(usdA, usd("25.50"), IdempotencyKey.generate());

        assertEquals(usd("74.50"), result.getNewBalance());
        assertEquals(usd("74.50"), balanceOf(usdA));
    }

    @Test
    void testWithdrawalInOtherCurrencyIsRejected() {
        assertThrows(InvalidTransferException.class,
            () -> transactionEngine.withdraw(pen, usd("1.00"), IdempotencyKey.generate()));
    }

    @Test
    void testReplayReturnsSameResultWithoutSecondMutation() {
        String key = IdempotencyKey.generate();

        TransferResult first = transactionEngine.transfer(usdA, usdB, usd("10.00"), key);
        TransferResult second = transactionEngine.transfer(usdA, usdB, usd("10.00"), key);

        assertEquals(first, second);
        assertEquals(usd("90.00"), balanceOf(usdA));
        assertEquals(usd("10.00"), balanceOf(usdB));
        assertEquals(1, auditLog.getAttempts(key).size());
    }

    @Test
    void testKeyReuseWithDifferentRequestIsRejected() {
        String key = IdempotencyKey.generate();
        transactionEngine.transfer(usdA, usdB, usd("10.00"), key);

        assertThrows(InvalidTransferException.class,
            () -> transactionEngine.transfer(usdA, usdB, usd("11.00"), key));
        assertThrows(InvalidTransferException.class,
            () -> transactionEngine.deposit(usdA, usd("10.00"), key));

        assertEquals(usd("90.00"), balanceOf(usdA));
    }

    @Test
    void testInsufficientFundsLeavesBalancesAndAuditsFailure() {
        String key = IdempotencyKey.generate();

        InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
            () -> transactionEngine.transfer(usdA, usdB, usd("100.01"), key));

        assertEquals(usdA, e.getAccountId());
        assertEquals(usd("100.00"), balanceOf(usdA));
        assertEquals(usd("0.00"), balanceOf(usdB));

        List<AuditRecord> attempts = auditLog.getAttempts(key);
        assertEquals(1, attempts.size());
        AuditRecord failed = attempts.get(0);
        assertEquals(TransactionStatus.FAILED, failed.getStatus());
        assertEquals(TransactionStatus.LOCKED.name(), failed.getFailureStage());
        assertTrue(failed.getFailureReason().startsWith("InsufficientFundsException"));
        assertNull(failed.getCommittedKey());
    }

    @Test
    void testFailedAttemptDoesNotBlockRetryWithSameKey() {
        String key = IdempotencyKey.generate();
        assertThrows(InsufficientFundsException.class,
            () -> transactionEngine.transfer(usdA, usdB, usd("150.00"), key));

        transactionEngine.deposit(usdA, usd("50.00"), IdempotencyKey.generate());
        TransferResult result = transactionEngine.transfer(usdA, usdB, usd("150.00"), key);

        assertEquals(usd("150.00"), result.getCredited());
        assertEquals(2, auditLog.getAttempts(key).size());
        assertTrue(auditLog.findCommitted(key).isPresent());
    }

    @Test
    void testCreditPastMaximumBalanceIsRejectedAndAudited() {
        String rich = openFunded(Currency.USD, "999999999999999.00");
        String key = IdempotencyKey.generate();

        InvalidTransferException e = assertThrows(InvalidTransferException.class,
            () -> transactionEngine.deposit(rich, usd("1.00"), key));

        assertEquals(TransactionStage.VALIDATION, e.getStage());
        assertFalse(e.isRetryable());
        assertEquals(usd("999999999999999.00"), balanceOf(rich));

        List<AuditRecord> attempts = auditLog.getAttempts(key);
        assertEquals(1, attempts.size());
        assertEquals(TransactionStatus.FAILED, attempts.get(0).getStatus());
        assertTrue(auditLog.findCommitted(key).isEmpty());
    }

    @Test
    void testConversionPastStorableRangeIsRejected() {
        String jpy = openFunded(Currency.JPY, "0");
        String rich = openFunded(Currency.USD, "99999999999999.00");

        // 99999999999999.00 * 151 has seventeen integer digits
        InvalidTransferException e = assertThrows(InvalidTransferException.class,
            () -> transactionEngine.transfer(rich, jpy, usd("99999999999999.00"), IdempotencyKey.generate()));

        assertFalse(e.isRetryable());
        assertEquals(usd("99999999999999.00"), balanceOf(rich));
        assertEquals(Money.of("0", Currency.JPY), balanceOf(jpy));
    }

    @Test
    void testSelfTransferIsRejected() {
        assertThrows(InvalidTransferException.class,
            () -> transactionEngine.transfer(usdA, usdA, usd("1.00"), IdempotencyKey.generate()));
        assertEquals(usd("100.00"), balanceOf(usdA));
    }

    @Test
    void testNonPositiveAmountIsRejected() {
        assertThrows(InvalidTransferException.class,
            () -> transactionEngine.transfer(usdA, usdB, usd("0.00"), IdempotencyKey.generate()));
        assertThrows(InvalidTransferException.class,
            () -> transactionEngine.deposit(usdA, usd("-5.00"), IdempotencyKey.generate()));
    }

    @Test
    void testBlankIdempotencyKeyIsRejected() {
        assertThrows(InvalidTransferException.class,
            () -> transactionEngine.transfer(usdA, usdB, usd("1.00"), " "));
    }

    @Test
    void testUnknownAccount() {
        assertThrows(AccountNotFoundException.class,
            () -> transactionEngine.transfer(usdA, "no-such-account", usd("1.00"), IdempotencyKey.generate()));
        assertEquals(usd("100.00"), balanceOf(usdA));
    }

    @Test
    void testClosedAccountIsRejected() {
        accountService.closeAccount(usdB, null);

        AccountClosedException e = assertThrows(AccountClosedException.class,
            () -> transactionEngine.transfer(usdA, usdB, usd("1.00"), IdempotencyKey.generate()));

        assertEquals(usdB, e.getAccountId());
        assertEquals(usd("100.00"), balanceOf(usdA));
    }

    @Test
    void testUnavailableRateFailsBeforeLocking() {
        String gbp = openFunded(Currency.GBP, "20.00");
        String jpy = openFunded(Currency.JPY, "0");
        String key = IdempotencyKey.generate();

        RateUnavailableException e = assertThrows(RateUnavailableException.class,
            () -> transactionEngine.transfer(gbp, jpy, Money.of("5.00", Currency.GBP), key));

        assertEquals(TransactionStage.RATE_RESOLUTION, e.getStage());
        assertTrue(e.isRetryable());
        assertEquals(Money.of("20.00", Currency.GBP), balanceOf(gbp));
        assertEquals(Money.of("0", Currency.JPY), balanceOf(jpy));

        AuditRecord failed = auditLog.getAttempts(key).get(0);
        assertEquals(TransactionStatus.PENDING.name(), failed.getFailureStage());
    }

    @Test
    void testHistoryReconstructsBalance() {
        transactionEngine.transfer(usdA, usdB, usd("12.34"), IdempotencyKey.generate());
        transactionEngine.transfer(usdB, usdA, usd("2.34"), IdempotencyKey.generate());
        transactionEngine.transfer(usdA, pen, usd("5.00"), IdempotencyKey.generate());
        transactionEngine.withdraw(usdA, usd("1.00"), IdempotencyKey.generate());

        assertEquals(balanceOf(usdA), auditLog.reconstructBalance(usdA, Currency.USD));
        assertEquals(balanceOf(usdB), auditLog.reconstructBalance(usdB, Currency.USD));
        assertEquals(balanceOf(pen), auditLog.reconstructBalance(pen, Currency.PEN));
    }

    private String openFunded(Currency currency, String initial) {
        String accountId = accountService.openAccount("engine-owner", currency).getAccountId();
        Money amount = Money.of(initial, currency);
        if (amount.isPositive()) {
            transactionEngine.deposit(accountId, amount, IdempotencyKey.generate());
        }
        return accountId;
    }

    private Money balanceOf(String accountId) {
        return accountService.getAccount(accountId).getBalance();
    }

    private static Money usd(String amount) {
        return Money.of(amount, Currency.USD);
    }
}
