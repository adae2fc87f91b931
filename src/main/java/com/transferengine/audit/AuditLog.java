package com.transferengine.audit;

import com.transferengine.common.Currency;
import com.transferengine.common.Money;
import com.transferengine.common.exception.AuditWriteFailureException;
import com.transferengine.common.exception.InvalidTransferException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Append-only log of every committed or failed transaction.
 *
 * Committed records are written inside the ledger's unit of work, so the
 * balance change and its record commit or roll back together. Failed records
 * are written in a transaction of their own after the unit has been abandoned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLog {

    private final AuditRecordRepository auditRecordRepository;

    /**
     * Appends the record of a committed mutation. Must join the transaction that
     * performed the mutation.
     *
     * @throws InvalidTransferException if the idempotency key already committed
     * @throws AuditWriteFailureException if the record could not be written; the
     *         caller's transaction is rolled back with it
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditRecord recordCommitted(AuditRecord record) {
        if (!record.isCommitted()) {
            throw new IllegalArgumentException("Expected a committed record, got " + record.getStatus());
        }
        try {
            AuditRecord saved = auditRecordRepository.saveAndFlush(record);
            log.info("Audited COMMITTED {}: txn={}, key={}", record.getType(),
                record.getTransactionId(), record.getIdempotencyKey());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new InvalidTransferException("Idempotency key already committed: " + record.getIdempotencyKey());
        } catch (TransientDataAccessException e) {
            throw e;
        } catch (DataAccessException e) {
            log.error("Audit write failed for txn={}, rolling back mutation", record.getTransactionId(), e);
            throw new AuditWriteFailureException(record.getTransactionId(), e);
        }
    }

    /**
     * Appends the record of a failed transaction in its own transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditRecord recordFailed(AuditRecord record) {
        if (record.isCommitted()) {
            throw new IllegalArgumentException("Expected a failed record, got " + record.getStatus());
        }
        AuditRecord saved = auditRecordRepository.save(record);
        log.info("Audited FAILED {}: txn={}, key={}, stage={}, reason={}", record.getType(),
            record.getTransactionId(), record.getIdempotencyKey(), record.getFailureStage(),
            record.getFailureReason());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<AuditRecord> findCommitted(String idempotencyKey) {
        return auditRecordRepository.findByCommittedKey(idempotencyKey);
    }

    @Transactional(readOnly = true)
    public List<AuditRecord> getAccountHistory(String accountId) {
        return auditRecordRepository.findByAccount(accountId);
    }

    @Transactional(readOnly = true)
    public List<AuditRecord> getTransaction(String transactionId) {
        return auditRecordRepository.findByTransactionId(transactionId);
    }

    @Transactional(readOnly = true)
    public List<AuditRecord> getAttempts(String idempotencyKey) {
        return auditRecordRepository.findByIdempotencyKeyOrderByCreatedAtAsc(idempotencyKey);
    }

    /**
     * Rebuilds an account's balance from its committed records alone: credits
     * received minus debits sent. Matches the stored balance when every mutation
     * was audited.
     */
    @Transactional(readOnly = true)
    public Money reconstructBalance(String accountId, Currency currency) {
        Money balance = Money.zero(currency);
        for (AuditRecord record : auditRecordRepository.findCommittedByAccount(accountId)) {
            if (accountId.equals(record.getDestinationAccountId()) && record.getCredit() != null) {
                balance = balance.add(record.getCredit());
            }
            if (accountId.equals(record.getSourceAccountId()) && record.getDebit() != null) {
                balance = balance.subtract(record.getDebit());
            }
        }
        return balance;
    }
}
