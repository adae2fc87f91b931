package com.transferengine.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for audit records. Insert and read only.
 */
@Repository
public interface AuditRecordRepository extends JpaRepository<AuditRecord, String> {

    Optional<AuditRecord> findByCommittedKey(String committedKey);

    List<AuditRecord> findByTransactionId(String transactionId);

    List<AuditRecord> findByIdempotencyKeyOrderByCreatedAtAsc(String idempotencyKey);

    @Query("select r from AuditRecord r "
        + "where r.sourceAccountId = :accountId or r.destinationAccountId = :accountId "
        + "order by r.createdAt desc")
    List<AuditRecord> findByAccount(@Param("accountId") String accountId);

    @Query("select r from AuditRecord r "
        + "where r.status = com.transferengine.transactions.TransactionStatus.COMMITTED "
        + "and (r.sourceAccountId = :accountId or r.destinationAccountId = :accountId) "
        + "order by r.createdAt asc")
    List<AuditRecord> findCommittedByAccount(@Param("accountId") String accountId);
}
