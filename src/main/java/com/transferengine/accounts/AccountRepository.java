package com.transferengine.accounts;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for account persistence.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findByAccountId(String accountId);

    List<Account> findByOwnerIdOrderByCreatedAtAsc(String ownerId);

    /**
     * Loads an account with a row lock held until the surrounding transaction ends,
     * so instances sharing the database also serialize on the account.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Account a where a.accountId = :accountId")
    Optional<Account> findForUpdate(@Param("accountId") String accountId);
}
