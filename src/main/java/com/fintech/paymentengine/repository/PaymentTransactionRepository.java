package com.fintech.paymentengine.repository;

import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.entity.TransactionType;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transaction store. Every status change goes through one of the locking finders below.
 */
@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, Long> {

    /**
     * Loads the transaction with a row-level exclusive lock held until the surrounding
     * database transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM PaymentTransaction t WHERE t.id = :id")
    Optional<PaymentTransaction> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM PaymentTransaction t WHERE t.systemType = :systemType " +
            "AND t.idInPaymentSystem = :idInPaymentSystem")
    Optional<PaymentTransaction> findBySystemTypeAndIdInPaymentSystemForUpdate(
            @Param("systemType") String systemType,
            @Param("idInPaymentSystem") String idInPaymentSystem
    );

    @EntityGraph(attributePaths = "wallet")
    Optional<PaymentTransaction> findWithWalletById(Long id);

    Optional<PaymentTransaction> findByUuid(UUID uuid);

    Optional<PaymentTransaction> findBySystemTypeAndIdInPaymentSystem(String systemType, String idInPaymentSystem);

    Page<PaymentTransaction> findByStatus(TransactionStatus status, Pageable pageable);

    /**
     * Pending transactions still inside their polling window that were not checked since
     * {@code checkedBefore}, with an id above {@code afterId}. Callers page by passing the last
     * id of the previous page, so rows that stay due do not hide the ones behind them.
     */
    @Query("SELECT t FROM PaymentTransaction t WHERE t.status = :status " +
            "AND t.checkStatusUntil > :now " +
            "AND (t.lastStatusCheckAt IS NULL OR t.lastStatusCheckAt < :checkedBefore) " +
            "AND t.id > :afterId " +
            "ORDER BY t.id ASC")
    List<PaymentTransaction> findDueForStatusCheck(
            @Param("status") TransactionStatus status,
            @Param("now") LocalDateTime now,
            @Param("checkedBefore") LocalDateTime checkedBefore,
            @Param("afterId") Long afterId,
            Pageable pageable
    );

    /**
     * Pending transactions of one type whose polling window elapsed, or that never got one and
     * were created before {@code createdBefore}. Keyset paged on id like
     * {@link #findDueForStatusCheck}.
     */
    @Query("SELECT t FROM PaymentTransaction t WHERE t.status = :status AND t.type = :type " +
            "AND ((t.checkStatusUntil IS NOT NULL AND t.checkStatusUntil <= :now) " +
            "OR (t.checkStatusUntil IS NULL AND t.createdAt < :createdBefore)) " +
            "AND t.id > :afterId " +
            "ORDER BY t.id ASC")
    List<PaymentTransaction> findExpired(
            @Param("status") TransactionStatus status,
            @Param("type") TransactionType type,
            @Param("now") LocalDateTime now,
            @Param("createdBefore") LocalDateTime createdBefore,
            @Param("afterId") Long afterId,
            Pageable pageable
    );

    long countByStatus(TransactionStatus status);

    List<PaymentTransaction> findByWalletIdOrderByIdAsc(Long walletId);
}
