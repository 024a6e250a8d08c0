package com.fintech.paymentengine.repository;

import com.fintech.paymentengine.entity.CurrencyWallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CurrencyWalletRepository extends JpaRepository<CurrencyWallet, Long> {

    /**
     * Locks the wallet row. Balances read through any other finder are display-only.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM CurrencyWallet w WHERE w.id = :id")
    Optional<CurrencyWallet> findByIdForUpdate(@Param("id") Long id);
}
