package com.fintech.paymentengine.repository;

import com.fintech.paymentengine.entity.BalanceTransaction;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BalanceTransactionRepository extends JpaRepository<BalanceTransaction, Long> {

    List<BalanceTransaction> findByWalletIdOrderByIdAsc(Long walletId);

    List<BalanceTransaction> findByPaymentTransactionIdOrderByIdAsc(Long paymentTransactionId);

    long countByPaymentTransactionId(Long paymentTransactionId);

    long countByPaymentTransactionIdAndType(Long paymentTransactionId, BalanceTransactionType type);
}
