package com.fintech.paymentengine.repository;

import com.fintech.paymentengine.entity.TransactionEventLog;
import com.fintech.paymentengine.entity.TransactionEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransactionEventLogRepository extends JpaRepository<TransactionEventLog, Long> {

    List<TransactionEventLog> findByTransactionIdOrderByIdAsc(Long transactionId);

    boolean existsByTransactionIdAndEventType(Long transactionId, TransactionEventType eventType);

    long countByTransactionIdAndEventType(Long transactionId, TransactionEventType eventType);
}
