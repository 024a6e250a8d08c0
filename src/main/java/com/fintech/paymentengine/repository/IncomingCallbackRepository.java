package com.fintech.paymentengine.repository;

import com.fintech.paymentengine.entity.CallbackStatus;
import com.fintech.paymentengine.entity.IncomingCallback;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IncomingCallbackRepository extends JpaRepository<IncomingCallback, Long> {

    boolean existsByReplayKeyAndStatusAndIdNot(String replayKey, CallbackStatus status, Long id);

    List<IncomingCallback> findByReplayKeyOrderByIdAsc(String replayKey);

    List<IncomingCallback> findByTransactionIdOrderByIdAsc(Long transactionId);
}
