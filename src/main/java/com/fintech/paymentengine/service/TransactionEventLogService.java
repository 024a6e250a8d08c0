package com.fintech.paymentengine.service;

import com.fintech.paymentengine.entity.JsonConverters;
import com.fintech.paymentengine.entity.TransactionEventLog;
import com.fintech.paymentengine.entity.TransactionEventType;
import com.fintech.paymentengine.observability.CorrelationContext;
import com.fintech.paymentengine.repository.TransactionEventLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the per-transaction event journal.
 */
@Service
@RequiredArgsConstructor
public class TransactionEventLogService {

    private static final int MAX_DESCRIPTION = 2000;
    private static final int MAX_TRACE = 8000;

    private final TransactionEventLogRepository eventLogRepository;

    @Transactional
    public TransactionEventLog record(Long transactionId, TransactionEventType type, String description,
                                      Map<String, String> extra) {
        return eventLogRepository.save(TransactionEventLog.builder()
                .transactionId(transactionId)
                .eventType(type)
                .description(truncate(description, MAX_DESCRIPTION))
                .extra(JsonConverters.write(extra))
                .correlationId(CorrelationContext.currentCorrelationId())
                .build());
    }

    @Transactional
    public TransactionEventLog record(Long transactionId, TransactionEventType type, String description) {
        return record(transactionId, type, description, null);
    }

    /**
     * Records an unexpected error together with its message and stack trace. The entry is
     * committed on its own and survives a rollback of the caller's transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TransactionEventLog recordError(Long transactionId, String description, Throwable error) {
        Map<String, String> extra = new LinkedHashMap<>();
        extra.put("exception", error.getClass().getName());
        extra.put("message", String.valueOf(error.getMessage()));
        extra.put("trace", truncate(stackTrace(error), MAX_TRACE));
        return record(transactionId, TransactionEventType.ERROR, description, extra);
    }

    @Transactional(readOnly = true)
    public List<TransactionEventLog> findByTransaction(Long transactionId) {
        return eventLogRepository.findByTransactionIdOrderByIdAsc(transactionId);
    }

    private static String stackTrace(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
