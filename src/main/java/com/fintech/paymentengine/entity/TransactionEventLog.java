package com.fintech.paymentengine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * Journal entry describing something that happened to a transaction outside of plain status
 * changes: gateway errors, declines, stuck withdrawals.
 */
@Entity
@Immutable
@Table(name = "transaction_event_logs", indexes = {
        @Index(name = "idx_event_log_transaction", columnList = "transaction_id, event_type")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private Long transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40, updatable = false)
    private TransactionEventType eventType;

    @Column(nullable = false, length = 2000, updatable = false)
    private String description;

    /**
     * Additional context as a JSON object.
     */
    @Column(columnDefinition = "TEXT", updatable = false)
    private String extra;

    @Column(name = "correlation_id", length = 64, updatable = false)
    private String correlationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
