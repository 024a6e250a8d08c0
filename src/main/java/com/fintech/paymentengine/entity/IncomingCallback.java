package com.fintech.paymentengine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * A webhook exactly as it was received from a payment system, plus the outcome of processing it.
 */
@Entity
@Table(name = "incoming_callbacks", indexes = {
        @Index(name = "idx_callback_replay_key", columnList = "replay_key"),
        @Index(name = "idx_callback_transaction", columnList = "transaction_id")
})
@Getter
@Setter
@ToString(exclude = {"body", "transaction"})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncomingCallback {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "system_type", nullable = false, length = 50, updatable = false)
    private String systemType;

    /**
     * Request headers as a JSON object.
     */
    @Column(columnDefinition = "TEXT", updatable = false)
    private String headers;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String body;

    @Column(length = 64, updatable = false)
    private String ip;

    /**
     * system type, event type and SHA-256 of the body, used to spot redelivered callbacks.
     */
    @Column(name = "replay_key", nullable = false, length = 200, updatable = false)
    private String replayKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private CallbackStatus status = CallbackStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_type", length = 30)
    private CallbackErrorType errorType;

    @Column(length = 2000)
    private String error;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "transaction_id")
    private PaymentTransaction transaction;

    @Column(name = "remote_status", columnDefinition = "TEXT")
    private String remoteStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public void markFailed(CallbackErrorType type, String message) {
        this.status = CallbackStatus.FAILED;
        this.errorType = type;
        this.error = message == null ? null : message.substring(0, Math.min(message.length(), 2000));
    }
}
