package com.fintech.paymentengine.entity;

import com.fintech.paymentengine.domain.Money;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A deposit or withdrawal moving money between a wallet and an external payment system.
 * <p>
 * The id_in_payment_system is the identifier assigned by the provider once it accepted the
 * request, and is unique per system_type. All status changes happen under a pessimistic
 * lock obtained through {@code PaymentTransactionRepository#findByIdForUpdate}.
 */
@Entity
@Table(name = "payment_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uq_system_type_id_in_payment_system",
                columnNames = {"system_type", "id_in_payment_system"}),
        indexes = {
                @Index(name = "idx_trx_uuid", columnList = "uuid", unique = true),
                @Index(name = "idx_trx_status_check_until", columnList = "status, check_status_until"),
                @Index(name = "idx_trx_status_created_at", columnList = "status, created_at")
        })
@Getter
@Setter
@ToString(exclude = "wallet")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    @Builder.Default
    private UUID uuid = UUID.randomUUID();

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "wallet_id", nullable = false, updatable = false)
    private CurrencyWallet wallet;

    @Column(name = "system_type", nullable = false, length = 50, updatable = false)
    private String systemType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(name = "id_in_payment_system", length = 255)
    private String idInPaymentSystem;

    @Column(name = "decline_code", length = 100)
    private String declineCode;

    @Column(name = "decline_reason", length = 1000)
    private String declineReason;

    @Convert(converter = JsonConverters.ExtraConverter.class)
    @Column(columnDefinition = "TEXT")
    @Builder.Default
    private TransactionExtra extra = new TransactionExtra();

    /**
     * Redirect form the payer has to complete, serialised as JSON.
     */
    @Column(columnDefinition = "TEXT")
    private String instruction;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "customer_instrument_id")
    private Long customerInstrumentId;

    @Column(name = "callback_url", length = 2000)
    private String callbackUrl;

    @Column(name = "redirect_url", length = 2000)
    private String redirectUrl;

    @Column(name = "check_status_until")
    private LocalDateTime checkStatusUntil;

    @Column(name = "status_check_attempts")
    @Builder.Default
    private Integer statusCheckAttempts = 0;

    @Column(name = "last_status_check_at")
    private LocalDateTime lastStatusCheckAt;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        // Callers importing historical rows may supply their own creation time
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public Money getMoney() {
        return Money.of(amount, currency);
    }

    public boolean isDeposit() {
        return type == TransactionType.DEPOSIT;
    }

    public boolean isWithdrawal() {
        return type == TransactionType.WITHDRAWAL;
    }

    /**
     * Stores a provider continuation value. A fresh {@link TransactionExtra} instance is set
     * so that the change is picked up by dirty checking.
     */
    public void putExtra(String namespace, String key, String value) {
        TransactionExtra copy = new TransactionExtra(extra == null ? null : extra.asMap());
        copy.put(namespace, key, value);
        this.extra = copy;
    }

    public void putAllExtra(String namespace, Map<String, String> entries) {
        TransactionExtra copy = new TransactionExtra(extra == null ? null : extra.asMap());
        copy.putAll(namespace, entries);
        this.extra = copy;
    }

    /**
     * Records the outcome of a status poll.
     */
    public void recordStatusCheck(String error) {
        this.statusCheckAttempts = (this.statusCheckAttempts == null ? 0 : this.statusCheckAttempts) + 1;
        this.lastStatusCheckAt = LocalDateTime.now();
        this.lastError = error == null ? null : truncate(error, 500);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
