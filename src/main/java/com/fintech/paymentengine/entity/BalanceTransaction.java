package com.fintech.paymentengine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Immutable audit row written once per ledger event.
 * <p>
 * The signed amount is positive for credits and negative for debits. Before and after
 * snapshots of all three wallet balances allow the wallet to be rebuilt by replaying the
 * rows in id order.
 */
@Entity
@Immutable
@Table(name = "balance_transactions", indexes = {
        @Index(name = "idx_balance_trx_wallet", columnList = "wallet_id, id"),
        @Index(name = "idx_balance_trx_payment", columnList = "payment_transaction_id")
})
@Getter
@ToString(exclude = {"wallet", "paymentTransaction"})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "wallet_id", nullable = false, updatable = false)
    private CurrencyWallet wallet;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40, updatable = false)
    private BalanceTransactionType type;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(name = "operational_before", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal operationalBefore;

    @Column(name = "operational_after", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal operationalAfter;

    @Column(name = "frozen_before", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal frozenBefore;

    @Column(name = "frozen_after", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal frozenAfter;

    @Column(name = "pending_before", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal pendingBefore;

    @Column(name = "pending_after", nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal pendingAfter;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "payment_transaction_id", updatable = false)
    private PaymentTransaction paymentTransaction;

    @Column(length = 500, updatable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private InitiatorType initiator;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
