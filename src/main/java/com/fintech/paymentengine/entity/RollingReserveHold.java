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

/**
 * Part of a deposit withheld in the wallet's frozen balance until {@code holdUntil}.
 * Moves ACTIVE -> RELEASED exactly once.
 */
@Entity
@Table(name = "rolling_reserve_holds", indexes = {
        @Index(name = "idx_reserve_status_hold_until", columnList = "status, hold_until")
})
@Getter
@Setter
@ToString(exclude = {"wallet", "sourceTransaction", "releaseTransaction"})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RollingReserveHold {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "wallet_id", nullable = false, updatable = false)
    private CurrencyWallet wallet;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(name = "hold_until", nullable = false)
    private LocalDateTime holdUntil;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ReserveStatus status = ReserveStatus.ACTIVE;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "source_transaction_id", nullable = false, updatable = false)
    private BalanceTransaction sourceTransaction;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "release_transaction_id")
    private BalanceTransaction releaseTransaction;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "released_at")
    private LocalDateTime releasedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public Money getMoney() {
        return Money.of(amount, currency);
    }

    public boolean isActive() {
        return status == ReserveStatus.ACTIVE;
    }
}
