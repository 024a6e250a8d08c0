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
 * Balance-bearing account in a single currency.
 * <p>
 * Balances are only ever written by {@code BalanceUpdateService} while holding a
 * pessimistic lock on this row. The available balance is derived, never stored.
 */
@Entity
@Table(name = "currency_wallets")
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrencyWallet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @Column(name = "operational_balance", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal operationalBalance = BigDecimal.ZERO;

    @Column(name = "frozen_balance", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal frozenBalance = BigDecimal.ZERO;

    @Column(name = "pending_balance", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal pendingBalance = BigDecimal.ZERO;

    /**
     * Routes the wallet's transactions through the sandbox gateway decorator.
     */
    @Column(nullable = false)
    @Builder.Default
    private boolean sandbox = false;

    @Column(name = "rolling_reserve_percent", precision = 5, scale = 2)
    private BigDecimal rollingReservePercent;

    @Column(name = "rolling_reserve_days")
    private Integer rollingReserveDays;

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

    public Money getOperational() {
        return Money.of(operationalBalance, currency);
    }

    public Money getFrozen() {
        return Money.of(frozenBalance, currency);
    }

    public Money getPending() {
        return Money.of(pendingBalance, currency);
    }

    public Money getAvailable() {
        return getOperational().subtract(getFrozen()).subtract(getPending());
    }

    public boolean hasRollingReserve() {
        return rollingReservePercent != null && rollingReservePercent.signum() > 0
                && rollingReserveDays != null && rollingReserveDays > 0;
    }
}
