package com.fintech.paymentengine.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of rebuilding a wallet's balances from its audit trail.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceReplayResult {

    private Long walletId;
    private String currency;
    private int entriesReplayed;

    private BigDecimal replayedOperational;
    private BigDecimal replayedFrozen;
    private BigDecimal replayedPending;

    private BigDecimal storedOperational;
    private BigDecimal storedFrozen;
    private BigDecimal storedPending;

    /**
     * Audit rows whose before/after snapshots do not chain or do not follow the event rules.
     */
    @Builder.Default
    private List<Long> inconsistentEntryIds = new ArrayList<>();

    public boolean isConsistent() {
        return inconsistentEntryIds.isEmpty()
                && replayedOperational.compareTo(storedOperational) == 0
                && replayedFrozen.compareTo(storedFrozen) == 0
                && replayedPending.compareTo(storedPending) == 0;
    }
}
