package com.fintech.paymentengine.service;

import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.dto.BalanceUpdateRequest;
import com.fintech.paymentengine.entity.BalanceTransaction;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.entity.CurrencyWallet;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.ReserveStatus;
import com.fintech.paymentengine.entity.RollingReserveHold;
import com.fintech.paymentengine.repository.RollingReserveHoldRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Rolling reserve: a share of each successful deposit is kept frozen for a number of days as
 * cover for chargebacks, then released by a sweep.
 */
@Service
@Slf4j
public class RollingReserveService {

    private final BalanceUpdateService balanceUpdateService;
    private final RollingReserveHoldRepository holdRepository;
    private final TransactionTemplate transactionTemplate;

    @Value("${payments.reserve.release.batch-size:100}")
    private int batchSize = 100;

    public RollingReserveService(BalanceUpdateService balanceUpdateService,
                                 RollingReserveHoldRepository holdRepository,
                                 TransactionTemplate transactionTemplate) {
        this.balanceUpdateService = balanceUpdateService;
        this.holdRepository = holdRepository;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Freezes the wallet's reserve share of a confirmed deposit. Does nothing for wallets
     * without a reserve policy.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<RollingReserveHold> holdForDeposit(PaymentTransaction deposit) {
        CurrencyWallet wallet = balanceUpdateService.lockWallet(deposit.getWallet().getId());
        if (!wallet.hasRollingReserve()) {
            return Optional.empty();
        }

        Money reserve = deposit.getMoney().percentage(wallet.getRollingReservePercent());
        if (!reserve.isPositive()) {
            log.debug("Reserve share of deposit {} rounds to zero, nothing held", deposit.getId());
            return Optional.empty();
        }

        BalanceTransaction source = balanceUpdateService.applyLocked(wallet, BalanceUpdateRequest.builder()
                .walletId(wallet.getId())
                .type(BalanceTransactionType.ROLLING_RESERVE_HOLD)
                .amount(reserve)
                .paymentTransaction(deposit)
                .description(String.format("Rolling reserve %s%% for %d days",
                        wallet.getRollingReservePercent().stripTrailingZeros().toPlainString(),
                        wallet.getRollingReserveDays()))
                .build());

        RollingReserveHold hold = holdRepository.save(RollingReserveHold.builder()
                .wallet(wallet)
                .amount(reserve.getAmount())
                .currency(reserve.getCurrency())
                .holdUntil(LocalDateTime.now().plusDays(wallet.getRollingReserveDays()))
                .status(ReserveStatus.ACTIVE)
                .sourceTransaction(source)
                .build());

        log.info("Holding {} of deposit {} on wallet {} until {}",
                reserve, deposit.getId(), wallet.getId(), hold.getHoldUntil());
        return Optional.of(hold);
    }

    /**
     * Releases one hold back to the available balance. Returns false if it was already released.
     */
    @Transactional
    public boolean releaseHold(Long holdId) {
        RollingReserveHold hold = holdRepository.findByIdForUpdate(holdId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown reserve hold " + holdId));
        if (!hold.isActive()) {
            log.debug("Reserve hold {} already released", holdId);
            return false;
        }

        CurrencyWallet wallet = balanceUpdateService.lockWallet(hold.getWallet().getId());
        BalanceTransaction release = balanceUpdateService.applyLocked(wallet, BalanceUpdateRequest.builder()
                .walletId(wallet.getId())
                .type(BalanceTransactionType.ROLLING_RESERVE_RELEASE)
                .amount(hold.getMoney())
                .description("Rolling reserve released, hold " + holdId)
                .build());

        hold.setStatus(ReserveStatus.RELEASED);
        hold.setReleaseTransaction(release);
        hold.setReleasedAt(LocalDateTime.now());
        holdRepository.save(hold);

        log.info("Released reserve hold {} ({}) on wallet {}", holdId, hold.getMoney(), wallet.getId());
        return true;
    }

    /**
     * Releases every active hold whose holding period is over. Each hold is released in its own
     * database transaction so that one failure does not block the rest.
     *
     * @return number of holds released by this run
     */
    public int releaseExpiredHolds() {
        int released = 0;
        int failed = 0;
        List<Long> due;
        do {
            due = holdRepository.findIdsDueForRelease(ReserveStatus.ACTIVE, LocalDateTime.now(),
                    PageRequest.of(0, batchSize));
            int releasedInBatch = 0;
            for (Long holdId : due) {
                try {
                    Boolean done = transactionTemplate.execute(status -> releaseHold(holdId));
                    if (Boolean.TRUE.equals(done)) {
                        released++;
                        releasedInBatch++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Failed to release reserve hold {}: {}", holdId, e.getMessage(), e);
                }
            }
            // stop when nothing in this batch could be released, otherwise failures would loop forever
            if (releasedInBatch == 0) {
                break;
            }
        } while (due.size() == batchSize);

        if (failed > 0) {
            log.warn("Reserve release sweep finished with {} failures", failed);
        }
        return released;
    }
}
