package com.fintech.paymentengine.scheduler;

import com.fintech.paymentengine.service.RollingReserveService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Releases rolling reserve holds whose holding period is over.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "payments.reserve.release.enabled", havingValue = "true", matchIfMissing = true)
public class RollingReserveScheduler {

    private final RollingReserveService rollingReserveService;

    @Scheduled(cron = "${payments.reserve.release.cron:0 */15 * * * *}")
    public void releaseExpiredHolds() {
        log.info("Starting rolling reserve release");
        try {
            int released = rollingReserveService.releaseExpiredHolds();
            log.info("Rolling reserve release finished, {} holds released", released);
        } catch (Exception e) {
            log.error("Rolling reserve release failed", e);
        }
    }
}
