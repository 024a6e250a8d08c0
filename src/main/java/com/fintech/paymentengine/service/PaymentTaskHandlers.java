package com.fintech.paymentengine.service;

import com.fintech.paymentengine.scheduler.BackgroundTask;
import com.fintech.paymentengine.scheduler.BackgroundTaskScheduler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Wires background tasks to the controller operations that execute them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentTaskHandlers {

    private final BackgroundTaskScheduler taskScheduler;
    private final PaymentSystemController controller;

    @PostConstruct
    public void register() {
        taskScheduler.registerHandler(BackgroundTask.CHECK_STATUS, controller::checkStatus);
        taskScheduler.registerHandler(BackgroundTask.DEPOSIT_FINALIZATION, controller::runDepositFinalization);
        log.debug("Registered payment background task handlers");
    }
}
