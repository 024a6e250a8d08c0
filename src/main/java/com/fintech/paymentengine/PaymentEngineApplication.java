package com.fintech.paymentengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Payment Processing Engine
 * <p>
 * Drives deposits and withdrawals against external payment systems and keeps wallet
 * balances consistent with their outcome.
 * <p>
 * Key Features:
 * - Transaction state machine with an exactly-once ledger effect per terminal status
 * - Webhook ingestion and periodic status polling funnelled into one sync path
 * - Background tasks with retry and exponential backoff
 * - Rolling reserve holds released by a sweep
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class PaymentEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentEngineApplication.class, args);
    }
}
