package com.fintech.paymentengine.service;

import com.fintech.paymentengine.dto.ReconciliationResult;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionEventType;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.entity.TransactionType;
import com.fintech.paymentengine.exception.GatewayApiException;
import com.fintech.paymentengine.exception.ReconciliationException;
import com.fintech.paymentengine.gateway.DeclineCodes;
import com.fintech.paymentengine.repository.PaymentTransactionRepository;
import com.fintech.paymentengine.repository.TransactionEventLogRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReconciliationService.
 * 
 * Tests cover:
 * - Counting of status check outcomes
 * - Error handling
 * - Paging and overlap protection
 * - Timeout sweep of deposits and withdrawals
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    @Mock
    private PaymentTransactionRepository transactionRepository;

    @Mock
    private TransactionEventLogRepository eventLogRepository;

    @Mock
    private PaymentSystemController controller;

    @Mock
    private TransactionEventLogService eventLogService;

    private SimpleMeterRegistry meterRegistry;

    private ReconciliationService reconciliationService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reconciliationService = new ReconciliationService(
            transactionRepository,
            eventLogRepository,
            controller,
            eventLogService,
            meterRegistry
        );
        reconciliationService.initMetrics();
    }

    private void givenDue(PaymentTransaction... transactions) {
        when(transactionRepository.findDueForStatusCheck(
            eq(TransactionStatus.PENDING), any(LocalDateTime.class), any(LocalDateTime.class), anyLong(), any(Pageable.class)))
            .thenReturn(Arrays.asList(transactions));
    }

    @Nested
    @DisplayName("Status Poll Tests")
    class StatusPollTests {

        @Test
        @DisplayName("Should count each outcome of the status checks")
        void shouldCountOutcomes() {
            // Given
            PaymentTransaction success = createPendingTransaction(1L, "PROV-001");
            PaymentTransaction failed = createPendingTransaction(2L, "PROV-002");
            PaymentTransaction pending = createPendingTransaction(3L, "PROV-003");
            PaymentTransaction refunded = createPendingTransaction(4L, "PROV-004");
            givenDue(success, failed, pending, refunded);

            when(controller.checkStatus(1L)).thenReturn(TransactionStatus.SUCCESS);
            when(controller.checkStatus(2L)).thenReturn(TransactionStatus.FAILED);
            when(controller.checkStatus(3L)).thenReturn(TransactionStatus.PENDING);
            when(controller.checkStatus(4L)).thenReturn(TransactionStatus.REFUNDED);

            // When
            ReconciliationResult result = reconciliationService.reconcilePendingTransactions();

            // Then
            assertThat(result.getTotalProcessed()).isEqualTo(4);
            assertThat(result.getUpdatedToSuccess()).isEqualTo(1);
            assertThat(result.getUpdatedToFailed()).isEqualTo(1);
            assertThat(result.getStillPending()).isEqualTo(1);
            assertThat(result.getUpdatedToOther()).isEqualTo(1);
            assertThat(result.getCompletedAt()).isNotNull();
            assertThat(meterRegistry.get("reconciliation.transactions.polled").counter().count()).isEqualTo(4.0);
        }

        @Test
        @DisplayName("Should return empty result when nothing is due")
        void shouldReturnEmptyResultWhenNothingDue() {
            // Given
            givenDue();

            // When
            ReconciliationResult result = reconciliationService.reconcilePendingTransactions();

            // Then
            assertThat(result.getTotalProcessed()).isEqualTo(0);
            assertThat(result.getErrors()).isEqualTo(0);
            verify(controller, never()).checkStatus(anyLong());
        }

        @Test
        @DisplayName("Should page past rows that stay due after a failed check")
        void shouldPageByLastId() {
            // Given: batches of two, both rows of the first batch keep failing
            ReflectionTestUtils.setField(reconciliationService, "batchSize", 2);
            when(transactionRepository.findDueForStatusCheck(
                eq(TransactionStatus.PENDING), any(LocalDateTime.class), any(LocalDateTime.class), eq(0L), any(Pageable.class)))
                .thenReturn(Arrays.asList(createPendingTransaction(1L, "PROV-001"), createPendingTransaction(2L, "PROV-002")));
            when(transactionRepository.findDueForStatusCheck(
                eq(TransactionStatus.PENDING), any(LocalDateTime.class), any(LocalDateTime.class), eq(2L), any(Pageable.class)))
                .thenReturn(List.of(createPendingTransaction(3L, "PROV-003")));
            when(controller.checkStatus(1L)).thenThrow(new IllegalStateException("amount mismatch"));
            when(controller.checkStatus(2L)).thenThrow(new IllegalStateException("amount mismatch"));
            when(controller.checkStatus(3L)).thenReturn(TransactionStatus.SUCCESS);

            // When
            ReconciliationResult result = reconciliationService.reconcilePendingTransactions();

            // Then: the row behind the failing batch is reached, and the short page ends the run
            assertThat(result.getTotalProcessed()).isEqualTo(3);
            assertThat(result.getErrors()).isEqualTo(2);
            assertThat(result.getUpdatedToSuccess()).isEqualTo(1);
            verify(transactionRepository, times(2)).findDueForStatusCheck(
                any(), any(), any(), anyLong(), any(Pageable.class));
        }

        @Test
        @DisplayName("Should refuse to start while another poll is running")
        void shouldRejectOverlappingPoll() {
            // Given
            givenDue(createPendingTransaction(1L, "PROV-001"));
            when(controller.checkStatus(1L)).thenAnswer(invocation -> {
                assertThatThrownBy(() -> reconciliationService.reconcilePendingTransactions())
                    .isInstanceOf(ReconciliationException.class);
                assertThat(reconciliationService.getStats().isPollRunning()).isTrue();
                return TransactionStatus.PENDING;
            });

            // When
            ReconciliationResult result = reconciliationService.reconcilePendingTransactions();

            // Then: the flag is cleared again
            assertThat(result.getTotalProcessed()).isEqualTo(1);
            assertThat(reconciliationService.getStats().isPollRunning()).isFalse();
        }
    }

    @Nested
    @DisplayName("Error Handling Tests")
    class ErrorHandlingTests {

        @Test
        @DisplayName("Should continue processing when the gateway fails for one transaction")
        void shouldContinueProcessingOnGatewayException() {
            // Given
            givenDue(createPendingTransaction(1L, "PROV-FAIL"), createPendingTransaction(2L, "PROV-SUCCESS"));

            // First call fails, second succeeds
            when(controller.checkStatus(1L))
                .thenThrow(new GatewayApiException("API timeout", "mock", "PROV-FAIL", true));
            when(controller.checkStatus(2L)).thenReturn(TransactionStatus.SUCCESS);

            // When
            ReconciliationResult result = reconciliationService.reconcilePendingTransactions();

            // Then
            assertThat(result.getTotalProcessed()).isEqualTo(2);
            assertThat(result.getErrors()).isEqualTo(1);
            assertThat(result.getUpdatedToSuccess()).isEqualTo(1);
            assertThat(result.getErrorDetails()).singleElement().satisfies(error -> {
                assertThat(error.getTransactionId()).isEqualTo(1L);
                assertThat(error.getIdInPaymentSystem()).isEqualTo("PROV-FAIL");
                assertThat(error.getErrorMessage()).isEqualTo("API timeout");
            });
            assertThat(meterRegistry.get("reconciliation.gateway.errors").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should record unexpected errors separately")
        void shouldRecordUnexpectedErrors() {
            // Given
            givenDue(createPendingTransaction(1L, "PROV-001"));
            when(controller.checkStatus(1L)).thenThrow(new IllegalStateException("boom"));

            // When
            ReconciliationResult result = reconciliationService.reconcilePendingTransactions();

            // Then
            assertThat(result.getErrors()).isEqualTo(1);
            assertThat(result.getErrorDetails().get(0).getErrorMessage()).isEqualTo("Unexpected error: boom");
            assertThat(meterRegistry.get("reconciliation.transactions.failure").counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Timeout Sweep Tests")
    class TimeoutSweepTests {

        private void givenExpired(TransactionType type, PaymentTransaction... transactions) {
            when(transactionRepository.findExpired(eq(TransactionStatus.PENDING), eq(type),
                any(LocalDateTime.class), any(LocalDateTime.class), anyLong(), any(Pageable.class)))
                .thenReturn(Arrays.asList(transactions));
        }

        @Test
        @DisplayName("Should fail expired deposits with the timeout decline code")
        void shouldFailExpiredDeposits() {
            // Given
            givenExpired(TransactionType.DEPOSIT, createPendingTransaction(1L, null), createPendingTransaction(2L, null));
            givenExpired(TransactionType.WITHDRAWAL);
            when(controller.failTransaction(1L, DeclineCodes.DEPOSIT_NOT_PROCESSED_IN_TIME, null)).thenReturn(true);
            // finalised concurrently by a callback
            when(controller.failTransaction(2L, DeclineCodes.DEPOSIT_NOT_PROCESSED_IN_TIME, null)).thenReturn(false);

            // When
            ReconciliationResult result = reconciliationService.failExpiredTransactions();

            // Then
            assertThat(result.getTotalProcessed()).isEqualTo(2);
            assertThat(result.getUpdatedToFailed()).isEqualTo(1);
            assertThat(result.getErrors()).isEqualTo(0);
        }

        @Test
        @DisplayName("Should flag stuck withdrawals once without changing them")
        void shouldFlagStuckWithdrawals() {
            // Given
            PaymentTransaction fresh = createPendingTransaction(10L, "PROV-W1");
            PaymentTransaction alreadyFlagged = createPendingTransaction(11L, "PROV-W2");
            givenExpired(TransactionType.DEPOSIT);
            givenExpired(TransactionType.WITHDRAWAL, fresh, alreadyFlagged);
            when(eventLogRepository.existsByTransactionIdAndEventType(10L, TransactionEventType.WITHDRAWAL_STUCK_IN_PROCESSING))
                .thenReturn(false);
            when(eventLogRepository.existsByTransactionIdAndEventType(11L, TransactionEventType.WITHDRAWAL_STUCK_IN_PROCESSING))
                .thenReturn(true);

            // When
            ReconciliationResult result = reconciliationService.failExpiredTransactions();

            // Then
            assertThat(result.getRequiresManualReview()).isEqualTo(2);
            ArgumentCaptor<Long> captor = ArgumentCaptor.forClass(Long.class);
            verify(eventLogService).record(captor.capture(), eq(TransactionEventType.WITHDRAWAL_STUCK_IN_PROCESSING), anyString());
            assertThat(captor.getValue()).isEqualTo(10L);
            verify(controller, never()).failTransaction(anyLong(), any(), any());
        }

        @Test
        @DisplayName("Should keep sweeping when one deposit cannot be failed")
        void shouldContinueAfterError() {
            // Given
            givenExpired(TransactionType.DEPOSIT, createPendingTransaction(1L, "PROV-1"), createPendingTransaction(2L, "PROV-2"));
            givenExpired(TransactionType.WITHDRAWAL);
            when(controller.failTransaction(eq(1L), anyString(), isNull()))
                .thenThrow(new IllegalStateException("lock timeout"));
            when(controller.failTransaction(eq(2L), anyString(), isNull())).thenReturn(true);

            // When
            ReconciliationResult result = reconciliationService.failExpiredTransactions();

            // Then
            assertThat(result.getErrors()).isEqualTo(1);
            assertThat(result.getUpdatedToFailed()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Statistics Tests")
    class StatisticsTests {

        @Test
        @DisplayName("Should return correct statistics")
        void shouldReturnCorrectStatistics() {
            // Given
            when(transactionRepository.countByStatus(TransactionStatus.PENDING)).thenReturn(10L);
            when(transactionRepository.countByStatus(TransactionStatus.SUCCESS)).thenReturn(100L);
            when(transactionRepository.countByStatus(TransactionStatus.FAILED)).thenReturn(5L);
            when(transactionRepository.countByStatus(TransactionStatus.REFUNDED)).thenReturn(2L);
            when(transactionRepository.countByStatus(TransactionStatus.CHARGED_BACK)).thenReturn(1L);

            // When
            var stats = reconciliationService.getStats();

            // Then
            assertThat(stats.getPendingCount()).isEqualTo(10L);
            assertThat(stats.getSuccessCount()).isEqualTo(100L);
            assertThat(stats.getFailedCount()).isEqualTo(5L);
            assertThat(stats.getRefundedCount()).isEqualTo(2L);
            assertThat(stats.getChargedBackCount()).isEqualTo(1L);
        }
    }

    // Helper methods

    private PaymentTransaction createPendingTransaction(Long id, String idInPaymentSystem) {
        return PaymentTransaction.builder()
            .id(id)
            .systemType("mock")
            .type(TransactionType.DEPOSIT)
            .amount(new BigDecimal("100.00"))
            .currency("USD")
            .status(TransactionStatus.PENDING)
            .idInPaymentSystem(idInPaymentSystem)
            .checkStatusUntil(LocalDateTime.now().plusHours(1))
            .build();
    }
}
