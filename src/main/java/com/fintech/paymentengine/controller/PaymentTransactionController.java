package com.fintech.paymentengine.controller;

import com.fintech.paymentengine.dto.BalanceTransactionResponse;
import com.fintech.paymentengine.dto.CreateTransactionRequest;
import com.fintech.paymentengine.dto.TransactionResponse;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionEventLog;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.exception.ResourceNotFoundException;
import com.fintech.paymentengine.repository.BalanceTransactionRepository;
import com.fintech.paymentengine.repository.PaymentTransactionRepository;
import com.fintech.paymentengine.scheduler.BackgroundTask;
import com.fintech.paymentengine.scheduler.BackgroundTaskScheduler;
import com.fintech.paymentengine.service.PaymentSystemController;
import com.fintech.paymentengine.service.TransactionCreationService;
import com.fintech.paymentengine.service.TransactionEventLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST API for deposits and withdrawals.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Transactions", description = "Deposit and withdrawal lifecycle API")
public class PaymentTransactionController {

    private final TransactionCreationService creationService;
    private final PaymentSystemController paymentSystemController;
    private final PaymentTransactionRepository transactionRepository;
    private final BalanceTransactionRepository balanceTransactionRepository;
    private final TransactionEventLogService eventLogService;
    private final BackgroundTaskScheduler taskScheduler;

    @Operation(
            summary = "Create a deposit",
            description = "Creates a PENDING deposit and sends it to the payment system. The response carries the redirect instruction or the decline."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Deposit created",
                    content = @Content(schema = @Schema(implementation = TransactionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Wallet not found")
    })
    @PostMapping("/deposits")
    public ResponseEntity<TransactionResponse> createDeposit(@Valid @RequestBody CreateTransactionRequest request) {
        PaymentTransaction transaction = creationService.createDeposit(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @Operation(
            summary = "Create a withdrawal",
            description = "Freezes the amount on the wallet, creates a PENDING withdrawal and sends it to the payment system."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Withdrawal created",
                    content = @Content(schema = @Schema(implementation = TransactionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request"),
            @ApiResponse(responseCode = "404", description = "Wallet not found"),
            @ApiResponse(responseCode = "422", description = "Insufficient available balance")
    })
    @PostMapping("/withdrawals")
    public ResponseEntity<TransactionResponse> createWithdrawal(@Valid @RequestBody CreateTransactionRequest request) {
        PaymentTransaction transaction = creationService.createWithdrawal(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @Operation(summary = "Get transaction by ID")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Transaction found"),
            @ApiResponse(responseCode = "404", description = "Transaction not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@Parameter(description = "Transaction ID") @PathVariable Long id) {
        return ResponseEntity.ok(TransactionResponse.from(load(id)));
    }

    @Operation(summary = "Get transaction by UUID")
    @GetMapping("/by-uuid/{uuid}")
    public ResponseEntity<TransactionResponse> getTransactionByUuid(@PathVariable UUID uuid) {
        return transactionRepository.findByUuid(uuid)
                .map(TransactionResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", uuid));
    }

    @Operation(summary = "List transactions by status", description = "Paginated, defaults to PENDING.")
    @GetMapping
    public ResponseEntity<Page<TransactionResponse>> listByStatus(
            @RequestParam(defaultValue = "PENDING") TransactionStatus status,
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(transactionRepository.findByStatus(status, PageRequest.of(page, size))
                .map(TransactionResponse::from));
    }

    @Operation(
            summary = "Check status now",
            description = "Queries the payment system for the transaction's status and syncs it."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status checked"),
            @ApiResponse(responseCode = "409", description = "Remote status contradicts the local one"),
            @ApiResponse(responseCode = "503", description = "Payment system unavailable")
    })
    @PostMapping("/{id}/check-status")
    public ResponseEntity<TransactionResponse> checkStatus(@PathVariable Long id) {
        log.info("Manual status check requested for transaction {}", id);
        paymentSystemController.checkStatus(id);
        return ResponseEntity.ok(TransactionResponse.from(load(id)));
    }

    @Operation(
            summary = "Finalize a deposit",
            description = "Schedules the second leg of a deposit, e.g. once the payer has completed 3-D-Secure."
    )
    @ApiResponse(responseCode = "202", description = "Finalization scheduled")
    @PostMapping("/{id}/finalize")
    public ResponseEntity<Void> finalizeDeposit(@PathVariable Long id) {
        PaymentTransaction transaction = load(id);
        if (!transaction.isDeposit()) {
            throw new IllegalArgumentException("Transaction " + id + " is not a deposit");
        }
        taskScheduler.schedule(BackgroundTask.DEPOSIT_FINALIZATION, id, Duration.ZERO);
        return ResponseEntity.accepted().build();
    }

    @Operation(summary = "Ledger entries written for a transaction")
    @GetMapping("/{id}/balance-transactions")
    public ResponseEntity<List<BalanceTransactionResponse>> getBalanceTransactions(@PathVariable Long id) {
        load(id);
        return ResponseEntity.ok(balanceTransactionRepository.findByPaymentTransactionIdOrderByIdAsc(id).stream()
                .map(BalanceTransactionResponse::from)
                .collect(Collectors.toList()));
    }

    @Operation(summary = "Event journal of a transaction")
    @GetMapping("/{id}/events")
    public ResponseEntity<List<TransactionEventLog>> getEvents(@PathVariable Long id) {
        load(id);
        return ResponseEntity.ok(eventLogService.findByTransaction(id));
    }

    private PaymentTransaction load(Long id) {
        return transactionRepository.findWithWalletById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction", id));
    }
}
