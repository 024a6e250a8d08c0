package com.fintech.paymentengine.controller;

import com.fintech.paymentengine.dto.BalanceReplayResult;
import com.fintech.paymentengine.dto.BalanceTransactionResponse;
import com.fintech.paymentengine.dto.CreateWalletRequest;
import com.fintech.paymentengine.dto.WalletOperationRequest;
import com.fintech.paymentengine.dto.WalletResponse;
import com.fintech.paymentengine.service.BalanceAuditService;
import com.fintech.paymentengine.service.WalletService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/wallets")
@RequiredArgsConstructor
@Tag(name = "Wallets", description = "Wallet balances and manual ledger operations")
public class WalletController {

    private final WalletService walletService;
    private final BalanceAuditService balanceAuditService;

    @Operation(summary = "Create a wallet", description = "Balances start at zero.")
    @ApiResponse(responseCode = "201", description = "Wallet created")
    @PostMapping
    public ResponseEntity<WalletResponse> create(@Valid @RequestBody CreateWalletRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(WalletResponse.from(walletService.create(request)));
    }

    @Operation(summary = "Get wallet balances")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Wallet found"),
            @ApiResponse(responseCode = "404", description = "Wallet not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<WalletResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(WalletResponse.from(walletService.get(id)));
    }

    @Operation(
            summary = "Apply a manual operation",
            description = "MANUAL_ADJUSTMENT, FEE, FROZEN or UNFROZEN, recorded with initiator USER."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Ledger entry written"),
            @ApiResponse(responseCode = "400", description = "Operation type not allowed")
    })
    @PostMapping("/{id}/operations")
    public ResponseEntity<BalanceTransactionResponse> applyOperation(@PathVariable Long id,
                                                                     @Valid @RequestBody WalletOperationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BalanceTransactionResponse.from(walletService.applyManualOperation(id, request)));
    }

    @Operation(summary = "Ledger of a wallet", description = "All balance transactions, oldest first.")
    @GetMapping("/{id}/balance-transactions")
    public ResponseEntity<List<BalanceTransactionResponse>> getLedger(@PathVariable Long id) {
        return ResponseEntity.ok(walletService.getLedger(id).stream()
                .map(BalanceTransactionResponse::from)
                .collect(Collectors.toList()));
    }

    @Operation(
            summary = "Audit wallet balances",
            description = "Replays the ledger from zero and compares the result with the stored balances."
    )
    @GetMapping("/{id}/audit")
    public ResponseEntity<BalanceReplayResult> audit(@PathVariable Long id) {
        return ResponseEntity.ok(balanceAuditService.replay(id));
    }
}
