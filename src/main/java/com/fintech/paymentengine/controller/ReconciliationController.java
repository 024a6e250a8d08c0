package com.fintech.paymentengine.controller;

import com.fintech.paymentengine.dto.ReconciliationResult;
import com.fintech.paymentengine.service.ReconciliationService;
import com.fintech.paymentengine.service.ReconciliationService.ReconciliationStats;
import com.fintech.paymentengine.service.RollingReserveService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for on-demand reconciliation runs.
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Status poll, timeout sweep and reserve release")
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final RollingReserveService rollingReserveService;

    @Operation(
            summary = "Trigger a status poll",
            description = "Queries the payment systems for every pending transaction due for a check. Useful for recovery after outages."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Poll completed",
                    content = @Content(schema = @Schema(implementation = ReconciliationResult.class))),
            @ApiResponse(responseCode = "409", description = "Poll already in progress")
    })
    @PostMapping("/run")
    public ResponseEntity<ReconciliationResult> triggerReconciliation() {
        log.info("Manual status poll triggered via API");
        return ResponseEntity.ok(reconciliationService.reconcilePendingTransactions());
    }

    @Operation(
            summary = "Trigger a timeout sweep",
            description = "Fails deposits past their deadline and flags stuck withdrawals."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Sweep completed"),
            @ApiResponse(responseCode = "409", description = "Sweep already in progress")
    })
    @PostMapping("/timeouts")
    public ResponseEntity<ReconciliationResult> triggerTimeoutSweep() {
        log.info("Manual timeout sweep triggered via API");
        return ResponseEntity.ok(reconciliationService.failExpiredTransactions());
    }

    @Operation(summary = "Release expired rolling reserve holds")
    @PostMapping("/reserves/release")
    public ResponseEntity<Map<String, Integer>> releaseReserves() {
        log.info("Manual rolling reserve release triggered via API");
        return ResponseEntity.ok(Map.of("released", rollingReserveService.releaseExpiredHolds()));
    }

    @Operation(summary = "Get reconciliation statistics")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = ReconciliationStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<ReconciliationStats> getStats() {
        return ResponseEntity.ok(reconciliationService.getStats());
    }
}
