package com.fintech.paymentengine.exception;

import com.fintech.paymentengine.dto.ErrorResponse;
import com.fintech.paymentengine.observability.CorrelationContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps engine exceptions to HTTP responses with an {@link ErrorResponse} body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest request) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + (error.getDefaultMessage() != null ? error.getDefaultMessage() : "invalid value"))
                .collect(Collectors.toList());
        log.warn("Validation failed on {}: {}", request.getRequestURI(), details);
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", request, details);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        log.warn("Invalid request on {}: {}", request.getRequestURI(), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), request, null);
    }

    @ExceptionHandler(CallbackValidationException.class)
    public ResponseEntity<ErrorResponse> handleCallbackValidation(CallbackValidationException e, HttpServletRequest request) {
        log.warn("Callback rejected ({}): {}", e.getErrorType(), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Callback Rejected", e.getMessage(), request, List.of(e.getErrorType().name()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException e, HttpServletRequest request) {
        log.warn("Not found on {}: {}", request.getRequestURI(), e.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), request, null);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e, HttpServletRequest request) {
        log.error("Invariant violation on {} (transaction {}): {}", request.getRequestURI(), e.getTransactionId(), e.getMessage());
        return build(HttpStatus.CONFLICT, "Invariant Violation", e.getMessage(), request, null);
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorResponse> handleReconciliation(ReconciliationException e, HttpServletRequest request) {
        log.warn("Reconciliation request refused: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, "Reconciliation In Progress", e.getMessage(), request, null);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(InsufficientFundsException e, HttpServletRequest request) {
        log.info("Insufficient funds on wallet {}: {}", e.getWalletId(), e.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Funds", e.getMessage(), request, null);
    }

    @ExceptionHandler(GatewayApiException.class)
    public ResponseEntity<ErrorResponse> handleGateway(GatewayApiException e, HttpServletRequest request) {
        log.warn("Gateway {} unavailable: {}", e.getSystemType(), e.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Gateway Unavailable", e.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", request, null);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                       HttpServletRequest request, List<String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .path(request.getRequestURI())
                .correlationId(CorrelationContext.currentCorrelationId())
                .details(details)
                .build());
    }
}
