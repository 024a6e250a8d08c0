package com.fintech.paymentengine.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.paymentengine.config.ResilienceConfig;
import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.entity.CallbackErrorType;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.exception.CallbackValidationException;
import com.fintech.paymentengine.exception.GatewayApiException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory payment system.
 * <p>
 * Simulates realistic provider behaviour including:
 * - Deposits answered with a redirect and completed later
 * - Payouts accepted asynchronously
 * - Status lookups, intermittent failures and full outages
 * - JSON webhooks signed with HMAC-SHA256, verified against a list of rotating secrets
 * <p>
 * Extra keys: {@code mock.session} holds the checkout session issued on deposit.
 * <p>
 * Webhook body: {@code {"event": "...", "id": "<provider id>", "reference": "<transaction uuid>",
 * "amount": "10.00", "currency": "USD", "decline_code": "...", "decline_reason": "..."}},
 * signature in the {@code X-Mock-Signature} header.
 */
@Service
@Slf4j
public class MockGatewayClient implements GatewayClient {

    public static final String SYSTEM_TYPE = "mock";
    public static final String SIGNATURE_HEADER = "X-Mock-Signature";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Simulated provider-side state, keyed by provider id
    private final Map<String, RemoteRecord> remoteDatabase = new ConcurrentHashMap<>();

    // Scripted answers consumed before the default behaviour
    private final Deque<Object> scriptedDeposits = new ConcurrentLinkedDeque<>();
    private final Deque<Object> scriptedWithdrawals = new ConcurrentLinkedDeque<>();

    private final Random random = new Random();

    @Value("${gateway.mock.failure-rate:0.0}")
    private double failureRate;

    @Value("${gateway.mock.latency-ms:0}")
    private int latencyMs;

    @Value("${gateway.mock.checkout-url:https://checkout.mock-gateway.example/pay}")
    private String checkoutUrl;

    @Value("${gateway.mock.webhook-secrets:mock-webhook-secret}")
    private List<String> webhookSecrets;

    private volatile boolean simulateOutage = false;

    @Override
    public String getSystemType() {
        return SYSTEM_TYPE;
    }

    @Override
    @Retryable(
            retryFor = GatewayApiException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${gateway.mock.retry.delay-ms:1000}", multiplier = 2)
    )
    public GatewayResponse deposit(PaymentTransaction transaction) {
        log.debug("Creating deposit at provider for transaction {}", transaction.getUuid());
        simulateLatency();
        checkAvailability(transaction.getUuid().toString());

        Object scripted = scriptedDeposits.poll();
        if (scripted instanceof RuntimeException) {
            throw (RuntimeException) scripted;
        }
        if (scripted instanceof GatewayResponse) {
            return (GatewayResponse) scripted;
        }

        // the uuid doubles as idempotency key, repeating the call returns the same session
        String providerId = "MOCK-D-" + transaction.getUuid();
        remoteDatabase.computeIfAbsent(providerId, id -> new RemoteRecord(
                TransactionStatus.PENDING, transaction.getAmount(), transaction.getCurrency(),
                transaction.getUuid(), null, null));

        String session = "sess_" + Integer.toHexString(providerId.hashCode());
        return GatewayResponse.builder()
                .status(GatewayResponseStatus.PENDING)
                .idInPaymentSystem(providerId)
                .redirectForm(RedirectForm.builder()
                        .action(checkoutUrl)
                        .method("GET")
                        .field("session", session)
                        .build())
                .extra("session", session)
                .build();
    }

    /**
     * Not retried: a timeout may hide a payout the provider already accepted.
     */
    @Override
    public GatewayResponse withdraw(PaymentTransaction transaction) {
        log.debug("Creating payout at provider for transaction {}", transaction.getUuid());
        simulateLatency();
        checkAvailability(transaction.getUuid().toString());

        Object scripted = scriptedWithdrawals.poll();
        if (scripted instanceof RuntimeException) {
            throw (RuntimeException) scripted;
        }
        if (scripted instanceof GatewayResponse) {
            return (GatewayResponse) scripted;
        }

        String providerId = "MOCK-W-" + transaction.getUuid();
        remoteDatabase.computeIfAbsent(providerId, id -> new RemoteRecord(
                TransactionStatus.PENDING, transaction.getAmount(), transaction.getCurrency(),
                transaction.getUuid(), null, null));
        return GatewayResponse.pending(providerId);
    }

    @Override
    @CircuitBreaker(name = ResilienceConfig.GATEWAY_API, fallbackMethod = "getTransactionStatusFallback")
    @Retryable(
            retryFor = GatewayApiException.class,
            maxAttempts = 3,
            backoff = @Backoff(delayExpression = "${gateway.mock.retry.delay-ms:1000}", multiplier = 2)
    )
    public RemoteTransactionStatus getTransactionStatus(PaymentTransaction transaction) {
        String providerId = transaction.getIdInPaymentSystem();
        log.debug("Fetching transaction status from provider for reference: {}", providerId);

        simulateLatency();
        checkAvailability(providerId);

        RemoteRecord record = providerId == null ? null : remoteDatabase.get(providerId);
        if (record == null) {
            log.warn("Transaction not found at provider: {}", providerId);
            throw new GatewayApiException("Transaction not found at provider", SYSTEM_TYPE, providerId, false);
        }

        log.debug("Provider returned status {} for reference {}", record.getStatus(), providerId);
        return RemoteTransactionStatus.builder()
                .operationStatus(record.getStatus())
                .idInPaymentSystem(providerId)
                .transactionUuid(record.getUuid())
                .declineCode(record.getDeclineCode())
                .declineReason(record.getDeclineReason())
                .remoteAmount(Money.of(record.getAmount(), record.getCurrency()))
                .build();
    }

    /**
     * Fallback method when circuit breaker is open.
     */
    public RemoteTransactionStatus getTransactionStatusFallback(PaymentTransaction transaction, Throwable throwable) {
        log.warn("Circuit breaker triggered for provider reference: {}. Error: {}",
                transaction.getIdInPaymentSystem(), throwable.getMessage());

        if (throwable instanceof GatewayApiException) {
            throw (GatewayApiException) throwable;
        }
        throw new GatewayApiException(
                "Gateway circuit breaker is open. Service temporarily unavailable.",
                SYSTEM_TYPE,
                transaction.getIdInPaymentSystem(),
                true
        );
    }

    @Override
    public boolean isCallbackSignatureValid(CallbackRequest callback) {
        return CallbackSignatures.isValidHmacSha256(webhookSecrets, callback.getBody(), callback.header(SIGNATURE_HEADER));
    }

    @Override
    public String resolveEventType(CallbackRequest callback) {
        try {
            return MAPPER.readTree(callback.getBody()).path("event").asText("unknown");
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return "unparseable";
        }
    }

    @Override
    public CallbackParseResult parseCallback(CallbackRequest callback) {
        JsonNode payload;
        try {
            payload = MAPPER.readTree(callback.getBody());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CallbackValidationException("Callback body is not valid JSON", CallbackErrorType.PARSING_ERROR, e);
        }
        if (payload == null || !payload.isObject()) {
            throw new CallbackValidationException("Callback body is not a JSON object", CallbackErrorType.PARSING_ERROR);
        }

        String event = payload.path("event").asText("");
        String providerId = textOrNull(payload, "id");
        UUID uuid = uuidOrNull(textOrNull(payload, "reference"));
        TransactionReference reference = new TransactionReference(providerId, uuid);

        switch (event) {
            case "payment.created":
                return CallbackParseResult.ignored("Informational event " + event);
            case "payment.processing":
                return CallbackParseResult.needsStatusCheck(reference);
            case "payment.succeeded":
                return CallbackParseResult.status(remoteStatus(payload, TransactionStatus.SUCCESS, providerId, uuid));
            case "payment.failed":
                return CallbackParseResult.status(remoteStatus(payload, TransactionStatus.FAILED, providerId, uuid));
            case "payment.refunded":
                return CallbackParseResult.status(remoteStatus(payload, TransactionStatus.REFUNDED, providerId, uuid));
            case "payment.chargeback":
                return CallbackParseResult.status(remoteStatus(payload, TransactionStatus.CHARGED_BACK, providerId, uuid));
            default:
                return CallbackParseResult.ignored("Unsupported event " + event);
        }
    }

    /**
     * Payouts rejected with {@code BENEFICIARY_ACCOUNT_CLOSED} are reported by the provider as
     * PENDING with an error code; the money never leaves, so treat them as failed.
     */
    @Override
    public RemoteTransactionStatus adjustRemoteStatus(PaymentTransaction transaction, RemoteTransactionStatus remote) {
        if (transaction.isWithdrawal()
                && remote.getOperationStatus() == TransactionStatus.PENDING
                && "BENEFICIARY_ACCOUNT_CLOSED".equals(remote.getDeclineCode())) {
            return remote.toBuilder()
                    .operationStatus(TransactionStatus.FAILED)
                    .declineReason(remote.getDeclineReason() == null ? "Beneficiary account closed" : remote.getDeclineReason())
                    .build();
        }
        return remote;
    }

    private RemoteTransactionStatus remoteStatus(JsonNode payload, TransactionStatus status, String providerId, UUID uuid) {
        Money amount = null;
        String rawAmount = textOrNull(payload, "amount");
        String currency = textOrNull(payload, "currency");
        if (rawAmount != null && currency != null) {
            try {
                amount = Money.of(new BigDecimal(rawAmount), currency);
            } catch (IllegalArgumentException e) {
                throw new CallbackValidationException("Invalid amount in callback: " + rawAmount + " " + currency,
                        CallbackErrorType.PARSING_ERROR, e);
            }
        }
        return RemoteTransactionStatus.builder()
                .operationStatus(status)
                .idInPaymentSystem(providerId)
                .transactionUuid(uuid)
                .declineCode(textOrNull(payload, "decline_code"))
                .declineReason(textOrNull(payload, "decline_reason"))
                .remoteAmount(amount)
                .rawData(MAPPER.convertValue(payload, Map.class))
                .build();
    }

    private static String textOrNull(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node == null || node.isNull() || node.asText().isBlank() ? null : node.asText();
    }

    private static UUID uuidOrNull(String value) {
        if (value == null) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new CallbackValidationException("Invalid transaction reference: " + value, CallbackErrorType.PARSING_ERROR, e);
        }
    }

    private void checkAvailability(String reference) {
        if (simulateOutage) {
            throw new GatewayApiException("Gateway API is currently unavailable", SYSTEM_TYPE, reference, true);
        }
        if (failureRate > 0 && random.nextDouble() < failureRate) {
            throw new GatewayApiException("Simulated network failure while contacting gateway", SYSTEM_TYPE, reference, true);
        }
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // Methods for testing/simulation control

    /**
     * Changes what the provider reports for one of its transactions.
     */
    public void updateTransactionStatus(String providerId, TransactionStatus status, String declineCode, String declineReason) {
        remoteDatabase.computeIfPresent(providerId, (id, existing) -> new RemoteRecord(
                status, existing.getAmount(), existing.getCurrency(), existing.getUuid(), declineCode, declineReason));
    }

    public void updateTransactionStatus(String providerId, TransactionStatus status) {
        updateTransactionStatus(providerId, status, null, null);
    }

    public void addTransaction(String providerId, TransactionStatus status, BigDecimal amount, String currency) {
        remoteDatabase.put(providerId, new RemoteRecord(status, amount, currency, null, null, null));
    }

    public void scriptNextDeposit(GatewayResponse response) {
        scriptedDeposits.add(response);
    }

    public void failNextDeposit(RuntimeException error) {
        scriptedDeposits.add(error);
    }

    public void scriptNextWithdrawal(GatewayResponse response) {
        scriptedWithdrawals.add(response);
    }

    public void failNextWithdrawal(RuntimeException error) {
        scriptedWithdrawals.add(error);
    }

    /**
     * Signs a webhook body with the current (first) secret, as the provider would.
     */
    public String sign(String body) {
        return CallbackSignatures.hmacSha256Hex(webhookSecrets.get(0), body);
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Gateway outage simulation set to: {}", outage);
    }

    public void clearMockData() {
        remoteDatabase.clear();
        scriptedDeposits.clear();
        scriptedWithdrawals.clear();
    }

    @Data
    @AllArgsConstructor
    private static class RemoteRecord {
        private TransactionStatus status;
        private BigDecimal amount;
        private String currency;
        private UUID uuid;
        private String declineCode;
        private String declineReason;
    }
}
