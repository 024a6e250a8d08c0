package com.fintech.paymentengine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.paymentengine.dto.CallbackResponse;
import com.fintech.paymentengine.entity.CallbackErrorType;
import com.fintech.paymentengine.entity.CallbackStatus;
import com.fintech.paymentengine.entity.IncomingCallback;
import com.fintech.paymentengine.entity.JsonConverters;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionEventType;
import com.fintech.paymentengine.exception.CallbackValidationException;
import com.fintech.paymentengine.exception.InvariantViolationException;
import com.fintech.paymentengine.exception.ResourceNotFoundException;
import com.fintech.paymentengine.gateway.CallbackParseResult;
import com.fintech.paymentengine.gateway.CallbackRequest;
import com.fintech.paymentengine.gateway.GatewayClient;
import com.fintech.paymentengine.gateway.GatewayClientRegistry;
import com.fintech.paymentengine.gateway.RemoteTransactionStatus;
import com.fintech.paymentengine.gateway.TransactionReference;
import com.fintech.paymentengine.observability.CorrelationContext;
import com.fintech.paymentengine.repository.IncomingCallbackRepository;
import com.fintech.paymentengine.repository.PaymentTransactionRepository;
import com.fintech.paymentengine.scheduler.BackgroundTask;
import com.fintech.paymentengine.scheduler.BackgroundTaskScheduler;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Entry point for payment system webhooks.
 * <p>
 * Every callback is stored verbatim before it is looked at. It is then checked for replay,
 * verified, parsed and matched to a transaction; a status it carries goes through
 * {@link PaymentSystemController#syncRemoteStatus}. The stored row records how far it got.
 */
@Service
@Slf4j
public class WebhookIngestionService {

    private static final int MAX_EVENT_TYPE = 80;
    // width of incoming_callbacks.system_type
    static final int MAX_SYSTEM_TYPE = 50;

    private final IncomingCallbackRepository callbackRepository;
    private final PaymentTransactionRepository transactionRepository;
    private final GatewayClientRegistry gatewayRegistry;
    private final PaymentSystemController controller;
    private final BackgroundTaskScheduler taskScheduler;
    private final TransactionEventLogService eventLogService;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate newTransactionTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public WebhookIngestionService(IncomingCallbackRepository callbackRepository,
                                   PaymentTransactionRepository transactionRepository,
                                   GatewayClientRegistry gatewayRegistry,
                                   PaymentSystemController controller,
                                   BackgroundTaskScheduler taskScheduler,
                                   TransactionEventLogService eventLogService,
                                   TransactionTemplate transactionTemplate,
                                   ObjectMapper objectMapper,
                                   MeterRegistry meterRegistry) {
        this.callbackRepository = callbackRepository;
        this.transactionRepository = transactionRepository;
        this.gatewayRegistry = gatewayRegistry;
        this.controller = controller;
        this.taskScheduler = taskScheduler;
        this.eventLogService = eventLogService;
        this.transactionTemplate = transactionTemplate;
        this.newTransactionTemplate = new TransactionTemplate(transactionTemplate.getTransactionManager());
        this.newTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Stores and processes one callback.
     *
     * @throws CallbackValidationException  if the signature is invalid or the body cannot be parsed
     * @throws ResourceNotFoundException    if the payment system or the transaction is unknown
     * @throws InvariantViolationException  if the reported status contradicts the local one
     */
    public CallbackResponse receive(String systemType, Map<String, String> headers, String body, String ip) {
        CallbackRequest request = CallbackRequest.builder()
                .systemType(systemType)
                .headers(headers)
                .body(body == null ? "" : body)
                .ip(ip)
                .build();

        Optional<GatewayClient> client = gatewayRegistry.supports(systemType)
                ? Optional.of(gatewayRegistry.get(systemType))
                : Optional.empty();
        String eventType = client.map(c -> c.resolveEventType(request)).orElse("unknown");

        IncomingCallback callback = persist(request, replayKey(systemType, eventType, request.getBody()));
        log.info("Received {} callback {} ({}) from {}", systemType, callback.getId(), eventType, ip);

        if (client.isEmpty()) {
            fail(callback, CallbackErrorType.UNKNOWN_ERROR, "Unknown payment system " + systemType);
            throw new ResourceNotFoundException("Payment system", systemType);
        }

        try {
            return process(client.get(), request, callback);
        } catch (CallbackValidationException e) {
            fail(callback, e.getErrorType(), e.getMessage());
            throw e;
        } catch (ResourceNotFoundException e) {
            fail(callback, CallbackErrorType.TRANSACTION_NOT_FOUND, e.getMessage());
            throw e;
        } catch (InvariantViolationException e) {
            log.error("Callback {} violates transaction invariants: {}", callback.getId(), e.getMessage());
            fail(callback, CallbackErrorType.INVARIANT_VIOLATION, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Callback {} failed: {}", callback.getId(), e.getMessage(), e);
            fail(callback, CallbackErrorType.UNKNOWN_ERROR, e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private CallbackResponse process(GatewayClient client, CallbackRequest request, IncomingCallback callback) {
        if (callbackRepository.existsByReplayKeyAndStatusAndIdNot(callback.getReplayKey(), CallbackStatus.SUCCESS, callback.getId())) {
            log.info("Callback {} repeats an already processed delivery, ignoring", callback.getId());
            update(callback.getId(), c -> {
                c.setStatus(CallbackStatus.IGNORED);
                c.setErrorType(CallbackErrorType.DUPLICATE);
                c.setError("Already processed");
            });
            count(request.getSystemType(), "duplicate");
            return response(callback.getId(), CallbackStatus.IGNORED, null, "Duplicate delivery");
        }

        if (!client.isCallbackSignatureValid(request)) {
            log.warn("Invalid signature on {} callback {} from {}", request.getSystemType(), callback.getId(), request.getIp());
            throw new CallbackValidationException("Invalid callback signature", CallbackErrorType.INVALID_SIGNATURE);
        }

        CallbackParseResult parsed = client.parseCallback(request);
        switch (parsed.getKind()) {
            case IGNORED:
                update(callback.getId(), c -> {
                    c.setStatus(CallbackStatus.IGNORED);
                    c.setError(parsed.getReason());
                });
                count(request.getSystemType(), "ignored");
                return response(callback.getId(), CallbackStatus.IGNORED, null, parsed.getReason());

            case NEEDS_STATUS_CHECK:
                return scheduleStatusCheck(request, callback, parsed.getReference());

            case STATUS:
            default:
                return syncStatus(request, callback, parsed.getRemoteStatus());
        }
    }

    private CallbackResponse scheduleStatusCheck(CallbackRequest request, IncomingCallback callback,
                                                 TransactionReference reference) {
        PaymentTransaction transaction = resolve(request.getSystemType(), reference);
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transaction.getId()));

        transactionTemplate.executeWithoutResult(status -> {
            IncomingCallback stored = load(callback.getId());
            stored.setTransaction(transactionRepository.getReferenceById(transaction.getId()));
            stored.setStatus(CallbackStatus.SUCCESS);
            callbackRepository.save(stored);
            eventLogService.record(transaction.getId(), TransactionEventType.CALLBACK_RECEIVED,
                    "Callback " + callback.getId() + " asked for a status check");
            taskScheduler.schedule(BackgroundTask.CHECK_STATUS, transaction.getId(), Duration.ZERO);
        });

        count(request.getSystemType(), "status_check");
        return response(callback.getId(), CallbackStatus.SUCCESS, transaction, "Status check scheduled");
    }

    private CallbackResponse syncStatus(CallbackRequest request, IncomingCallback callback, RemoteTransactionStatus remote) {
        PaymentTransaction transaction = resolve(request.getSystemType(),
                new TransactionReference(remote.getIdInPaymentSystem(), remote.getTransactionUuid()));
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(transaction.getId()));
        String remoteJson = toJson(remote);

        PaymentTransaction synced = transactionTemplate.execute(status -> {
            PaymentTransaction result = controller.syncRemoteStatus(transaction.getId(), remote);
            IncomingCallback stored = load(callback.getId());
            stored.setTransaction(result);
            stored.setRemoteStatus(remoteJson);
            stored.setStatus(CallbackStatus.SUCCESS);
            callbackRepository.save(stored);
            eventLogService.record(transaction.getId(), TransactionEventType.CALLBACK_RECEIVED,
                    "Callback " + callback.getId() + " reported " + remote.getOperationStatus());
            return result;
        });

        count(request.getSystemType(), "synced");
        return response(callback.getId(), CallbackStatus.SUCCESS, synced, null);
    }

    private PaymentTransaction resolve(String systemType, TransactionReference reference) {
        if (reference == null || reference.isEmpty()) {
            throw new ResourceNotFoundException("Callback does not reference a transaction");
        }
        Optional<PaymentTransaction> found = Optional.empty();
        if (reference.getIdInPaymentSystem() != null) {
            found = transactionRepository.findBySystemTypeAndIdInPaymentSystem(systemType, reference.getIdInPaymentSystem());
        }
        if (found.isEmpty() && reference.getUuid() != null) {
            found = transactionRepository.findByUuid(reference.getUuid())
                    .filter(t -> systemType.equals(t.getSystemType()));
        }
        return found.orElseThrow(() -> new ResourceNotFoundException(String.format(
                "No %s transaction matches provider id %s / uuid %s",
                systemType, reference.getIdInPaymentSystem(), reference.getUuid())));
    }

    private IncomingCallback persist(CallbackRequest request, String replayKey) {
        return newTransactionTemplate.execute(status -> callbackRepository.save(IncomingCallback.builder()
                .systemType(storedSystemType(request.getSystemType()))
                .headers(JsonConverters.write(request.getHeaders()))
                .body(request.getBody())
                .ip(request.getIp())
                .replayKey(replayKey)
                .status(CallbackStatus.PENDING)
                .build()));
    }

    private void fail(IncomingCallback callback, CallbackErrorType type, String message) {
        update(callback.getId(), c -> c.markFailed(type, message));
        count(callback.getSystemType(), type.name().toLowerCase(Locale.ROOT));
    }

    private void update(Long callbackId, Consumer<IncomingCallback> change) {
        newTransactionTemplate.executeWithoutResult(status -> {
            IncomingCallback stored = load(callbackId);
            change.accept(stored);
            callbackRepository.save(stored);
        });
    }

    private IncomingCallback load(Long callbackId) {
        return callbackRepository.findById(callbackId)
                .orElseThrow(() -> new IllegalStateException("Stored callback " + callbackId + " disappeared"));
    }

    static String replayKey(String systemType, String eventType, String body) {
        String event = eventType == null ? "unknown" : eventType;
        if (event.length() > MAX_EVENT_TYPE) {
            event = event.substring(0, MAX_EVENT_TYPE);
        }
        return storedSystemType(systemType) + ":" + event + ":" + DigestUtils.sha256Hex(body == null ? "" : body);
    }

    /**
     * The system type as stored on the callback row. Path values longer than the column are
     * cut so that callbacks for unknown systems are still recorded.
     */
    static String storedSystemType(String systemType) {
        if (systemType == null) {
            return "unknown";
        }
        return systemType.length() > MAX_SYSTEM_TYPE ? systemType.substring(0, MAX_SYSTEM_TYPE) : systemType;
    }

    private String toJson(RemoteTransactionStatus remote) {
        try {
            return objectMapper.writeValueAsString(remote);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialise remote status: {}", e.getMessage());
            return null;
        }
    }

    private void count(String systemType, String outcome) {
        meterRegistry.counter("webhooks.processed", "system_type", systemType, "outcome", outcome).increment();
    }

    private static CallbackResponse response(Long callbackId, CallbackStatus status, PaymentTransaction transaction,
                                             String message) {
        return CallbackResponse.builder()
                .callbackId(callbackId)
                .status(status)
                .transactionId(transaction == null ? null : transaction.getId())
                .transactionStatus(transaction == null ? null : transaction.getStatus())
                .message(message)
                .build();
    }
}
