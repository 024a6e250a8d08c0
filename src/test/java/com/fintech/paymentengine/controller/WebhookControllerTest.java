package com.fintech.paymentengine.controller;

import com.fintech.paymentengine.IntegrationTestBase;
import com.fintech.paymentengine.entity.BalanceTransactionType;
import com.fintech.paymentengine.entity.CallbackErrorType;
import com.fintech.paymentengine.entity.CallbackStatus;
import com.fintech.paymentengine.entity.CurrencyWallet;
import com.fintech.paymentengine.entity.IncomingCallback;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.entity.TransactionType;
import com.fintech.paymentengine.gateway.CallbackSignatures;
import com.fintech.paymentengine.gateway.MockGatewayClient;
import com.fintech.paymentengine.repository.IncomingCallbackRepository;
import com.fintech.paymentengine.scheduler.BackgroundTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class WebhookControllerTest extends IntegrationTestBase {

    private static final String CALLBACK_URL = "/api/v1/callbacks/{systemType}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private IncomingCallbackRepository callbackRepository;

    private ResultActions send(String body, String signature) throws Exception {
        return mockMvc.perform(post(CALLBACK_URL, MockGatewayClient.SYSTEM_TYPE)
                .contentType(MediaType.APPLICATION_JSON)
                .header(MockGatewayClient.SIGNATURE_HEADER, signature)
                .content(body));
    }

    private ResultActions sendSigned(String body) throws Exception {
        return send(body, mockGateway.sign(body));
    }

    private static String event(String event, PaymentTransaction transaction, String amount) {
        return String.format("{\"event\":\"%s\",\"id\":\"%s\",\"reference\":\"%s\",\"amount\":\"%s\",\"currency\":\"%s\"}",
                event, transaction.getIdInPaymentSystem(), transaction.getUuid(), amount, transaction.getCurrency());
    }

    private PaymentTransaction pendingDeposit(CurrencyWallet wallet, String amount) {
        PaymentTransaction deposit = createPendingTransaction(wallet, TransactionType.DEPOSIT, amount);
        deposit.setIdInPaymentSystem("MOCK-D-" + deposit.getUuid());
        return transactionRepository.save(deposit);
    }

    private IncomingCallback onlyCallback() {
        List<IncomingCallback> callbacks = callbackRepository.findAll();
        assertThat(callbacks).hasSize(1);
        return callbacks.get(0);
    }

    @Test
    @DisplayName("A signed success callback completes the deposit and credits the wallet")
    void signedSuccessCallback() throws Exception {
        CurrencyWallet wallet = createWallet("MXN");
        PaymentTransaction deposit = pendingDeposit(wallet, "30.01");

        sendSigned(event("payment.succeeded", deposit, "30.01"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Correlation-ID"))
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.transactionId").value(deposit.getId()))
                .andExpect(jsonPath("$.transactionStatus").value("SUCCESS"));

        assertThat(reload(deposit.getId()).getStatus()).isEqualTo(TransactionStatus.SUCCESS);
        assertThat(reloadWallet(wallet.getId()).getOperational().getAmount()).isEqualByComparingTo("30.01");

        IncomingCallback callback = onlyCallback();
        assertThat(callback.getStatus()).isEqualTo(CallbackStatus.SUCCESS);
        assertThat(callback.getReplayKey()).startsWith("mock:payment.succeeded:");
        assertThat(callback.getRemoteStatus()).contains("SUCCESS");
    }

    @Test
    @DisplayName("A callback signed with the previous secret is still accepted")
    void rotatedSecretAccepted() throws Exception {
        CurrencyWallet wallet = createWallet("USD");
        PaymentTransaction deposit = pendingDeposit(wallet, "15.00");
        String body = event("payment.succeeded", deposit, "15.00");

        send(body, CallbackSignatures.hmacSha256Hex("test-secret-old", body))
                .andExpect(status().isOk());

        assertThat(reload(deposit.getId()).getStatus()).isEqualTo(TransactionStatus.SUCCESS);
    }

    @Test
    @DisplayName("A callback with a bad signature is stored, rejected and changes nothing")
    void badSignatureRejected() throws Exception {
        CurrencyWallet wallet = createWallet("USD");
        PaymentTransaction deposit = pendingDeposit(wallet, "15.00");
        String body = event("payment.succeeded", deposit, "15.00");

        send(body, CallbackSignatures.hmacSha256Hex("some-other-secret", body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value("INVALID_SIGNATURE"));

        assertThat(reload(deposit.getId()).getStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(balanceTransactionRepository.countByPaymentTransactionId(deposit.getId())).isZero();

        IncomingCallback callback = onlyCallback();
        assertThat(callback.getStatus()).isEqualTo(CallbackStatus.FAILED);
        assertThat(callback.getErrorType()).isEqualTo(CallbackErrorType.INVALID_SIGNATURE);
        assertThat(callback.getBody()).isEqualTo(body);
    }

    @Test
    @DisplayName("A callback for an unknown transaction is answered with 404")
    void unmatchedCallback() throws Exception {
        String body = String.format("{\"event\":\"payment.succeeded\",\"id\":\"MOCK-D-nothing\",\"reference\":\"%s\"}",
                UUID.randomUUID());

        sendSigned(body).andExpect(status().isNotFound());

        IncomingCallback callback = onlyCallback();
        assertThat(callback.getStatus()).isEqualTo(CallbackStatus.FAILED);
        assertThat(callback.getErrorType()).isEqualTo(CallbackErrorType.TRANSACTION_NOT_FOUND);
    }

    @Test
    @DisplayName("A repeated delivery is ignored and credits the wallet once")
    void duplicateDeliveryIgnored() throws Exception {
        CurrencyWallet wallet = createWallet("USD");
        PaymentTransaction deposit = pendingDeposit(wallet, "40.00");
        String body = event("payment.succeeded", deposit, "40.00");

        sendSigned(body).andExpect(status().isOk());
        sendSigned(body)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IGNORED"));

        assertThat(balanceTransactionRepository.countByPaymentTransactionIdAndType(
                deposit.getId(), BalanceTransactionType.OPERATION_CONFIRMED)).isEqualTo(1);
        assertThat(callbackRepository.findAll())
                .extracting(IncomingCallback::getStatus, IncomingCallback::getErrorType)
                .containsExactlyInAnyOrder(
                        tuple(CallbackStatus.SUCCESS, null),
                        tuple(CallbackStatus.IGNORED, CallbackErrorType.DUPLICATE));
    }

    @Test
    @DisplayName("A callback contradicting a final status is answered with 409")
    void contradictingCallback() throws Exception {
        CurrencyWallet wallet = createWallet("USD");
        PaymentTransaction deposit = pendingDeposit(wallet, "40.00");
        sendSigned(event("payment.succeeded", deposit, "40.00")).andExpect(status().isOk());

        sendSigned(event("payment.failed", deposit, "40.00")).andExpect(status().isConflict());

        assertThat(reload(deposit.getId()).getStatus()).isEqualTo(TransactionStatus.SUCCESS);
        assertThat(callbackRepository.findAll())
                .filteredOn(c -> c.getStatus() == CallbackStatus.FAILED)
                .singleElement()
                .satisfies(c -> assertThat(c.getErrorType()).isEqualTo(CallbackErrorType.INVARIANT_VIOLATION));
    }

    @Test
    @DisplayName("A processing notification schedules an immediate status check")
    void processingSchedulesStatusCheck() throws Exception {
        CurrencyWallet wallet = createWallet("USD");
        PaymentTransaction deposit = pendingDeposit(wallet, "40.00");

        sendSigned(event("payment.processing", deposit, "40.00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transactionStatus").value("PENDING"));

        verify(taskScheduler).schedule(BackgroundTask.CHECK_STATUS, deposit.getId(), Duration.ZERO);
        assertThat(reload(deposit.getId()).getStatus()).isEqualTo(TransactionStatus.PENDING);
    }

    @Test
    @DisplayName("Informational events are stored as ignored")
    void informationalEventIgnored() throws Exception {
        CurrencyWallet wallet = createWallet("USD");
        PaymentTransaction deposit = pendingDeposit(wallet, "40.00");

        sendSigned(event("payment.created", deposit, "40.00"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IGNORED"));

        assertThat(onlyCallback().getStatus()).isEqualTo(CallbackStatus.IGNORED);
        verify(taskScheduler, never()).schedule(any(), any(), any());
    }

    @Test
    @DisplayName("A malformed body is rejected as a parsing error")
    void malformedBody() throws Exception {
        sendSigned("not json").andExpect(status().isBadRequest());

        assertThat(onlyCallback().getErrorType()).isEqualTo(CallbackErrorType.PARSING_ERROR);
    }

    @Test
    @DisplayName("A callback for an unknown payment system is stored and answered with 404")
    void unknownSystemType() throws Exception {
        mockMvc.perform(post(CALLBACK_URL, "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());

        IncomingCallback callback = onlyCallback();
        assertThat(callback.getSystemType()).isEqualTo("acme");
        assertThat(callback.getStatus()).isEqualTo(CallbackStatus.FAILED);
    }

    @Test
    @DisplayName("A callback whose system type exceeds the column width is still stored")
    void overlongSystemType() throws Exception {
        String systemType = "x".repeat(60);

        mockMvc.perform(post(CALLBACK_URL, systemType)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound());

        IncomingCallback callback = onlyCallback();
        assertThat(callback.getSystemType()).isEqualTo("x".repeat(50));
        assertThat(callback.getStatus()).isEqualTo(CallbackStatus.FAILED);
        assertThat(callback.getErrorType()).isEqualTo(CallbackErrorType.UNKNOWN_ERROR);
        assertThat(callback.getError()).contains(systemType);
    }
}
