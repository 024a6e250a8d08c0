package com.fintech.paymentengine.gateway;

import com.fintech.paymentengine.domain.Money;
import com.fintech.paymentengine.entity.CallbackErrorType;
import com.fintech.paymentengine.entity.CurrencyWallet;
import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.entity.TransactionStatus;
import com.fintech.paymentengine.entity.TransactionType;
import com.fintech.paymentengine.exception.CallbackValidationException;
import com.fintech.paymentengine.exception.GatewayApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockGatewayClientTest {

    private MockGatewayClient client;

    @BeforeEach
    void setUp() {
        client = new MockGatewayClient();
        ReflectionTestUtils.setField(client, "webhookSecrets", List.of("current-secret", "previous-secret"));
        ReflectionTestUtils.setField(client, "checkoutUrl", "https://checkout.test/pay");
    }

    private static PaymentTransaction transaction(TransactionType type) {
        return PaymentTransaction.builder()
                .wallet(CurrencyWallet.builder().id(1L).currency("USD").build())
                .systemType(MockGatewayClient.SYSTEM_TYPE)
                .type(type)
                .status(TransactionStatus.PENDING)
                .amount(new BigDecimal("25.00"))
                .currency("USD")
                .build();
    }

    private static CallbackRequest callback(String body) {
        return CallbackRequest.builder().systemType(MockGatewayClient.SYSTEM_TYPE).body(body).build();
    }

    @Nested
    @DisplayName("Money operations")
    class MoneyOperations {

        @Test
        @DisplayName("Deposit returns a redirect and is idempotent per transaction")
        void depositRedirect() {
            PaymentTransaction transaction = transaction(TransactionType.DEPOSIT);

            GatewayResponse first = client.deposit(transaction);
            GatewayResponse second = client.deposit(transaction);

            assertThat(first.getStatus()).isEqualTo(GatewayResponseStatus.PENDING);
            assertThat(first.getIdInPaymentSystem()).isEqualTo("MOCK-D-" + transaction.getUuid());
            assertThat(first.getRedirectForm().getAction()).isEqualTo("https://checkout.test/pay");
            assertThat(first.getExtra()).containsKey("session");
            assertThat(second.getExtra()).isEqualTo(first.getExtra());
        }

        @Test
        @DisplayName("Status query reports what the provider holds")
        void statusQuery() {
            PaymentTransaction transaction = transaction(TransactionType.WITHDRAWAL);
            transaction.setIdInPaymentSystem(client.withdraw(transaction).getIdInPaymentSystem());
            client.updateTransactionStatus(transaction.getIdInPaymentSystem(), TransactionStatus.FAILED,
                    "LIMIT", "Daily limit exceeded");

            RemoteTransactionStatus remote = client.getTransactionStatus(transaction);

            assertThat(remote.getOperationStatus()).isEqualTo(TransactionStatus.FAILED);
            assertThat(remote.getTransactionUuid()).isEqualTo(transaction.getUuid());
            assertThat(remote.getDeclineCode()).isEqualTo("LIMIT");
            assertThat(remote.getRemoteAmount()).isEqualTo(Money.of("25.00", "USD"));
        }

        @Test
        @DisplayName("Outages surface as retryable gateway errors")
        void outage() {
            client.setSimulateOutage(true);

            assertThatThrownBy(() -> client.withdraw(transaction(TransactionType.WITHDRAWAL)))
                    .isInstanceOf(GatewayApiException.class)
                    .satisfies(e -> assertThat(((GatewayApiException) e).isRetryable()).isTrue());
        }

        @Test
        @DisplayName("Unknown provider ids are reported as non-retryable")
        void unknownProviderId() {
            PaymentTransaction transaction = transaction(TransactionType.DEPOSIT);
            transaction.setIdInPaymentSystem("MOCK-D-missing");

            assertThatThrownBy(() -> client.getTransactionStatus(transaction))
                    .isInstanceOf(GatewayApiException.class)
                    .satisfies(e -> assertThat(((GatewayApiException) e).isRetryable()).isFalse());
        }
    }

    @Nested
    @DisplayName("Callback handling")
    class Callbacks {

        @Test
        @DisplayName("Signature is read from the header regardless of case")
        void signatureHeader() {
            String body = "{\"event\":\"payment.created\"}";
            CallbackRequest request = CallbackRequest.builder()
                    .systemType(MockGatewayClient.SYSTEM_TYPE)
                    .header("x-mock-signature", client.sign(body))
                    .body(body)
                    .build();

            assertThat(client.isCallbackSignatureValid(request)).isTrue();
            assertThat(client.isCallbackSignatureValid(callback(body))).isFalse();
        }

        @Test
        @DisplayName("Succeeded events carry the status, references and amount")
        void succeeded() {
            UUID uuid = UUID.randomUUID();
            CallbackParseResult result = client.parseCallback(callback(
                    "{\"event\":\"payment.succeeded\",\"id\":\"MOCK-D-1\",\"reference\":\"" + uuid
                            + "\",\"amount\":\"30.01\",\"currency\":\"MXN\"}"));

            assertThat(result.getKind()).isEqualTo(CallbackParseResult.Kind.STATUS);
            assertThat(result.getReference().getIdInPaymentSystem()).isEqualTo("MOCK-D-1");
            assertThat(result.getReference().getUuid()).isEqualTo(uuid);
            assertThat(result.getRemoteStatus().getOperationStatus()).isEqualTo(TransactionStatus.SUCCESS);
            assertThat(result.getRemoteStatus().getRemoteAmount()).isEqualTo(Money.of("30.01", "MXN"));
            assertThat(result.getRemoteStatus().getRawData()).containsEntry("event", "payment.succeeded");
        }

        @Test
        @DisplayName("Failed events carry the decline")
        void failed() {
            CallbackParseResult result = client.parseCallback(callback(
                    "{\"event\":\"payment.failed\",\"id\":\"MOCK-W-1\",\"decline_code\":\"CARD_EXPIRED\",\"decline_reason\":\"Expired\"}"));

            assertThat(result.getRemoteStatus().getOperationStatus()).isEqualTo(TransactionStatus.FAILED);
            assertThat(result.getRemoteStatus().getDeclineCode()).isEqualTo("CARD_EXPIRED");
            assertThat(result.getRemoteStatus().getDeclineReason()).isEqualTo("Expired");
            assertThat(result.getRemoteStatus().getRemoteAmount()).isNull();
        }

        @Test
        @DisplayName("Processing events ask for a status check, informational ones are ignored")
        void nonAuthoritativeEvents() {
            CallbackParseResult processing = client.parseCallback(callback("{\"event\":\"payment.processing\",\"id\":\"MOCK-D-2\"}"));
            CallbackParseResult created = client.parseCallback(callback("{\"event\":\"payment.created\",\"id\":\"MOCK-D-2\"}"));
            CallbackParseResult unknown = client.parseCallback(callback("{\"event\":\"payment.disputed\"}"));

            assertThat(processing.getKind()).isEqualTo(CallbackParseResult.Kind.NEEDS_STATUS_CHECK);
            assertThat(processing.getReference().getIdInPaymentSystem()).isEqualTo("MOCK-D-2");
            assertThat(created.getKind()).isEqualTo(CallbackParseResult.Kind.IGNORED);
            assertThat(unknown.getKind()).isEqualTo(CallbackParseResult.Kind.IGNORED);
            assertThat(unknown.getReason()).contains("payment.disputed");
        }

        @Test
        @DisplayName("Malformed bodies and references are parsing errors")
        void malformed() {
            assertThatThrownBy(() -> client.parseCallback(callback("not json")))
                    .isInstanceOf(CallbackValidationException.class)
                    .satisfies(e -> assertThat(((CallbackValidationException) e).getErrorType())
                            .isEqualTo(CallbackErrorType.PARSING_ERROR));
            assertThatThrownBy(() -> client.parseCallback(callback("[1,2]")))
                    .isInstanceOf(CallbackValidationException.class);
            assertThatThrownBy(() -> client.parseCallback(callback("{\"event\":\"payment.succeeded\",\"reference\":\"nope\"}")))
                    .isInstanceOf(CallbackValidationException.class)
                    .hasMessageContaining("nope");
            assertThatThrownBy(() -> client.parseCallback(callback(
                    "{\"event\":\"payment.succeeded\",\"id\":\"MOCK-D-3\",\"amount\":\"1.001\",\"currency\":\"USD\"}")))
                    .isInstanceOf(CallbackValidationException.class);
        }

        @Test
        @DisplayName("Event type resolution never throws")
        void resolveEventType() {
            assertThat(client.resolveEventType(callback("{\"event\":\"payment.failed\"}"))).isEqualTo("payment.failed");
            assertThat(client.resolveEventType(callback("{}"))).isEqualTo("unknown");
            assertThat(client.resolveEventType(callback("{oops"))).isEqualTo("unparseable");
        }
    }

    @Nested
    @DisplayName("Remote status adjustment")
    class Adjustment {

        private final RemoteTransactionStatus accountClosed = RemoteTransactionStatus.builder()
                .operationStatus(TransactionStatus.PENDING)
                .idInPaymentSystem("MOCK-W-9")
                .declineCode("BENEFICIARY_ACCOUNT_CLOSED")
                .build();

        @Test
        @DisplayName("Closed beneficiary accounts fail the payout")
        void closedAccountFailsWithdrawal() {
            RemoteTransactionStatus adjusted = client.adjustRemoteStatus(transaction(TransactionType.WITHDRAWAL), accountClosed);

            assertThat(adjusted.getOperationStatus()).isEqualTo(TransactionStatus.FAILED);
            assertThat(adjusted.getDeclineReason()).isEqualTo("Beneficiary account closed");
        }

        @Test
        @DisplayName("Deposits and other codes pass through unchanged")
        void otherStatusesUnchanged() {
            assertThat(client.adjustRemoteStatus(transaction(TransactionType.DEPOSIT), accountClosed)).isSameAs(accountClosed);

            RemoteTransactionStatus pending = RemoteTransactionStatus.pending("MOCK-W-9");
            assertThat(client.adjustRemoteStatus(transaction(TransactionType.WITHDRAWAL), pending)).isSameAs(pending);
        }
    }
}
