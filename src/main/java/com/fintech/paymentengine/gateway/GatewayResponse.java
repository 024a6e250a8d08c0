package com.fintech.paymentengine.gateway;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Result of a deposit, withdraw or deposit-finalize call.
 * <p>
 * A FAILED response always carries a {@link Decline}. Extra entries are stored on the
 * transaction under the gateway's namespace.
 */
@Value
@Builder
public class GatewayResponse {

    GatewayResponseStatus status;

    String idInPaymentSystem;

    Decline decline;

    RedirectForm redirectForm;

    @Singular("extra")
    Map<String, String> extra;

    public static GatewayResponse pending(String idInPaymentSystem) {
        return GatewayResponse.builder()
                .status(GatewayResponseStatus.PENDING)
                .idInPaymentSystem(idInPaymentSystem)
                .build();
    }

    public static GatewayResponse success(String idInPaymentSystem) {
        return GatewayResponse.builder()
                .status(GatewayResponseStatus.SUCCESS)
                .idInPaymentSystem(idInPaymentSystem)
                .build();
    }

    public static GatewayResponse declined(String code, String reason) {
        return GatewayResponse.builder()
                .status(GatewayResponseStatus.FAILED)
                .decline(Decline.of(code, reason))
                .build();
    }

    public boolean isDeclined() {
        return status == GatewayResponseStatus.FAILED;
    }
}
