package com.fintech.paymentengine.gateway;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Where the payer has to be sent to complete a deposit.
 */
@Value
@Builder
public class RedirectForm {

    String action;

    @Builder.Default
    String method = "GET";

    @Singular
    Map<String, String> fields;
}
