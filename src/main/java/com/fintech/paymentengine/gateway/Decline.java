package com.fintech.paymentengine.gateway;

import lombok.Value;

/**
 * A business decline: the provider (or the risk check) refused the operation.
 * Declines are returned as values and never retried.
 */
@Value
public class Decline {

    String code;
    String reason;

    public static Decline of(String code, String reason) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("A decline needs a code");
        }
        return new Decline(code, reason);
    }
}
