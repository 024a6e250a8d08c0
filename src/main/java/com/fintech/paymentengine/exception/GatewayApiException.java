package com.fintech.paymentengine.exception;

/**
 * Thrown when communication with a payment gateway fails: network errors, timeouts,
 * non-2xx responses or an open circuit breaker.
 * <p>
 * Business declines are not reported through this exception; they come back as a
 * {@code Decline} inside the gateway response.
 */
public class GatewayApiException extends PaymentEngineException {

    private final String systemType;
    private final String reference;
    private final boolean isRetryable;

    public GatewayApiException(String message, String systemType) {
        this(message, systemType, null, true);
    }

    public GatewayApiException(String message, String systemType, String reference, boolean isRetryable) {
        super(message);
        this.systemType = systemType;
        this.reference = reference;
        this.isRetryable = isRetryable;
    }

    public GatewayApiException(String message, String systemType, Throwable cause) {
        super(message, cause);
        this.systemType = systemType;
        this.reference = null;
        this.isRetryable = true;
    }

    public String getSystemType() {
        return systemType;
    }

    public String getReference() {
        return reference;
    }

    /**
     * Indicates if this error is transient and the call can be repeated.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
