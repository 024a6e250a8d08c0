package com.fintech.paymentengine.gateway;

/**
 * Decline codes assigned by the engine itself rather than by a provider.
 */
public final class DeclineCodes {

    /**
     * An unexpected error while talking to the gateway during deposit initiation.
     */
    public static final String INTERNAL_ERROR = "internal_error";

    /**
     * The deposit stayed pending past its status-check window.
     */
    public static final String DEPOSIT_NOT_PROCESSED_IN_TIME = "deposit not processed in time";

    /**
     * The risk pre-check refused the operation before anything was sent to the provider.
     */
    public static final String RISK_DECLINE = "risk_decline";

    private DeclineCodes() {
    }
}
