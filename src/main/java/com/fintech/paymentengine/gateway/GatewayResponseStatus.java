package com.fintech.paymentengine.gateway;

/**
 * Answer of a gateway to a deposit, withdraw or deposit-finalize request.
 */
public enum GatewayResponseStatus {
    /**
     * Accepted, outcome will be known later
     */
    PENDING,

    /**
     * Completed inline. Not expected from withdrawals.
     */
    SUCCESS,

    /**
     * Declined; the response carries a {@link Decline}
     */
    FAILED
}
