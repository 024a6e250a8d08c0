package com.fintech.paymentengine.risk;

import com.fintech.paymentengine.entity.PaymentTransaction;

/**
 * Risk and limit evaluation consulted before a deposit or withdrawal is sent to the gateway.
 * A decline is handled like a decline from the gateway itself.
 */
public interface RiskCheck {

    RiskDecision evaluate(PaymentTransaction transaction);
}
