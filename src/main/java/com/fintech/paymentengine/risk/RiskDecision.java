package com.fintech.paymentengine.risk;

import com.fintech.paymentengine.gateway.Decline;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RiskDecision {

    private static final RiskDecision ALLOW = new RiskDecision(true, null);

    boolean allowed;
    Decline decline;

    public static RiskDecision allow() {
        return ALLOW;
    }

    public static RiskDecision decline(String code, String reason) {
        return new RiskDecision(false, Decline.of(code, reason));
    }

    public boolean isDeclined() {
        return !allowed;
    }
}
