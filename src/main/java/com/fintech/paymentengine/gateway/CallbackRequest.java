package com.fintech.paymentengine.gateway;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.TreeMap;

/**
 * An inbound webhook as handed to a gateway for signature checking and parsing.
 * Header names are matched case-insensitively.
 */
@Value
@Builder
public class CallbackRequest {

    String systemType;

    @Singular
    Map<String, String> headers;

    String body;

    String ip;

    public String header(String name) {
        Map<String, String> lookup = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        lookup.putAll(headers);
        return lookup.get(name);
    }
}
