package com.fintech.paymentengine.gateway;

import com.fintech.paymentengine.entity.PaymentTransaction;
import com.fintech.paymentengine.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway clients keyed by system type. Every {@link GatewayClient} bean is registered at
 * start-up; two clients claiming the same system type is a configuration error.
 */
@Component
@Slf4j
public class GatewayClientRegistry {

    private final Map<String, GatewayClient> clients;

    public GatewayClientRegistry(List<GatewayClient> gatewayClients) {
        Map<String, GatewayClient> byType = new LinkedHashMap<>();
        for (GatewayClient client : gatewayClients) {
            GatewayClient previous = byType.putIfAbsent(client.getSystemType(), client);
            if (previous != null) {
                throw new IllegalStateException("Two gateway clients registered for system type " + client.getSystemType());
            }
        }
        this.clients = Collections.unmodifiableMap(byType);
        log.info("Registered gateway clients: {}", clients.keySet());
    }

    public GatewayClient get(String systemType) {
        GatewayClient client = clients.get(systemType);
        if (client == null) {
            throw new ResourceNotFoundException("Payment system", systemType);
        }
        return client;
    }

    /**
     * Client for a transaction, wrapped in the sandbox decorator when its wallet is a sandbox
     * wallet. The wallet association must be initialised.
     */
    public GatewayClient forTransaction(PaymentTransaction transaction) {
        GatewayClient client = get(transaction.getSystemType());
        return transaction.getWallet().isSandbox() ? new SandboxGatewayClient(client) : client;
    }

    public boolean supports(String systemType) {
        return clients.containsKey(systemType);
    }
}
