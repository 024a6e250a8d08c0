package com.fintech.paymentengine.config;

import com.fintech.paymentengine.exception.GatewayApiException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker in front of gateway status queries.
 * <p>
 * While a provider is down the reconciliation poll fails fast instead of spending its batch
 * on timeouts; the transactions stay PENDING and are picked up again once the breaker closes.
 * Only transport failures count against the provider. A non-retryable
 * {@link GatewayApiException} (e.g. unknown reference) is a valid answer and is not recorded.
 */
@Configuration
public class ResilienceConfig {

    public static final String GATEWAY_API = "gatewayApi";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${gateway.circuit-breaker.sliding-window-size:20}") int slidingWindowSize,
            @Value("${gateway.circuit-breaker.minimum-calls:10}") int minimumCalls,
            @Value("${gateway.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${gateway.circuit-breaker.open-seconds:60}") long openSeconds) {
        CircuitBreakerConfig gatewayApi = CircuitBreakerConfig.custom()
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(minimumCalls)
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(openSeconds))
                .permittedNumberOfCallsInHalfOpenState(2)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(ResilienceConfig::isProviderFailure)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(gatewayApi);
        // created up front so the actuator lists it before the first poll
        registry.circuitBreaker(GATEWAY_API);
        return registry;
    }

    static boolean isProviderFailure(Throwable error) {
        return !(error instanceof GatewayApiException) || ((GatewayApiException) error).isRetryable();
    }
}
