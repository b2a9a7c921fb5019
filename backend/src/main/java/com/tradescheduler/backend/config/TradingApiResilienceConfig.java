package com.tradescheduler.backend.config;

import com.tradescheduler.backend.exception.TradingApiException;
import com.tradescheduler.backend.exception.TradingApiRateLimitException;
import com.tradescheduler.backend.exception.TradingApiServerException;
import com.tradescheduler.backend.exception.TradingApiTimeoutException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class TradingApiResilienceConfig {

    @Bean
    public CircuitBreaker tradingCircuitBreaker(
            @Value("${trading.api.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${trading.api.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${trading.api.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        // Broker rejections (4xx) do not count as failures.
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(Math.min(slidingWindowSize, 10))
                .recordException(ex -> !(ex instanceof TradingApiException)
                        || ex instanceof TradingApiServerException
                        || ex instanceof TradingApiTimeoutException
                        || ex instanceof TradingApiRateLimitException)
                .build();
        return CircuitBreaker.of("trading-api", config);
    }

    @Bean
    public RateLimiter tradingRateLimiter(
            @Value("${trading.api.resilience.rate.limit-per-second:5}") int limitPerSecond,
            @Value("${trading.api.resilience.rate.timeout-ms:2000}") long timeoutMs
    ) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(limitPerSecond)
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .build();
        return RateLimiter.of("trading-api", config);
    }

    /**
     * Bounded retry for order submission. Read timeouts are never retried: the
     * order may already be live at the broker.
     */
    @Bean
    public Retry tradingRetry(
            @Value("${trading.api.resilience.retry.max-attempts:3}") int maxAttempts,
            @Value("${trading.api.resilience.retry.base-delay-ms:500}") long baseDelayMs,
            @Value("${trading.api.resilience.retry.jitter-factor:0.2}") double jitterFactor
    ) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(baseDelayMs),
                2.0,
                jitterFactor
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryExceptions(TradingApiRateLimitException.class, TradingApiServerException.class,
                        ResourceAccessException.class)
                .ignoreExceptions(TradingApiTimeoutException.class)
                .build();
        return Retry.of("trading-api", config);
    }
}
