package com.tradescheduler.backend.service.trading;

import com.tradescheduler.backend.config.TradingApiProperties;
import com.tradescheduler.backend.exception.TradingApiCircuitOpenException;
import com.tradescheduler.backend.exception.TradingApiException;
import com.tradescheduler.backend.exception.TradingApiRateLimitException;
import com.tradescheduler.backend.exception.TradingApiServerException;
import com.tradescheduler.backend.exception.TradingApiTimeoutException;
import com.tradescheduler.backend.exception.TradingApiUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.function.Supplier;

/**
 * HTTP transport to the trading API, wrapped in retry, circuit
 * breaker and rate limiter. Every failure leaves here as a
 * {@link TradingApiException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingApiHttpClient {

    private final RestTemplate tradingRestTemplate;
    private final CircuitBreaker tradingCircuitBreaker;
    private final RateLimiter tradingRateLimiter;
    private final Retry tradingRetry;
    private final TradingApiProperties tradingApiProperties;
    private final MeterRegistry meterRegistry;

    public String get(String path) {
        return execute(path, HttpMethod.GET, null);
    }

    public String post(String path, String body) {
        return execute(path, HttpMethod.POST, body);
    }

    private String execute(String path, HttpMethod method, String body) {
        String url = tradingApiProperties.baseUrl() + path;
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        Supplier<String> supplier = () -> doRequest(url, method, body);
        try {
            Supplier<String> decorated = Retry.decorateSupplier(tradingRetry, supplier);
            decorated = CircuitBreaker.decorateSupplier(tradingCircuitBreaker, decorated);
            decorated = RateLimiter.decorateSupplier(tradingRateLimiter, decorated);
            String response = decorated.get();
            status = "success";
            return response;
        } catch (CallNotPermittedException e) {
            status = "circuit_open";
            log.warn("Trading API circuit open method={} url={}", method, url);
            throw new TradingApiCircuitOpenException("Trading API circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            status = "throttled";
            log.warn("Trading API local rate limit exceeded method={} url={}", method, url);
            throw new TradingApiRateLimitException("Trading API request rate exceeded", e);
        } catch (TradingApiException e) {
            log.warn("Trading API request failed method={} url={} status={} type={} message={}",
                    method, url, e.getStatusCode(), e.getClass().getSimpleName(), e.getMessage());
            throw e;
        } catch (ResourceAccessException e) {
            log.warn("Trading API unreachable method={} url={} message={}", method, url, e.getMessage());
            throw new TradingApiUnavailableException("Trading API unreachable: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("trading_api_call_latency")
                    .tag("method", method.name())
                    .tag("status", status)
                    .register(meterRegistry));
        }
    }

    private String doRequest(String url, HttpMethod method, String body) {
        try {
            HttpHeaders headers = new HttpHeaders();
            if (method == HttpMethod.POST) {
                headers.setContentType(MediaType.APPLICATION_JSON);
            }
            ResponseEntity<String> response = tradingRestTemplate.exchange(url, method,
                    new HttpEntity<>(body, headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new TradingApiRateLimitException("Trading API rate limit (429)", e);
        } catch (HttpServerErrorException e) {
            throw new TradingApiServerException("Trading API server error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            throw new TradingApiException("Trading API rejected request (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new TradingApiTimeoutException("Trading API did not respond in time", e);
            }
            throw e;
        }
    }
}
