package com.tradescheduler.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * RestTemplate for the brokerage. Every request carries the account's key
 * pair, read from {@link TradingApiProperties} per request so that the paper
 * and live credentials follow the configured mode.
 */
@Configuration
public class TradingApiHttpConfig {

    public static final String KEY_ID_HEADER = "APCA-API-KEY-ID";
    public static final String SECRET_KEY_HEADER = "APCA-API-SECRET-KEY";

    @Bean
    public RestTemplate tradingRestTemplate(TradingApiProperties tradingApiProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(tradingApiProperties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(tradingApiProperties.getHttp().getReadTimeoutMs());
        RestTemplate restTemplate = new RestTemplate(factory);
        restTemplate.getInterceptors().add(credentialsInterceptor(tradingApiProperties));
        return restTemplate;
    }

    static ClientHttpRequestInterceptor credentialsInterceptor(TradingApiProperties tradingApiProperties) {
        return (request, body, execution) -> {
            HttpHeaders headers = request.getHeaders();
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            if (tradingApiProperties.hasCredentials()) {
                headers.set(KEY_ID_HEADER, tradingApiProperties.getKeyId());
                headers.set(SECRET_KEY_HEADER, tradingApiProperties.getSecretKey());
            }
            return execution.execute(request, body);
        };
    }
}
