package com.tradescheduler.backend.service.trading;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradescheduler.backend.config.TradingApiProperties;
import com.tradescheduler.backend.exception.TradingApiException;
import com.tradescheduler.backend.model.TradingMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Alpaca-style REST brokerage. Paper and live accounts differ only in base
 * URL and credentials.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlpacaTradingClient implements TradingApiClient {

    static final String ORDERS_PATH = "/v2/orders";
    static final String ACCOUNT_PATH = "/v2/account";

    private final TradingApiHttpClient tradingApiHttpClient;
    private final TradingApiProperties tradingApiProperties;
    private final ObjectMapper objectMapper;

    @Override
    public OrderResult submitOrder(OrderRequest request) {
        if (!tradingApiProperties.hasCredentials()) {
            throw new TradingApiException("Trading API credentials are not configured", 401, null);
        }
        ObjectNode body = objectMapper.createObjectNode();
        body.put("symbol", request.ticker());
        body.put("qty", String.valueOf(request.quantity()));
        body.put("side", request.action().wireValue());
        body.put("type", "market");
        body.put("time_in_force", tradingApiProperties.getTimeInForce());
        if (request.clientOrderId() != null) {
            body.put("client_order_id", request.clientOrderId());
        }
        log.info("Submitting market order mode={} side={} symbol={} qty={} clientOrderId={}",
                mode(), request.action().wireValue(), request.ticker(), request.quantity(),
                request.clientOrderId());
        JsonNode response = parse(tradingApiHttpClient.post(ORDERS_PATH, write(body)));
        OrderResult result = new OrderResult(
                text(response, "id"),
                text(response, "client_order_id"),
                text(response, "status"));
        log.info("Order accepted orderId={} status={} clientOrderId={}",
                result.orderId(), result.status(), result.clientOrderId());
        return result;
    }

    @Override
    public AccountSummary getAccount() {
        JsonNode response = parse(tradingApiHttpClient.get(ACCOUNT_PATH));
        return new AccountSummary(
                text(response, "id"),
                text(response, "status"),
                text(response, "currency"),
                text(response, "buying_power"));
    }

    @Override
    public TradingMode mode() {
        return tradingApiProperties.getMode();
    }

    private String write(ObjectNode body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TradingApiException("Failed to encode order request", e);
        }
    }

    private JsonNode parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new TradingApiException("Empty response from trading API");
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new TradingApiException("Unreadable response from trading API", e);
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
