package com.tradescheduler.backend.service.trading;

import com.tradescheduler.backend.model.TradeAction;
import com.tradescheduler.backend.model.TradingMode;

/**
 * Outbound port to the brokerage. Implementations throw subclasses of
 * {@link com.tradescheduler.backend.exception.TradingApiException} on failure.
 */
public interface TradingApiClient {

    /**
     * Submits a market order. {@code clientOrderId} is forwarded to the broker,
     * which rejects a second order carrying the same id.
     */
    OrderResult submitOrder(OrderRequest request);

    AccountSummary getAccount();

    TradingMode mode();

    record OrderRequest(TradeAction action, String ticker, int quantity, String clientOrderId) {
    }

    record OrderResult(String orderId, String clientOrderId, String status) {
    }

    record AccountSummary(String accountId, String status, String currency, String buyingPower) {
    }
}
