package com.tradescheduler.backend.model;

/**
 * Which brokerage account orders go to. Paper orders are simulated by the
 * broker.
 */
public enum TradingMode {
    PAPER,
    LIVE
}
