package com.tradescheduler.backend.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum TradeAction {
    BUY,
    SELL;

    /**
     * Case-insensitive lookup of a request value; empty for anything but buy or sell.
     */
    public static Optional<TradeAction> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(action -> action.name().equals(normalized))
                .findFirst();
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
