package com.tradescheduler.backend.model;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Recognized day-of-week tokens. Declaration order is Monday first and is the
 * order used when rendering cron day lists.
 */
public enum DayToken {
    MON("mon", "monday"),
    TUE("tue", "tuesday"),
    WED("wed", "wednesday"),
    THU("thu", "thursday"),
    FRI("fri", "friday"),
    SAT("sat", "saturday"),
    SUN("sun", "sunday");

    private static final Map<String, DayToken> BY_SPELLING = new HashMap<>();

    static {
        for (DayToken token : values()) {
            for (String spelling : token.spellings) {
                BY_SPELLING.put(spelling, token);
            }
        }
    }

    private final List<String> spellings;

    DayToken(String... spellings) {
        this.spellings = List.of(spellings);
    }

    public static Optional<DayToken> lookup(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SPELLING.get(raw.trim().toLowerCase(Locale.ROOT)));
    }

    public String cronName() {
        return name();
    }
}
