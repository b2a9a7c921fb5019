package com.tradescheduler.backend.service.schedule;

import com.tradescheduler.backend.exception.InvalidScheduleException;
import com.tradescheduler.backend.model.DayToken;
import com.tradescheduler.backend.model.JobSchedule;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.zone.ZoneRules;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.stream.Collectors;

/**
 * Translates a job schedule into a {@link TriggerSpec}. Pure: the same input
 * always yields the same spec, and nothing outside the arguments is read.
 */
@Component
public class ScheduleCompiler {

    private static final Map<String, Set<DayToken>> ALIASES = Map.of(
            "weekdays", EnumSet.range(DayToken.MON, DayToken.FRI),
            "weekends", EnumSet.of(DayToken.SAT, DayToken.SUN),
            "daily", EnumSet.allOf(DayToken.class),
            "*", EnumSet.allOf(DayToken.class)
    );

    public TriggerSpec compile(JobSchedule schedule, ZoneId zone) {
        if (schedule == null) {
            throw new InvalidScheduleException("Schedule is required");
        }
        if (zone == null) {
            throw new InvalidScheduleException("Timezone is required");
        }
        int hour = requireInRange("hour", schedule.hour(), 23);
        int minute = requireInRange("minute", schedule.minute(), 59);
        Set<DayToken> days = resolveDays(schedule.days());
        String dayField = days.stream().map(DayToken::cronName).collect(Collectors.joining(","));
        String cron = "0 " + minute + " " + hour + " ? * " + dayField;
        return new TriggerSpec(cron, engineZoneId(zone));
    }

    /**
     * Parses a zone id and checks that the engine can fire in it.
     */
    public ZoneId parseZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidScheduleException("Timezone is required");
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(timezone.trim());
        } catch (DateTimeException ex) {
            throw new InvalidScheduleException("Unknown timezone '" + timezone + "'");
        }
        engineZoneId(zone);
        return zone;
    }

    /**
     * The zone as the engine reports it back: a java.util.TimeZone id with the
     * same rules. TimeZone maps ids it does not know to GMT, so fixed offsets
     * such as UTC+05:00 are reduced to their offset first and the rules are
     * compared afterwards.
     */
    String engineZoneId(ZoneId zone) {
        TimeZone timeZone = TimeZone.getTimeZone(zone.normalized());
        if (!sameRules(timeZone.toZoneId().getRules(), zone.getRules())) {
            throw new InvalidScheduleException("Timezone '" + zone.getId() + "' is not supported by the scheduler");
        }
        return timeZone.getID();
    }

    private static boolean sameRules(ZoneRules engine, ZoneRules requested) {
        if (engine.isFixedOffset() || requested.isFixedOffset()) {
            return engine.isFixedOffset() && requested.isFixedOffset()
                    && engine.getOffset(Instant.EPOCH).equals(requested.getOffset(Instant.EPOCH));
        }
        return engine.equals(requested);
    }

    /**
     * Expands day entries into the set of days they cover, in Monday-first order.
     */
    public Set<DayToken> resolveDays(List<String> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new InvalidScheduleException("At least one day is required");
        }
        EnumSet<DayToken> days = EnumSet.noneOf(DayToken.class);
        for (String entry : entries) {
            days.addAll(resolveEntry(entry));
        }
        return days;
    }

    /**
     * Canonical stored form of a day entry: trimmed and lower-cased. Validates
     * the entry on the way.
     */
    public String normalizeEntry(String entry) {
        resolveEntry(entry);
        return entry.trim().toLowerCase(Locale.ROOT);
    }

    private Set<DayToken> resolveEntry(String entry) {
        if (entry == null || entry.isBlank()) {
            throw new InvalidScheduleException("Day entries must not be blank");
        }
        String normalized = entry.trim().toLowerCase(Locale.ROOT);
        Set<DayToken> alias = ALIASES.get(normalized);
        if (alias != null) {
            return alias;
        }
        int dash = normalized.indexOf('-');
        if (dash < 0) {
            return EnumSet.of(lookup(normalized, entry));
        }
        String startRaw = normalized.substring(0, dash);
        String endRaw = normalized.substring(dash + 1);
        if (startRaw.isBlank() || endRaw.isBlank() || endRaw.indexOf('-') >= 0) {
            throw new InvalidScheduleException("Malformed day range '" + entry + "'");
        }
        DayToken start = lookup(startRaw, entry);
        DayToken end = lookup(endRaw, entry);
        if (start.compareTo(end) > 0) {
            throw new InvalidScheduleException("Day range '" + entry + "' runs backwards; list the days explicitly");
        }
        return EnumSet.range(start, end);
    }

    private DayToken lookup(String token, String entry) {
        return DayToken.lookup(token)
                .orElseThrow(() -> new InvalidScheduleException(
                        "Unrecognized day '" + token.trim() + "' in '" + entry + "'"));
    }

    private int requireInRange(String field, Integer value, int max) {
        if (value == null) {
            throw new InvalidScheduleException("Schedule " + field + " is required");
        }
        if (value < 0 || value > max) {
            throw new InvalidScheduleException("Schedule " + field + " must be between 0 and " + max + ", got " + value);
        }
        return value;
    }
}
