package com.tradescheduler.backend.service;

import com.tradescheduler.backend.exception.InvalidScheduleException;
import com.tradescheduler.backend.exception.ValidationException;
import com.tradescheduler.backend.model.JobDefinition;
import com.tradescheduler.backend.service.schedule.ScheduleCompiler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks a candidate definition and returns its normalized copy. Runs before
 * anything is written.
 */
@Component
@RequiredArgsConstructor
public class JobDefinitionValidator {

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,99}");
    private static final Pattern TICKER = Pattern.compile("[A-Z0-9][A-Z0-9.\\-]{0,15}");

    private final ScheduleCompiler scheduleCompiler;

    public JobDefinition validate(JobDefinition candidate) {
        if (candidate == null) {
            throw new ValidationException("Job definition is required");
        }
        List<String> violations = new ArrayList<>();

        String name = candidate.getName() == null ? null : candidate.getName().trim();
        if (name == null || name.isEmpty()) {
            violations.add("name is required");
        } else if (!NAME.matcher(name).matches()) {
            violations.add("name must be 1-100 characters of letters, digits, '.', '_' or '-' and start with a letter or digit");
        }

        if (candidate.getAction() == null) {
            violations.add("action must be buy or sell");
        }

        String ticker = candidate.getTicker() == null ? null : candidate.getTicker().trim().toUpperCase(Locale.ROOT);
        if (ticker == null || ticker.isEmpty()) {
            violations.add("ticker is required");
        } else if (!TICKER.matcher(ticker).matches()) {
            violations.add("ticker '" + candidate.getTicker() + "' is not a valid symbol");
        }

        if (candidate.getQuantity() == null || candidate.getQuantity() <= 0) {
            violations.add("quantity must be a positive integer");
        }

        List<String> days = new ArrayList<>();
        if (candidate.getDays() == null || candidate.getDays().isEmpty()) {
            violations.add("schedule.days must contain at least one day");
        } else {
            for (String entry : candidate.getDays()) {
                try {
                    days.add(scheduleCompiler.normalizeEntry(entry));
                } catch (InvalidScheduleException ex) {
                    violations.add("schedule.days: " + ex.getMessage());
                }
            }
        }

        if (candidate.getHour() == null || candidate.getHour() < 0 || candidate.getHour() > 23) {
            violations.add("schedule.hour must be between 0 and 23");
        }
        if (candidate.getMinute() == null || candidate.getMinute() < 0 || candidate.getMinute() > 59) {
            violations.add("schedule.minute must be between 0 and 59");
        }

        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid job definition", violations);
        }
        return candidate.toBuilder()
                .name(name)
                .ticker(ticker)
                .days(days)
                .build();
    }
}
