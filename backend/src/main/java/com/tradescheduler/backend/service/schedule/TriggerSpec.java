package com.tradescheduler.backend.service.schedule;

/**
 * Recurring fire specification as understood by the scheduling engine: a
 * Quartz cron expression evaluated in the given IANA zone.
 */
public record TriggerSpec(String cronExpression, String timeZone) {
}
