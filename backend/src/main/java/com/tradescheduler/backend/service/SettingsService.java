package com.tradescheduler.backend.service;

import com.tradescheduler.backend.config.SchedulerProperties;
import com.tradescheduler.backend.exception.InvalidScheduleException;
import com.tradescheduler.backend.model.Setting;
import com.tradescheduler.backend.repository.SettingRepository;
import com.tradescheduler.backend.service.schedule.ScheduleCompiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneId;

/**
 * Global settings. Today this is only the timezone every trigger fires in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {

    private final SettingRepository settingRepository;
    private final SchedulerProperties schedulerProperties;
    private final ScheduleCompiler scheduleCompiler;

    @Transactional(readOnly = true)
    public String getTimezone() {
        return settingRepository.findByKey(Setting.TIMEZONE)
                .map(Setting::getValue)
                .orElseGet(schedulerProperties::getDefaultTimezone);
    }

    /**
     * Zone triggers are compiled in. A stored value that no longer parses
     * falls back to the configured default.
     */
    public ZoneId getZone() {
        String timezone = getTimezone();
        try {
            return scheduleCompiler.parseZone(timezone);
        } catch (InvalidScheduleException ex) {
            log.error("Stored timezone '{}' is invalid, falling back to {}", timezone,
                    schedulerProperties.getDefaultTimezone());
            return scheduleCompiler.parseZone(schedulerProperties.getDefaultTimezone());
        }
    }

    @Transactional
    public String updateTimezone(String timezone) {
        ZoneId zone = scheduleCompiler.parseZone(timezone);
        Setting setting = settingRepository.findByKey(Setting.TIMEZONE)
                .orElseGet(() -> Setting.builder().key(Setting.TIMEZONE).build());
        String previous = setting.getValue();
        setting.setValue(zone.getId());
        settingRepository.save(setting);
        log.info("Timezone changed from {} to {}", previous != null ? previous : schedulerProperties.getDefaultTimezone(),
                zone.getId());
        return zone.getId();
    }
}
