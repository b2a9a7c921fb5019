package com.tradescheduler.backend.service.schedule;

import com.tradescheduler.backend.exception.InvalidScheduleException;
import com.tradescheduler.backend.model.DayToken;
import com.tradescheduler.backend.model.JobSchedule;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.List;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleCompilerTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private final ScheduleCompiler compiler = new ScheduleCompiler();

    @Test
    void weekdayRangeCompilesToQuartzCron() {
        TriggerSpec spec = compiler.compile(new JobSchedule(List.of("mon-fri"), 9, 35), NEW_YORK);

        assertThat(spec.cronExpression()).isEqualTo("0 35 9 ? * MON,TUE,WED,THU,FRI");
        assertThat(spec.timeZone()).isEqualTo("America/New_York");
    }

    @Test
    void compileIsDeterministic() {
        JobSchedule schedule = new JobSchedule(List.of("fri", "mon", "wed"), 15, 0);

        assertThat(compiler.compile(schedule, NEW_YORK)).isEqualTo(compiler.compile(schedule, NEW_YORK));
        assertThat(compiler.compile(schedule, NEW_YORK).cronExpression()).isEqualTo("0 0 15 ? * MON,WED,FRI");
    }

    @Test
    void entriesAreUnionedInMondayFirstOrder() {
        TriggerSpec spec = compiler.compile(new JobSchedule(List.of("Sunday", "weekdays", "tue"), 0, 5), NEW_YORK);

        assertThat(spec.cronExpression()).isEqualTo("0 5 0 ? * MON,TUE,WED,THU,FRI,SUN");
    }

    @Test
    void aliasesExpand() {
        assertThat(compiler.resolveDays(List.of("weekends"))).containsExactly(DayToken.SAT, DayToken.SUN);
        assertThat(compiler.resolveDays(List.of("daily"))).hasSize(7);
        assertThat(compiler.resolveDays(List.of("*"))).hasSize(7);
        assertThat(compiler.resolveDays(List.of(" Monday-Wednesday "))).containsExactly(DayToken.MON, DayToken.TUE, DayToken.WED);
    }

    @Test
    void wrappingRangeIsRejected() {
        assertThatThrownBy(() -> compiler.resolveDays(List.of("fri-mon")))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("fri-mon");
    }

    @Test
    void unknownTokenIsRejectedWithItsName() {
        assertThatThrownBy(() -> compiler.resolveDays(List.of("mon", "funday")))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("funday");
    }

    @Test
    void malformedEntriesAreRejected() {
        assertThatThrownBy(() -> compiler.resolveDays(List.of()))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> compiler.resolveDays(List.of("  ")))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> compiler.resolveDays(List.of("mon-")))
                .isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(() -> compiler.resolveDays(List.of("mon-tue-wed")))
                .isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void hourAndMinuteAreRangeChecked() {
        assertThatThrownBy(() -> compiler.compile(new JobSchedule(List.of("mon"), 24, 0), NEW_YORK))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("hour");
        assertThatThrownBy(() -> compiler.compile(new JobSchedule(List.of("mon"), 9, 60), NEW_YORK))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("minute");
        assertThatThrownBy(() -> compiler.compile(new JobSchedule(List.of("mon"), null, 0), NEW_YORK))
                .isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void unknownZoneIsRejected() {
        assertThatThrownBy(() -> compiler.parseZone("Mars/Olympus"))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("Mars/Olympus");
    }

    @Test
    void zoneIdMatchesEngineRepresentation() {
        TriggerSpec spec = compiler.compile(new JobSchedule(List.of("mon"), 9, 0), ZoneId.of("Z"));

        assertThat(spec.timeZone()).isEqualTo("UTC");
    }

    @Test
    void prefixedOffsetZonesKeepTheirOffset() {
        TriggerSpec utcPlusFive = compiler.compile(new JobSchedule(List.of("mon"), 9, 0), compiler.parseZone("UTC+05:00"));
        TriggerSpec utMinusThree = compiler.compile(new JobSchedule(List.of("mon"), 9, 0), compiler.parseZone("UT-03:00"));

        assertThat(utcPlusFive.timeZone()).isEqualTo("GMT+05:00");
        assertThat(TimeZone.getTimeZone(utcPlusFive.timeZone()).getRawOffset()).isEqualTo(5 * 3_600_000);
        assertThat(utMinusThree.timeZone()).isEqualTo("GMT-03:00");
        assertThat(TimeZone.getTimeZone(utMinusThree.timeZone()).getRawOffset()).isEqualTo(-3 * 3_600_000);
    }

    @Test
    void regionZonesAreNotRewritten() {
        TriggerSpec spec = compiler.compile(new JobSchedule(List.of("mon"), 9, 0), compiler.parseZone("Europe/London"));

        assertThat(spec.timeZone()).isEqualTo("Europe/London");
    }

    @Test
    void normalizeEntryTrimsAndLowerCases() {
        assertThat(compiler.normalizeEntry("  MON-Fri ")).isEqualTo("mon-fri");
    }
}
