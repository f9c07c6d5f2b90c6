package io.github.riemr.attendance.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class AttendanceConfig {

    /** Zone clock times are read in and "today" is taken from. Gulf Standard Time unless overridden. */
    @Bean
    public ZoneId attendanceZoneId(@Value("${attendance.zone-id:Asia/Dubai}") String zoneId) {
        return ZoneId.of(zoneId);
    }

    @Bean
    public Clock attendanceClock(ZoneId attendanceZoneId) {
        return Clock.system(attendanceZoneId);
    }
}
