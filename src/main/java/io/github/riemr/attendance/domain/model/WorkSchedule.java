package io.github.riemr.attendance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkSchedule {
    private String scheduleId;
    private String employeeId;
    private LocalTime startTime;
    private LocalTime endTime;
    private BigDecimal minimumDailyHours;
    // weekday names as stored, e.g. "Monday"
    private Set<String> workingDays;
    private Boolean active;
}
