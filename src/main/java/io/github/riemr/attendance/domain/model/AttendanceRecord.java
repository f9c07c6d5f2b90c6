package io.github.riemr.attendance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceRecord {
    private String attendanceId;
    private String employeeId;
    private LocalDate date;
    private OffsetDateTime clockInTime;
    private OffsetDateTime clockOutTime;
    // maintained by a trigger once both clock times are present
    private BigDecimal totalHours;
    private Boolean wfh;
    private String notes;
}
