package io.github.riemr.attendance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceException {
    private String exceptionId;
    private String employeeId;
    private LocalDate targetDate;
    // late_arrival, early_departure, missed_clock_in, missed_clock_out, wrong_time, short_permission, wfh ...
    private String exceptionType;
    private String status;
    private String reason;
    private OffsetDateTime proposedClockIn;
    private OffsetDateTime proposedClockOut;

    public boolean hasStatus(RequestStatus expected) {
        return RequestStatus.fromCode(status) == expected;
    }
}
