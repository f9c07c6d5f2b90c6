package io.github.riemr.attendance.application.repository;

import io.github.riemr.attendance.domain.model.AttendanceException;
import io.github.riemr.attendance.domain.model.RequestStatus;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface AttendanceExceptionRepository {
    List<AttendanceException> findByEmployeeAndDateRange(String employeeId, LocalDate from, LocalDate to,
                                                         Collection<RequestStatus> statuses);
}
