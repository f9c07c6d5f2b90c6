package io.github.riemr.attendance.application.repository;

import io.github.riemr.attendance.domain.model.AttendanceRecord;

import java.time.LocalDate;
import java.util.List;

public interface AttendanceRecordRepository {
    List<AttendanceRecord> findByEmployeeAndDateRange(String employeeId, LocalDate from, LocalDate to);
}
