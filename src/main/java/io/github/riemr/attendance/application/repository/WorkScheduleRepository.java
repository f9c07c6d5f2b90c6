package io.github.riemr.attendance.application.repository;

import io.github.riemr.attendance.domain.model.WorkSchedule;

import java.util.Optional;

public interface WorkScheduleRepository {
    Optional<WorkSchedule> findActiveByEmployee(String employeeId);
}
