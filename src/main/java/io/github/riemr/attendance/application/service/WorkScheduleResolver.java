package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.exception.ScheduleConfigurationException;
import io.github.riemr.attendance.application.repository.WorkScheduleRepository;
import io.github.riemr.attendance.domain.model.WorkSchedule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WorkScheduleResolver {
    private final WorkScheduleRepository repository;

    /**
     * Active schedule of the employee. A missing schedule or an empty working-day set is
     * reported rather than replaced by a default.
     */
    public WorkSchedule resolve(String employeeId) {
        WorkSchedule schedule = repository.findActiveByEmployee(employeeId)
                .orElseThrow(() -> new ScheduleConfigurationException(employeeId,
                        "No active work schedule for employee " + employeeId));
        if (schedule.getWorkingDays() == null || schedule.getWorkingDays().isEmpty()) {
            throw new ScheduleConfigurationException(employeeId,
                    "Work schedule of employee " + employeeId + " has no working days configured");
        }
        return schedule;
    }
}
