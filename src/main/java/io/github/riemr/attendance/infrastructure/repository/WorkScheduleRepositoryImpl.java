package io.github.riemr.attendance.infrastructure.repository;

import io.github.riemr.attendance.application.repository.WorkScheduleRepository;
import io.github.riemr.attendance.domain.model.WorkSchedule;
import io.github.riemr.attendance.infrastructure.mapper.WorkScheduleMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class WorkScheduleRepositoryImpl implements WorkScheduleRepository {
    private final WorkScheduleMapper mapper;

    public WorkScheduleRepositoryImpl(WorkScheduleMapper mapper) { this.mapper = mapper; }

    @Override
    public Optional<WorkSchedule> findActiveByEmployee(String employeeId) {
        return Optional.ofNullable(mapper.selectActiveByEmployee(employeeId));
    }
}
