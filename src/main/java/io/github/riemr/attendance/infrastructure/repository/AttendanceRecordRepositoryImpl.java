package io.github.riemr.attendance.infrastructure.repository;

import io.github.riemr.attendance.application.repository.AttendanceRecordRepository;
import io.github.riemr.attendance.domain.model.AttendanceRecord;
import io.github.riemr.attendance.infrastructure.mapper.AttendanceMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public class AttendanceRecordRepositoryImpl implements AttendanceRecordRepository {
    private final AttendanceMapper mapper;

    public AttendanceRecordRepositoryImpl(AttendanceMapper mapper) { this.mapper = mapper; }

    @Override
    public List<AttendanceRecord> findByEmployeeAndDateRange(String employeeId, LocalDate from, LocalDate to) {
        return mapper.selectByEmployeeAndDateRange(employeeId, from, to);
    }
}
