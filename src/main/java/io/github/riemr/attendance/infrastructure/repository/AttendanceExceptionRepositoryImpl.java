package io.github.riemr.attendance.infrastructure.repository;

import io.github.riemr.attendance.application.repository.AttendanceExceptionRepository;
import io.github.riemr.attendance.domain.model.AttendanceException;
import io.github.riemr.attendance.domain.model.RequestStatus;
import io.github.riemr.attendance.infrastructure.mapper.AttendanceExceptionMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public class AttendanceExceptionRepositoryImpl implements AttendanceExceptionRepository {
    private final AttendanceExceptionMapper mapper;

    public AttendanceExceptionRepositoryImpl(AttendanceExceptionMapper mapper) { this.mapper = mapper; }

    @Override
    public List<AttendanceException> findByEmployeeAndDateRange(String employeeId, LocalDate from, LocalDate to,
                                                                Collection<RequestStatus> statuses) {
        List<String> codes = statuses == null ? List.of() : statuses.stream().map(RequestStatus::code).toList();
        return mapper.selectByEmployeeAndDateRange(employeeId, from, to, codes);
    }
}
