package io.github.riemr.attendance.infrastructure.repository;

import io.github.riemr.attendance.application.repository.LeaveBalanceRepository;
import io.github.riemr.attendance.domain.model.LeaveBalance;
import io.github.riemr.attendance.infrastructure.mapper.LeaveBalanceMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class LeaveBalanceRepositoryImpl implements LeaveBalanceRepository {
    private final LeaveBalanceMapper mapper;

    public LeaveBalanceRepositoryImpl(LeaveBalanceMapper mapper) { this.mapper = mapper; }

    @Override public void upsert(LeaveBalance balance) { mapper.upsert(balance); }

    @Override
    public List<LeaveBalance> findByEmployeeAndYear(String employeeId, int year) {
        return mapper.selectByEmployeeAndYear(employeeId, year);
    }
}
