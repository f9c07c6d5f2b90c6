package io.github.riemr.attendance.infrastructure.repository;

import io.github.riemr.attendance.application.repository.LeaveRequestRepository;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.infrastructure.mapper.LeaveRequestMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public class LeaveRequestRepositoryImpl implements LeaveRequestRepository {
    private final LeaveRequestMapper mapper;

    public LeaveRequestRepositoryImpl(LeaveRequestMapper mapper) { this.mapper = mapper; }

    @Override public LeaveRequest find(String requestId) { return mapper.selectByPrimaryKey(requestId); }
    @Override public void insert(LeaveRequest request) { mapper.insert(request); }
    @Override public void update(LeaveRequest request) { mapper.updateByPrimaryKey(request); }

    @Override
    public List<LeaveRequest> findApprovedOverlapping(String employeeId, LocalDate from, LocalDate to) {
        return mapper.selectApprovedOverlapping(employeeId, from, to);
    }

    @Override
    public int sumApprovedDays(String employeeId, String leaveTypeId, int year, String excludeRequestId) {
        Integer sum = mapper.sumApprovedDays(employeeId, leaveTypeId, year, excludeRequestId);
        return sum == null ? 0 : sum;
    }

    @Override
    public boolean existsApproved(String employeeId, String leaveTypeId, String excludeRequestId) {
        return mapper.countApproved(employeeId, leaveTypeId, excludeRequestId) > 0;
    }
}
