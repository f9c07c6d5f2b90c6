package io.github.riemr.attendance.infrastructure.repository;

import io.github.riemr.attendance.application.repository.LeaveTypeRepository;
import io.github.riemr.attendance.domain.model.LeaveType;
import io.github.riemr.attendance.infrastructure.mapper.LeaveTypeMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class LeaveTypeRepositoryImpl implements LeaveTypeRepository {
    private final LeaveTypeMapper mapper;

    public LeaveTypeRepositoryImpl(LeaveTypeMapper mapper) { this.mapper = mapper; }

    @Override public LeaveType find(String leaveTypeId) { return mapper.selectByPrimaryKey(leaveTypeId); }
    @Override public List<LeaveType> findAllActive() { return mapper.selectAllActive(); }
}
