package io.github.riemr.attendance.application.repository;

import io.github.riemr.attendance.domain.model.LeaveType;

import java.util.List;

public interface LeaveTypeRepository {
    LeaveType find(String leaveTypeId);

    List<LeaveType> findAllActive();
}
