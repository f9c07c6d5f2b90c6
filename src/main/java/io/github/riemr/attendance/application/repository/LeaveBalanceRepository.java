package io.github.riemr.attendance.application.repository;

import io.github.riemr.attendance.domain.model.LeaveBalance;

import java.util.List;

public interface LeaveBalanceRepository {
    /** Insert, or overwrite the allocation of the existing (employee, leave type, year) row. */
    void upsert(LeaveBalance balance);

    List<LeaveBalance> findByEmployeeAndYear(String employeeId, int year);
}
