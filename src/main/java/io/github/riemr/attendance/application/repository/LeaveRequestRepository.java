package io.github.riemr.attendance.application.repository;

import io.github.riemr.attendance.domain.model.LeaveRequest;

import java.time.LocalDate;
import java.util.List;

public interface LeaveRequestRepository {
    LeaveRequest find(String requestId);

    void insert(LeaveRequest request);

    void update(LeaveRequest request);

    /** Approved requests whose interval intersects [from, to], with the leave type name joined in. */
    List<LeaveRequest> findApprovedOverlapping(String employeeId, LocalDate from, LocalDate to);

    /** Sum of total_days over approved requests of the type starting in {@code year}; excludeRequestId may be null. */
    int sumApprovedDays(String employeeId, String leaveTypeId, int year, String excludeRequestId);

    boolean existsApproved(String employeeId, String leaveTypeId, String excludeRequestId);
}
