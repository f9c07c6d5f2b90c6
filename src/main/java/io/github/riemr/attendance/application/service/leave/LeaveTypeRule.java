package io.github.riemr.attendance.application.service.leave;

import io.github.riemr.attendance.application.exception.LeaveValidationException;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.PaymentType;

/**
 * Request-time checks for one leave type.
 */
public interface LeaveTypeRule {

    LeaveCategory category();

    /**
     * @return the payment tier the request must be stored with
     * @throws LeaveValidationException when the request breaks a rule of this leave type
     */
    PaymentType apply(LeaveRequest request, EmployeeLeaveState state);

    default int requestedDays(LeaveRequest request) {
        return request.getTotalDays() == null ? 0 : request.getTotalDays();
    }
}
