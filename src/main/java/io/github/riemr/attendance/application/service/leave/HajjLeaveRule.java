package io.github.riemr.attendance.application.service.leave;

import io.github.riemr.attendance.application.exception.LeaveValidationException;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.PaymentType;
import org.springframework.stereotype.Component;

@Component
public class HajjLeaveRule implements LeaveTypeRule {
    static final int MIN_SERVICE_MONTHS = 24;

    @Override
    public LeaveCategory category() {
        return LeaveCategory.HAJJ;
    }

    @Override
    public PaymentType apply(LeaveRequest request, EmployeeLeaveState state) {
        if (state.serviceMonths() < MIN_SERVICE_MONTHS) {
            throw new LeaveValidationException(category(), "Hajj leave requires minimum 2 years of service");
        }
        if (state.hasApprovedHajj()) {
            throw new LeaveValidationException(category(), "Hajj leave can only be taken once per employment");
        }
        return PaymentType.UNPAID;
    }
}
