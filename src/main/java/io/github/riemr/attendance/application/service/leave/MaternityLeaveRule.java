package io.github.riemr.attendance.application.service.leave;

import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.PaymentType;
import org.springframework.stereotype.Component;

/**
 * Tier follows the length of this request alone: 45 days full pay, up to 60 half pay.
 */
@Component
public class MaternityLeaveRule implements LeaveTypeRule {
    static final int FULL_PAY_LIMIT = 45;
    static final int HALF_PAY_LIMIT = 60;

    @Override
    public LeaveCategory category() {
        return LeaveCategory.MATERNITY;
    }

    @Override
    public PaymentType apply(LeaveRequest request, EmployeeLeaveState state) {
        int days = requestedDays(request);
        if (days <= FULL_PAY_LIMIT) return PaymentType.FULL_PAY;
        if (days <= HALF_PAY_LIMIT) return PaymentType.HALF_PAY;
        return PaymentType.UNPAID;
    }
}
