package io.github.riemr.attendance.application.service.leave;

import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.PaymentType;
import org.springframework.stereotype.Component;

@Component
public class ParentalLeaveRule implements LeaveTypeRule {

    @Override
    public LeaveCategory category() {
        return LeaveCategory.PARENTAL;
    }

    @Override
    public PaymentType apply(LeaveRequest request, EmployeeLeaveState state) {
        return PaymentType.FULL_PAY;
    }
}
