package io.github.riemr.attendance.application.service.leave;

import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.PaymentType;
import org.springframework.stereotype.Component;

@Component
public class StudyLeaveRule implements LeaveTypeRule {

    @Override
    public LeaveCategory category() {
        return LeaveCategory.STUDY;
    }

    @Override
    public PaymentType apply(LeaveRequest request, EmployeeLeaveState state) {
        PaymentType requested = PaymentType.fromCode(request.getPaymentType());
        return requested != null ? requested : PaymentType.FULL_PAY;
    }
}
