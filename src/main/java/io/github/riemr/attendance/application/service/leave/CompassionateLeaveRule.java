package io.github.riemr.attendance.application.service.leave;

import io.github.riemr.attendance.application.exception.LeaveValidationException;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.PaymentType;
import org.springframework.stereotype.Component;

@Component
public class CompassionateLeaveRule implements LeaveTypeRule {

    @Override
    public LeaveCategory category() {
        return LeaveCategory.COMPASSIONATE;
    }

    @Override
    public PaymentType apply(LeaveRequest request, EmployeeLeaveState state) {
        String relationship = request.getRelationship();
        if (relationship == null || relationship.isBlank()) {
            throw new LeaveValidationException(category(),
                    "Relationship must be specified for compassionate leave");
        }
        return PaymentType.FULL_PAY;
    }
}
