package io.github.riemr.attendance.application.service.leave;

import io.github.riemr.attendance.application.exception.LeaveValidationException;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.PaymentType;
import org.springframework.stereotype.Component;

/**
 * 15 days full pay, the next 30 half pay, the rest unpaid, counted per calendar year.
 */
@Component
public class SickLeaveRule implements LeaveTypeRule {
    static final int CERTIFICATE_THRESHOLD_DAYS = 3;
    static final int FULL_PAY_LIMIT = 15;
    static final int HALF_PAY_LIMIT = 45;

    @Override
    public LeaveCategory category() {
        return LeaveCategory.SICK;
    }

    @Override
    public PaymentType apply(LeaveRequest request, EmployeeLeaveState state) {
        if (!state.probationCompleted()) {
            throw new LeaveValidationException(category(),
                    "Sick leave is only available after completing probation period");
        }
        int days = requestedDays(request);
        String certificate = request.getMedicalCertificateUrl();
        if (days > CERTIFICATE_THRESHOLD_DAYS && (certificate == null || certificate.isBlank())) {
            throw new LeaveValidationException(category(),
                    "Medical certificate is required for sick leave exceeding 3 days");
        }
        int cumulative = state.approvedSickDaysInYear() + days;
        if (cumulative <= FULL_PAY_LIMIT) return PaymentType.FULL_PAY;
        if (cumulative <= HALF_PAY_LIMIT) return PaymentType.HALF_PAY;
        return PaymentType.UNPAID;
    }
}
