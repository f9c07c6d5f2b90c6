package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.exception.LeaveValidationException;
import io.github.riemr.attendance.application.service.leave.CompassionateLeaveRule;
import io.github.riemr.attendance.application.service.leave.EmployeeLeaveState;
import io.github.riemr.attendance.application.service.leave.HajjLeaveRule;
import io.github.riemr.attendance.application.service.leave.LeaveTypeRule;
import io.github.riemr.attendance.application.service.leave.MaternityLeaveRule;
import io.github.riemr.attendance.application.service.leave.ParentalLeaveRule;
import io.github.riemr.attendance.application.service.leave.SickLeaveRule;
import io.github.riemr.attendance.application.service.leave.StudyLeaveRule;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.PaymentType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Gate run before every insert or update of a leave request.
 * Dispatches to the {@link LeaveTypeRule} registered for the request's leave type;
 * types without a rule keep the requested tier, or full pay when none was given.
 */
@Component
public class LeaveRequestValidator {
    private final Map<LeaveCategory, LeaveTypeRule> rules = new EnumMap<>(LeaveCategory.class);

    public LeaveRequestValidator(List<LeaveTypeRule> rules) {
        for (var rule : rules) {
            LeaveTypeRule previous = this.rules.put(rule.category(), rule);
            if (previous != null) {
                throw new IllegalStateException("Duplicate rule for " + rule.category() + ": "
                        + previous.getClass().getSimpleName() + ", " + rule.getClass().getSimpleName());
            }
        }
    }

    public static LeaveRequestValidator withDefaultRules() {
        return new LeaveRequestValidator(List.of(
                new SickLeaveRule(),
                new HajjLeaveRule(),
                new MaternityLeaveRule(),
                new ParentalLeaveRule(),
                new StudyLeaveRule(),
                new CompassionateLeaveRule()));
    }

    /**
     * @throws LeaveValidationException when the request must be refused
     */
    public PaymentType validate(LeaveRequest request, EmployeeLeaveState state) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(state, "state");
        LeaveCategory category = LeaveCategory.fromName(request.getLeaveTypeName());
        LeaveTypeRule rule = rules.get(category);
        if (rule == null) {
            PaymentType requested = PaymentType.fromCode(request.getPaymentType());
            return requested != null ? requested : PaymentType.FULL_PAY;
        }
        return rule.apply(request, state);
    }
}
