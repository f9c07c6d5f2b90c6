package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.exception.LeaveValidationException;
import io.github.riemr.attendance.application.service.leave.EmployeeLeaveState;
import io.github.riemr.attendance.application.service.leave.ParentalLeaveRule;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.PaymentType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeaveRequestValidatorTest {

    private static final EmployeeLeaveState SENIOR =
            new EmployeeLeaveState(LocalDate.of(2018, 1, 1), null, LocalDate.of(2024, 6, 1), 0, false);

    private final LeaveRequestValidator validator = LeaveRequestValidator.withDefaultRules();

    private static LeaveRequest request(String type, int days) {
        return LeaveRequest.builder()
                .leaveTypeName(type)
                .startDate(LocalDate.of(2024, 6, 3))
                .endDate(LocalDate.of(2024, 6, 3).plusDays(days - 1))
                .totalDays(days)
                .build();
    }

    @Test
    void validate_tiersMaternity_byRequestLength() {
        assertThat(validator.validate(request("Maternity Leave", 45), SENIOR)).isEqualTo(PaymentType.FULL_PAY);
        assertThat(validator.validate(request("Maternity Leave", 60), SENIOR)).isEqualTo(PaymentType.HALF_PAY);
        assertThat(validator.validate(request("Maternity Leave", 61), SENIOR)).isEqualTo(PaymentType.UNPAID);
    }

    @Test
    void validate_paysParentalInFull() {
        assertThat(validator.validate(request("Parental Leave", 5), SENIOR)).isEqualTo(PaymentType.FULL_PAY);
    }

    @Test
    void validate_keepsRequestedTier_forStudyLeave() {
        LeaveRequest study = request("Study Leave", 2);
        assertThat(validator.validate(study, SENIOR)).isEqualTo(PaymentType.FULL_PAY);

        study.setPaymentType("unpaid");
        assertThat(validator.validate(study, SENIOR)).isEqualTo(PaymentType.UNPAID);
    }

    @Test
    void validate_requiresRelationship_forCompassionateLeave() {
        LeaveRequest compassionate = request("Compassionate Leave", 3);

        assertThatThrownBy(() -> validator.validate(compassionate, SENIOR))
                .isInstanceOf(LeaveValidationException.class)
                .hasMessage("Relationship must be specified for compassionate leave");

        compassionate.setRelationship("parent");
        assertThat(validator.validate(compassionate, SENIOR)).isEqualTo(PaymentType.FULL_PAY);
    }

    @Test
    void validate_passesUnknownTypes_throughUnchanged() {
        LeaveRequest annual = request("Annual Leave", 10);
        assertThat(validator.validate(annual, SENIOR)).isEqualTo(PaymentType.FULL_PAY);

        LeaveRequest other = request("Unpaid Leave", 10);
        other.setPaymentType("unpaid");
        assertThat(validator.validate(other, SENIOR)).isEqualTo(PaymentType.UNPAID);
    }

    @Test
    void validate_rejectsHajj_forEmployeeHiredIn2023() {
        var state = new EmployeeLeaveState(LocalDate.of(2023, 1, 1), null, LocalDate.of(2024, 6, 1), 0, false);

        assertThatThrownBy(() -> validator.validate(request("Hajj Leave", 30), state))
                .isInstanceOf(LeaveValidationException.class)
                .hasMessage("Hajj leave requires minimum 2 years of service");
    }

    @Test
    void constructor_rejectsTwoRulesForOneType() {
        assertThatThrownBy(() -> new LeaveRequestValidator(List.of(new ParentalLeaveRule(), new ParentalLeaveRule())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(LeaveCategory.PARENTAL.name());
    }
}
