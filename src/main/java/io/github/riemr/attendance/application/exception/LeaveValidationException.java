package io.github.riemr.attendance.application.exception;

import io.github.riemr.attendance.domain.model.LeaveCategory;

/**
 * A leave request broke a labour rule. The request must not be persisted.
 */
public class LeaveValidationException extends RuntimeException {

    private final LeaveCategory category;

    public LeaveValidationException(LeaveCategory category, String reason) {
        super(reason);
        this.category = category;
    }

    public LeaveCategory getCategory() {
        return category;
    }

    public String getReason() {
        return getMessage();
    }
}
