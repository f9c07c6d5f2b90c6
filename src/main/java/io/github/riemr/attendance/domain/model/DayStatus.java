package io.github.riemr.attendance.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.List;

/**
 * Classification of one calendar day. Derived on demand, never persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DayStatus(LocalDate date, DayStatusKind status, DayStatusDetails details) {

    public static DayStatus of(LocalDate date, DayStatusKind status) {
        return new DayStatus(date, status, null);
    }

    public List<String> issues() {
        if (details == null || details.getIssues() == null) return List.of();
        return details.getIssues();
    }

    public boolean is(DayStatusKind kind) {
        return status == kind;
    }
}
