package io.github.riemr.attendance.application.dto;

import io.github.riemr.attendance.application.service.DayStatusClassifier;
import io.github.riemr.attendance.domain.model.DayStatus;
import io.github.riemr.attendance.domain.model.DayStatusKind;

import java.util.Collection;

public record AttendanceSummary(
        int workingDays,
        int okDays,
        int issueDays,
        int pendingExceptionDays,
        int unexcusedIssueDays,
        int leaveDays,
        int absentDays,
        int lateDays) {

    public static AttendanceSummary of(Collection<DayStatus> days) {
        int working = 0, ok = 0, pending = 0, unexcused = 0, leave = 0, absent = 0, late = 0;
        for (DayStatus day : days) {
            switch (day.status()) {
                case OK -> ok++;
                case PENDING_EXCEPTION -> pending++;
                case ISSUES_NO_EXCEPTION -> unexcused++;
                case LEAVE -> leave++;
                case ABSENT -> absent++;
                default -> { }
            }
            // future and non-working days are not working days
            if (day.is(DayStatusKind.FUTURE) || day.is(DayStatusKind.NON_WORKING)) continue;
            working++;
            if (day.issues().contains(DayStatusClassifier.ISSUE_LATE_ARRIVAL)) late++;
        }
        return new AttendanceSummary(working, ok, pending + unexcused, pending, unexcused, leave, absent, late);
    }
}
