package io.github.riemr.attendance.application.service.leave;

import io.github.riemr.attendance.application.util.ServicePeriodUtils;

import java.time.LocalDate;

/**
 * Persisted state a leave request is checked against.
 *
 * @param asOf                    date service length and probation are measured to
 * @param approvedSickDaysInYear  approved sick days in the request's calendar year, excluding the request itself
 * @param hasApprovedHajj         an approved Hajj request other than this one exists
 */
public record EmployeeLeaveState(
        LocalDate hireDate,
        LocalDate probationEndDate,
        LocalDate asOf,
        int approvedSickDaysInYear,
        boolean hasApprovedHajj) {

    public long serviceMonths() {
        if (hireDate == null) return 0;
        return ServicePeriodUtils.serviceMonths(hireDate, asOf);
    }

    public boolean probationCompleted() {
        return ServicePeriodUtils.isProbationCompleted(
                ServicePeriodUtils.probationEnd(hireDate, probationEndDate), asOf);
    }
}
