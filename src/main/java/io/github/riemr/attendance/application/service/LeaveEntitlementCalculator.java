package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.util.ServicePeriodUtils;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Yearly leave allocation from length of service, measured to December 31 of the target year.
 * Pure: the allocation batch is the only caller that persists the result.
 */
@Component
public class LeaveEntitlementCalculator {
    static final int ANNUAL_FULL_DAYS = 30;
    static final int SICK_DAYS = 90;
    static final int MATERNITY_DAYS = 60;
    static final int PARENTAL_DAYS = 5;
    static final int STUDY_DAYS = 10;
    static final int HAJJ_DAYS = 30;
    static final int HAJJ_MIN_SERVICE_MONTHS = 24;

    public int entitlement(LocalDate hireDate, String leaveTypeName, int year) {
        return entitlement(hireDate, null, LeaveCategory.fromName(leaveTypeName), year);
    }

    /**
     * @param probationEnd explicit probation end from the employee row, or null for hire date + 6 months
     */
    public int entitlement(LocalDate hireDate, LocalDate probationEnd, LeaveCategory category, int year) {
        if (hireDate == null || category == null) return 0;
        LocalDate reference = ServicePeriodUtils.endOfYear(year);
        long months = ServicePeriodUtils.serviceMonths(hireDate, reference);

        switch (category) {
            case ANNUAL:
                if (months < 6) return 0;
                if (months < 12) return (int) (months - 5) * 2;
                return ANNUAL_FULL_DAYS;
            case SICK: {
                LocalDate end = ServicePeriodUtils.probationEnd(hireDate, probationEnd);
                return ServicePeriodUtils.isProbationCompleted(end, reference) ? SICK_DAYS : 0;
            }
            case MATERNITY:
                return MATERNITY_DAYS;
            case PARENTAL:
                return PARENTAL_DAYS;
            case STUDY:
                return STUDY_DAYS;
            case HAJJ:
                return months >= HAJJ_MIN_SERVICE_MONTHS ? HAJJ_DAYS : 0;
            case COMPASSIONATE:
            case OTHER:
            default:
                return 0;
        }
    }

    public long serviceMonthsAtYearEnd(LocalDate hireDate, int year) {
        return ServicePeriodUtils.serviceMonths(hireDate, ServicePeriodUtils.endOfYear(year));
    }
}
