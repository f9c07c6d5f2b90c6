package io.github.riemr.attendance.application.util;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Service-duration arithmetic shared by entitlement and request validation.
 */
public final class ServicePeriodUtils {
    public static final int PROBATION_MONTHS = 6;

    private ServicePeriodUtils() {}

    /**
     * Whole calendar months from {@code hireDate} to {@code asOf}, floored.
     * Negative when the hire date lies after {@code asOf}.
     */
    public static long serviceMonths(LocalDate hireDate, LocalDate asOf) {
        Objects.requireNonNull(hireDate, "hireDate");
        Objects.requireNonNull(asOf, "asOf");
        return ChronoUnit.MONTHS.between(hireDate, asOf);
    }

    public static LocalDate defaultProbationEnd(LocalDate hireDate) {
        return hireDate.plusMonths(PROBATION_MONTHS);
    }

    public static LocalDate probationEnd(LocalDate hireDate, LocalDate explicitProbationEnd) {
        if (explicitProbationEnd != null) return explicitProbationEnd;
        return hireDate == null ? null : defaultProbationEnd(hireDate);
    }

    /** A null probation end counts as completed, matching rows that never had one recorded. */
    public static boolean isProbationCompleted(LocalDate probationEnd, LocalDate asOf) {
        return probationEnd == null || !probationEnd.isAfter(asOf);
    }

    public static LocalDate endOfYear(int year) {
        return LocalDate.of(year, 12, 31);
    }
}
