package io.github.riemr.attendance.application.dto;

import java.util.List;
import java.util.Map;

public record AllocationReport(
        int year,
        int employeesProcessed,
        int balancesWritten,
        Map<String, Integer> allocationsByType,
        List<AllocationFailure> failures) {

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
