package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.domain.model.Breach;
import io.github.riemr.attendance.domain.model.BreachType;
import io.github.riemr.attendance.domain.model.DayStatus;
import io.github.riemr.attendance.domain.model.DayStatusKind;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Scans classified days for absence-policy violations.
 * Only the literal {@code absent} status counts; a pending exception breaks a run.
 */
@Component
public class BreachDetector {
    public static final int CONSECUTIVE_THRESHOLD = 3;
    public static final int MONTHLY_THRESHOLD = 5;

    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);

    public List<Breach> detectBreaches(Map<LocalDate, DayStatus> days) {
        if (days == null || days.isEmpty()) return List.of();
        Map<LocalDate, DayStatus> ordered = new TreeMap<>(days);

        List<Breach> breaches = new ArrayList<>();
        List<LocalDate> run = new ArrayList<>();
        List<LocalDate> allAbsences = new ArrayList<>();
        for (var entry : ordered.entrySet()) {
            DayStatus day = entry.getValue();
            if (day != null && day.is(DayStatusKind.ABSENT)) {
                run.add(entry.getKey());
                allAbsences.add(entry.getKey());
            } else {
                closeRun(run, breaches);
            }
        }
        closeRun(run, breaches);

        if (allAbsences.size() > MONTHLY_THRESHOLD) {
            breaches.add(new Breach(BreachType.MONTHLY, allAbsences.size(), allAbsences,
                    String.format("Total of %d absences this month (exceeds %d-day threshold)",
                            allAbsences.size(), MONTHLY_THRESHOLD)));
        }
        return breaches;
    }

    private static void closeRun(List<LocalDate> run, List<Breach> breaches) {
        if (run.size() >= CONSECUTIVE_THRESHOLD) {
            LocalDate first = run.get(0);
            LocalDate last = run.get(run.size() - 1);
            breaches.add(new Breach(BreachType.CONSECUTIVE, run.size(), run,
                    String.format("%d consecutive absences detected (%s - %s)",
                            run.size(), LABEL.format(first), LABEL.format(last))));
        }
        run.clear();
    }
}
