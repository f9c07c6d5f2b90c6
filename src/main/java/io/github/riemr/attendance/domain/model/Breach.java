package io.github.riemr.attendance.domain.model;

import java.time.LocalDate;
import java.util.List;

public record Breach(
        BreachType type,
        int count,
        List<LocalDate> dates,
        String message) {

    public Breach {
        dates = List.copyOf(dates);
    }
}
