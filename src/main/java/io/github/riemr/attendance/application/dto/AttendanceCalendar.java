package io.github.riemr.attendance.application.dto;

import io.github.riemr.attendance.domain.model.Breach;
import io.github.riemr.attendance.domain.model.DayStatus;

import java.time.LocalDate;
import java.util.List;

public record AttendanceCalendar(
        String employeeId,
        LocalDate from,
        LocalDate to,
        List<DayStatus> days,
        List<Breach> breaches,
        AttendanceSummary summary) {}
