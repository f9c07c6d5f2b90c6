package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.exception.ScheduleConfigurationException;
import io.github.riemr.attendance.domain.model.AttendanceException;
import io.github.riemr.attendance.domain.model.AttendanceRecord;
import io.github.riemr.attendance.domain.model.DateRange;
import io.github.riemr.attendance.domain.model.DayStatus;
import io.github.riemr.attendance.domain.model.DayStatusDetails;
import io.github.riemr.attendance.domain.model.DayStatusKind;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.RequestStatus;
import io.github.riemr.attendance.domain.model.WorkSchedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges schedule, attendance, approved leave and exceptions into one {@link DayStatus} per day.
 * <p>
 * Rules are applied top to bottom and the first match wins:
 * future, non-working, leave, absent, then issue detection resolved against same-day exceptions.
 * The result depends only on the arguments; "today" and the zone used to read clock times
 * are always passed in.
 */
@Slf4j
@Component
public class DayStatusClassifier {
    public static final String ISSUE_NO_RECORD = "No attendance record";
    public static final String ISSUE_MISSING_CLOCK_IN = "Missing clock-in";
    public static final String ISSUE_LATE_ARRIVAL = "Late arrival";
    public static final String ISSUE_MISSING_CLOCK_OUT = "Missing clock-out";
    public static final String ISSUE_EARLY_DEPARTURE = "Early departure";
    public static final String ISSUE_INCOMPLETE_HOURS = "Incomplete hours";

    public Map<LocalDate, DayStatus> classify(WorkSchedule schedule,
                                              Collection<AttendanceRecord> attendance,
                                              Collection<LeaveRequest> leaves,
                                              Collection<AttendanceException> exceptions,
                                              DateRange range,
                                              LocalDate today,
                                              ZoneId zone) {
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(today, "today");
        Objects.requireNonNull(zone, "zone");
        Set<DayOfWeek> workingDays = resolveWorkingDays(schedule);

        Map<LocalDate, AttendanceRecord> attendanceByDate = new HashMap<>();
        if (attendance != null) {
            for (var record : attendance) {
                if (record == null || record.getDate() == null) continue;
                attendanceByDate.putIfAbsent(record.getDate(), record);
            }
        }
        List<LeaveRequest> approvedLeaves = new ArrayList<>();
        if (leaves != null) {
            for (var leave : leaves) {
                if (leave != null && leave.hasStatus(RequestStatus.APPROVED)) {
                    approvedLeaves.add(leave);
                }
            }
        }
        Map<LocalDate, List<AttendanceException>> exceptionsByDate = new HashMap<>();
        if (exceptions != null) {
            for (var ex : exceptions) {
                if (ex == null || ex.getTargetDate() == null) continue;
                exceptionsByDate.computeIfAbsent(ex.getTargetDate(), k -> new ArrayList<>()).add(ex);
            }
        }

        Map<LocalDate, DayStatus> result = new LinkedHashMap<>();
        for (LocalDate date : range.days()) {
            DayStatus status = classifyDay(date, today, zone, schedule, workingDays,
                    attendanceByDate.get(date), approvedLeaves,
                    exceptionsByDate.getOrDefault(date, List.of()));
            log.debug("{} -> {}", date, status.status());
            result.put(date, status);
        }
        return result;
    }

    private DayStatus classifyDay(LocalDate date,
                                  LocalDate today,
                                  ZoneId zone,
                                  WorkSchedule schedule,
                                  Set<DayOfWeek> workingDays,
                                  AttendanceRecord record,
                                  List<LeaveRequest> approvedLeaves,
                                  List<AttendanceException> dayExceptions) {
        if (date.isAfter(today)) {
            return DayStatus.of(date, DayStatusKind.FUTURE);
        }
        if (!workingDays.contains(date.getDayOfWeek())) {
            return DayStatus.of(date, DayStatusKind.NON_WORKING);
        }
        for (var leave : approvedLeaves) {
            if (leave.covers(date)) {
                return new DayStatus(date, DayStatusKind.LEAVE,
                        DayStatusDetails.builder().leaveType(leave.getLeaveTypeName()).build());
            }
        }

        long approved = countByStatus(dayExceptions, RequestStatus.APPROVED);
        long pending = countByStatus(dayExceptions, RequestStatus.PENDING);

        if (record == null || record.getClockInTime() == null) {
            // an approved exception explains an absence but never synthesizes presence
            boolean hasPending = pending > 0;
            return new DayStatus(date,
                    hasPending ? DayStatusKind.PENDING_EXCEPTION : DayStatusKind.ABSENT,
                    DayStatusDetails.builder()
                            .issues(List.of(ISSUE_NO_RECORD))
                            .exceptionsCount(hasPending ? 1 : 0)
                            .build());
        }

        List<String> issues = detectIssues(record, schedule, zone);
        DayStatusKind kind;
        if (issues.isEmpty() || approved >= issues.size()) {
            kind = DayStatusKind.OK;
        } else if (pending > 0) {
            kind = DayStatusKind.PENDING_EXCEPTION;
        } else {
            kind = DayStatusKind.ISSUES_NO_EXCEPTION;
        }
        return new DayStatus(date, kind, DayStatusDetails.builder()
                .clockInTime(record.getClockInTime())
                .clockOutTime(record.getClockOutTime())
                .totalHours(record.getTotalHours())
                .issues(issues.isEmpty() ? null : List.copyOf(issues))
                .exceptionsCount((int) (approved + pending))
                .wfh(record.getWfh())
                .build());
    }

    List<String> detectIssues(AttendanceRecord record, WorkSchedule schedule, ZoneId zone) {
        List<String> issues = new ArrayList<>();
        OffsetDateTime clockIn = record.getClockInTime();
        OffsetDateTime clockOut = record.getClockOutTime();

        if (clockIn == null) {
            issues.add(ISSUE_MISSING_CLOCK_IN);
        } else if (schedule.getStartTime() != null
                && timeOfDay(clockIn, zone).isAfter(schedule.getStartTime())) {
            issues.add(ISSUE_LATE_ARRIVAL);
        }

        if (clockOut == null) {
            issues.add(ISSUE_MISSING_CLOCK_OUT);
        } else if (clockIn != null && schedule.getEndTime() != null
                && timeOfDay(clockOut, zone).isBefore(schedule.getEndTime())) {
            issues.add(ISSUE_EARLY_DEPARTURE);
        }

        if (record.getTotalHours() != null && schedule.getMinimumDailyHours() != null
                && record.getTotalHours().compareTo(schedule.getMinimumDailyHours()) < 0) {
            issues.add(ISSUE_INCOMPLETE_HOURS);
        }
        return issues;
    }

    private static LocalTime timeOfDay(OffsetDateTime instant, ZoneId zone) {
        return instant.atZoneSameInstant(zone).toLocalTime().truncatedTo(ChronoUnit.SECONDS);
    }

    private static long countByStatus(List<AttendanceException> exceptions, RequestStatus status) {
        return exceptions.stream().filter(e -> e.hasStatus(status)).count();
    }

    private static Set<DayOfWeek> resolveWorkingDays(WorkSchedule schedule) {
        if (schedule == null) {
            throw new ScheduleConfigurationException(null, "No active work schedule");
        }
        if (schedule.getWorkingDays() == null || schedule.getWorkingDays().isEmpty()) {
            throw new ScheduleConfigurationException(schedule.getEmployeeId(),
                    "Work schedule has no working days configured");
        }
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String name : schedule.getWorkingDays()) {
            DayOfWeek day = parseWeekday(name);
            if (day == null) {
                throw new ScheduleConfigurationException(schedule.getEmployeeId(),
                        "Unknown working day: " + name);
            }
            days.add(day);
        }
        return days;
    }

    static DayOfWeek parseWeekday(String name) {
        if (name == null || name.isBlank()) return null;
        String trimmed = name.trim();
        for (DayOfWeek d : DayOfWeek.values()) {
            if (d.getDisplayName(TextStyle.FULL, Locale.ENGLISH).equalsIgnoreCase(trimmed)) {
                return d;
            }
        }
        return null;
    }
}
