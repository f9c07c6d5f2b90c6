package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.exception.ScheduleConfigurationException;
import io.github.riemr.attendance.domain.model.AttendanceException;
import io.github.riemr.attendance.domain.model.AttendanceRecord;
import io.github.riemr.attendance.domain.model.DateRange;
import io.github.riemr.attendance.domain.model.DayStatus;
import io.github.riemr.attendance.domain.model.DayStatusKind;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.WorkSchedule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DayStatusClassifierTest {

    private static final ZoneId GST = ZoneId.of("Asia/Dubai");
    private static final ZoneOffset PLUS_4 = ZoneOffset.ofHours(4);
    // Monday
    private static final LocalDate MON = LocalDate.of(2024, 6, 3);
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);

    private final DayStatusClassifier classifier = new DayStatusClassifier();

    private static WorkSchedule weekdaySchedule() {
        return WorkSchedule.builder()
                .employeeId("e1")
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(17, 0))
                .minimumDailyHours(new BigDecimal("8.00"))
                .workingDays(Set.of("Monday", "Tuesday", "Wednesday", "Thursday", "Friday"))
                .active(true)
                .build();
    }

    private static AttendanceRecord record(LocalDate date, LocalTime in, LocalTime out, String hours) {
        return AttendanceRecord.builder()
                .employeeId("e1")
                .date(date)
                .clockInTime(in == null ? null : OffsetDateTime.of(date, in, PLUS_4))
                .clockOutTime(out == null ? null : OffsetDateTime.of(date, out, PLUS_4))
                .totalHours(hours == null ? null : new BigDecimal(hours))
                .wfh(false)
                .build();
    }

    private static AttendanceException exception(LocalDate date, String status) {
        return AttendanceException.builder()
                .employeeId("e1")
                .targetDate(date)
                .exceptionType("late_arrival")
                .status(status)
                .reason("traffic")
                .build();
    }

    private DayStatus classifyOne(LocalDate date, List<AttendanceRecord> attendance,
                                  List<LeaveRequest> leaves, List<AttendanceException> exceptions) {
        return classifier.classify(weekdaySchedule(), attendance, leaves, exceptions,
                new DateRange(date, date), TODAY, GST).get(date);
    }

    @Test
    void classify_returnsOneEntryPerDay_inChronologicalOrder() {
        DateRange june = new DateRange(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 30));

        Map<LocalDate, DayStatus> result = classifier.classify(weekdaySchedule(), List.of(), List.of(), List.of(),
                june, TODAY, GST);

        assertThat(result).hasSize(30);
        assertThat(result.keySet()).containsExactlyElementsOf(june.days());
    }

    @Test
    void classify_marksDatesAfterToday_asFuture_evenWithAttendance() {
        LocalDate tomorrow = TODAY.plusDays(1);
        var rec = record(tomorrow, LocalTime.of(9, 0), LocalTime.of(17, 0), "8");

        Map<LocalDate, DayStatus> result = classifier.classify(weekdaySchedule(), List.of(rec), List.of(), List.of(),
                new DateRange(TODAY, tomorrow), TODAY, GST);

        assertThat(result.get(tomorrow).status()).isEqualTo(DayStatusKind.FUTURE);
        assertThat(result.get(tomorrow).details()).isNull();
    }

    @Test
    void classify_marksWeekend_asNonWorking_evenWithAttendance() {
        LocalDate saturday = MON.minusDays(2);
        assertThat(saturday.getDayOfWeek()).isEqualTo(DayOfWeek.SATURDAY);

        DayStatus status = classifyOne(saturday,
                List.of(record(saturday, LocalTime.of(10, 0), LocalTime.of(12, 0), "2")), List.of(), List.of());

        assertThat(status.status()).isEqualTo(DayStatusKind.NON_WORKING);
    }

    @Test
    void classify_prefersApprovedLeave_overMissingAttendance() {
        LeaveRequest leave = LeaveRequest.builder()
                .startDate(MON).endDate(MON.plusDays(2))
                .leaveTypeName("Annual Leave").status("approved").build();

        DayStatus status = classifyOne(MON.plusDays(1), List.of(), List.of(leave), List.of());

        assertThat(status.status()).isEqualTo(DayStatusKind.LEAVE);
        assertThat(status.details().getLeaveType()).isEqualTo("Annual Leave");
    }

    @Test
    void classify_ignoresPendingLeave() {
        LeaveRequest leave = LeaveRequest.builder()
                .startDate(MON).endDate(MON)
                .leaveTypeName("Annual Leave").status("pending").build();

        DayStatus status = classifyOne(MON, List.of(), List.of(leave), List.of());

        assertThat(status.status()).isEqualTo(DayStatusKind.ABSENT);
        assertThat(status.issues()).containsExactly(DayStatusClassifier.ISSUE_NO_RECORD);
    }

    @Test
    void classify_marksMissingClockIn_asAbsent() {
        DayStatus status = classifyOne(MON, List.of(record(MON, null, LocalTime.of(17, 0), null)),
                List.of(), List.of());

        assertThat(status.status()).isEqualTo(DayStatusKind.ABSENT);
    }

    @Test
    void classify_marksAbsenceWithPendingException_asPendingException() {
        DayStatus status = classifyOne(MON, List.of(), List.of(), List.of(exception(MON, "pending")));

        assertThat(status.status()).isEqualTo(DayStatusKind.PENDING_EXCEPTION);
        assertThat(status.details().getExceptionsCount()).isEqualTo(1);
    }

    @Test
    void classify_keepsAbsence_whenOnlyApprovedExceptionExists() {
        DayStatus status = classifyOne(MON, List.of(), List.of(), List.of(exception(MON, "approved")));

        assertThat(status.status()).isEqualTo(DayStatusKind.ABSENT);
        assertThat(status.details().getExceptionsCount()).isZero();
    }

    @Test
    void classify_reportsLateAndIncomplete_withoutExceptions() {
        DayStatus status = classifyOne(MON,
                List.of(record(MON, LocalTime.of(9, 20), LocalTime.of(17, 0), "7.67")), List.of(), List.of());

        assertThat(status.status()).isEqualTo(DayStatusKind.ISSUES_NO_EXCEPTION);
        assertThat(status.issues()).containsExactly(
                DayStatusClassifier.ISSUE_LATE_ARRIVAL, DayStatusClassifier.ISSUE_INCOMPLETE_HOURS);
    }

    @Test
    void classify_readsClockTimes_inReferenceZone() {
        // 05:20Z is 09:20 in Dubai
        var rec = AttendanceRecord.builder()
                .date(MON)
                .clockInTime(OffsetDateTime.of(MON, LocalTime.of(5, 20), ZoneOffset.UTC))
                .clockOutTime(OffsetDateTime.of(MON, LocalTime.of(13, 30), ZoneOffset.UTC))
                .totalHours(new BigDecimal("8.17"))
                .build();

        DayStatus status = classifyOne(MON, List.of(rec), List.of(), List.of());

        assertThat(status.issues()).containsExactly(DayStatusClassifier.ISSUE_LATE_ARRIVAL);
    }

    @Test
    void classify_marksCompleteDay_asOk() {
        DayStatus status = classifyOne(MON,
                List.of(record(MON, LocalTime.of(8, 55), LocalTime.of(17, 5), "8.17")), List.of(), List.of());

        assertThat(status.status()).isEqualTo(DayStatusKind.OK);
        assertThat(status.issues()).isEmpty();
        assertThat(status.details().getClockInTime()).isNotNull();
    }

    @Test
    void classify_comparesAtSecondPrecision() {
        var rec = record(MON, LocalTime.of(9, 0, 0, 500_000_000), LocalTime.of(17, 0), "8");

        DayStatus status = classifyOne(MON, List.of(rec), List.of(), List.of());

        assertThat(status.status()).isEqualTo(DayStatusKind.OK);
    }

    @Test
    void classify_treatsMissingClockOut_asIssue() {
        DayStatus status = classifyOne(MON, List.of(record(MON, LocalTime.of(9, 0), null, null)),
                List.of(), List.of());

        assertThat(status.status()).isEqualTo(DayStatusKind.ISSUES_NO_EXCEPTION);
        assertThat(status.issues()).containsExactly(DayStatusClassifier.ISSUE_MISSING_CLOCK_OUT);
    }

    @Test
    void classify_resolvesIssues_whenApprovedExceptionsCoverThem() {
        var rec = record(MON, LocalTime.of(9, 20), LocalTime.of(17, 0), "7.67");

        DayStatus covered = classifyOne(MON, List.of(rec), List.of(),
                List.of(exception(MON, "approved"), exception(MON, "approved")));
        DayStatus partlyCovered = classifyOne(MON, List.of(rec), List.of(),
                List.of(exception(MON, "approved")));

        assertThat(covered.status()).isEqualTo(DayStatusKind.OK);
        assertThat(covered.details().getExceptionsCount()).isEqualTo(2);
        assertThat(partlyCovered.status()).isEqualTo(DayStatusKind.ISSUES_NO_EXCEPTION);
    }

    @Test
    void classify_marksIssuesWithPendingException_asPendingException() {
        var rec = record(MON, LocalTime.of(9, 20), LocalTime.of(17, 0), "7.67");

        DayStatus status = classifyOne(MON, List.of(rec), List.of(),
                List.of(exception(MON, "approved"), exception(MON, "pending")));

        assertThat(status.status()).isEqualTo(DayStatusKind.PENDING_EXCEPTION);
    }

    @Test
    void classify_ignoresRejectedExceptions() {
        var rec = record(MON, LocalTime.of(9, 20), LocalTime.of(17, 0), "8");

        DayStatus status = classifyOne(MON, List.of(rec), List.of(), List.of(exception(MON, "rejected")));

        assertThat(status.status()).isEqualTo(DayStatusKind.ISSUES_NO_EXCEPTION);
        assertThat(status.details().getExceptionsCount()).isZero();
    }

    @Test
    void classify_isIdempotent() {
        DateRange june = new DateRange(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 30));
        var attendance = List.of(
                record(MON, LocalTime.of(9, 20), LocalTime.of(17, 0), "7.67"),
                record(MON.plusDays(1), LocalTime.of(9, 0), LocalTime.of(17, 0), "8"));
        var exceptions = List.of(exception(MON, "pending"));

        var first = classifier.classify(weekdaySchedule(), attendance, List.of(), exceptions, june, TODAY, GST);
        var second = classifier.classify(weekdaySchedule(), attendance, List.of(), exceptions, june, TODAY, GST);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void detectIssues_neverDecreases_whenClockInBecomesLate() {
        var onTime = record(MON, LocalTime.of(9, 0), LocalTime.of(16, 0), "7");
        var late = record(MON, LocalTime.of(9, 45), LocalTime.of(16, 0), "7");

        int before = classifier.detectIssues(onTime, weekdaySchedule(), GST).size();
        int after = classifier.detectIssues(late, weekdaySchedule(), GST).size();

        assertThat(after).isGreaterThanOrEqualTo(before);
    }

    @Test
    void classify_rejectsScheduleWithoutWorkingDays() {
        WorkSchedule schedule = weekdaySchedule();
        schedule.setWorkingDays(Set.of());

        assertThatThrownBy(() -> classifier.classify(schedule, List.of(), List.of(), List.of(),
                new DateRange(MON, MON), TODAY, GST))
                .isInstanceOf(ScheduleConfigurationException.class);
    }

    @Test
    void classify_rejectsUnknownWorkingDayName() {
        WorkSchedule schedule = weekdaySchedule();
        schedule.setWorkingDays(Set.of("Funday"));

        assertThatThrownBy(() -> classifier.classify(schedule, List.of(), List.of(), List.of(),
                new DateRange(MON, MON), TODAY, GST))
                .isInstanceOf(ScheduleConfigurationException.class)
                .hasMessageContaining("Funday");
    }

    @Test
    void parseWeekday_isCaseInsensitive() {
        assertThat(DayStatusClassifier.parseWeekday(" friday ")).isEqualTo(DayOfWeek.FRIDAY);
        assertThat(DayStatusClassifier.parseWeekday("Fri")).isNull();
    }
}
