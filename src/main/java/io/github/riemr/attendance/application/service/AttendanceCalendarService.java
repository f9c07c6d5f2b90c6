package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.dto.AttendanceCalendar;
import io.github.riemr.attendance.application.dto.AttendanceSummary;
import io.github.riemr.attendance.application.exception.ResourceNotFoundException;
import io.github.riemr.attendance.application.repository.AttendanceExceptionRepository;
import io.github.riemr.attendance.application.repository.AttendanceRecordRepository;
import io.github.riemr.attendance.application.repository.EmployeeRepository;
import io.github.riemr.attendance.application.repository.LeaveRequestRepository;
import io.github.riemr.attendance.domain.model.AttendanceException;
import io.github.riemr.attendance.domain.model.AttendanceRecord;
import io.github.riemr.attendance.domain.model.Breach;
import io.github.riemr.attendance.domain.model.DateRange;
import io.github.riemr.attendance.domain.model.DayStatus;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.RequestStatus;
import io.github.riemr.attendance.domain.model.WorkSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Read side of the attendance calendar: loads the employee's data for a range
 * and runs it through the classifier and the breach detector.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AttendanceCalendarService {
    private final EmployeeRepository employeeRepository;
    private final WorkScheduleResolver scheduleResolver;
    private final AttendanceRecordRepository attendanceRepository;
    private final LeaveRequestRepository leaveRequestRepository;
    private final AttendanceExceptionRepository exceptionRepository;
    private final DayStatusClassifier classifier;
    private final BreachDetector breachDetector;
    private final Clock clock;
    private final ZoneId zoneId;

    public AttendanceCalendar monthlyCalendar(String employeeId, YearMonth month) {
        return calendar(employeeId, DateRange.ofMonth(month));
    }

    public AttendanceCalendar calendar(String employeeId, DateRange range) {
        Map<LocalDate, DayStatus> days = classify(employeeId, range);
        List<Breach> breaches = breachDetector.detectBreaches(days);
        if (!breaches.isEmpty()) {
            log.info("Employee {} has {} attendance breach(es) between {} and {}",
                    employeeId, breaches.size(), range.from(), range.to());
        }
        return new AttendanceCalendar(employeeId, range.from(), range.to(),
                new ArrayList<>(days.values()), breaches, AttendanceSummary.of(days.values()));
    }

    public List<Breach> monthlyBreaches(String employeeId, YearMonth month) {
        return breachDetector.detectBreaches(classify(employeeId, DateRange.ofMonth(month)));
    }

    Map<LocalDate, DayStatus> classify(String employeeId, DateRange range) {
        if (employeeRepository.find(employeeId) == null) {
            throw new ResourceNotFoundException("Employee not found: " + employeeId,
                    ResourceNotFoundException.ResourceType.EMPLOYEE);
        }
        WorkSchedule schedule = scheduleResolver.resolve(employeeId);
        List<AttendanceRecord> attendance =
                attendanceRepository.findByEmployeeAndDateRange(employeeId, range.from(), range.to());
        List<LeaveRequest> leaves =
                leaveRequestRepository.findApprovedOverlapping(employeeId, range.from(), range.to());
        List<AttendanceException> exceptions = exceptionRepository.findByEmployeeAndDateRange(
                employeeId, range.from(), range.to(), EnumSet.of(RequestStatus.PENDING, RequestStatus.APPROVED));

        LocalDate today = LocalDate.now(clock.withZone(zoneId));
        log.debug("Classifying {} days for employee {} (attendance={}, leaves={}, exceptions={})",
                range.lengthInDays(), employeeId, attendance.size(), leaves.size(), exceptions.size());
        return classifier.classify(schedule, attendance, leaves, exceptions, range, today, zoneId);
    }
}
