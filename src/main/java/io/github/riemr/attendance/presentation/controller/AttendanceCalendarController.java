package io.github.riemr.attendance.presentation.controller;

import io.github.riemr.attendance.application.dto.AttendanceCalendar;
import io.github.riemr.attendance.application.service.AttendanceCalendarService;
import io.github.riemr.attendance.domain.model.Breach;
import io.github.riemr.attendance.domain.model.DateRange;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

@RestController
@RequestMapping("/attendance/api")
public class AttendanceCalendarController {
    private final AttendanceCalendarService calendarService;

    public AttendanceCalendarController(AttendanceCalendarService calendarService) {
        this.calendarService = calendarService;
    }

    @GetMapping("/calendar")
    public ResponseEntity<AttendanceCalendar> monthly(@RequestParam("employee") String employeeId,
                                                      @RequestParam("month") @DateTimeFormat(pattern = "yyyy-MM") YearMonth month) {
        return ResponseEntity.ok(calendarService.monthlyCalendar(employeeId, month));
    }

    @GetMapping("/calendar/range")
    public ResponseEntity<AttendanceCalendar> range(@RequestParam("employee") String employeeId,
                                                    @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                                    @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(calendarService.calendar(employeeId, new DateRange(from, to)));
    }

    @GetMapping("/breaches")
    public ResponseEntity<List<Breach>> breaches(@RequestParam("employee") String employeeId,
                                                 @RequestParam("month") @DateTimeFormat(pattern = "yyyy-MM") YearMonth month) {
        return ResponseEntity.ok(calendarService.monthlyBreaches(employeeId, month));
    }
}
