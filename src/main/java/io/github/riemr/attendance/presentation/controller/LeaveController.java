package io.github.riemr.attendance.presentation.controller;

import io.github.riemr.attendance.application.dto.AllocationReport;
import io.github.riemr.attendance.application.service.LeaveAllocationService;
import io.github.riemr.attendance.application.service.LeaveEntitlementCalculator;
import io.github.riemr.attendance.application.service.LeaveRequestService;
import io.github.riemr.attendance.domain.model.LeaveBalance;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.presentation.form.LeaveRequestForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/leave/api")
@RequiredArgsConstructor
public class LeaveController {
    private final LeaveEntitlementCalculator entitlementCalculator;
    private final LeaveRequestService leaveRequestService;
    private final LeaveAllocationService allocationService;

    @GetMapping("/entitlement")
    public ResponseEntity<?> entitlement(@RequestParam("hireDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate hireDate,
                                         @RequestParam("leaveType") String leaveType,
                                         @RequestParam("year") int year,
                                         @RequestParam(value = "probationEnd", required = false)
                                         @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate probationEnd) {
        LeaveCategory category = LeaveCategory.fromName(leaveType);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("leaveType", leaveType);
        body.put("year", year);
        body.put("serviceMonths", entitlementCalculator.serviceMonthsAtYearEnd(hireDate, year));
        body.put("entitledDays", entitlementCalculator.entitlement(hireDate, probationEnd, category, year));
        return ResponseEntity.ok(body);
    }

    @PostMapping(path = "/requests", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submit(@Valid @RequestBody LeaveRequestForm form, BindingResult bindingResult) {
        if (bindingResult.hasErrors()) {
            return ResponseEntity.badRequest().body(Map.of("error", describe(bindingResult)));
        }
        LeaveRequest saved = leaveRequestService.submit(form.toLeaveRequest());
        return ResponseEntity.status(HttpStatus.CREATED).body(saved);
    }

    @PutMapping(path = "/requests/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LeaveRequest> update(@PathVariable("id") String requestId,
                                               @RequestBody LeaveRequestForm form) {
        LeaveRequest changes = form.toLeaveRequest();
        // the employee of an existing request cannot be reassigned
        changes.setEmployeeId(null);
        return ResponseEntity.ok(leaveRequestService.update(requestId, changes));
    }

    @GetMapping("/balances")
    public ResponseEntity<List<LeaveBalance>> balances(@RequestParam("employee") String employeeId,
                                                       @RequestParam("year") int year) {
        return ResponseEntity.ok(allocationService.findBalances(employeeId, year));
    }

    @PostMapping("/allocations")
    public ResponseEntity<AllocationReport> allocate(@RequestParam("year") int year) {
        log.info("Leave allocation for {} requested over REST", year);
        return ResponseEntity.ok(allocationService.allocate(year));
    }

    private static String describe(BindingResult bindingResult) {
        return bindingResult.getFieldErrors().stream()
                .map(FieldError::getField)
                .distinct()
                .map(field -> field + " is invalid")
                .collect(Collectors.joining(", "));
    }
}
