package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.exception.ResourceNotFoundException;
import io.github.riemr.attendance.application.exception.ResourceNotFoundException.ResourceType;
import io.github.riemr.attendance.application.repository.EmployeeRepository;
import io.github.riemr.attendance.application.repository.LeaveRequestRepository;
import io.github.riemr.attendance.application.repository.LeaveTypeRepository;
import io.github.riemr.attendance.application.service.leave.EmployeeLeaveState;
import io.github.riemr.attendance.domain.model.Employee;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import io.github.riemr.attendance.domain.model.LeaveType;
import io.github.riemr.attendance.domain.model.PaymentType;
import io.github.riemr.attendance.domain.model.RequestStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * Write path for leave requests. Every insert and update goes through {@link LeaveRequestValidator};
 * the employee row is locked first so two concurrent requests cannot both pass the
 * cumulative sick-leave or once-per-employment Hajj checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaveRequestService {
    private final LeaveRequestRepository leaveRequestRepository;
    private final LeaveTypeRepository leaveTypeRepository;
    private final EmployeeRepository employeeRepository;
    private final LeaveRequestValidator validator;
    private final Clock clock;
    private final ZoneId zoneId;

    /**
     * Inserts a new request. New requests always start pending; approval is a separate transition.
     */
    @Transactional
    public LeaveRequest submit(LeaveRequest request) {
        request.setStatus(RequestStatus.PENDING.code());
        prepare(request, null);
        leaveRequestRepository.insert(request);
        log.info("Leave request {} created for employee {} ({}, {} day(s), {})",
                request.getRequestId(), request.getEmployeeId(), request.getLeaveTypeName(),
                request.getTotalDays(), request.getPaymentType());
        return request;
    }

    /**
     * Applies the non-null fields of {@code changes} to the stored request and re-validates it.
     */
    @Transactional
    public LeaveRequest update(String requestId, LeaveRequest changes) {
        LeaveRequest existing = leaveRequestRepository.find(requestId);
        if (existing == null) {
            throw new ResourceNotFoundException("Leave request not found: " + requestId, ResourceType.LEAVE_REQUEST);
        }
        merge(existing, changes);
        prepare(existing, requestId);
        leaveRequestRepository.update(existing);
        log.info("Leave request {} updated (status={}, paymentType={})",
                requestId, existing.getStatus(), existing.getPaymentType());
        return existing;
    }

    private void prepare(LeaveRequest request, String excludeRequestId) {
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        if (RequestStatus.fromCode(request.getStatus()) == null) {
            throw new IllegalArgumentException("Unknown status: " + request.getStatus());
        }
        // day count always follows the inclusive date span, whatever the client sent
        request.setTotalDays((int) ChronoUnit.DAYS.between(request.getStartDate(), request.getEndDate()) + 1);

        Employee employee = employeeRepository.lockForUpdate(request.getEmployeeId());
        if (employee == null) {
            throw new ResourceNotFoundException("Employee not found: " + request.getEmployeeId(), ResourceType.EMPLOYEE);
        }
        LeaveType leaveType = leaveTypeRepository.find(request.getLeaveTypeId());
        if (leaveType == null) {
            throw new ResourceNotFoundException("Leave type not found: " + request.getLeaveTypeId(), ResourceType.LEAVE_TYPE);
        }
        request.setLeaveTypeName(leaveType.getName());

        LeaveCategory category = LeaveCategory.fromName(leaveType.getName());
        int sickDays = category == LeaveCategory.SICK
                ? leaveRequestRepository.sumApprovedDays(employee.getId(), leaveType.getId(),
                        request.getStartDate().getYear(), excludeRequestId)
                : 0;
        boolean hajjTaken = category == LeaveCategory.HAJJ
                && leaveRequestRepository.existsApproved(employee.getId(), leaveType.getId(), excludeRequestId);
        EmployeeLeaveState state = new EmployeeLeaveState(employee.getHireDate(), employee.getProbationEndDate(),
                LocalDate.now(clock.withZone(zoneId)), sickDays, hajjTaken);

        PaymentType paymentType = validator.validate(request, state);
        request.setPaymentType(paymentType.code());
    }

    private static void merge(LeaveRequest target, LeaveRequest changes) {
        if (changes.getLeaveTypeId() != null) target.setLeaveTypeId(changes.getLeaveTypeId());
        if (changes.getStartDate() != null) target.setStartDate(changes.getStartDate());
        if (changes.getEndDate() != null) target.setEndDate(changes.getEndDate());
        if (changes.getReason() != null) target.setReason(changes.getReason());
        if (changes.getStatus() != null) target.setStatus(changes.getStatus());
        if (changes.getPaymentType() != null) target.setPaymentType(changes.getPaymentType());
        if (changes.getMedicalCertificateUrl() != null) target.setMedicalCertificateUrl(changes.getMedicalCertificateUrl());
        if (changes.getRelationship() != null) target.setRelationship(changes.getRelationship());
    }
}
