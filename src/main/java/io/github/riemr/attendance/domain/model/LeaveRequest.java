package io.github.riemr.attendance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveRequest {
    private String requestId;
    private String employeeId;
    private String leaveTypeId;
    private String leaveTypeName;
    private LocalDate startDate;
    private LocalDate endDate;
    private Integer totalDays;
    private String reason;
    private String status;
    private String paymentType;
    private String medicalCertificateUrl;
    private String relationship;

    public boolean hasStatus(RequestStatus expected) {
        return RequestStatus.fromCode(status) == expected;
    }

    public boolean covers(LocalDate date) {
        if (startDate == null || endDate == null || date == null) return false;
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
