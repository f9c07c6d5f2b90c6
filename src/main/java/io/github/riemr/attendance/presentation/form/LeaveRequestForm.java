package io.github.riemr.attendance.presentation.form;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.github.riemr.attendance.domain.model.LeaveRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Body of leave request submission. Updates accept the same shape with every field optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaveRequestForm {
    @NotBlank
    private String employeeId;
    @NotBlank
    private String leaveTypeId;
    @NotNull
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;
    @NotNull
    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;
    @Positive
    private Integer totalDays;
    @NotBlank
    private String reason;
    private String status;
    private String paymentType;
    private String medicalCertificateUrl;
    private String relationship;

    public LeaveRequest toLeaveRequest() {
        return LeaveRequest.builder()
                .employeeId(employeeId)
                .leaveTypeId(leaveTypeId)
                .startDate(startDate)
                .endDate(endDate)
                .totalDays(totalDays)
                .reason(reason)
                .status(status)
                .paymentType(paymentType)
                .medicalCertificateUrl(medicalCertificateUrl)
                .relationship(relationship)
                .build();
    }
}
