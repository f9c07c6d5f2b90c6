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
public class Employee {
    private String id;
    private String employeeCode;
    private String fullName;
    private LocalDate hireDate;
    // null means hire date + 6 months
    private LocalDate probationEndDate;
    private String status;
}
