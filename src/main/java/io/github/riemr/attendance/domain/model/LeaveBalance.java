package io.github.riemr.attendance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaveBalance {
    private String employeeId;
    private String leaveTypeId;
    private String leaveTypeName;
    private Integer year;
    private Integer allocatedDays;
    // used_days <= allocated_days is not enforced on write
    private Integer usedDays;
    private Boolean autoCalculated;
    private Integer serviceMonthsAtAllocation;
}
