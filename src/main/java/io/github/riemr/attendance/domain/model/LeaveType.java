package io.github.riemr.attendance.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaveType {
    private String id;
    private String name;
    private Boolean active;
}
