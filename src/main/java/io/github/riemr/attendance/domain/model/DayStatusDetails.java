package io.github.riemr.attendance.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DayStatusDetails {
    private OffsetDateTime clockInTime;
    private OffsetDateTime clockOutTime;
    private BigDecimal totalHours;
    private List<String> issues;
    private String leaveType;
    private Integer exceptionsCount;
    private Boolean wfh;
}
