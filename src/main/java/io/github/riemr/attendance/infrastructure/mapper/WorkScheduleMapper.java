package io.github.riemr.attendance.infrastructure.mapper;

import io.github.riemr.attendance.domain.model.WorkSchedule;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface WorkScheduleMapper {
    WorkSchedule selectActiveByEmployee(@Param("employeeId") String employeeId);
}
