package io.github.riemr.attendance.infrastructure.mapper;

import io.github.riemr.attendance.domain.model.AttendanceRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface AttendanceMapper {
    List<AttendanceRecord> selectByEmployeeAndDateRange(@Param("employeeId") String employeeId,
                                                        @Param("from") LocalDate from,
                                                        @Param("to") LocalDate to);
}
