package io.github.riemr.attendance.infrastructure.mapper;

import io.github.riemr.attendance.domain.model.AttendanceException;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface AttendanceExceptionMapper {
    List<AttendanceException> selectByEmployeeAndDateRange(@Param("employeeId") String employeeId,
                                                           @Param("from") LocalDate from,
                                                           @Param("to") LocalDate to,
                                                           @Param("statuses") List<String> statuses);
}
