package io.github.riemr.attendance.infrastructure.mapper;

import io.github.riemr.attendance.domain.model.LeaveBalance;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface LeaveBalanceMapper {
    int upsert(LeaveBalance row);
    List<LeaveBalance> selectByEmployeeAndYear(@Param("employeeId") String employeeId, @Param("year") int year);
}
