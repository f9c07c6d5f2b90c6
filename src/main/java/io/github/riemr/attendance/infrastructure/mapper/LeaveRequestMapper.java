package io.github.riemr.attendance.infrastructure.mapper;

import io.github.riemr.attendance.domain.model.LeaveRequest;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface LeaveRequestMapper {
    LeaveRequest selectByPrimaryKey(@Param("requestId") String requestId);
    int insert(LeaveRequest row);
    int updateByPrimaryKey(LeaveRequest row);

    List<LeaveRequest> selectApprovedOverlapping(@Param("employeeId") String employeeId,
                                                 @Param("from") LocalDate from,
                                                 @Param("to") LocalDate to);

    Integer sumApprovedDays(@Param("employeeId") String employeeId,
                            @Param("leaveTypeId") String leaveTypeId,
                            @Param("year") int year,
                            @Param("excludeRequestId") String excludeRequestId);

    int countApproved(@Param("employeeId") String employeeId,
                      @Param("leaveTypeId") String leaveTypeId,
                      @Param("excludeRequestId") String excludeRequestId);
}
