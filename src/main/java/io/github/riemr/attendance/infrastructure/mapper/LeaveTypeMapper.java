package io.github.riemr.attendance.infrastructure.mapper;

import io.github.riemr.attendance.domain.model.LeaveType;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface LeaveTypeMapper {
    LeaveType selectByPrimaryKey(@Param("id") String id);
    List<LeaveType> selectAllActive();
}
