package io.github.riemr.attendance.infrastructure.mapper;

import io.github.riemr.attendance.domain.model.Employee;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface EmployeeMapper {
    Employee selectByPrimaryKey(@Param("id") String id);
    List<Employee> selectAllActive();
    Employee selectForUpdate(@Param("id") String id);
}
