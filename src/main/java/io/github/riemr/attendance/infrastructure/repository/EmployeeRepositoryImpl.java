package io.github.riemr.attendance.infrastructure.repository;

import io.github.riemr.attendance.application.repository.EmployeeRepository;
import io.github.riemr.attendance.domain.model.Employee;
import io.github.riemr.attendance.infrastructure.mapper.EmployeeMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class EmployeeRepositoryImpl implements EmployeeRepository {
    private final EmployeeMapper mapper;

    public EmployeeRepositoryImpl(EmployeeMapper mapper) { this.mapper = mapper; }

    @Override public Employee find(String employeeId) { return mapper.selectByPrimaryKey(employeeId); }
    @Override public List<Employee> findAllActive() { return mapper.selectAllActive(); }
    @Override public Employee lockForUpdate(String employeeId) { return mapper.selectForUpdate(employeeId); }
}
