package io.github.riemr.attendance.application.repository;

import io.github.riemr.attendance.domain.model.Employee;

import java.util.List;

public interface EmployeeRepository {
    Employee find(String employeeId);

    List<Employee> findAllActive();

    /** Row lock held until the surrounding transaction ends. */
    Employee lockForUpdate(String employeeId);
}
