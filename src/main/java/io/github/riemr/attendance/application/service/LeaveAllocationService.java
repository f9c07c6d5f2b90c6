package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.dto.AllocationFailure;
import io.github.riemr.attendance.application.dto.AllocationReport;
import io.github.riemr.attendance.application.repository.EmployeeRepository;
import io.github.riemr.attendance.application.repository.LeaveBalanceRepository;
import io.github.riemr.attendance.application.repository.LeaveTypeRepository;
import io.github.riemr.attendance.domain.model.Employee;
import io.github.riemr.attendance.domain.model.LeaveBalance;
import io.github.riemr.attendance.domain.model.LeaveCategory;
import io.github.riemr.attendance.domain.model.LeaveType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Yearly allocation of leave balances for every active employee.
 * Each employee is written in its own transaction; a failing employee is reported and skipped.
 * Re-running for the same year overwrites the allocation and leaves used days untouched.
 */
@Slf4j
@Service
public class LeaveAllocationService {
    private final EmployeeRepository employeeRepository;
    private final LeaveTypeRepository leaveTypeRepository;
    private final LeaveBalanceRepository leaveBalanceRepository;
    private final LeaveEntitlementCalculator calculator;
    private final TransactionTemplate perEmployeeTx;

    public LeaveAllocationService(EmployeeRepository employeeRepository,
                                  LeaveTypeRepository leaveTypeRepository,
                                  LeaveBalanceRepository leaveBalanceRepository,
                                  LeaveEntitlementCalculator calculator,
                                  PlatformTransactionManager transactionManager) {
        this.employeeRepository = employeeRepository;
        this.leaveTypeRepository = leaveTypeRepository;
        this.leaveBalanceRepository = leaveBalanceRepository;
        this.calculator = calculator;
        this.perEmployeeTx = new TransactionTemplate(transactionManager);
        this.perEmployeeTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public AllocationReport allocate(int year) {
        List<LeaveType> types = new ArrayList<>();
        for (LeaveType type : leaveTypeRepository.findAllActive()) {
            if (LeaveCategory.fromName(type.getName()).isAutoAllocated()) {
                types.add(type);
            }
        }
        List<Employee> employees = employeeRepository.findAllActive();
        log.info("Allocating {} leave balances for {} employee(s) across {} leave type(s)",
                year, employees.size(), types.size());

        Map<String, Integer> byType = new LinkedHashMap<>();
        types.forEach(t -> byType.put(t.getName(), 0));
        List<AllocationFailure> failures = new ArrayList<>();
        int processed = 0;
        int written = 0;

        for (Employee employee : employees) {
            try {
                List<LeaveBalance> balances = perEmployeeTx.execute(status -> allocateFor(employee, types, year));
                if (balances == null) continue;
                for (LeaveBalance b : balances) {
                    byType.merge(b.getLeaveTypeName(), b.getAllocatedDays(), Integer::sum);
                }
                written += balances.size();
                processed++;
            } catch (RuntimeException e) {
                log.warn("Leave allocation failed for employee {} ({}): {}",
                        employee.getEmployeeCode(), employee.getId(), e.getMessage());
                failures.add(new AllocationFailure(employee.getId(), employee.getEmployeeCode(), e.getMessage()));
            }
        }

        log.info("Leave allocation {} finished: employees={}, balances={}, failures={}",
                year, processed, written, failures.size());
        return new AllocationReport(year, processed, written, byType, List.copyOf(failures));
    }

    public List<LeaveBalance> findBalances(String employeeId, int year) {
        return leaveBalanceRepository.findByEmployeeAndYear(employeeId, year);
    }

    private List<LeaveBalance> allocateFor(Employee employee, List<LeaveType> types, int year) {
        if (employee.getHireDate() == null) {
            throw new IllegalStateException("Employee has no hire date");
        }
        int months = (int) Math.max(0, calculator.serviceMonthsAtYearEnd(employee.getHireDate(), year));
        List<LeaveBalance> written = new ArrayList<>();
        for (LeaveType type : types) {
            int days = calculator.entitlement(employee.getHireDate(), employee.getProbationEndDate(),
                    LeaveCategory.fromName(type.getName()), year);
            LeaveBalance balance = LeaveBalance.builder()
                    .employeeId(employee.getId())
                    .leaveTypeId(type.getId())
                    .leaveTypeName(type.getName())
                    .year(year)
                    .allocatedDays(days)
                    .usedDays(0)
                    .autoCalculated(true)
                    .serviceMonthsAtAllocation(months)
                    .build();
            leaveBalanceRepository.upsert(balance);
            written.add(balance);
        }
        return written;
    }
}
