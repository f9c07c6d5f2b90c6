package io.github.riemr.attendance.application.service;

import io.github.riemr.attendance.application.dto.AllocationReport;
import io.github.riemr.attendance.application.repository.EmployeeRepository;
import io.github.riemr.attendance.application.repository.LeaveBalanceRepository;
import io.github.riemr.attendance.application.repository.LeaveTypeRepository;
import io.github.riemr.attendance.domain.model.Employee;
import io.github.riemr.attendance.domain.model.LeaveBalance;
import io.github.riemr.attendance.domain.model.LeaveType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LeaveAllocationServiceTest {

    @Mock EmployeeRepository employeeRepository;
    @Mock LeaveTypeRepository leaveTypeRepository;
    @Mock LeaveBalanceRepository leaveBalanceRepository;
    @Mock PlatformTransactionManager transactionManager;

    private LeaveAllocationService service;

    @BeforeEach
    void setUp() {
        service = new LeaveAllocationService(employeeRepository, leaveTypeRepository, leaveBalanceRepository,
                new LeaveEntitlementCalculator(), transactionManager);
        when(leaveTypeRepository.findAllActive()).thenReturn(List.of(
                new LeaveType("lt-annual", "Annual Leave", true),
                new LeaveType("lt-sick", "Sick Leave", true),
                new LeaveType("lt-comp", "Compassionate Leave", true)));
    }

    private static Employee employee(String id, LocalDate hireDate) {
        return Employee.builder().id(id).employeeCode("EMP-" + id).hireDate(hireDate).status("active").build();
    }

    @Test
    void allocate_upsertsAutoAllocatedTypes_forEveryActiveEmployee() {
        when(employeeRepository.findAllActive()).thenReturn(List.of(employee("e1", LocalDate.of(2020, 1, 1))));

        AllocationReport report = service.allocate(2024);

        assertThat(report.employeesProcessed()).isEqualTo(1);
        assertThat(report.balancesWritten()).isEqualTo(2);
        assertThat(report.allocationsByType()).containsEntry("Annual Leave", 30).containsEntry("Sick Leave", 90)
                .doesNotContainKey("Compassionate Leave");
        assertThat(report.hasFailures()).isFalse();

        ArgumentCaptor<LeaveBalance> captor = ArgumentCaptor.forClass(LeaveBalance.class);
        verify(leaveBalanceRepository, times(2)).upsert(captor.capture());
        LeaveBalance annual = captor.getAllValues().get(0);
        assertThat(annual.getLeaveTypeId()).isEqualTo("lt-annual");
        assertThat(annual.getYear()).isEqualTo(2024);
        assertThat(annual.getUsedDays()).isZero();
        assertThat(annual.getAutoCalculated()).isTrue();
        assertThat(annual.getServiceMonthsAtAllocation()).isEqualTo(59);
    }

    @Test
    void allocate_recordsFailure_andContinuesWithOtherEmployees() {
        when(employeeRepository.findAllActive()).thenReturn(List.of(
                employee("e1", null),
                employee("e2", LocalDate.of(2024, 7, 2))));

        AllocationReport report = service.allocate(2024);

        assertThat(report.employeesProcessed()).isEqualTo(1);
        assertThat(report.failures()).singleElement().satisfies(f -> {
            assertThat(f.employeeId()).isEqualTo("e1");
            assertThat(f.employeeCode()).isEqualTo("EMP-e1");
            assertThat(f.message()).isEqualTo("Employee has no hire date");
        });
        assertThat(report.allocationsByType()).containsEntry("Annual Leave", 0).containsEntry("Sick Leave", 0);
        verify(transactionManager).rollback(any());
    }

    @Test
    void allocate_isRepeatable_forTheSameYear() {
        when(employeeRepository.findAllActive()).thenReturn(List.of(employee("e1", LocalDate.of(2024, 3, 1))));

        AllocationReport first = service.allocate(2024);
        AllocationReport second = service.allocate(2024);

        assertThat(second).isEqualTo(first);
        assertThat(first.allocationsByType()).containsEntry("Annual Leave", 8).containsEntry("Sick Leave", 90);
    }
}
