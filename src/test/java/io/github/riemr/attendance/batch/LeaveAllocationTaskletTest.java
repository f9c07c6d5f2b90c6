package io.github.riemr.attendance.batch;

import io.github.riemr.attendance.application.dto.AllocationFailure;
import io.github.riemr.attendance.application.dto.AllocationReport;
import io.github.riemr.attendance.application.service.LeaveAllocationService;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.scope.context.StepContext;
import org.springframework.batch.repeat.RepeatStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LeaveAllocationTaskletTest {

    private final LeaveAllocationService allocationService = mock(LeaveAllocationService.class);
    private final Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final LeaveAllocationJobConfig.LeaveAllocationTasklet tasklet =
            new LeaveAllocationJobConfig.LeaveAllocationTasklet(allocationService, clock);

    private static StepExecution stepExecution(JobParameters parameters) {
        JobExecution jobExecution = new JobExecution(1L, parameters);
        return jobExecution.createStepExecution("leaveAllocationStep");
    }

    @Test
    void execute_allocatesRequestedYear_andStoresCounters() throws Exception {
        when(allocationService.allocate(2024)).thenReturn(new AllocationReport(2024, 3, 15,
                Map.of("Annual Leave", 60), List.of(new AllocationFailure("e9", "EMP009", "Employee has no hire date"))));
        StepExecution step = stepExecution(new JobParametersBuilder().addLong("year", 2024L).toJobParameters());

        RepeatStatus status = tasklet.execute(step.createStepContribution(), new ChunkContext(new StepContext(step)));

        assertThat(status).isEqualTo(RepeatStatus.FINISHED);
        assertThat(step.getExecutionContext().getInt("employeesProcessed")).isEqualTo(3);
        assertThat(step.getExecutionContext().getInt("balancesWritten")).isEqualTo(15);
        assertThat(step.getExecutionContext().getInt("failures")).isEqualTo(1);
    }

    @Test
    void execute_defaultsToCurrentYear() throws Exception {
        when(allocationService.allocate(2025)).thenReturn(new AllocationReport(2025, 0, 0, Map.of(), List.of()));
        StepExecution step = stepExecution(new JobParameters());

        tasklet.execute(step.createStepContribution(), new ChunkContext(new StepContext(step)));

        verify(allocationService).allocate(2025);
    }

    @Test
    void parametersFor_carriesYear() {
        JobParameters parameters = LeaveAllocationScheduler.parametersFor(2026);

        assertThat(parameters.getLong(LeaveAllocationJobConfig.PARAM_YEAR)).isEqualTo(2026L);
    }
}
