package io.github.riemr.attendance.batch;

import io.github.riemr.attendance.application.dto.AllocationReport;
import io.github.riemr.attendance.application.service.LeaveAllocationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class LeaveAllocationJobConfig {
    public static final String JOB_NAME = "leaveAllocationJob";
    public static final String PARAM_YEAR = "year";

    private final JobRepository jobRepository;
    private final PlatformTransactionManager txManager;

    @Bean
    public Job leaveAllocationJob(Step leaveAllocationStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(leaveAllocationStep)
                .build();
    }

    @Bean
    public Step leaveAllocationStep(LeaveAllocationTasklet leaveAllocationTasklet) {
        // the service opens one transaction per employee
        return new StepBuilder("leaveAllocationStep", jobRepository)
                .tasklet(leaveAllocationTasklet, txManager)
                .build();
    }

    @Bean
    public LeaveAllocationTasklet leaveAllocationTasklet(LeaveAllocationService allocationService, Clock clock) {
        return new LeaveAllocationTasklet(allocationService, clock);
    }

    /**
     * Runs the allocation for the {@code year} job parameter, or the current year when absent,
     * and leaves the counters in the step execution context.
     */
    @RequiredArgsConstructor
    public static class LeaveAllocationTasklet implements Tasklet {
        private final LeaveAllocationService allocationService;
        private final Clock clock;

        @Override
        public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
            Map<String, Object> params = chunkContext.getStepContext().getJobParameters();
            int year = resolveYear(params.get(PARAM_YEAR));
            AllocationReport report = allocationService.allocate(year);

            ExecutionContext ctx = chunkContext.getStepContext().getStepExecution().getExecutionContext();
            ctx.putInt("year", report.year());
            ctx.putInt("employeesProcessed", report.employeesProcessed());
            ctx.putInt("balancesWritten", report.balancesWritten());
            ctx.putInt("failures", report.failures().size());
            contribution.incrementWriteCount(report.balancesWritten());
            if (report.hasFailures()) {
                log.warn("{} finished for {} with {} failure(s)", JOB_NAME, year, report.failures().size());
            }
            return RepeatStatus.FINISHED;
        }

        private int resolveYear(Object value) {
            if (value == null) return LocalDate.now(clock).getYear();
            if (value instanceof Number n) return n.intValue();
            return Integer.parseInt(value.toString().trim());
        }
    }
}
