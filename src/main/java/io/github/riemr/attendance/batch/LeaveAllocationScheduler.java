package io.github.riemr.attendance.batch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Launches {@code leaveAllocationJob} for the current year on {@code attendance.allocation.cron}.
 * The default cron "-" disables the trigger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeaveAllocationScheduler {
    private final JobLauncher jobLauncher;
    private final Job leaveAllocationJob;
    private final Clock clock;

    @Scheduled(cron = "${attendance.allocation.cron:-}", zone = "${attendance.zone-id:Asia/Dubai}")
    public void allocateCurrentYear() {
        int year = LocalDate.now(clock).getYear();
        try {
            JobExecution execution = jobLauncher.run(leaveAllocationJob, parametersFor(year));
            log.info("{} for {} ended with status {}", LeaveAllocationJobConfig.JOB_NAME, year, execution.getStatus());
        } catch (Exception e) {
            log.error("Failed to launch {} for {}", LeaveAllocationJobConfig.JOB_NAME, year, e);
        }
    }

    static JobParameters parametersFor(int year) {
        return new JobParametersBuilder()
                .addLong("ts", System.currentTimeMillis())
                .addLong(LeaveAllocationJobConfig.PARAM_YEAR, (long) year)
                .toJobParameters();
    }
}
