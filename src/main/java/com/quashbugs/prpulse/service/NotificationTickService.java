package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.dto.TickSummaryDTO;
import com.quashbugs.prpulse.model.ExecutionLog;
import com.quashbugs.prpulse.model.ExecutionStatus;
import com.quashbugs.prpulse.model.Schedule;
import com.quashbugs.prpulse.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One notification tick: picks the due schedules and runs them on the bounded schedule pool. A failing
 * or hanging schedule only counts against the summary, it never stops its siblings.
 */
@Service
public class NotificationTickService {

    private static final Logger LOGGER = LoggerFactory.getLogger(NotificationTickService.class);

    private final ScheduleRepository scheduleRepository;
    private final DueScheduleService dueScheduleService;
    private final ScheduleExecutionService scheduleExecutionService;
    private final ExecutorService scheduleExecutor;
    private final Clock clock;
    private final long jobTimeoutSeconds;

    @Autowired
    public NotificationTickService(ScheduleRepository scheduleRepository,
                                   DueScheduleService dueScheduleService,
                                   ScheduleExecutionService scheduleExecutionService,
                                   @Qualifier("scheduleExecutor") ExecutorService scheduleExecutor,
                                   Clock clock,
                                   @Value("${spring.scheduler.job-timeout-seconds:120}") long jobTimeoutSeconds) {
        this.scheduleRepository = scheduleRepository;
        this.dueScheduleService = dueScheduleService;
        this.scheduleExecutionService = scheduleExecutionService;
        this.scheduleExecutor = scheduleExecutor;
        this.clock = clock;
        this.jobTimeoutSeconds = jobTimeoutSeconds;
    }

    public TickSummaryDTO runTick() {
        long startMillis = clock.millis();
        LOGGER.info("Notification tick started");

        List<Schedule> due;
        try {
            due = dueScheduleService.selectDue(scheduleRepository.findByActiveTrue(), clock.instant());
        } catch (Exception e) {
            LOGGER.error("Failed to load active schedules", e);
            return TickSummaryDTO.builder()
                    .success(false)
                    .executionTimeMs(clock.millis() - startMillis)
                    .error(e.getMessage())
                    .build();
        }
        LOGGER.info("{} schedules due", due.size());

        List<CompletableFuture<Boolean>> runs = due.stream()
                .map(this::submit)
                .toList();

        int processed = 0;
        int failed = 0;
        for (CompletableFuture<Boolean> run : runs) {
            if (run.join()) {
                processed++;
            } else {
                failed++;
            }
        }

        long elapsed = clock.millis() - startMillis;
        LOGGER.info("Notification tick finished: {} processed, {} failed in {} ms", processed, failed, elapsed);
        return TickSummaryDTO.builder()
                .success(true)
                .schedulesProcessed(processed)
                .schedulesFailed(failed)
                .executionTimeMs(elapsed)
                .build();
    }

    /**
     * Queues one schedule on the pool. The job timeout is armed when a worker picks the schedule up, so
     * time spent waiting behind other schedules never counts against it.
     */
    private CompletableFuture<Boolean> submit(Schedule schedule) {
        CompletableFuture<Void> started = new CompletableFuture<>();
        CompletableFuture<ExecutionLog> run = new CompletableFuture<>();
        try {
            scheduleExecutor.execute(() -> {
                started.complete(null);
                try {
                    run.complete(scheduleExecutionService.execute(schedule));
                } catch (Throwable e) {
                    run.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(succeeded(schedule, null, e));
        }
        return started
                .thenCompose(ignored -> run.orTimeout(jobTimeoutSeconds, TimeUnit.SECONDS))
                .handle((executionLog, error) -> succeeded(schedule, executionLog, error));
    }

    private boolean succeeded(Schedule schedule, ExecutionLog executionLog, Throwable error) {
        if (error == null) {
            return executionLog.getStatus() != ExecutionStatus.ERROR;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof TimeoutException) {
            LOGGER.error("Schedule {} did not finish within {} seconds", schedule.getId(), jobTimeoutSeconds);
        } else {
            LOGGER.error("Schedule {} failed outside its execution log", schedule.getId(), cause);
        }
        return false;
    }
}
