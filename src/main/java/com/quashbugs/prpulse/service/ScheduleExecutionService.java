package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.adapter.GitProviderAdapter;
import com.quashbugs.prpulse.adapter.MessagingProviderAdapter;
import com.quashbugs.prpulse.dto.RenderedMessageDTO;
import com.quashbugs.prpulse.exception.ProviderNotFoundException;
import com.quashbugs.prpulse.model.*;
import com.quashbugs.prpulse.repository.ExecutionLogRepository;
import com.quashbugs.prpulse.repository.GitProviderRepository;
import com.quashbugs.prpulse.repository.MessagingProviderRepository;
import com.quashbugs.prpulse.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Runs one due schedule end to end: fetch, filter, notify, escalate. Every run leaves exactly one
 * {@link ExecutionLog}, and the schedule is only marked executed when something useful went out.
 */
@Service
public class ScheduleExecutionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleExecutionService.class);

    private final ScheduleRepository scheduleRepository;
    private final ExecutionLogRepository executionLogRepository;
    private final GitProviderRepository gitProviderRepository;
    private final MessagingProviderRepository messagingProviderRepository;
    private final ProviderRegistryService providerRegistryService;
    private final PullRequestFilterService pullRequestFilterService;
    private final EscalationService escalationService;
    private final NotificationFormatService notificationFormatService;
    private final Clock clock;

    @Autowired
    public ScheduleExecutionService(ScheduleRepository scheduleRepository,
                                    ExecutionLogRepository executionLogRepository,
                                    GitProviderRepository gitProviderRepository,
                                    MessagingProviderRepository messagingProviderRepository,
                                    ProviderRegistryService providerRegistryService,
                                    PullRequestFilterService pullRequestFilterService,
                                    EscalationService escalationService,
                                    NotificationFormatService notificationFormatService,
                                    Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.executionLogRepository = executionLogRepository;
        this.gitProviderRepository = gitProviderRepository;
        this.messagingProviderRepository = messagingProviderRepository;
        this.providerRegistryService = providerRegistryService;
        this.pullRequestFilterService = pullRequestFilterService;
        this.escalationService = escalationService;
        this.notificationFormatService = notificationFormatService;
        this.clock = clock;
    }

    public ExecutionLog execute(Schedule schedule) {
        Instant now = clock.instant();
        long startMillis = clock.millis();
        ExecutionLog executionLog = ExecutionLog.builder()
                .scheduleId(schedule.getId())
                .executedAt(now)
                .status(ExecutionStatus.ERROR)
                .build();

        try {
            GitProvider gitProvider = gitProviderRepository.findById(schedule.getGitProviderId())
                    .orElseThrow(() -> new ProviderNotFoundException("Git provider not found: " + schedule.getGitProviderId()));
            MessagingProvider messagingProvider = findMessagingProvider(schedule.getMessagingProviderId());
            GitProviderAdapter gitAdapter = providerRegistryService.getGitProvider(gitProvider.getProvider());
            MessagingProviderAdapter messagingAdapter = providerRegistryService.getMessagingProvider(messagingProvider.getProvider());

            LOGGER.info("Executing schedule {} ({}), filters: {}", schedule.getId(), schedule.getName(),
                    pullRequestFilterService.describe(schedule.getPrFilters()));

            List<PullRequest> fetched = gitAdapter.fetchPullRequests(gitProvider, schedule.getRepositories(), schedule.getPrFilters());
            // found counts what the provider reported, before the schedule's filter
            executionLog.setPullRequestsFound(fetched.size());
            List<PullRequest> filtered = pullRequestFilterService.apply(fetched, schedule.getPrFilters(), now);

            if (!filtered.isEmpty() || schedule.isSendWhenEmpty()) {
                RenderedMessageDTO message = notificationFormatService.formatNotification(
                        schedule.getName(), filtered, messagingAdapter.getMessageStyle());
                String channelId = schedule.getChannelId() != null ? schedule.getChannelId() : messagingProvider.getChannelId();
                messagingAdapter.sendMessage(messagingProvider, channelId, message);
                executionLog.setMessagesSent(1);
            }
            executionLog.setStatus(ExecutionStatus.SUCCESS);

            if (schedule.hasEscalation()) {
                try {
                    escalate(schedule, fetched, filtered, now, executionLog);
                } catch (RuntimeException e) {
                    if (executionLog.getMessagesSent() == 0) {
                        throw e;
                    }
                    LOGGER.warn("Escalation failed for schedule {}: {}", schedule.getId(), e.getMessage());
                    executionLog.setStatus(ExecutionStatus.PARTIAL);
                    executionLog.setErrorMessage("Escalation failed: " + e.getMessage());
                }
            }

            scheduleRepository.markExecuted(schedule.getId(), clock.instant());
            LOGGER.info("Schedule {} finished with status {}: {} pull requests, {} messages, {} escalations",
                    schedule.getId(), executionLog.getStatus(), executionLog.getPullRequestsFound(),
                    executionLog.getMessagesSent(), executionLog.getEscalationsTriggered());
        } catch (Exception e) {
            LOGGER.error("Schedule {} failed: {}", schedule.getId(), e.getMessage(), e);
            executionLog.setStatus(ExecutionStatus.ERROR);
            executionLog.setErrorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            executionLog.setExecutionTimeMs(clock.millis() - startMillis);
            executionLogRepository.save(executionLog);
        }
        return executionLog;
    }

    private void escalate(Schedule schedule, List<PullRequest> fetched, List<PullRequest> filtered,
                          Instant now, ExecutionLog executionLog) {
        MessagingProvider escalationProvider = findMessagingProvider(schedule.getEscalationProviderId());
        MessagingProviderAdapter escalationAdapter = providerRegistryService.getMessagingProvider(escalationProvider.getProvider());

        EscalationPlan plan = escalationService.plan(schedule, filtered, now);
        if (!plan.isEmpty()) {
            RenderedMessageDTO message = notificationFormatService.formatEscalation(
                    schedule.getName(), plan.getEscalating(), schedule.getEscalationDays(), escalationAdapter.getMessageStyle());
            escalationAdapter.sendMessage(escalationProvider, schedule.getEscalationChannelId(), message);
            escalationService.commit(plan);
            executionLog.setEscalationsTriggered(plan.getEscalating().size());
            executionLog.setMessagesSent(executionLog.getMessagesSent() + 1);
            LOGGER.info("Escalated {} pull requests for schedule {}", plan.getEscalating().size(), schedule.getId());
        }

        // raw fetch result: a PR hidden by the filter is still open and keeps its tracking row
        escalationService.cleanup(schedule.getId(), fetched.stream().map(PullRequest::getId).toList());
    }

    private MessagingProvider findMessagingProvider(String id) {
        return messagingProviderRepository.findById(id)
                .orElseThrow(() -> new ProviderNotFoundException("Messaging provider not found: " + id));
    }
}
