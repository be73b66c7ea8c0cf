package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.model.EscalationPlan;
import com.quashbugs.prpulse.model.EscalationTracking;
import com.quashbugs.prpulse.model.PullRequest;
import com.quashbugs.prpulse.model.Schedule;
import com.quashbugs.prpulse.repository.EscalationTrackingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Tracks which pull requests have been escalated for a schedule so each one escalates once when it
 * crosses the threshold and at most once a week after that.
 */
@Service
public class EscalationService {

    static final long DAY_MILLIS = 86_400_000L;
    static final Duration RE_ESCALATION_INTERVAL = Duration.ofDays(7);

    private static final Logger LOGGER = LoggerFactory.getLogger(EscalationService.class);

    private final EscalationTrackingRepository escalationTrackingRepository;

    @Autowired
    public EscalationService(EscalationTrackingRepository escalationTrackingRepository) {
        this.escalationTrackingRepository = escalationTrackingRepository;
    }

    public EscalationPlan plan(Schedule schedule, List<PullRequest> pullRequests, Instant now) {
        long thresholdMillis = schedule.getEscalationDays() * DAY_MILLIS;
        List<PullRequest> escalating = new ArrayList<>();
        List<EscalationTracking> pending = new ArrayList<>();

        for (PullRequest pullRequest : pullRequests) {
            if (pullRequest.ageInMillis(now) < thresholdMillis) {
                continue;
            }
            Optional<EscalationTracking> existing = escalationTrackingRepository
                    .findByScheduleIdAndPullRequestId(schedule.getId(), pullRequest.getId());

            if (existing.isEmpty()) {
                escalating.add(pullRequest);
                pending.add(EscalationTracking.builder()
                        .scheduleId(schedule.getId())
                        .pullRequestId(pullRequest.getId())
                        .pullRequestUrl(pullRequest.getUrl())
                        .firstEscalatedAt(now)
                        .lastEscalatedAt(now)
                        .escalationCount(1)
                        .build());
                continue;
            }

            EscalationTracking tracking = existing.get();
            Instant last = tracking.getLastEscalatedAt();
            if (last == null || !now.isBefore(last.plus(RE_ESCALATION_INTERVAL))) {
                escalating.add(pullRequest);
                tracking.setLastEscalatedAt(now);
                tracking.setEscalationCount(tracking.getEscalationCount() + 1);
                tracking.setPullRequestUrl(pullRequest.getUrl());
                pending.add(tracking);
            }
        }
        return new EscalationPlan(escalating, pending);
    }

    public void commit(EscalationPlan plan) {
        if (!plan.getPendingTracking().isEmpty()) {
            escalationTrackingRepository.saveAll(plan.getPendingTracking());
        }
    }

    /**
     * Drops tracking rows of pull requests that are no longer open.
     *
     * @return number of rows deleted
     */
    public long cleanup(String scheduleId, Collection<String> activePullRequestIds) {
        long deleted = escalationTrackingRepository.deleteByScheduleIdAndPullRequestIdNotIn(scheduleId, activePullRequestIds);
        if (deleted > 0) {
            LOGGER.info("Removed {} escalation tracking rows for schedule {}", deleted, scheduleId);
        }
        return deleted;
    }
}
