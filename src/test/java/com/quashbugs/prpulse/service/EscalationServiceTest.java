package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.model.EscalationPlan;
import com.quashbugs.prpulse.model.EscalationTracking;
import com.quashbugs.prpulse.model.PullRequest;
import com.quashbugs.prpulse.model.Schedule;
import com.quashbugs.prpulse.repository.EscalationTrackingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EscalationServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T16:00:00Z");

    @Mock
    private EscalationTrackingRepository escalationTrackingRepository;

    @Captor
    private ArgumentCaptor<List<EscalationTracking>> trackingCaptor;

    private EscalationService escalationService;
    private Schedule schedule;

    @BeforeEach
    void setUp() {
        escalationService = new EscalationService(escalationTrackingRepository);
        schedule = Schedule.builder().id("schedule-1").escalationDays(3).build();
    }

    @Test
    void pullRequestBelowThresholdIsNeverEscalated() {
        PullRequest young = pr("young", Duration.ofDays(3).minusMinutes(1));

        EscalationPlan plan = escalationService.plan(schedule, List.of(young), NOW);

        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.getPendingTracking()).isEmpty();
        verifyNoInteractions(escalationTrackingRepository);
    }

    @Test
    void firstCrossingEscalatesImmediatelyWithCountOne() {
        PullRequest old = pr("pr-4d", Duration.ofDays(4));
        when(escalationTrackingRepository.findByScheduleIdAndPullRequestId("schedule-1", "pr-4d")).thenReturn(Optional.empty());

        EscalationPlan plan = escalationService.plan(schedule, List.of(old), NOW);

        assertThat(plan.getEscalating()).containsExactly(old);
        EscalationTracking tracking = plan.getPendingTracking().get(0);
        assertThat(tracking.getScheduleId()).isEqualTo("schedule-1");
        assertThat(tracking.getPullRequestId()).isEqualTo("pr-4d");
        assertThat(tracking.getEscalationCount()).isEqualTo(1);
        assertThat(tracking.getFirstEscalatedAt()).isEqualTo(NOW);
        assertThat(tracking.getLastEscalatedAt()).isEqualTo(NOW);
        // nothing is persisted until the message went out
        verify(escalationTrackingRepository, never()).saveAll(any());
    }

    @Test
    void recentlyEscalatedPullRequestIsNotEscalatedAgain() {
        PullRequest old = pr("pr-4d", Duration.ofDays(4));
        when(escalationTrackingRepository.findByScheduleIdAndPullRequestId("schedule-1", "pr-4d"))
                .thenReturn(Optional.of(tracking("pr-4d", NOW.minus(Duration.ofDays(2)), 1)));

        EscalationPlan plan = escalationService.plan(schedule, List.of(old), NOW);

        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.getPendingTracking()).isEmpty();
    }

    @Test
    void reEscalatesOnceTheWeeklyCooldownHasPassed() {
        PullRequest old = pr("pr-10d", Duration.ofDays(10));
        EscalationTracking existing = tracking("pr-10d", NOW.minus(Duration.ofDays(7)), 1);
        when(escalationTrackingRepository.findByScheduleIdAndPullRequestId("schedule-1", "pr-10d"))
                .thenReturn(Optional.of(existing));

        EscalationPlan plan = escalationService.plan(schedule, List.of(old), NOW);

        assertThat(plan.getEscalating()).containsExactly(old);
        assertThat(existing.getEscalationCount()).isEqualTo(2);
        assertThat(existing.getLastEscalatedAt()).isEqualTo(NOW);
        assertThat(existing.getFirstEscalatedAt()).isEqualTo(NOW.minus(Duration.ofDays(14)));
    }

    @Test
    void trackingRowWithoutLastEscalationIsTreatedAsDue() {
        PullRequest old = pr("pr-5d", Duration.ofDays(5));
        when(escalationTrackingRepository.findByScheduleIdAndPullRequestId(anyString(), anyString()))
                .thenReturn(Optional.of(tracking("pr-5d", null, 3)));

        EscalationPlan plan = escalationService.plan(schedule, List.of(old), NOW);

        assertThat(plan.getEscalating()).containsExactly(old);
        assertThat(plan.getPendingTracking().get(0).getEscalationCount()).isEqualTo(4);
    }

    @Test
    void commitPersistsStagedTracking() {
        PullRequest old = pr("pr-4d", Duration.ofDays(4));
        when(escalationTrackingRepository.findByScheduleIdAndPullRequestId("schedule-1", "pr-4d")).thenReturn(Optional.empty());
        EscalationPlan plan = escalationService.plan(schedule, List.of(old), NOW);

        escalationService.commit(plan);

        verify(escalationTrackingRepository).saveAll(trackingCaptor.capture());
        assertThat(trackingCaptor.getValue()).extracting(EscalationTracking::getPullRequestId).containsExactly("pr-4d");
    }

    @Test
    void commitOfEmptyPlanWritesNothing() {
        escalationService.commit(new EscalationPlan(List.of(), List.of()));

        verify(escalationTrackingRepository, never()).saveAll(any());
    }

    @Test
    void cleanupDeletesRowsOfPullRequestsNoLongerOpen() {
        when(escalationTrackingRepository.deleteByScheduleIdAndPullRequestIdNotIn("schedule-1", List.of("pr-a", "pr-b")))
                .thenReturn(2L);

        assertThat(escalationService.cleanup("schedule-1", List.of("pr-a", "pr-b"))).isEqualTo(2L);
    }

    private static PullRequest pr(String id, Duration age) {
        return PullRequest.builder()
                .id(id)
                .title("PR " + id)
                .url("https://example.com/" + id)
                .createdAt(NOW.minus(age))
                .build();
    }

    private static EscalationTracking tracking(String prId, Instant lastEscalatedAt, int count) {
        return EscalationTracking.builder()
                .scheduleId("schedule-1")
                .pullRequestId(prId)
                .firstEscalatedAt(NOW.minus(Duration.ofDays(14)))
                .lastEscalatedAt(lastEscalatedAt)
                .escalationCount(count)
                .build();
    }
}
