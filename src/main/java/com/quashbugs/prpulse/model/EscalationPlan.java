package com.quashbugs.prpulse.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * The outcome of evaluating one schedule's pull requests against its escalation threshold. Tracking rows
 * are only staged here and persisted once the escalation message went out.
 */
@Data
@AllArgsConstructor
public class EscalationPlan {
    private List<PullRequest> escalating;
    private List<EscalationTracking> pendingTracking;

    public boolean isEmpty() {
        return escalating.isEmpty();
    }
}
