package com.quashbugs.prpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "escalation_tracking")
@CompoundIndex(name = "schedule_pull_request", def = "{'scheduleId': 1, 'pullRequestId': 1}", unique = true)
public class EscalationTracking {
    @Id
    private String id;
    private String scheduleId;
    private String pullRequestId; // provider-scoped id, stable across runs
    private String pullRequestUrl;
    private Instant firstEscalatedAt;
    private Instant lastEscalatedAt;
    private int escalationCount;
}
