package com.quashbugs.prpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "schedules")
public class Schedule {
    @Id
    private String id;
    private String userId;
    private String name;
    private String cronExpression; // always UTC, five fields
    private String gitProviderId;
    private List<String> repositories;
    private String messagingProviderId;
    private String channelId;
    private String escalationProviderId;
    private String escalationChannelId;
    private Integer escalationDays;
    private PullRequestFilter prFilters;
    private boolean sendWhenEmpty;
    @Indexed
    private boolean active;
    private Instant lastExecuted;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasEscalation() {
        return escalationProviderId != null
                && escalationChannelId != null
                && escalationDays != null
                && escalationDays > 0;
    }
}
