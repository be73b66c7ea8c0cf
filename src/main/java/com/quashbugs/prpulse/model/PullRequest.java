package com.quashbugs.prpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * An open pull (or merge) request as fetched from a git provider. Lives only for the duration of one
 * schedule execution and is never persisted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PullRequest {
    private String id;
    private String title;
    private String author;
    private String url;
    private Instant createdAt;
    private String repository;
    private List<String> labels;
    private List<String> reviewers;
    private boolean approved;
    private boolean changesRequested;
    private Integer additions;
    private Integer deletions;

    public long ageInMillis(Instant now) {
        return Duration.between(createdAt, now).toMillis();
    }

    public long ageInDays(Instant now) {
        return Duration.between(createdAt, now).toDays();
    }

    public boolean hasReviewers() {
        return reviewers != null && !reviewers.isEmpty();
    }
}
