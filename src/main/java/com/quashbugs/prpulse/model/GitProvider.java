package com.quashbugs.prpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "git_providers")
public class GitProvider {
    @Id
    private String id;
    private String userId;
    private GitProviderType provider;
    private String accessToken;
    private String refreshToken;
    private Instant expiresAt;
    private String installationId; // github app installations only
    private List<String> repositories;
    private Instant createdAt;
    private Instant updatedAt;
}
