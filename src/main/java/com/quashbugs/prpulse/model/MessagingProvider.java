package com.quashbugs.prpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "messaging_providers")
public class MessagingProvider {
    @Id
    private String id;
    private String userId;
    private MessagingProviderType provider;
    private String accessToken;
    private String refreshToken;
    private String channelId;
    private String channelName;
    private String webhookUrl;
    private Instant expiresAt;
    private Instant createdAt;
    private Instant updatedAt;
}
