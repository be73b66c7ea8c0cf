package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.adapter.GitProviderAdapter;
import com.quashbugs.prpulse.adapter.MessagingProviderAdapter;
import com.quashbugs.prpulse.dto.TokenRefreshDTO;
import com.quashbugs.prpulse.dto.TokenRefreshSummaryDTO;
import com.quashbugs.prpulse.exception.UnsupportedProviderException;
import com.quashbugs.prpulse.model.*;
import com.quashbugs.prpulse.repository.GitProviderRepository;
import com.quashbugs.prpulse.repository.MessagingProviderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TokenRefreshServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T16:00:00Z");

    @Mock
    private GitProviderRepository gitProviderRepository;
    @Mock
    private MessagingProviderRepository messagingProviderRepository;
    @Mock
    private ProviderRegistryService providerRegistryService;
    @Mock
    private GitProviderAdapter gitlabAdapter;
    @Mock
    private MessagingProviderAdapter discordAdapter;

    private TokenRefreshService tokenRefreshService;

    @BeforeEach
    void setUp() {
        tokenRefreshService = new TokenRefreshService(gitProviderRepository, messagingProviderRepository,
                providerRegistryService, Clock.fixed(NOW, ZoneOffset.UTC), 60);
    }

    @Test
    void refreshesExpiringConnectionsAndKeepsOldRefreshTokenWhenNotRotated() {
        GitProvider gitlab = GitProvider.builder().id("gl-1").provider(GitProviderType.GITLAB)
                .accessToken("old").refreshToken("refresh-old").expiresAt(NOW.plusSeconds(600)).build();
        MessagingProvider discord = MessagingProvider.builder().id("dc-1").provider(MessagingProviderType.DISCORD)
                .accessToken("old").refreshToken("dc-refresh").expiresAt(NOW.plusSeconds(60)).build();
        Instant cutoff = NOW.plus(Duration.ofMinutes(60));
        when(gitProviderRepository.findExpiringBefore(cutoff)).thenReturn(List.of(gitlab));
        when(messagingProviderRepository.findByExpiresAtBeforeAndRefreshTokenIsNotNull(cutoff)).thenReturn(List.of(discord));
        when(providerRegistryService.getGitProvider(GitProviderType.GITLAB)).thenReturn(gitlabAdapter);
        when(providerRegistryService.getMessagingProvider(MessagingProviderType.DISCORD)).thenReturn(discordAdapter);
        when(gitlabAdapter.refreshToken(gitlab)).thenReturn(Optional.of(new TokenRefreshDTO("new", "refresh-new", NOW.plusSeconds(7200))));
        when(discordAdapter.refreshToken(discord)).thenReturn(Optional.of(new TokenRefreshDTO("dc-new", null, NOW.plusSeconds(604800))));

        TokenRefreshSummaryDTO summary = tokenRefreshService.refreshExpiringTokens();

        assertThat(summary.getGitProvidersRefreshed()).isEqualTo(1);
        assertThat(summary.getMessagingProvidersRefreshed()).isEqualTo(1);
        assertThat(summary.getErrors()).isEmpty();
        assertThat(gitlab.getAccessToken()).isEqualTo("new");
        assertThat(gitlab.getRefreshToken()).isEqualTo("refresh-new");
        assertThat(gitlab.getExpiresAt()).isEqualTo(NOW.plusSeconds(7200));
        assertThat(discord.getAccessToken()).isEqualTo("dc-new");
        assertThat(discord.getRefreshToken()).isEqualTo("dc-refresh");
        assertThat(discord.getUpdatedAt()).isEqualTo(NOW);
        verify(gitProviderRepository).save(gitlab);
        verify(messagingProviderRepository).save(discord);
    }

    @Test
    void neverExpiringTokensCountAsRefreshedWithoutAWrite() {
        GitProvider github = GitProvider.builder().id("gh-1").provider(GitProviderType.GITHUB).refreshToken("r").build();
        when(gitProviderRepository.findExpiringBefore(any())).thenReturn(List.of(github));
        when(messagingProviderRepository.findByExpiresAtBeforeAndRefreshTokenIsNotNull(any())).thenReturn(List.of());
        when(providerRegistryService.getGitProvider(GitProviderType.GITHUB)).thenReturn(gitlabAdapter);
        when(gitlabAdapter.refreshToken(github)).thenReturn(Optional.empty());

        TokenRefreshSummaryDTO summary = tokenRefreshService.refreshExpiringTokens();

        assertThat(summary.getGitProvidersRefreshed()).isEqualTo(1);
        verify(gitProviderRepository, never()).save(any());
    }

    @Test
    void failingRecordIsReportedAndDoesNotStopTheSweep() {
        GitProvider bitbucket = GitProvider.builder().id("bb-1").provider(GitProviderType.BITBUCKET).refreshToken("r").build();
        GitProvider gitlab = GitProvider.builder().id("gl-1").provider(GitProviderType.GITLAB).refreshToken("r").build();
        when(gitProviderRepository.findExpiringBefore(any())).thenReturn(List.of(bitbucket, gitlab));
        when(messagingProviderRepository.findByExpiresAtBeforeAndRefreshTokenIsNotNull(any())).thenReturn(List.of());
        when(providerRegistryService.getGitProvider(GitProviderType.BITBUCKET))
                .thenThrow(new UnsupportedProviderException("Unsupported git provider: BITBUCKET"));
        when(providerRegistryService.getGitProvider(GitProviderType.GITLAB)).thenReturn(gitlabAdapter);
        when(gitlabAdapter.refreshToken(gitlab)).thenReturn(Optional.of(new TokenRefreshDTO("new", null, null)));

        TokenRefreshSummaryDTO summary = tokenRefreshService.refreshExpiringTokens();

        assertThat(summary.getGitProvidersRefreshed()).isEqualTo(1);
        assertThat(summary.getErrors()).containsExactly("Error refreshing git provider bb-1: Unsupported git provider: BITBUCKET");
        verify(gitProviderRepository).save(gitlab);
    }
}
