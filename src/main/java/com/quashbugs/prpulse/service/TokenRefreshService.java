package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.dto.TokenRefreshDTO;
import com.quashbugs.prpulse.dto.TokenRefreshSummaryDTO;
import com.quashbugs.prpulse.model.GitProvider;
import com.quashbugs.prpulse.model.MessagingProvider;
import com.quashbugs.prpulse.repository.GitProviderRepository;
import com.quashbugs.prpulse.repository.MessagingProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Service
public class TokenRefreshService {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenRefreshService.class);

    private final GitProviderRepository gitProviderRepository;
    private final MessagingProviderRepository messagingProviderRepository;
    private final ProviderRegistryService providerRegistryService;
    private final Clock clock;
    private final Duration lookahead;

    @Autowired
    public TokenRefreshService(GitProviderRepository gitProviderRepository,
                               MessagingProviderRepository messagingProviderRepository,
                               ProviderRegistryService providerRegistryService,
                               Clock clock,
                               @Value("${spring.token.refresh.lookahead-minutes:60}") long lookaheadMinutes) {
        this.gitProviderRepository = gitProviderRepository;
        this.messagingProviderRepository = messagingProviderRepository;
        this.providerRegistryService = providerRegistryService;
        this.clock = clock;
        this.lookahead = Duration.ofMinutes(lookaheadMinutes);
    }

    /**
     * Refreshes every connection whose token expires within the lookahead window. Each record is refreshed
     * on its own; a failure is reported in the summary and the sweep moves on.
     */
    public TokenRefreshSummaryDTO refreshExpiringTokens() {
        Instant cutoff = clock.instant().plus(lookahead);
        TokenRefreshSummaryDTO summary = TokenRefreshSummaryDTO.builder().build();

        for (GitProvider gitProvider : gitProviderRepository.findExpiringBefore(cutoff)) {
            try {
                Optional<TokenRefreshDTO> tokens = providerRegistryService
                        .getGitProvider(gitProvider.getProvider())
                        .refreshToken(gitProvider);
                tokens.ifPresent(refreshed -> {
                    gitProvider.setAccessToken(refreshed.getAccessToken());
                    if (refreshed.getRefreshToken() != null) {
                        gitProvider.setRefreshToken(refreshed.getRefreshToken());
                    }
                    gitProvider.setExpiresAt(refreshed.getExpiresAt());
                    gitProvider.setUpdatedAt(clock.instant());
                    gitProviderRepository.save(gitProvider);
                });
                summary.setGitProvidersRefreshed(summary.getGitProvidersRefreshed() + 1);
            } catch (Exception e) {
                LOGGER.warn("Error refreshing git provider {}: {}", gitProvider.getId(), e.getMessage());
                summary.getErrors().add("Error refreshing git provider " + gitProvider.getId() + ": " + e.getMessage());
            }
        }

        for (MessagingProvider messagingProvider : messagingProviderRepository.findByExpiresAtBeforeAndRefreshTokenIsNotNull(cutoff)) {
            try {
                Optional<TokenRefreshDTO> tokens = providerRegistryService
                        .getMessagingProvider(messagingProvider.getProvider())
                        .refreshToken(messagingProvider);
                tokens.ifPresent(refreshed -> {
                    messagingProvider.setAccessToken(refreshed.getAccessToken());
                    if (refreshed.getRefreshToken() != null) {
                        messagingProvider.setRefreshToken(refreshed.getRefreshToken());
                    }
                    messagingProvider.setExpiresAt(refreshed.getExpiresAt());
                    messagingProvider.setUpdatedAt(clock.instant());
                    messagingProviderRepository.save(messagingProvider);
                });
                summary.setMessagingProvidersRefreshed(summary.getMessagingProvidersRefreshed() + 1);
            } catch (Exception e) {
                LOGGER.warn("Error refreshing messaging provider {}: {}", messagingProvider.getId(), e.getMessage());
                summary.getErrors().add("Error refreshing messaging provider " + messagingProvider.getId() + ": " + e.getMessage());
            }
        }

        LOGGER.info("Token refresh finished: {} git, {} messaging, {} errors", summary.getGitProvidersRefreshed(),
                summary.getMessagingProvidersRefreshed(), summary.getErrors().size());
        return summary;
    }
}
