package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.adapter.MessagingProviderAdapter;
import com.quashbugs.prpulse.dto.MessageStyle;
import com.quashbugs.prpulse.dto.RenderedMessageDTO;
import com.quashbugs.prpulse.dto.TokenRefreshDTO;
import com.quashbugs.prpulse.exception.ProviderApiException;
import com.quashbugs.prpulse.model.MessagingProvider;
import com.quashbugs.prpulse.model.MessagingProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

@Service
public class DiscordService implements MessagingProviderAdapter {

    private static final String PROVIDER_NAME = "Discord";
    private static final Logger LOGGER = LoggerFactory.getLogger(DiscordService.class);

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final String discordApiUrl;
    private final String botToken;
    private final String clientId;
    private final String clientSecret;

    @Autowired
    public DiscordService(RestTemplate restTemplate,
                          Clock clock,
                          @Value("${spring.discord.api.url:https://discord.com/api/v10}") String discordApiUrl,
                          @Value("${spring.discord.bot.token:}") String botToken,
                          @Value("${spring.discord.client.id:}") String clientId,
                          @Value("${spring.discord.client.secret:}") String clientSecret) {
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.discordApiUrl = discordApiUrl;
        this.botToken = botToken;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    @Override
    public MessagingProviderType getProviderType() {
        return MessagingProviderType.DISCORD;
    }

    @Override
    public MessageStyle getMessageStyle() {
        return MessageStyle.PLAIN_TEXT;
    }

    @Override
    public void sendMessage(MessagingProvider connection, String channelId, RenderedMessageDTO message) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> payload = Map.of("content", message.getText());

        String url;
        if (usesWebhook(connection, channelId)) {
            url = connection.getWebhookUrl();
        } else {
            if (botToken == null || botToken.isBlank()) {
                throw new IllegalStateException("Discord bot token is not configured and connection "
                        + connection.getId() + " has no webhook");
            }
            headers.set(HttpHeaders.AUTHORIZATION, "Bot " + botToken);
            url = discordApiUrl + "/channels/" + channelId + "/messages";
        }

        try {
            restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(payload, headers), String.class);
            LOGGER.debug("Discord message posted to channel {}", channelId);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == 403) {
                throw new ProviderApiException(PROVIDER_NAME, ProviderApiException.Kind.CLIENT_ERROR, 403,
                        "Discord bot lacks permission to post in channel " + channelId, e);
            }
            throw ProviderApiException.from(PROVIDER_NAME, e);
        } catch (RestClientException e) {
            throw ProviderApiException.from(PROVIDER_NAME, e);
        }
    }

    // a webhook is bound to one channel, anything routed elsewhere goes through the bot
    private static boolean usesWebhook(MessagingProvider connection, String channelId) {
        if (connection.getWebhookUrl() == null || connection.getWebhookUrl().isBlank()) {
            return false;
        }
        return channelId == null || channelId.isBlank() || channelId.equals(connection.getChannelId());
    }

    @Override
    public Optional<TokenRefreshDTO> refreshToken(MessagingProvider connection) {
        if (connection.getRefreshToken() == null) {
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(clientId, clientSecret);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("grant_type", "refresh_token");
        body.add("refresh_token", connection.getRefreshToken());

        Map<String, Object> tokenData;
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    discordApiUrl + "/oauth2/token",
                    HttpMethod.POST,
                    new HttpEntity<>(body, headers),
                    new ParameterizedTypeReference<Map<String, Object>>() {
                    }
            );
            tokenData = response.getBody();
        } catch (RestClientException e) {
            throw ProviderApiException.from(PROVIDER_NAME, e);
        }
        if (tokenData == null || tokenData.get("access_token") == null) {
            throw new ProviderApiException(PROVIDER_NAME, ProviderApiException.Kind.SERVER_ERROR, null,
                    "Discord token refresh returned no access token");
        }

        return Optional.of(TokenRefreshDTO.builder()
                .accessToken(tokenData.get("access_token").toString())
                .refreshToken(tokenData.get("refresh_token") != null ? tokenData.get("refresh_token").toString() : null)
                .expiresAt(tokenData.get("expires_in") instanceof Number expiresIn
                        ? clock.instant().plusSeconds(expiresIn.longValue())
                        : null)
                .build());
    }
}
