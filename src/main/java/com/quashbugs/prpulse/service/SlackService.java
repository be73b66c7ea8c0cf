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
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class SlackService implements MessagingProviderAdapter {

    private static final String PROVIDER_NAME = "Slack";
    private static final Logger LOGGER = LoggerFactory.getLogger(SlackService.class);

    private final RestTemplate restTemplate;
    private final String slackApiUrl;

    @Autowired
    public SlackService(RestTemplate restTemplate,
                        @Value("${spring.slack.api.url:https://slack.com/api}") String slackApiUrl) {
        this.restTemplate = restTemplate;
        this.slackApiUrl = slackApiUrl;
    }

    @Override
    public MessagingProviderType getProviderType() {
        return MessagingProviderType.SLACK;
    }

    @Override
    public MessageStyle getMessageStyle() {
        return MessageStyle.BLOCKS;
    }

    @Override
    public void sendMessage(MessagingProvider connection, String channelId, RenderedMessageDTO message) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(connection.getAccessToken());
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> payload = new HashMap<>();
        payload.put("channel", channelId);
        payload.put("text", message.getText());
        if (message.getBlocks() != null && !message.getBlocks().isEmpty()) {
            payload.put("blocks", message.getBlocks());
        }

        Map<String, Object> body;
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    slackApiUrl + "/chat.postMessage",
                    HttpMethod.POST,
                    new HttpEntity<>(payload, headers),
                    new ParameterizedTypeReference<Map<String, Object>>() {
                    }
            );
            body = response.getBody();
        } catch (RestClientException e) {
            throw ProviderApiException.from(PROVIDER_NAME, e);
        }

        // Slack answers 200 for most failures and reports them in the body
        if (body == null || !Boolean.TRUE.equals(body.get("ok"))) {
            String error = body != null ? String.valueOf(body.get("error")) : "empty response";
            throw toApiException(error);
        }
        LOGGER.debug("Slack message posted to channel {}", channelId);
    }

    /**
     * Slack bot tokens do not expire.
     */
    @Override
    public Optional<TokenRefreshDTO> refreshToken(MessagingProvider connection) {
        return Optional.empty();
    }

    private ProviderApiException toApiException(String error) {
        ProviderApiException.Kind kind = switch (error) {
            case "invalid_auth", "token_revoked", "token_expired", "not_authed", "account_inactive" ->
                    ProviderApiException.Kind.AUTH_EXPIRED;
            case "rate_limited", "ratelimited" -> ProviderApiException.Kind.RATE_LIMITED;
            default -> ProviderApiException.Kind.CLIENT_ERROR;
        };
        return new ProviderApiException(PROVIDER_NAME, kind, null, "Slack API error: " + error);
    }
}
