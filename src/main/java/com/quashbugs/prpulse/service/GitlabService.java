package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.adapter.GitProviderAdapter;
import com.quashbugs.prpulse.dto.TokenRefreshDTO;
import com.quashbugs.prpulse.exception.ProviderApiException;
import com.quashbugs.prpulse.model.GitProvider;
import com.quashbugs.prpulse.model.GitProviderType;
import com.quashbugs.prpulse.model.PullRequest;
import com.quashbugs.prpulse.model.PullRequestFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.*;

@Service
public class GitlabService implements GitProviderAdapter {

    private static final String PROVIDER_NAME = "GitLab";
    private static final Logger LOGGER = LoggerFactory.getLogger(GitlabService.class);
    private static final List<String> CHANGE_REQUEST_PHRASES = List.of(
            "needs changes", "request changes", "please fix", "changes needed");

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final String gitlabUrl;
    private final String applicationId;
    private final String applicationSecret;

    @Autowired
    public GitlabService(RestTemplate restTemplate,
                         Clock clock,
                         @Value("${spring.gitlab.url:https://gitlab.com}") String gitlabUrl,
                         @Value("${spring.gitlab.application.id:}") String applicationId,
                         @Value("${spring.gitlab.application.secret:}") String applicationSecret) {
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.gitlabUrl = gitlabUrl;
        this.applicationId = applicationId;
        this.applicationSecret = applicationSecret;
    }

    @Override
    public GitProviderType getProviderType() {
        return GitProviderType.GITLAB;
    }

    @Override
    public List<PullRequest> fetchPullRequests(GitProvider connection, List<String> repositories, PullRequestFilter filterHints) {
        if (connection.getAccessToken() == null || connection.getAccessToken().isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }
        HttpEntity<?> entity = new HttpEntity<>(createHeaders(connection.getAccessToken()));

        List<PullRequest> mergeRequests = new ArrayList<>();
        for (String projectPath : resolveRepositories(connection, repositories, filterHints)) {
            Map<String, Object> project = exchange(apiUri("/projects/{path}", projectPath), entity,
                    new ParameterizedTypeReference<Map<String, Object>>() {
                    });
            Object projectId = project.get("id");

            List<Map<String, Object>> opened = exchange(
                    apiUri("/projects/{id}/merge_requests?state=opened&per_page=100", projectId), entity,
                    new ParameterizedTypeReference<List<Map<String, Object>>>() {
                    });
            for (Map<String, Object> mergeRequest : opened) {
                mergeRequests.add(mapMergeRequest(projectPath, projectId, mergeRequest, entity));
            }
            LOGGER.debug("Fetched {} open merge requests from {}", opened.size(), projectPath);
        }
        return mergeRequests;
    }

    @Override
    public Optional<TokenRefreshDTO> refreshToken(GitProvider connection) {
        if (connection.getRefreshToken() == null) {
            LOGGER.warn("GitLab connection {} has no refresh token, skipping refresh", connection.getId());
            return Optional.empty();
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("grant_type", "refresh_token");
        body.add("refresh_token", connection.getRefreshToken());
        body.add("client_id", applicationId);
        body.add("client_secret", applicationSecret);

        Map<String, Object> tokenData;
        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    gitlabUrl + "/oauth/token",
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
                    "GitLab token refresh returned no access token");
        }

        Instant expiresAt = null;
        if (tokenData.get("expires_in") instanceof Number expiresIn) {
            Instant issuedAt = tokenData.get("created_at") instanceof Number createdAt
                    ? Instant.ofEpochSecond(createdAt.longValue())
                    : clock.instant();
            expiresAt = issuedAt.plusSeconds(expiresIn.longValue());
        }
        return Optional.of(TokenRefreshDTO.builder()
                .accessToken(tokenData.get("access_token").toString())
                .refreshToken(tokenData.get("refresh_token") != null ? tokenData.get("refresh_token").toString() : null)
                .expiresAt(expiresAt)
                .build());
    }

    private PullRequest mapMergeRequest(String projectPath, Object projectId, Map<String, Object> mergeRequest,
                                        HttpEntity<?> entity) {
        Object iid = mergeRequest.get("iid");

        Set<String> reviewers = new LinkedHashSet<>();
        for (Map<String, Object> reviewer : listOfMaps(mergeRequest.get("reviewers"))) {
            reviewers.add((String) reviewer.get("username"));
        }

        boolean approved = false;
        boolean changesRequested = false;
        try {
            Map<String, Object> approvals = exchange(
                    apiUri("/projects/{id}/merge_requests/{iid}/approvals", projectId, iid), entity,
                    new ParameterizedTypeReference<Map<String, Object>>() {
                    });
            for (Map<String, Object> approval : listOfMaps(approvals.get("approved_by"))) {
                @SuppressWarnings("unchecked")
                Map<String, Object> user = (Map<String, Object>) approval.get("user");
                if (user != null) {
                    reviewers.add((String) user.get("username"));
                    approved = true;
                }
            }

            List<Map<String, Object>> notes = exchange(
                    apiUri("/projects/{id}/merge_requests/{iid}/notes?per_page=100", projectId, iid), entity,
                    new ParameterizedTypeReference<List<Map<String, Object>>>() {
                    });
            changesRequested = notes.stream()
                    .filter(note -> !Boolean.TRUE.equals(note.get("system")))
                    .map(note -> String.valueOf(note.get("body")).toLowerCase(Locale.ROOT))
                    .anyMatch(body -> CHANGE_REQUEST_PHRASES.stream().anyMatch(body::contains));
        } catch (ProviderApiException e) {
            LOGGER.warn("Failed to fetch review info for {}!{}: {}", projectPath, iid, e.getMessage());
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> author = (Map<String, Object>) mergeRequest.get("author");
        @SuppressWarnings("unchecked")
        List<String> labels = mergeRequest.get("labels") instanceof List ? (List<String>) mergeRequest.get("labels") : List.of();

        return PullRequest.builder()
                .id(String.valueOf(mergeRequest.get("id")))
                .title((String) mergeRequest.get("title"))
                .author(author != null ? (String) author.get("username") : "unknown")
                .url((String) mergeRequest.get("web_url"))
                .createdAt(OffsetDateTime.parse(mergeRequest.get("created_at").toString()).toInstant())
                .repository(projectPath)
                .labels(labels)
                .reviewers(new ArrayList<>(reviewers))
                .approved(approved)
                .changesRequested(changesRequested)
                .build();
    }

    private <T> T exchange(URI uri, HttpEntity<?> entity, ParameterizedTypeReference<T> type) {
        try {
            ResponseEntity<T> response = restTemplate.exchange(uri, HttpMethod.GET, entity, type);
            if (response.getBody() == null) {
                throw new ProviderApiException(PROVIDER_NAME, ProviderApiException.Kind.SERVER_ERROR,
                        response.getStatusCode().value(), "Empty response from GitLab API: " + uri.getPath());
            }
            return response.getBody();
        } catch (RestClientException e) {
            throw ProviderApiException.from(PROVIDER_NAME, e);
        }
    }

    // project paths contain slashes and have to travel as a single encoded segment
    private URI apiUri(String path, Object... variables) {
        return UriComponentsBuilder.fromHttpUrl(gitlabUrl + "/api/v4" + path)
                .encode()
                .buildAndExpand(variables)
                .toUri();
    }

    private HttpHeaders createHeaders(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Object value) {
        return value instanceof List ? (List<Map<String, Object>>) value : List.of();
    }
}
