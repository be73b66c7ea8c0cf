package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.adapter.GitProviderAdapter;
import com.quashbugs.prpulse.dto.JwtResponseDTO;
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
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.*;

@Service
public class GithubService implements GitProviderAdapter {

    private static final String PROVIDER_NAME = "GitHub";
    private static final Logger LOGGER = LoggerFactory.getLogger(GithubService.class);

    private final RestTemplate restTemplate;
    private final JwtService jwtService;
    private final String githubApiUrl;
    private final String githubAppId;
    private final String privateKeyPath;

    @Autowired
    public GithubService(RestTemplate restTemplate,
                         JwtService jwtService,
                         @Value("${spring.github.api.url:https://api.github.com}") String githubApiUrl,
                         @Value("${spring.github.app.id:}") String githubAppId,
                         @Value("${spring.github.app.private.key:}") String privateKeyPath) {
        this.restTemplate = restTemplate;
        this.jwtService = jwtService;
        this.githubApiUrl = githubApiUrl;
        this.githubAppId = githubAppId;
        this.privateKeyPath = privateKeyPath;
    }

    @Override
    public GitProviderType getProviderType() {
        return GitProviderType.GITHUB;
    }

    @Override
    public List<PullRequest> fetchPullRequests(GitProvider connection, List<String> repositories, PullRequestFilter filterHints) {
        validateAccessToken(connection.getAccessToken());
        HttpEntity<?> entity = new HttpEntity<>(createHeaders(connection.getAccessToken()));

        List<PullRequest> pullRequests = new ArrayList<>();
        for (String repo : resolveRepositories(connection, repositories, filterHints)) {
            List<Map<String, Object>> pulls = exchangeList(
                    githubApiUrl + "/repos/" + repo + "/pulls?state=open&per_page=100", entity);
            for (Map<String, Object> pull : pulls) {
                pullRequests.add(mapPullRequest(repo, pull, entity));
            }
            LOGGER.debug("Fetched {} open pull requests from {}", pulls.size(), repo);
        }
        return pullRequests;
    }

    /**
     * OAuth tokens issued to a GitHub user do not expire. Connections made through the GitHub App carry an
     * installation id and get a fresh installation token minted with the app JWT.
     */
    @Override
    public Optional<TokenRefreshDTO> refreshToken(GitProvider connection) {
        if (connection.getInstallationId() == null) {
            return Optional.empty();
        }

        JwtResponseDTO appJwt;
        try {
            appJwt = jwtService.generateAppJwt(githubAppId, privateKeyPath);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read GitHub App private key", e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(appJwt.getToken());
        headers.setAccept(List.of(MediaType.parseMediaType("application/vnd.github+json")));

        try {
            ResponseEntity<Map<String, Object>> response = restTemplate.exchange(
                    githubApiUrl + "/app/installations/" + connection.getInstallationId() + "/access_tokens",
                    HttpMethod.POST,
                    new HttpEntity<>(headers),
                    new ParameterizedTypeReference<Map<String, Object>>() {
                    }
            );
            Map<String, Object> body = response.getBody();
            if (body == null || !body.containsKey("token")) {
                throw new ProviderApiException(PROVIDER_NAME, ProviderApiException.Kind.SERVER_ERROR,
                        response.getStatusCode().value(), "Unexpected response from GitHub installation token endpoint");
            }
            return Optional.of(TokenRefreshDTO.builder()
                    .accessToken((String) body.get("token"))
                    .expiresAt(parseTimestamp(body.get("expires_at")))
                    .build());
        } catch (RestClientException e) {
            throw ProviderApiException.from(PROVIDER_NAME, e);
        }
    }

    private PullRequest mapPullRequest(String repo, Map<String, Object> pull, HttpEntity<?> entity) {
        Number number = (Number) pull.get("number");
        ReviewSummary reviews = fetchReviewSummary(repo, number, entity);

        Set<String> reviewers = new LinkedHashSet<>();
        for (Map<String, Object> reviewer : listOfMaps(pull.get("requested_reviewers"))) {
            reviewers.add((String) reviewer.get("login"));
        }
        for (Map<String, Object> team : listOfMaps(pull.get("requested_teams"))) {
            reviewers.add("team:" + team.get("name"));
        }
        reviewers.addAll(reviews.states.keySet());

        List<String> labels = listOfMaps(pull.get("labels")).stream()
                .map(label -> (String) label.get("name"))
                .toList();

        @SuppressWarnings("unchecked")
        Map<String, Object> user = (Map<String, Object>) pull.get("user");

        return PullRequest.builder()
                .id(String.valueOf(pull.get("id")))
                .title((String) pull.get("title"))
                .author(user != null ? (String) user.get("login") : "unknown")
                .url((String) pull.get("html_url"))
                .createdAt(parseTimestamp(pull.get("created_at")))
                .repository(repo)
                .labels(labels)
                .reviewers(new ArrayList<>(reviewers))
                .approved(reviews.states.containsValue("APPROVED"))
                .changesRequested(reviews.states.containsValue("CHANGES_REQUESTED"))
                .additions(pull.get("additions") instanceof Number n ? n.intValue() : null)
                .deletions(pull.get("deletions") instanceof Number n ? n.intValue() : null)
                .build();
    }

    // review lookups degrade to "no review info", the pull request is still reported
    private ReviewSummary fetchReviewSummary(String repo, Number number, HttpEntity<?> entity) {
        Map<String, String> states = new LinkedHashMap<>();
        try {
            List<Map<String, Object>> reviews = exchangeList(
                    githubApiUrl + "/repos/" + repo + "/pulls/" + number + "/reviews?per_page=100", entity);
            // reviews come back oldest first, so the last state per reviewer wins
            for (Map<String, Object> review : reviews) {
                @SuppressWarnings("unchecked")
                Map<String, Object> reviewer = (Map<String, Object>) review.get("user");
                String state = (String) review.get("state");
                if (reviewer != null && state != null && !"COMMENTED".equals(state)) {
                    states.put((String) reviewer.get("login"), state);
                }
            }
        } catch (ProviderApiException e) {
            LOGGER.warn("Failed to fetch review info for {}#{}: {}", repo, number, e.getMessage());
        }
        return new ReviewSummary(states);
    }

    private List<Map<String, Object>> exchangeList(String url, HttpEntity<?> entity) {
        try {
            ResponseEntity<List<Map<String, Object>>> response = restTemplate.exchange(
                    url,
                    HttpMethod.GET,
                    entity,
                    new ParameterizedTypeReference<List<Map<String, Object>>>() {
                    }
            );
            return response.getBody() != null ? response.getBody() : List.of();
        } catch (RestClientException e) {
            throw ProviderApiException.from(PROVIDER_NAME, e);
        }
    }

    private void validateAccessToken(String accessToken) {
        if (accessToken == null || accessToken.trim().isEmpty()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }
    }

    private HttpHeaders createHeaders(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.parseMediaType("application/vnd.github+json")));
        return headers;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Object value) {
        return value instanceof List ? (List<Map<String, Object>>) value : List.of();
    }

    private static Instant parseTimestamp(Object value) {
        return value != null ? OffsetDateTime.parse(value.toString()).toInstant() : null;
    }

    private record ReviewSummary(Map<String, String> states) {
    }
}
