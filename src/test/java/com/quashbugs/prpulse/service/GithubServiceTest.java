package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.dto.JwtResponseDTO;
import com.quashbugs.prpulse.dto.TokenRefreshDTO;
import com.quashbugs.prpulse.exception.ProviderApiException;
import com.quashbugs.prpulse.model.GitProvider;
import com.quashbugs.prpulse.model.GitProviderType;
import com.quashbugs.prpulse.model.PullRequest;
import com.quashbugs.prpulse.model.PullRequestFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class GithubServiceTest {

    private static final String API = "https://api.github.com";

    private static final String PULLS = """
            [{
              "id": 1001,
              "number": 7,
              "title": "Add response cache",
              "html_url": "https://github.com/acme/api/pull/7",
              "created_at": "2024-05-06T10:00:00Z",
              "user": {"login": "alice"},
              "labels": [{"name": "backend"}, {"name": "perf"}],
              "requested_reviewers": [{"login": "bob"}],
              "requested_teams": [{"name": "platform"}]
            }]
            """;

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private JwtService jwtService;
    private GithubService githubService;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        jwtService = mock(JwtService.class);
        githubService = new GithubService(restTemplate, jwtService, API, "12345", "/keys/app.pem");
    }

    @Test
    void fetchesOpenPullRequestsWithLatestReviewState() {
        server.expect(requestTo(API + "/repos/acme/api/pulls?state=open&per_page=100"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer gh-token"))
                .andRespond(withSuccess(PULLS, MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/repos/acme/api/pulls/7/reviews?per_page=100"))
                .andRespond(withSuccess("""
                        [
                          {"user": {"login": "carol"}, "state": "CHANGES_REQUESTED"},
                          {"user": {"login": "carol"}, "state": "COMMENTED"},
                          {"user": {"login": "carol"}, "state": "APPROVED"},
                          {"user": {"login": "dave"}, "state": "COMMENTED"}
                        ]
                        """, MediaType.APPLICATION_JSON));

        List<PullRequest> pullRequests = githubService.fetchPullRequests(connection(), List.of("acme/api"), null);

        server.verify();
        assertThat(pullRequests).hasSize(1);
        PullRequest pr = pullRequests.get(0);
        assertThat(pr.getId()).isEqualTo("1001");
        assertThat(pr.getTitle()).isEqualTo("Add response cache");
        assertThat(pr.getAuthor()).isEqualTo("alice");
        assertThat(pr.getUrl()).isEqualTo("https://github.com/acme/api/pull/7");
        assertThat(pr.getCreatedAt()).isEqualTo(Instant.parse("2024-05-06T10:00:00Z"));
        assertThat(pr.getRepository()).isEqualTo("acme/api");
        assertThat(pr.getLabels()).containsExactly("backend", "perf");
        assertThat(pr.getReviewers()).containsExactly("bob", "team:platform", "carol");
        assertThat(pr.isApproved()).isTrue();
        assertThat(pr.isChangesRequested()).isFalse();
    }

    @Test
    void usesConnectionRepositoriesNarrowedByTheFilter() {
        GitProvider connection = connection();
        connection.setRepositories(List.of("acme/api", "acme/web"));
        PullRequestFilter filter = PullRequestFilter.builder().repositories(List.of("acme/web")).build();
        server.expect(requestTo(API + "/repos/acme/web/pulls?state=open&per_page=100"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThat(githubService.fetchPullRequests(connection, List.of(), filter)).isEmpty();
        server.verify();
    }

    @Test
    void repeatedRepositoriesAreFetchedOnceAndAllowListIgnoresCase() {
        PullRequestFilter filter = PullRequestFilter.builder().repositories(List.of("Acme/API")).build();
        server.expect(once(), requestTo(API + "/repos/acme/api/pulls?state=open&per_page=100"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        List<PullRequest> pullRequests = githubService.fetchPullRequests(connection(),
                List.of("acme/api", "ACME/api", "acme/api", "acme/web"), filter);

        assertThat(pullRequests).isEmpty();
        server.verify();
    }

    @Test
    void reviewLookupFailureStillReportsThePullRequest() {
        server.expect(requestTo(API + "/repos/acme/api/pulls?state=open&per_page=100"))
                .andRespond(withSuccess(PULLS, MediaType.APPLICATION_JSON));
        server.expect(requestTo(API + "/repos/acme/api/pulls/7/reviews?per_page=100"))
                .andRespond(withServerError());

        List<PullRequest> pullRequests = githubService.fetchPullRequests(connection(), List.of("acme/api"), null);

        assertThat(pullRequests).singleElement().satisfies(pr -> {
            assertThat(pr.isApproved()).isFalse();
            assertThat(pr.getReviewers()).containsExactly("bob", "team:platform");
        });
    }

    @Test
    void listingFailureIsTranslated() {
        server.expect(requestTo(API + "/repos/acme/api/pulls?state=open&per_page=100"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> githubService.fetchPullRequests(connection(), List.of("acme/api"), null))
                .isInstanceOfSatisfying(ProviderApiException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ProviderApiException.Kind.AUTH_EXPIRED);
                    assertThat(e.getStatus()).isEqualTo(401);
                    assertThat(e.getMessage()).isEqualTo("GitHub token expired or invalid");
                });
    }

    @Test
    void rateLimitIsTranslated() {
        server.expect(requestTo(API + "/repos/acme/api/pulls?state=open&per_page=100"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> githubService.fetchPullRequests(connection(), List.of("acme/api"), null))
                .isInstanceOfSatisfying(ProviderApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ProviderApiException.Kind.RATE_LIMITED));
    }

    @Test
    void oauthConnectionsNeverNeedRefreshing() {
        assertThat(githubService.refreshToken(connection())).isEmpty();
        verifyNoInteractions(jwtService);
    }

    @Test
    void appInstallationTokenIsMintedWithTheAppJwt() throws Exception {
        GitProvider connection = connection();
        connection.setInstallationId("55");
        when(jwtService.generateAppJwt("12345", "/keys/app.pem"))
                .thenReturn(new JwtResponseDTO("app-jwt", Instant.parse("2024-05-10T16:10:00Z")));
        server.expect(requestTo(API + "/app/installations/55/access_tokens"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer app-jwt"))
                .andRespond(withSuccess("{\"token\": \"ghs_new\", \"expires_at\": \"2024-05-10T17:00:00Z\"}",
                        MediaType.APPLICATION_JSON));

        Optional<TokenRefreshDTO> refreshed = githubService.refreshToken(connection);

        server.verify();
        assertThat(refreshed).hasValueSatisfying(tokens -> {
            assertThat(tokens.getAccessToken()).isEqualTo("ghs_new");
            assertThat(tokens.getRefreshToken()).isNull();
            assertThat(tokens.getExpiresAt()).isEqualTo(Instant.parse("2024-05-10T17:00:00Z"));
        });
    }

    private static GitProvider connection() {
        return GitProvider.builder()
                .id("gh-1")
                .provider(GitProviderType.GITHUB)
                .accessToken("gh-token")
                .build();
    }
}
