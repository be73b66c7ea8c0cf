package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.model.PullRequest;
import com.quashbugs.prpulse.model.PullRequestFilter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PullRequestFilterServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-10T16:00:00Z");

    private final PullRequestFilterService filterService = new PullRequestFilterService();

    private final PullRequest backendFix = pr("1", "Fix login timeout", "alice", "acme/api", 2, List.of("bug", "backend"));
    private final PullRequest docs = pr("2", "Update README", "dependabot", "acme/api", 12, List.of("docs"));
    private final PullRequest feature = pr("3", "Add dark mode", "bob", "acme/web", 5, List.of("Feature-Request"));

    @Test
    void emptyFilterReturnsInputUnchanged() {
        List<PullRequest> input = List.of(backendFix, docs, feature);

        assertThat(filterService.apply(input, new PullRequestFilter(), NOW)).containsExactly(backendFix, docs, feature);
        assertThat(filterService.apply(input, null, NOW)).containsExactly(backendFix, docs, feature);
    }

    @Test
    void repositoryAllowListKeepsOnlyListedRepositories() {
        PullRequestFilter filter = PullRequestFilter.builder().repositories(List.of("acme/web")).build();

        assertThat(filterService.apply(List.of(backendFix, docs, feature), filter, NOW)).containsExactly(feature);
    }

    @Test
    void labelsMatchAnySubstringIgnoringCase() {
        PullRequestFilter filter = PullRequestFilter.builder().labels(List.of("feature", "BACK")).build();

        assertThat(filterService.apply(List.of(backendFix, docs, feature), filter, NOW)).containsExactly(backendFix, feature);
    }

    @Test
    void titleKeywordsAndExcludedAuthorsCombine() {
        PullRequestFilter filter = PullRequestFilter.builder()
                .titleKeywords(List.of("fix", "readme"))
                .excludeAuthors(List.of("dependabot"))
                .build();

        assertThat(filterService.apply(List.of(backendFix, docs, feature), filter, NOW)).containsExactly(backendFix);
    }

    @Test
    void ageBoundsAreInclusiveAndZeroMeansUnset() {
        PullRequestFilter bounded = PullRequestFilter.builder().minAge(5).maxAge(12).build();
        PullRequestFilter unset = PullRequestFilter.builder().minAge(0).maxAge(0).build();

        assertThat(filterService.apply(List.of(backendFix, docs, feature), bounded, NOW)).containsExactly(docs, feature);
        assertThat(filterService.apply(List.of(backendFix, docs, feature), unset, NOW)).hasSize(3);
    }

    @Test
    void applyingTheSameFilterTwiceIsIdempotent() {
        PullRequestFilter filter = PullRequestFilter.builder().labels(List.of("bug", "docs")).maxAge(10).build();

        List<PullRequest> once = filterService.apply(List.of(backendFix, docs, feature), filter, NOW);
        assertThat(filterService.apply(once, filter, NOW)).isEqualTo(once);
    }

    @Test
    void validateReportsNegativeAndInvertedAges() {
        PullRequestFilter filter = PullRequestFilter.builder().minAge(10).maxAge(3).labels(List.of()).build();

        assertThat(filterService.validate(filter)).containsExactly(
                "Minimum age cannot be greater than maximum age",
                "Label filter cannot be empty");
        assertThat(filterService.validate(PullRequestFilter.builder().minAge(-1).build()))
                .containsExactly("Minimum age cannot be negative");
        assertThat(filterService.validate(null)).isEmpty();
    }

    @Test
    void describeSummarisesConfiguredCriteria() {
        PullRequestFilter filter = PullRequestFilter.builder()
                .labels(List.of("bug"))
                .excludeAuthors(List.of("dependabot"))
                .minAge(2)
                .build();

        assertThat(filterService.describe(filter))
                .isEqualTo("labels: bug; excluding authors: dependabot; at least 2 days old");
        assertThat(filterService.describe(new PullRequestFilter())).isEqualTo("No filters applied");
    }

    private static PullRequest pr(String id, String title, String author, String repo, int ageDays, List<String> labels) {
        return PullRequest.builder()
                .id(id)
                .title(title)
                .author(author)
                .repository(repo)
                .url("https://example.com/" + id)
                .createdAt(NOW.minus(Duration.ofDays(ageDays)).minusSeconds(60))
                .labels(labels)
                .reviewers(List.of())
                .build();
    }
}
