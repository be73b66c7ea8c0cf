package com.quashbugs.prpulse.adapter;

import com.quashbugs.prpulse.dto.TokenRefreshDTO;
import com.quashbugs.prpulse.model.GitProvider;
import com.quashbugs.prpulse.model.GitProviderType;
import com.quashbugs.prpulse.model.PullRequest;
import com.quashbugs.prpulse.model.PullRequestFilter;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public interface GitProviderAdapter {

    GitProviderType getProviderType();

    /**
     * Lists the open pull requests of the given repositories. Failures are thrown, never swallowed.
     *
     * @param repositories repositories configured on the schedule; when empty the connection's own list is used
     * @param filterHints  the schedule's filter, used only to skip repositories the filter would discard anyway
     */
    List<PullRequest> fetchPullRequests(GitProvider connection, List<String> repositories, PullRequestFilter filterHints);

    /**
     * @return the new credentials, or empty when this kind of connection never needs refreshing
     */
    Optional<TokenRefreshDTO> refreshToken(GitProvider connection);

    /**
     * Schedule repositories, else the connection's, de-duplicated ignoring case and narrowed by the
     * filter's allow-list with the same case-insensitive match the filter pipeline uses.
     */
    default List<String> resolveRepositories(GitProvider connection, List<String> repositories, PullRequestFilter filterHints) {
        List<String> configured = repositories != null && !repositories.isEmpty()
                ? repositories
                : (connection.getRepositories() != null ? connection.getRepositories() : List.of());
        List<String> allowed = filterHints != null && filterHints.getRepositories() != null
                && !filterHints.getRepositories().isEmpty() ? filterHints.getRepositories() : null;

        Set<String> seen = new HashSet<>();
        return configured.stream()
                .filter(Objects::nonNull)
                .filter(repository -> seen.add(repository.toLowerCase(Locale.ROOT)))
                .filter(repository -> allowed == null
                        || allowed.stream().anyMatch(repository::equalsIgnoreCase))
                .toList();
    }
}
