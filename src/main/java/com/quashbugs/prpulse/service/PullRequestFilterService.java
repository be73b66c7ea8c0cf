package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.model.PullRequest;
import com.quashbugs.prpulse.model.PullRequestFilter;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Narrows a fetched pull request list down to what a schedule cares about. Stateless; input order is
 * preserved and a filter with nothing configured returns the input unchanged.
 */
@Service
public class PullRequestFilterService {

    public List<PullRequest> apply(List<PullRequest> pullRequests, PullRequestFilter filter, Instant now) {
        if (pullRequests == null || pullRequests.isEmpty()) {
            return List.of();
        }
        if (filter == null) {
            return pullRequests;
        }

        List<Predicate<PullRequest>> stages = new ArrayList<>();
        if (isSet(filter.getRepositories())) {
            stages.add(pr -> filter.getRepositories().stream()
                    .anyMatch(repo -> repo.equalsIgnoreCase(pr.getRepository())));
        }
        if (isSet(filter.getLabels())) {
            stages.add(pr -> pr.getLabels() != null && pr.getLabels().stream()
                    .anyMatch(label -> containsAny(label, filter.getLabels())));
        }
        if (isSet(filter.getTitleKeywords())) {
            stages.add(pr -> containsAny(pr.getTitle(), filter.getTitleKeywords()));
        }
        if (isSet(filter.getExcludeAuthors())) {
            stages.add(pr -> !filter.getExcludeAuthors().contains(pr.getAuthor()));
        }
        if (isSet(filter.getMinAge())) {
            stages.add(pr -> pr.ageInDays(now) >= filter.getMinAge());
        }
        if (isSet(filter.getMaxAge())) {
            stages.add(pr -> pr.ageInDays(now) <= filter.getMaxAge());
        }

        if (stages.isEmpty()) {
            return pullRequests;
        }
        Predicate<PullRequest> combined = stages.stream().reduce(pr -> true, Predicate::and);
        return pullRequests.stream().filter(combined).toList();
    }

    /**
     * @return human readable problems with the filter, empty when it is usable
     */
    public List<String> validate(PullRequestFilter filter) {
        List<String> errors = new ArrayList<>();
        if (filter == null) {
            return errors;
        }
        if (filter.getMinAge() != null && filter.getMinAge() < 0) {
            errors.add("Minimum age cannot be negative");
        }
        if (filter.getMaxAge() != null && filter.getMaxAge() < 0) {
            errors.add("Maximum age cannot be negative");
        }
        if (isSet(filter.getMinAge()) && isSet(filter.getMaxAge()) && filter.getMinAge() > filter.getMaxAge()) {
            errors.add("Minimum age cannot be greater than maximum age");
        }
        checkNotEmpty(filter.getRepositories(), "Repository filter cannot be empty", errors);
        checkNotEmpty(filter.getLabels(), "Label filter cannot be empty", errors);
        checkNotEmpty(filter.getTitleKeywords(), "Title keyword filter cannot be empty", errors);
        checkNotEmpty(filter.getExcludeAuthors(), "Excluded author filter cannot be empty", errors);
        return errors;
    }

    public String describe(PullRequestFilter filter) {
        if (filter == null) {
            return "No filters applied";
        }
        List<String> parts = new ArrayList<>();
        if (isSet(filter.getRepositories())) {
            parts.add("repositories: " + String.join(", ", filter.getRepositories()));
        }
        if (isSet(filter.getLabels())) {
            parts.add("labels: " + String.join(", ", filter.getLabels()));
        }
        if (isSet(filter.getTitleKeywords())) {
            parts.add("title contains: " + String.join(", ", filter.getTitleKeywords()));
        }
        if (isSet(filter.getExcludeAuthors())) {
            parts.add("excluding authors: " + String.join(", ", filter.getExcludeAuthors()));
        }
        if (isSet(filter.getMinAge())) {
            parts.add("at least " + filter.getMinAge() + " days old");
        }
        if (isSet(filter.getMaxAge())) {
            parts.add("at most " + filter.getMaxAge() + " days old");
        }
        return parts.isEmpty() ? "No filters applied" : String.join("; ", parts);
    }

    private static boolean containsAny(String value, List<String> needles) {
        if (value == null) {
            return false;
        }
        String haystack = value.toLowerCase(Locale.ROOT);
        return needles.stream().anyMatch(needle -> haystack.contains(needle.toLowerCase(Locale.ROOT)));
    }

    private static void checkNotEmpty(List<String> values, String message, List<String> errors) {
        if (values != null && values.stream().allMatch(value -> value == null || value.isBlank())) {
            errors.add(message);
        }
    }

    private static boolean isSet(List<String> values) {
        return values != null && !values.isEmpty();
    }

    // zero means "not configured"
    private static boolean isSet(Integer age) {
        return age != null && age > 0;
    }
}
