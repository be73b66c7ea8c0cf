package com.quashbugs.prpulse.service;

import com.quashbugs.prpulse.dto.MessageStyle;
import com.quashbugs.prpulse.dto.RenderedMessageDTO;
import com.quashbugs.prpulse.model.PullRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders pull request digests for chat providers, either as Slack style blocks or as markdown flavoured
 * plain text. Every size cap that kicks in leaves a visible notice and sets
 * {@link RenderedMessageDTO#isTruncated()}.
 */
@Service
public class NotificationFormatService {

    static final String DEFAULT_TITLE = "Daily reminder for open pull requests";
    static final String ALL_CLEAR = "All clear! No open pull requests need attention right now.";
    static final String TRUNCATION_NOTICE = "_...message truncated, open the repository for the full list_";
    static final int SLACK_SECTION_LIMIT = 3000;

    enum Category {
        READY_TO_MERGE("✅", "Ready to Merge", "ready"),
        NEEDS_CHANGES("🔧", "Needs Changes", "changes"),
        STALE("⏰", "Stale", "stale"),
        UNDER_REVIEW("👀", "Under Review", "in review"),
        AWAITING_REVIEW("📝", "Awaiting Review", "awaiting");

        final String emoji;
        final String heading;
        final String shortName;

        Category(String emoji, String heading, String shortName) {
            this.emoji = emoji;
            this.heading = heading;
            this.shortName = shortName;
        }
    }

    private static final long STALE_DAYS = 7;

    private final Clock clock;
    private final int maxPrsPerCategory;
    private final int maxTitleLength;
    private final int maxTextLength;
    private final int maxBlocks;

    @Autowired
    public NotificationFormatService(Clock clock,
                                     @Value("${spring.notification.max-prs-per-category:10}") int maxPrsPerCategory,
                                     @Value("${spring.notification.max-title-length:60}") int maxTitleLength,
                                     @Value("${spring.notification.max-text-length:1900}") int maxTextLength,
                                     @Value("${spring.notification.max-blocks:50}") int maxBlocks) {
        this.clock = clock;
        this.maxPrsPerCategory = maxPrsPerCategory;
        this.maxTitleLength = maxTitleLength;
        this.maxTextLength = maxTextLength;
        this.maxBlocks = maxBlocks;
    }

    public RenderedMessageDTO formatNotification(String scheduleName, List<PullRequest> pullRequests, MessageStyle style) {
        String title = scheduleName != null && !scheduleName.isBlank() ? scheduleName : DEFAULT_TITLE;
        if (pullRequests.isEmpty()) {
            return renderAllClear(title, style);
        }

        Map<Category, List<PullRequest>> categorized = categorize(pullRequests);
        String summary = pullRequests.size() + " open pull request" + (pullRequests.size() == 1 ? "" : "s")
                + ": " + categorized.entrySet().stream()
                .map(entry -> entry.getValue().size() + " " + entry.getKey().shortName)
                .collect(Collectors.joining(" · "));

        Map<String, List<PullRequest>> sections = new LinkedHashMap<>();
        categorized.forEach((category, prs) ->
                sections.put(category.emoji + " " + category.heading + " (" + prs.size() + ")", prs));
        return render(title, summary, sections, null, pullRequests.size(), style);
    }

    public RenderedMessageDTO formatEscalation(String scheduleName, List<PullRequest> pullRequests,
                                               int escalationDays, MessageStyle style) {
        String title = "🚨 Escalated pull requests"
                + (scheduleName != null && !scheduleName.isBlank() ? ": " + scheduleName : "");
        String summary = pullRequests.size() + " pull request" + (pullRequests.size() == 1 ? " has" : "s have")
                + " been waiting too long";
        Map<String, List<PullRequest>> sections = new LinkedHashMap<>();
        sections.put("Open for " + escalationDays + "+ days (" + pullRequests.size() + ")", pullRequests);
        String footer = "These pull requests crossed the " + escalationDays + " day escalation threshold. "
                + "Please review or close them.";
        return render(title, summary, sections, footer, pullRequests.size(), style);
    }

    Map<Category, List<PullRequest>> categorize(List<PullRequest> pullRequests) {
        Instant now = clock.instant();
        Map<Category, List<PullRequest>> categorized = new EnumMap<>(Category.class);
        for (PullRequest pullRequest : pullRequests) {
            categorized.computeIfAbsent(categoryOf(pullRequest, now), key -> new ArrayList<>()).add(pullRequest);
        }
        return categorized;
    }

    // first match wins, in display priority order
    static Category categoryOf(PullRequest pullRequest, Instant now) {
        if (pullRequest.isApproved() && !pullRequest.isChangesRequested()) {
            return Category.READY_TO_MERGE;
        }
        if (pullRequest.isChangesRequested()) {
            return Category.NEEDS_CHANGES;
        }
        if (pullRequest.ageInDays(now) >= STALE_DAYS) {
            return Category.STALE;
        }
        if (pullRequest.hasReviewers()) {
            return Category.UNDER_REVIEW;
        }
        return Category.AWAITING_REVIEW;
    }

    private RenderedMessageDTO renderAllClear(String title, MessageStyle style) {
        if (style == MessageStyle.BLOCKS) {
            List<Map<String, Object>> blocks = List.of(header(title), section("🎉 " + ALL_CLEAR));
            return RenderedMessageDTO.builder()
                    .text(title + ": " + ALL_CLEAR)
                    .blocks(blocks)
                    .pullRequestCount(0)
                    .empty(true)
                    .build();
        }
        return RenderedMessageDTO.builder()
                .text("**" + title + "**\n🎉 " + ALL_CLEAR)
                .pullRequestCount(0)
                .empty(true)
                .build();
    }

    private RenderedMessageDTO render(String title, String summary, Map<String, List<PullRequest>> sections,
                                      String footer, int count, MessageStyle style) {
        return style == MessageStyle.BLOCKS
                ? renderBlocks(title, summary, sections, footer, count)
                : renderPlainText(title, summary, sections, footer, count);
    }

    private RenderedMessageDTO renderBlocks(String title, String summary, Map<String, List<PullRequest>> sections,
                                            String footer, int count) {
        Instant now = clock.instant();
        boolean truncated = false;
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(header(title));
        blocks.add(context(summary));

        for (Map.Entry<String, List<PullRequest>> entry : sections.entrySet()) {
            List<String> lines = new ArrayList<>();
            lines.add("*" + entry.getKey() + "*");
            truncated |= appendLines(lines, entry.getValue(), pr -> slackLine(pr, now));

            String text = String.join("\n", lines);
            if (text.length() > SLACK_SECTION_LIMIT) {
                text = cutAtLine(text, SLACK_SECTION_LIMIT - TRUNCATION_NOTICE.length() - 1) + "\n" + TRUNCATION_NOTICE;
                truncated = true;
            }
            blocks.add(divider());
            blocks.add(section(text));
        }
        if (footer != null) {
            blocks.add(context(footer));
        }

        if (blocks.size() > maxBlocks) {
            blocks = new ArrayList<>(blocks.subList(0, maxBlocks - 1));
            blocks.add(context(TRUNCATION_NOTICE));
            truncated = true;
        }

        return RenderedMessageDTO.builder()
                .text(title + ": " + summary)
                .blocks(blocks)
                .pullRequestCount(count)
                .truncated(truncated)
                .build();
    }

    private RenderedMessageDTO renderPlainText(String title, String summary, Map<String, List<PullRequest>> sections,
                                               String footer, int count) {
        Instant now = clock.instant();
        boolean truncated = false;
        List<String> lines = new ArrayList<>();
        lines.add("**" + title + "**");
        lines.add(summary);
        for (Map.Entry<String, List<PullRequest>> entry : sections.entrySet()) {
            lines.add("");
            lines.add("**" + entry.getKey() + "**");
            truncated |= appendLines(lines, entry.getValue(), pr -> markdownLine(pr, now));
        }
        if (footer != null) {
            lines.add("");
            lines.add(footer);
        }

        String text = String.join("\n", lines);
        if (text.length() > maxTextLength) {
            text = cutAtLine(text, maxTextLength - TRUNCATION_NOTICE.length() - 1) + "\n" + TRUNCATION_NOTICE;
            truncated = true;
        }
        return RenderedMessageDTO.builder()
                .text(text)
                .pullRequestCount(count)
                .truncated(truncated)
                .build();
    }

    /**
     * @return whether PRs were left out of the listing
     */
    private boolean appendLines(List<String> lines, List<PullRequest> pullRequests,
                                Function<PullRequest, String> renderer) {
        pullRequests.stream().limit(maxPrsPerCategory).map(renderer).forEach(lines::add);
        int hidden = pullRequests.size() - maxPrsPerCategory;
        if (hidden > 0) {
            lines.add("_...and " + hidden + " more_");
            return true;
        }
        return false;
    }

    private String slackLine(PullRequest pr, Instant now) {
        String title = truncateTitle(pr.getTitle()).replace("&", "&amp;").replace("<", "&lt;")
                .replace(">", "&gt;").replace("|", "¦");
        return "• <" + pr.getUrl() + "|" + title + "> by " + pr.getAuthor() + details(pr, now);
    }

    private String markdownLine(PullRequest pr, Instant now) {
        String title = truncateTitle(pr.getTitle()).replace("[", "(").replace("]", ")");
        return "• [" + title + "](" + pr.getUrl() + ") by " + pr.getAuthor() + details(pr, now);
    }

    private String details(PullRequest pr, Instant now) {
        StringBuilder details = new StringBuilder(" · ").append(formatAge(pr.ageInDays(now)));
        if (pr.getAdditions() != null && pr.getDeletions() != null) {
            details.append(" (+").append(pr.getAdditions()).append("/-").append(pr.getDeletions()).append(")");
        }
        if (pr.getLabels() != null && !pr.getLabels().isEmpty()) {
            details.append(" [").append(pr.getLabels().stream().limit(3).collect(Collectors.joining(", "))).append("]");
        }
        return details.toString();
    }

    String truncateTitle(String title) {
        if (title == null) {
            return "(untitled)";
        }
        return title.length() > maxTitleLength ? title.substring(0, maxTitleLength - 3) + "..." : title;
    }

    static String formatAge(long days) {
        if (days <= 0) {
            return "today";
        }
        return days + "d";
    }

    private static String cutAtLine(String text, int limit) {
        String cut = text.substring(0, Math.max(0, limit));
        int lastNewline = cut.lastIndexOf('\n');
        return lastNewline > 0 ? cut.substring(0, lastNewline) : cut;
    }

    private static Map<String, Object> header(String text) {
        return Map.of("type", "header", "text", Map.of("type", "plain_text", "text", text, "emoji", true));
    }

    private static Map<String, Object> section(String markdown) {
        return Map.of("type", "section", "text", Map.of("type", "mrkdwn", "text", markdown));
    }

    private static Map<String, Object> context(String markdown) {
        return Map.of("type", "context", "elements", List.of(Map.of("type", "mrkdwn", "text", markdown)));
    }

    private static Map<String, Object> divider() {
        return Map.of("type", "divider");
    }
}
