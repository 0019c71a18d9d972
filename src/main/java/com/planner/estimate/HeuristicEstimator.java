package com.planner.estimate;

import com.planner.core.Task;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Derives priority, tags and effort from free text and an optional deadline.
 * <p>
 * Rules, applied in order:
 * <ol>
 *   <li>Keyword tiers over title + description (case-insensitive substring match),
 *       first matching tier wins: urgent/asap/immediately, then high/important,
 *       then low/whenever.</li>
 *   <li>Deadline proximity only tightens priority: within 12h, 24h, 3 days.</li>
 *   <li>Effort = clamp(8 * (words / 20 + 1), 15, 80) over the description.</li>
 * </ol>
 */
public class HeuristicEstimator {

    static final List<String> URGENT_KEYWORDS = List.of("urgent", "asap", "immediately");
    static final List<String> HIGH_KEYWORDS = List.of("high", "important");
    static final List<String> LOW_KEYWORDS = List.of("low", "whenever");

    public static final String TAG_URGENT = "urgent";
    public static final String TAG_HIGH = "high";
    public static final String TAG_LOW = "low";
    public static final String TAG_DUE_12H = "due_12h";
    public static final String TAG_DUE_24H = "due_24h";
    public static final String TAG_DUE_3D = "due_3d";

    private static final Duration WITHIN_12H = Duration.ofHours(12);
    private static final Duration WITHIN_24H = Duration.ofHours(24);
    private static final Duration WITHIN_3D = Duration.ofDays(3);

    private static final int MINUTES_PER_BLOCK = 8;
    private static final int WORDS_PER_BLOCK = 20;
    private static final int MIN_EFFORT_MINUTES = 15;
    private static final int MAX_EFFORT_MINUTES = MINUTES_PER_BLOCK * 10;

    private final Clock clock;

    public HeuristicEstimator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Estimate priority, tags and effort.
     *
     * @param title        Task title (may be null)
     * @param description  Task description (may be null)
     * @param userDeadline Deadline supplied by the caller, or null
     * @return the estimate
     */
    public Estimate estimate(String title, String description, Instant userDeadline) {
        String safeDescription = description != null ? description : "";
        String text = ((title != null ? title : "") + " " + safeDescription).toLowerCase(Locale.ROOT);

        List<String> tags = new ArrayList<>();
        int priority = Task.DEFAULT_PRIORITY;

        if (containsAny(text, URGENT_KEYWORDS)) {
            priority = 1;
            tags.add(TAG_URGENT);
        } else if (containsAny(text, HIGH_KEYWORDS)) {
            priority = Math.min(priority, 2);
            tags.add(TAG_HIGH);
        } else if (containsAny(text, LOW_KEYWORDS)) {
            priority = Math.max(priority, 7);
            tags.add(TAG_LOW);
        }

        if (userDeadline != null) {
            Duration remaining = Duration.between(clock.instant(), userDeadline);
            if (remaining.compareTo(WITHIN_12H) <= 0) {
                priority = Math.min(priority, 1);
                tags.add(TAG_DUE_12H);
            } else if (remaining.compareTo(WITHIN_24H) <= 0) {
                priority = Math.min(priority, 2);
                tags.add(TAG_DUE_24H);
            } else if (remaining.compareTo(WITHIN_3D) <= 0) {
                priority = Math.min(priority, 3);
                tags.add(TAG_DUE_3D);
            }
        }

        return new Estimate(priority, userDeadline, tags, estimateEffortMinutes(safeDescription));
    }

    /**
     * Effort estimate from description length.
     */
    static int estimateEffortMinutes(String description) {
        int words = wordCount(description);
        int raw = MINUTES_PER_BLOCK * (words / WORDS_PER_BLOCK + 1);
        return Math.max(MIN_EFFORT_MINUTES, Math.min(raw, MAX_EFFORT_MINUTES));
    }

    static int wordCount(String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("\\s+").length;
    }

    static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
