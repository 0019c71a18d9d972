package com.planner.estimate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Best-effort parse of a raw sentence into task fields.
 * <p>
 * This is a keyword stub, not natural-language understanding. It only knows:
 * <ul>
 *   <li>title truncation to 57 characters plus "..." when the text exceeds 60</li>
 *   <li>"tomorrow" (now + 1 day) and "today" (now); "tomorrow" wins when both appear</li>
 *   <li>the urgent keyword tier (urgent, asap, immediately)</li>
 * </ul>
 */
public class NaturalLanguageParser {

    static final int MAX_TITLE_LENGTH = 60;
    static final int TRUNCATED_TITLE_LENGTH = 57;
    static final String ELLIPSIS = "...";

    private final Clock clock;

    public NaturalLanguageParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public ParsedTask parse(String naturalText) {
        String text = naturalText != null ? naturalText : "";
        String title = text.length() <= MAX_TITLE_LENGTH
                ? text
                : text.substring(0, TRUNCATED_TITLE_LENGTH) + ELLIPSIS;

        String lower = text.toLowerCase(Locale.ROOT);
        Instant now = clock.instant();
        Instant deadline = null;
        if (lower.contains("tomorrow")) {
            deadline = now.plus(Duration.ofDays(1));
        } else if (lower.contains("today")) {
            deadline = now;
        }

        boolean urgent = HeuristicEstimator.containsAny(lower, HeuristicEstimator.URGENT_KEYWORDS);
        return new ParsedTask(title, text, deadline, urgent);
    }
}
