package com.planner.estimate;

import java.time.Instant;

/**
 * Output of the natural-language parse stub.
 *
 * @param title       Possibly truncated title
 * @param description Full input text
 * @param deadline    Inferred deadline, or null
 * @param urgent      Whether an urgency keyword was found
 */
public record ParsedTask(
        String title,
        String description,
        Instant deadline,
        boolean urgent
) {
}
