package com.planner.time;

import java.time.Instant;

/**
 * Converts deadline text into an absolute timestamp.
 */
@FunctionalInterface
public interface DeadlineParser {

    /**
     * Parse deadline text.
     *
     * @param text Non-blank deadline text
     * @return Absolute timestamp
     * @throws com.planner.exception.DeadlineParseException if the text is not understood
     */
    Instant parse(String text);
}
