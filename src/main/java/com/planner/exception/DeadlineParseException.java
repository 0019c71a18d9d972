package com.planner.exception;

/**
 * Exception thrown when deadline text cannot be turned into a timestamp.
 */
public class DeadlineParseException extends PlannerException {

    private final String text;

    public DeadlineParseException(String text) {
        super("Unable to parse deadline: '" + text + "'");
        this.text = text;
    }

    public DeadlineParseException(String text, Throwable cause) {
        super("Unable to parse deadline: '" + text + "'", cause);
        this.text = text;
    }

    /**
     * The offending input.
     */
    public String getText() {
        return text;
    }
}
