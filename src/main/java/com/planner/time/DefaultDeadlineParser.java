package com.planner.time;

import com.planner.exception.DeadlineParseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deadline parser for absolute ISO-8601 values and a few relative phrases.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>{@code 2025-03-01T10:15:30Z}, {@code 2025-03-01T10:15:30+02:00}, zoned date-times</li>
 *   <li>{@code 2025-03-01T10:15} or {@code 2025-03-01 10:15} (local, in the configured zone)</li>
 *   <li>{@code 2025-03-01} (start of that day in the configured zone)</li>
 *   <li>{@code now}, {@code today}, {@code tomorrow}, {@code yesterday}</li>
 *   <li>{@code in 3 hours}, {@code 2 days from now}, {@code 30 minutes ago}</li>
 * </ul>
 */
public class DefaultDeadlineParser implements DeadlineParser {

    private static final Pattern IN_AMOUNT = Pattern.compile("^in\\s+(\\d+)\\s+([a-z]+)$");
    private static final Pattern AMOUNT_FROM_NOW = Pattern.compile("^(\\d+)\\s+([a-z]+)\\s+(from\\s+now|ago)$");
    private static final Pattern SPACED_LOCAL_DATE_TIME =
            Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})\\s+(\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?)$");

    // date, optional time, optional offset, optional [region]
    private static final DateTimeFormatter ABSOLUTE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalStart()
            .appendLiteral('[')
            .parseCaseSensitive()
            .appendZoneRegionId()
            .appendLiteral(']')
            .optionalEnd()
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final Map<String, Duration> UNITS = Map.ofEntries(
            Map.entry("minute", Duration.ofMinutes(1)),
            Map.entry("minutes", Duration.ofMinutes(1)),
            Map.entry("min", Duration.ofMinutes(1)),
            Map.entry("mins", Duration.ofMinutes(1)),
            Map.entry("hour", Duration.ofHours(1)),
            Map.entry("hours", Duration.ofHours(1)),
            Map.entry("day", Duration.ofDays(1)),
            Map.entry("days", Duration.ofDays(1)),
            Map.entry("week", Duration.ofDays(7)),
            Map.entry("weeks", Duration.ofDays(7))
    );

    private final Clock clock;
    private final ZoneId zone;

    public DefaultDeadlineParser(Clock clock) {
        this(clock, clock.getZone());
    }

    public DefaultDeadlineParser(Clock clock, ZoneId zone) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.zone = Objects.requireNonNull(zone, "zone cannot be null");
    }

    @Override
    public Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw new DeadlineParseException(text);
        }
        String normalized = text.strip().toLowerCase(Locale.ROOT);

        Instant relative = parseRelative(normalized);
        if (relative != null) {
            return relative;
        }
        return parseAbsolute(text.strip());
    }

    private Instant parseRelative(String text) {
        Instant now = clock.instant();
        if (text.equals("now") || text.equals("today")) {
            return now;
        }
        if (text.equals("tomorrow")) {
            return now.plus(Duration.ofDays(1));
        }
        if (text.equals("yesterday")) {
            return now.minus(Duration.ofDays(1));
        }

        Matcher in = IN_AMOUNT.matcher(text);
        if (in.matches()) {
            return now.plus(amount(text, in.group(1), in.group(2)));
        }
        Matcher fromNow = AMOUNT_FROM_NOW.matcher(text);
        if (fromNow.matches()) {
            Duration amount = amount(text, fromNow.group(1), fromNow.group(2));
            return fromNow.group(3).equals("ago") ? now.minus(amount) : now.plus(amount);
        }
        return null;
    }

    private Duration amount(String text, String count, String unit) {
        Duration perUnit = UNITS.get(unit);
        if (perUnit == null) {
            throw new DeadlineParseException(text);
        }
        try {
            return perUnit.multipliedBy(Long.parseLong(count));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new DeadlineParseException(text, e);
        }
    }

    private Instant parseAbsolute(String text) {
        String candidate = text;
        Matcher spaced = SPACED_LOCAL_DATE_TIME.matcher(text);
        if (spaced.matches()) {
            candidate = spaced.group(1) + "T" + spaced.group(2);
        }

        try {
            TemporalAccessor parsed = ABSOLUTE.parseBest(candidate,
                    ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            if (parsed instanceof LocalDateTime local) {
                return local.atZone(zone).toInstant();
            }
            return ((LocalDate) parsed).atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new DeadlineParseException(text, e);
        }
    }
}
