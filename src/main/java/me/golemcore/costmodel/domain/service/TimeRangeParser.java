package me.golemcore.costmodel.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.costmodel.domain.exception.InvalidRangeException;
import me.golemcore.costmodel.domain.model.TimeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Prometheus-style durations and resolves cost windows against the
 * current time.
 *
 * <p>
 * Durations are one or more {@code <number><unit>} terms in descending unit
 * order, with units {@code w}, {@code d}, {@code h}, {@code m}, {@code s} and
 * {@code ms}, e.g. {@code 24h}, {@code 7d} or {@code 1h30m}.
 */
@Component
@RequiredArgsConstructor
public class TimeRangeParser {

    private static final Pattern DURATION = Pattern.compile(
            "^(?:(\\d+)w)?(?:(\\d+)d)?(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?(?:(\\d+)ms)?$");
    private static final String OFFSET_PREFIX = "offset ";

    private final Clock clock;

    /**
     * Resolve a window ending {@code offset} before now.
     *
     * @param window
     *            window length, e.g. {@code 24h}
     * @param offset
     *            how far the end is shifted into the past; blank means none
     * @throws InvalidRangeException
     *             if either value is unparsable, the window is zero-length or
     *             the resulting instants are out of range
     */
    public TimeWindow resolveWindow(String window, String offset) {
        Duration windowDuration = parseDuration(window);
        if (windowDuration.isZero()) {
            throw new InvalidRangeException("illegal time range: window '" + window + "' has zero length");
        }
        Duration offsetDuration = parseOffset(offset);

        Instant end;
        Instant start;
        try {
            end = clock.instant().minus(offsetDuration);
            start = end.minus(windowDuration);
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidRangeException("illegal time range: window '" + window + "' offset '" + offset
                    + "' falls outside the supported instants", e);
        }
        if (!end.isAfter(start)) {
            throw new InvalidRangeException("illegal time range: " + start + " to " + end);
        }
        return new TimeWindow(start, end);
    }

    /**
     * Parse an offset, accepting an optional leading {@code offset } keyword.
     * Blank means no offset.
     */
    public Duration parseOffset(String offset) {
        if (offset == null || offset.isBlank()) {
            return Duration.ZERO;
        }
        String trimmed = offset.trim();
        if (trimmed.startsWith(OFFSET_PREFIX)) {
            trimmed = trimmed.substring(OFFSET_PREFIX.length()).trim();
        }
        return parseDuration(trimmed);
    }

    /**
     * @throws InvalidRangeException
     *             if the text is not a duration
     */
    public Duration parseDuration(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidRangeException("Duration is empty");
        }
        String trimmed = text.trim();
        if ("0".equals(trimmed)) {
            return Duration.ZERO;
        }
        Matcher matcher = DURATION.matcher(trimmed);
        if (!matcher.matches()) {
            throw new InvalidRangeException("Invalid duration '" + text + "'");
        }
        try {
            return Duration.ofDays(Math.multiplyExact(7L, group(matcher, 1)))
                    .plusDays(group(matcher, 2))
                    .plusHours(group(matcher, 3))
                    .plusMinutes(group(matcher, 4))
                    .plusSeconds(group(matcher, 5))
                    .plusMillis(group(matcher, 6));
        } catch (ArithmeticException | NumberFormatException e) {
            throw new InvalidRangeException("Duration out of range '" + text + "'", e);
        }
    }

    /**
     * Parse an ISO-8601 instant such as {@code 2024-01-01T00:00:00.000Z}.
     *
     * @throws InvalidRangeException
     *             if the text is not an instant
     */
    public Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidRangeException("Timestamp is empty");
        }
        try {
            return Instant.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidRangeException("Invalid timestamp '" + text + "'", e);
        }
    }

    private static long group(Matcher matcher, int index) {
        String value = matcher.group(index);
        return value == null ? 0 : Long.parseLong(value);
    }
}
