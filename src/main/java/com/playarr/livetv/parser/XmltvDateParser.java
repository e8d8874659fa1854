package com.playarr.livetv.parser;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses XMLTV timestamps such as {@code 20241204163000 +0100}.
 *
 * The offset is optional and defaults to UTC. Anything that does not match the XMLTV shape is tried
 * as an ISO-8601 date-time. Results outside 1970..2100 are rejected.
 */
public final class XmltvDateParser {

    private static final Pattern XMLTV_DATE = Pattern.compile(
            "^(\\d{4})(\\d{2})(\\d{2})(\\d{2})(\\d{2})(\\d{2})(?:\\s*([+-])(\\d{2})(\\d{2}))?$");
    private static final int MIN_YEAR = 1970;
    private static final int MAX_YEAR = 2100;
    private static final int MAX_OFFSET_HOURS = 14;

    private XmltvDateParser() {
    }

    public static Optional<Instant> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        Matcher matcher = XMLTV_DATE.matcher(trimmed);
        Optional<Instant> parsed = matcher.matches() ? parseXmltv(matcher) : parseIso(trimmed);
        return parsed.filter(XmltvDateParser::inRange);
    }

    private static Optional<Instant> parseXmltv(Matcher matcher) {
        int year = Integer.parseInt(matcher.group(1));
        int month = Integer.parseInt(matcher.group(2));
        int day = Integer.parseInt(matcher.group(3));
        int hour = Integer.parseInt(matcher.group(4));
        int minute = Integer.parseInt(matcher.group(5));
        int second = Integer.parseInt(matcher.group(6));

        if (year < MIN_YEAR || year > MAX_YEAR) {
            return Optional.empty();
        }

        ZoneOffset offset = ZoneOffset.UTC;
        if (matcher.group(7) != null) {
            int offsetHours = Integer.parseInt(matcher.group(8));
            int offsetMinutes = Integer.parseInt(matcher.group(9));
            if (offsetHours > MAX_OFFSET_HOURS || offsetMinutes > 59) {
                return Optional.empty();
            }
            int sign = "+".equals(matcher.group(7)) ? 1 : -1;
            try {
                offset = ZoneOffset.ofTotalSeconds(sign * (offsetHours * 3600 + offsetMinutes * 60));
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }

        try {
            // rejects month 13, Feb 30, hour 24 and the like
            return Optional.of(LocalDateTime.of(year, month, day, hour, minute, second).toInstant(offset));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseIso(String value) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return Optional.of(offsetDateTime.toInstant());
            }
            return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static boolean inRange(Instant instant) {
        int year = instant.atOffset(ZoneOffset.UTC).getYear();
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }
}
