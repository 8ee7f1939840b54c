package com.mike.reportpopulator.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first date in a message and attaches a time written close to it.
 * Values are naive local timestamps; no zone is inferred.
 */
@Component
@Slf4j
public class DateTimeExtractor {

    static final int TIME_WINDOW_CHARS = 20;

    /**
     * Tried in this order and the first combined string that parses wins. "HH:MM" comes
     * first, so seconds and an AM/PM suffix next to the date are not picked up:
     * "14:30:45" reads as 14:30 and "2:30 PM" as 02:30.
     */
    private static final List<Pattern> TIME_PATTERNS = List.of(
            Pattern.compile("\\d{1,2}:\\d{2}"),
            Pattern.compile("\\d{1,2}:\\d{2}:\\d{2}"),
            Pattern.compile("\\d{1,2}:\\d{2}\\s*[AP]M", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern MERIDIEM = Pattern.compile("\\s*([AaPp][Mm])$");

    /**
     * D/M/Y is tried before M/D/Y, so "03/04/2025" reads as 3 April.
     */
    private static final List<Layout> LAYOUTS = List.of(
            Layout.withTime("uuuu-MM-dd H:mm"),
            Layout.withTime("uuuu-MM-dd H:mm:ss"),
            Layout.withTime("uuuu-MM-dd h:mm a"),
            Layout.dateOnly("uuuu-MM-dd"),
            Layout.withTime("d/M/uuuu H:mm"),
            Layout.withTime("M/d/uuuu H:mm"),
            Layout.dateOnly("d/M/uuuu"),
            Layout.dateOnly("M/d/uuuu"),
            Layout.withTime("MMMM d, uuuu H:mm"),
            Layout.dateOnly("MMMM d, uuuu"),
            Layout.dateOnly("MMMM d uuuu")
    );

    public Optional<LocalDateTime> extract(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();

        for (DateShape shape : DateShape.values()) {
            Matcher dateMatch = shape.pattern.matcher(text);
            if (!dateMatch.find()) continue;

            String date = shape.canonical(dateMatch.group());
            String window = text.substring(
                    Math.max(0, dateMatch.start() - TIME_WINDOW_CHARS),
                    Math.min(text.length(), dateMatch.end() + TIME_WINDOW_CHARS));

            for (Pattern timePattern : TIME_PATTERNS) {
                Matcher timeMatch = timePattern.matcher(window);
                if (!timeMatch.find()) continue;

                Optional<LocalDateTime> combined = parse(date + " " + canonicalTime(timeMatch.group()));
                if (combined.isPresent()) return combined;
            }

            Optional<LocalDateTime> dateOnly = parse(date);
            if (dateOnly.isPresent()) return dateOnly;

            log.debug("DateTimeExtractor: date candidate '{}' could not be parsed", date);
        }

        log.debug("DateTimeExtractor: no date/time found");
        return Optional.empty();
    }

    Optional<LocalDateTime> parse(String value) {
        for (Layout layout : LAYOUTS) {
            try {
                return Optional.of(layout.parse(value));
            } catch (DateTimeParseException e) {
                log.trace("DateTimeExtractor: '{}' does not fit layout {}", value, layout.pattern());
            }
        }
        return Optional.empty();
    }

    private String canonicalTime(String raw) {
        String time = raw.trim();
        Matcher m = MERIDIEM.matcher(time);
        if (!m.find()) return time;
        return time.substring(0, m.start()) + " " + m.group(1).toUpperCase(Locale.ROOT);
    }

    private enum DateShape {
        ISO(Pattern.compile("\\d{4}-\\d{2}-\\d{2}")),
        NUMERIC(Pattern.compile("\\d{1,2}[/.-]\\d{1,2}[/.-]\\d{4}")),
        TEXTUAL(Pattern.compile("(?:January|February|March|April|May|June|July|August|September|October|November|December)"
                + "\\s+\\d{1,2},?\\s+\\d{4}", Pattern.CASE_INSENSITIVE));

        private static final Pattern NUMERIC_SEPARATOR = Pattern.compile("[.-]");
        private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

        private final Pattern pattern;

        DateShape(Pattern pattern) {
            this.pattern = pattern;
        }

        /** Folds "15.03.2025" and "15-03-2025" onto the slash layouts. */
        String canonical(String raw) {
            return switch (this) {
                case ISO -> raw;
                case NUMERIC -> NUMERIC_SEPARATOR.matcher(raw).replaceAll("/");
                case TEXTUAL -> WHITESPACE_RUN.matcher(raw).replaceAll(" ");
            };
        }
    }

    private record Layout(String pattern, DateTimeFormatter formatter, boolean hasTime) {

        static Layout withTime(String pattern) {
            return new Layout(pattern, formatter(pattern), true);
        }

        static Layout dateOnly(String pattern) {
            return new Layout(pattern, formatter(pattern), false);
        }

        private static DateTimeFormatter formatter(String pattern) {
            return new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern(pattern)
                    .toFormatter(Locale.ENGLISH)
                    .withResolverStyle(ResolverStyle.STRICT);
        }

        LocalDateTime parse(String value) {
            return hasTime
                    ? LocalDateTime.parse(value, formatter)
                    : LocalDate.parse(value, formatter).atStartOfDay();
        }
    }
}
