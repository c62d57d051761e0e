package me.bantu.agent.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves short natural-language time phrases to local date-times.
 *
 * <p>
 * Rules are tried in a fixed order and the first that matches wins, no matter
 * where in the phrase it matches:
 * <ol>
 * <li>absolute {@code YYYY-MM-DD HH:MM}</li>
 * <li>{@code in <N> minutes|hours} relative to now</li>
 * <li>{@code tomorrow}, with an optional am/pm hour or {@code HH:MM}; 09:00
 * otherwise</li>
 * <li>{@code today}, a leading {@code at } or an inner {@code  at }, with an
 * am/pm hour or {@code HH:MM}</li>
 * <li>a bare am/pm hour or {@code HH:MM}</li>
 * </ol>
 * Rules 4 and 5 pick today's occurrence and roll to the next day when it is
 * not strictly after now. Results outside years 1 to 9999 are treated as
 * unparseable.
 *
 * <p>
 * Examples: {@code "tomorrow at 8AM"}, {@code "at 14:00"},
 * {@code "in 30 minutes"}, {@code "2025-10-01 14:00"}, {@code "8pm"}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimeExpressionParser {

    private static final Pattern AMPM = Pattern.compile("\\b(1[0-2]|0?[1-9])\\s*(am|pm)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern HHMM = Pattern.compile("\\b([01]?\\d|2[0-3]):([0-5]\\d)\\b");
    private static final Pattern IN_X = Pattern.compile("\\bin\\s+(\\d+)\\s+(minute|minutes|hour|hours)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DATE_TIME = Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\s+(\\d{1,2}:\\d{2})\\b");

    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd H:mm")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final int DEFAULT_HOUR = 9;
    private static final int MIN_YEAR = 1;
    private static final int MAX_YEAR = 9999;

    private final Clock clock;

    /**
     * Parses relative to the current time of the configured clock.
     */
    public Optional<LocalDateTime> parse(String text) {
        return parse(text, LocalDateTime.now(clock));
    }

    public Optional<LocalDateTime> parse(String text, LocalDateTime now) {
        if (text == null) {
            return Optional.empty();
        }
        try {
            return resolve(text, now).filter(TimeExpressionParser::isInRange);
        } catch (NumberFormatException | DateTimeException | ArithmeticException e) {
            log.debug("[Scheduler] Time out of range in '{}': {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<LocalDateTime> resolve(String text, LocalDateTime now) {
        String trimmed = text.trim();

        Optional<LocalDateTime> absolute = parseAbsolute(trimmed);
        if (absolute.isPresent()) {
            return absolute;
        }

        Matcher inX = IN_X.matcher(trimmed);
        if (inX.find()) {
            long amount = Long.parseLong(inX.group(1));
            boolean minutes = inX.group(2).toLowerCase(Locale.ROOT).startsWith("minute");
            return Optional.of(minutes ? now.plusMinutes(amount) : now.plusHours(amount));
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);

        if (lower.contains("tomorrow")) {
            LocalDateTime base = now.plusDays(1).truncatedTo(ChronoUnit.MINUTES);
            Optional<LocalDateTime> timed = applyTimeOfDay(lower, base);
            return Optional.of(timed.orElse(base.withHour(DEFAULT_HOUR).withMinute(0)));
        }

        if (lower.contains("today") || lower.startsWith("at ") || lower.contains(" at ")) {
            LocalDateTime base = now.truncatedTo(ChronoUnit.MINUTES);
            Optional<LocalDateTime> timed = applyTimeOfDay(lower, base);
            if (timed.isPresent()) {
                return timed.map(candidate -> nextOccurrence(candidate, now));
            }
        }

        LocalDateTime base = now.truncatedTo(ChronoUnit.MINUTES);
        return applyTimeOfDay(lower, base).map(candidate -> nextOccurrence(candidate, now));
    }

    private Optional<LocalDateTime> parseAbsolute(String text) {
        Matcher matcher = DATE_TIME.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String candidate = matcher.group(1) + " " + matcher.group(2);
        try {
            return Optional.of(LocalDateTime.parse(candidate, DATE_TIME_FORMAT))
                    .filter(TimeExpressionParser::isInRange);
        } catch (DateTimeParseException e) {
            log.debug("[Scheduler] Ignoring invalid date-time '{}': {}", candidate, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Applies the first am/pm hour, or failing that the first {@code HH:MM}, to
     * the base date.
     */
    private Optional<LocalDateTime> applyTimeOfDay(String lower, LocalDateTime base) {
        Matcher ampm = AMPM.matcher(lower);
        if (ampm.find()) {
            int hour = to24Hour(Integer.parseInt(ampm.group(1)), ampm.group(2));
            return Optional.of(base.withHour(hour).withMinute(0));
        }
        Matcher hhmm = HHMM.matcher(lower);
        if (hhmm.find()) {
            return Optional.of(base
                    .withHour(Integer.parseInt(hhmm.group(1)))
                    .withMinute(Integer.parseInt(hhmm.group(2))));
        }
        return Optional.empty();
    }

    private static boolean isInRange(LocalDateTime value) {
        return value.getYear() >= MIN_YEAR && value.getYear() <= MAX_YEAR;
    }

    private static LocalDateTime nextOccurrence(LocalDateTime candidate, LocalDateTime now) {
        return candidate.isAfter(now) ? candidate : candidate.plusDays(1);
    }

    static int to24Hour(int hour, String marker) {
        if ("am".equalsIgnoreCase(marker)) {
            return hour == 12 ? 0 : hour;
        }
        return hour == 12 ? 12 : hour + 12;
    }
}
