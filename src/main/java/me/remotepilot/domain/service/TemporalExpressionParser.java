package me.remotepilot.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.remotepilot.domain.model.ScheduleWhen;
import me.remotepilot.infrastructure.config.PilotProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a natural-language or cron-like time description into a
 * {@link ScheduleWhen}.
 *
 * <p>
 * Recognized forms, tried in order:
 * <ol>
 * <li>raw 5-field cron: {@code "30 9 * * 1-5"}</li>
 * <li>{@code every day at 9[:30][am|pm]} → {@code M H * * *}</li>
 * <li>{@code every hour}, {@code every morning} (07:00),
 * {@code every evening} (18:00)</li>
 * <li>{@code every N hours} → hour field stepped by N</li>
 * <li>{@code every weekday at 9[:30][am|pm]} → {@code M H * * 1-5}</li>
 * <li>{@code in N seconds|minutes|hours|days}</li>
 * <li>an ISO-8601 date or date-time</li>
 * </ol>
 * Anything else, including blank input and out-of-range clock times, resolves
 * to one minute from now. The parser never throws.
 */
@Component
@Slf4j
public class TemporalExpressionParser {

    private static final Duration DEFAULT_DELAY = Duration.ofSeconds(60);
    private static final int MAX_HOUR = 23;
    private static final int MAX_MINUTE = 59;
    private static final int NOON = 12;

    private static final String CRON_FIELD = "[\\d*/\\-,]+";
    private static final Pattern RAW_CRON = Pattern.compile(
            "^" + CRON_FIELD + "\\s+" + CRON_FIELD + "\\s+" + CRON_FIELD + "\\s+" + CRON_FIELD + "\\s+" + CRON_FIELD
                    + "$");
    private static final Pattern DAILY = Pattern.compile(
            "every\\s*day\\s*(?:at\\s*)?(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern HOURLY = Pattern.compile("every\\s*hour", Pattern.CASE_INSENSITIVE);
    private static final Pattern MORNING = Pattern.compile("every\\s*morning", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVENING = Pattern.compile("every\\s*evening", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVERY_N_HOURS = Pattern.compile("every\\s*(\\d+)\\s*hours?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WEEKDAY = Pattern.compile(
            "every\\s*weekday\\s*(?:at\\s*)?(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELATIVE = Pattern.compile("in\\s+(\\d+)\\s*(second|minute|hour|day)s?",
            Pattern.CASE_INSENSITIVE);

    private final ZoneId zone;

    public TemporalExpressionParser(PilotProperties properties, Clock clock) {
        String configured = properties.getScheduler().getZone();
        this.zone = configured != null && !configured.isBlank() ? ZoneId.of(configured) : clock.getZone();
    }

    /**
     * Zone used for wall-clock forms and for evaluating cron expressions.
     */
    public ZoneId getZone() {
        return zone;
    }

    public ScheduleWhen parse(String expression, Instant now) {
        Instant fallback = now.plus(DEFAULT_DELAY);
        if (expression == null || expression.isBlank()) {
            return ScheduleWhen.at(fallback);
        }
        String input = expression.trim();
        try {
            ScheduleWhen parsed = parseRecognized(input, now);
            return parsed != null ? parsed : ScheduleWhen.at(fallback);
        } catch (RuntimeException e) { // NOSONAR - parser is total, degrade to default delay
            log.debug("[Schedule] Failed to parse '{}': {}", input, e.getMessage());
            return ScheduleWhen.at(fallback);
        }
    }

    private ScheduleWhen parseRecognized(String input, Instant now) {
        if (RAW_CRON.matcher(input).matches()) {
            return ScheduleWhen.cron(input);
        }

        Matcher daily = DAILY.matcher(input);
        if (daily.find()) {
            return clockTimeCron(daily, "* * *");
        }

        if (HOURLY.matcher(input).find()) {
            return ScheduleWhen.cron("0 * * * *");
        }
        if (MORNING.matcher(input).find()) {
            return ScheduleWhen.cron("0 7 * * *");
        }
        if (EVENING.matcher(input).find()) {
            return ScheduleWhen.cron("0 18 * * *");
        }

        Matcher everyHours = EVERY_N_HOURS.matcher(input);
        if (everyHours.find()) {
            int hours = Integer.parseInt(everyHours.group(1));
            if (hours < 1 || hours > MAX_HOUR) {
                return null;
            }
            return ScheduleWhen.cron("0 */" + hours + " * * *");
        }

        Matcher weekday = WEEKDAY.matcher(input);
        if (weekday.find()) {
            return clockTimeCron(weekday, "* * 1-5");
        }

        Matcher relative = RELATIVE.matcher(input);
        if (relative.find()) {
            long amount = Long.parseLong(relative.group(1));
            ChronoUnit unit = switch (relative.group(2).toLowerCase(Locale.ROOT)) {
            case "second" -> ChronoUnit.SECONDS;
            case "minute" -> ChronoUnit.MINUTES;
            case "hour" -> ChronoUnit.HOURS;
            default -> ChronoUnit.DAYS;
            };
            return ScheduleWhen.at(now.plus(Duration.of(amount, unit)));
        }

        Instant absolute = parseDate(input);
        return absolute != null ? ScheduleWhen.at(absolute) : null;
    }

    private ScheduleWhen clockTimeCron(Matcher matcher, String trailingFields) {
        int hour = Integer.parseInt(matcher.group(1));
        int minute = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0;
        String meridiem = matcher.group(3) != null ? matcher.group(3).toLowerCase(Locale.ROOT) : null;
        if ("pm".equals(meridiem) && hour < NOON) {
            hour += NOON;
        } else if ("am".equals(meridiem) && hour == NOON) {
            hour = 0;
        }
        if (hour > MAX_HOUR || minute > MAX_MINUTE) {
            return null;
        }
        return ScheduleWhen.cron(minute + " " + hour + " " + trailingFields);
    }

    private Instant parseDate(String input) {
        Instant parsed = tryParse(input, Instant::parse);
        if (parsed == null) {
            parsed = tryParse(input, text -> OffsetDateTime.parse(text).toInstant());
        }
        if (parsed == null) {
            parsed = tryParse(input, text -> ZonedDateTime.parse(text).toInstant());
        }
        if (parsed == null) {
            parsed = tryParse(input, text -> LocalDateTime.parse(text).atZone(zone).toInstant());
        }
        if (parsed == null) {
            parsed = tryParse(input, text -> LocalDate.parse(text).atStartOfDay(zone).toInstant());
        }
        return parsed;
    }

    private static Instant tryParse(String input, Function<String, Instant> parser) {
        try {
            return parser.apply(input);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
