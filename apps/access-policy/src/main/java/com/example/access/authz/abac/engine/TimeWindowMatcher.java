package com.example.access.authz.abac.engine;

import com.example.access.authz.abac.model.TimeWindow;
import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Checks a timestamp against a policy time window.
 *
 * <p>Times are {@code HH:mm}, both bounds inclusive, minute resolution. A window whose end
 * is before its start runs past midnight (22:00-06:00). With only a start the window is
 * open-ended towards midnight, with only an end it starts at midnight. Days of week use
 * 0 = Sunday. Unknown zones and unparseable times never match.
 */
@Slf4j
public final class TimeWindowMatcher {

    private static final DateTimeFormatter HOURS_MINUTES = DateTimeFormatter.ofPattern("H:mm");

    public boolean matches(TimeWindow window, Instant timestamp) {
        if (window == null) {
            return true;
        }
        if (timestamp == null) {
            return false;
        }
        Optional<ZoneId> zone = zoneOf(window.timezone());
        if (zone.isEmpty()) {
            return false;
        }
        ZonedDateTime local = timestamp.atZone(zone.get());

        if (!window.daysOfWeek().isEmpty() && !window.daysOfWeek().contains(dayIndex(local))) {
            return false;
        }
        if (!window.hasTimeRange()) {
            return true;
        }

        Optional<LocalTime> start = parseTime(window.start());
        Optional<LocalTime> end = parseTime(window.end());
        if (isSet(window.start()) && start.isEmpty() || isSet(window.end()) && end.isEmpty()) {
            return false;
        }

        LocalTime now = local.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
        if (start.isPresent() && end.isPresent()) {
            return inRange(now, start.get(), end.get());
        }
        if (start.isPresent()) {
            return !now.isBefore(start.get());
        }
        return !now.isAfter(end.get());
    }

    static boolean inRange(LocalTime now, LocalTime start, LocalTime end) {
        if (!end.isBefore(start)) {
            return !now.isBefore(start) && !now.isAfter(end);
        }
        // overnight
        return !now.isBefore(start) || !now.isAfter(end);
    }

    static int dayIndex(ZonedDateTime dateTime) {
        return dateTime.getDayOfWeek().getValue() % 7;
    }

    private static Optional<ZoneId> zoneOf(String timezone) {
        if (!isSet(timezone)) {
            return Optional.of(ZoneOffset.UTC);
        }
        try {
            return Optional.of(ZoneId.of(timezone.trim()));
        } catch (DateTimeException e) {
            log.warn("Unknown time zone in policy time window: {}", timezone);
            return Optional.empty();
        }
    }

    private static Optional<LocalTime> parseTime(String value) {
        if (!isSet(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalTime.parse(value.trim(), HOURS_MINUTES));
        } catch (DateTimeException e) {
            log.warn("Invalid time in policy time window: {}", value);
            return Optional.empty();
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
