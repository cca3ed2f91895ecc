package com.example.access.authz.abac.model;

import java.util.List;

/**
 * Time-of-day and day-of-week restriction.
 *
 * @param start      window start, {@code HH:mm}
 * @param end        window end, {@code HH:mm}; earlier than {@code start} for overnight windows
 * @param timezone   zone the window is expressed in, UTC when absent
 * @param daysOfWeek allowed days, 0 = Sunday through 6 = Saturday
 */
public record TimeWindow(
        String start,
        String end,
        String timezone,
        List<Integer> daysOfWeek
) {
    public TimeWindow {
        daysOfWeek = ModelCollections.list(daysOfWeek);
    }

    public static TimeWindow between(String start, String end) {
        return new TimeWindow(start, end, null, List.of());
    }

    public boolean hasTimeRange() {
        return isSet(start) || isSet(end);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
