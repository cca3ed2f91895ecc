package com.example.access.authz.abac.engine;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Conversions between the loosely typed attribute values found in contexts and policy
 * definitions.
 */
final class AttributeValues {

    private AttributeValues() {}

    static Optional<BigDecimal> toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof Number number) {
            try {
                return Optional.of(new BigDecimal(number.toString()));
            } catch (NumberFormatException e) {
                // NaN and infinities
                return Optional.empty();
            }
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(new BigDecimal(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Optional<Boolean> toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true")) {
                return Optional.of(Boolean.TRUE);
            }
            if (normalized.equals("false")) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    /**
     * ISO-8601 instants, offset date-times and plain dates (start of day, UTC).
     */
    static Optional<Instant> toInstant(Object value) {
        if (value instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.toInstant());
        }
        if (value instanceof LocalDateTime ldt) {
            return Optional.of(ldt.toInstant(ZoneOffset.UTC));
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant());
        }
        if (value instanceof String text && !text.isBlank()) {
            return parseInstant(text.trim());
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseInstant(String text) {
        try {
            if (text.indexOf('T') < 0) {
                return Optional.of(LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
            }
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    /**
     * Collections and arrays as a list; anything else is not a list.
     */
    static Optional<List<Object>> toList(Object value) {
        if (value instanceof Collection<?> collection) {
            return Optional.of(List.copyOf(collection.stream().filter(Objects::nonNull).toList()));
        }
        if (value instanceof Object[] array) {
            return Optional.of(Arrays.stream(array).filter(Objects::nonNull).toList());
        }
        return Optional.empty();
    }

    /**
     * Scalars become a one-element list.
     */
    static List<Object> asList(Object value) {
        return toList(value).orElseGet(() -> value == null ? List.of() : List.of(value));
    }

    /**
     * Equality used by membership tests and subject attribute matching: numbers are
     * compared by value, a number or boolean also equals its string form.
     */
    static boolean looselyEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number || b instanceof Number) {
            Optional<BigDecimal> left = toDecimal(a);
            Optional<BigDecimal> right = toDecimal(b);
            return left.isPresent() && right.isPresent() && left.get().compareTo(right.get()) == 0;
        }
        if (a instanceof Boolean || b instanceof Boolean) {
            Optional<Boolean> left = toBoolean(a);
            return left.isPresent() && left.equals(toBoolean(b));
        }
        return a.equals(b);
    }

    static boolean containsLoosely(Collection<?> values, Object candidate) {
        return values.stream().anyMatch(v -> looselyEquals(v, candidate));
    }
}
