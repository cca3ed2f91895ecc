package com.example.access.authz.abac.engine;

import com.example.access.authz.abac.model.PolicyEvaluationContext;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves dotted attribute paths ({@code subject.department}, {@code resource.ownerId},
 * {@code env.ipAddress}) and {@code ${...}} placeholders against an evaluation context.
 *
 * <p>Attribute maps are looked up by full key first, then by walking nested maps one
 * segment at a time, so both {@code {"address.city": ..}} and
 * {@code {"address": {"city": ..}}} resolve {@code address.city}.
 */
public final class AttributeResolver {

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\$\\{\\s*((?:subject|resource|env|environment)\\.[^}\\s]+)\\s*}");
    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("HH:mm");
    private static final String ATTRIBUTES_PREFIX = "attributes.";

    /**
     * Resolve a dotted path. Empty when the root is unknown or the attribute is absent.
     */
    public Optional<Object> resolve(String path, PolicyEvaluationContext context) {
        if (path == null || path.isBlank() || context == null) {
            return Optional.empty();
        }
        String trimmed = path.trim();
        if (trimmed.equals("organizationId")) {
            return Optional.ofNullable(context.organizationId());
        }
        int dot = trimmed.indexOf('.');
        if (dot <= 0 || dot == trimmed.length() - 1) {
            return Optional.empty();
        }
        String root = trimmed.substring(0, dot);
        String rest = trimmed.substring(dot + 1);
        return switch (root) {
            case "subject" -> subjectAttribute(rest, context.subject());
            case "resource" -> resourceAttribute(rest, context.resource());
            case "env", "environment" -> environmentAttribute(rest, context.environment());
            default -> Optional.empty();
        };
    }

    /**
     * Substitute placeholders in an expected value. A value that is exactly one placeholder
     * becomes the raw attribute (type preserved), placeholders inside longer text are
     * interpolated, lists are resolved element-wise. Empty when any placeholder cannot be
     * resolved.
     */
    public Optional<Object> resolvePlaceholders(Object value, PolicyEvaluationContext context) {
        if (value instanceof String text) {
            return resolveText(text, context);
        }
        if (value instanceof List<?> list) {
            List<Object> resolved = new ArrayList<>(list.size());
            for (Object element : list) {
                Optional<Object> r = resolvePlaceholders(element, context);
                if (r.isEmpty()) {
                    return Optional.empty();
                }
                resolved.add(r.get());
            }
            return Optional.of(resolved);
        }
        return Optional.ofNullable(value);
    }

    /**
     * Look up a key in an attribute map: full key first, then nested traversal.
     */
    public static Optional<Object> lookup(Map<String, Object> attributes, String key) {
        if (attributes == null || key == null || key.isEmpty()) {
            return Optional.empty();
        }
        if (attributes.containsKey(key)) {
            return Optional.ofNullable(attributes.get(key));
        }
        Object current = attributes;
        for (String segment : key.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return Optional.empty();
            }
            current = map.get(segment);
        }
        return Optional.ofNullable(current);
    }

    private Optional<Object> resolveText(String text, PolicyEvaluationContext context) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        if (!matcher.find()) {
            return Optional.of(text);
        }
        if (matcher.start() == 0 && matcher.end() == text.length()) {
            return resolve(matcher.group(1), context);
        }
        matcher.reset();
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Optional<Object> replacement = resolve(matcher.group(1), context);
            if (replacement.isEmpty()) {
                return Optional.empty();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(replacement.get())));
        }
        matcher.appendTail(out);
        return Optional.of(out.toString());
    }

    private Optional<Object> subjectAttribute(String name, PolicyEvaluationContext.Subject subject) {
        return switch (name) {
            case "id" -> Optional.ofNullable(subject.id());
            case "roles" -> Optional.of(subject.roles());
            case "groups" -> Optional.of(subject.groups());
            default -> lookup(subject.attributes(), stripAttributesPrefix(name));
        };
    }

    private Optional<Object> resourceAttribute(String name, PolicyEvaluationContext.Resource resource) {
        return switch (name) {
            case "type" -> Optional.ofNullable(resource.type());
            case "id" -> Optional.ofNullable(resource.id());
            default -> lookup(resource.attributes(), stripAttributesPrefix(name));
        };
    }

    private Optional<Object> environmentAttribute(String name, PolicyEvaluationContext.Environment env) {
        Optional<ZonedDateTime> utc = Optional.ofNullable(env.timestamp()).map(t -> t.atZone(ZoneOffset.UTC));
        return switch (name) {
            case "ipAddress" -> Optional.ofNullable(env.ipAddress());
            case "location" -> Optional.ofNullable(env.location());
            case "timestamp" -> Optional.ofNullable(env.timestamp());
            case "time" -> utc.map(TIME_OF_DAY::format);
            case "dayOfWeek" -> utc.map(t -> t.getDayOfWeek().getValue() % 7);
            case "date" -> utc.map(t -> t.toLocalDate().toString());
            default -> lookup(env.attributes(), stripAttributesPrefix(name));
        };
    }

    private static String stripAttributesPrefix(String name) {
        return name.startsWith(ATTRIBUTES_PREFIX) ? name.substring(ATTRIBUTES_PREFIX.length()) : name;
    }
}
