package com.nzila.api.proposal;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Typed accessors over a raw payload map that record a {@link FieldViolation}
 * instead of throwing, so one pass reports every problem.
 */
public final class FieldReader {

    private final Map<String, Object> payload;
    private final List<FieldViolation> violations;

    public FieldReader(Map<String, Object> payload, List<FieldViolation> violations) {
        this.payload = payload;
        this.violations = violations;
    }

    public boolean isPresent(String field) {
        Object value = payload.get(field);
        return value != null && !(value instanceof String s && s.isBlank());
    }

    public String requiredString(String field, int maxLength) {
        if (!isPresent(field)) {
            violations.add(new FieldViolation(field, FieldViolation.REQUIRED, field + " is required"));
            return null;
        }
        return string(field, maxLength);
    }

    public String optionalString(String field, int maxLength, String defaultValue) {
        if (!isPresent(field)) {
            return defaultValue;
        }
        String value = string(field, maxLength);
        return value == null ? defaultValue : value;
    }

    public String requiredMatching(String field, Pattern pattern, String description) {
        String value = requiredString(field, 200);
        return value == null ? null : matching(field, value, pattern, description);
    }

    public String optionalMatching(String field, Pattern pattern, String description, String defaultValue) {
        if (!isPresent(field)) {
            return defaultValue;
        }
        String value = string(field, 200);
        return value == null ? null : matching(field, value, pattern, description);
    }

    public String requiredOneOf(String field, Set<String> allowed) {
        String value = requiredString(field, 100);
        return value == null ? null : oneOf(field, value, allowed);
    }

    public String optionalOneOf(String field, Set<String> allowed, String defaultValue) {
        if (!isPresent(field)) {
            return defaultValue;
        }
        String value = string(field, 100);
        return value == null ? null : oneOf(field, value, allowed);
    }

    public UUID requiredUuid(String field) {
        String value = requiredString(field, 36);
        if (value == null) {
            return null;
        }
        try {
            UUID uuid = UUID.fromString(value);
            if (!uuid.toString().equalsIgnoreCase(value)) {
                throw new IllegalArgumentException(value);
            }
            return uuid;
        } catch (IllegalArgumentException e) {
            violations.add(new FieldViolation(field, FieldViolation.INVALID_FORMAT, field + " must be a UUID"));
            return null;
        }
    }

    public Integer optionalInt(String field, int min, int max, int defaultValue) {
        Object raw = payload.get(field);
        if (raw == null) {
            return defaultValue;
        }
        long value;
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            value = ((Number) raw).longValue();
        } else {
            violations.add(new FieldViolation(field, FieldViolation.INVALID_TYPE, field + " must be an integer"));
            return null;
        }
        if (value < min || value > max) {
            violations.add(new FieldViolation(field, FieldViolation.OUT_OF_RANGE,
                    field + " must be between " + min + " and " + max));
            return null;
        }
        return (int) value;
    }

    public Boolean optionalBoolean(String field, boolean defaultValue) {
        Object raw = payload.get(field);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Boolean b) {
            return b;
        }
        violations.add(new FieldViolation(field, FieldViolation.INVALID_TYPE, field + " must be a boolean"));
        return null;
    }

    public void addViolation(String field, String code, String message) {
        violations.add(new FieldViolation(field, code, message));
    }

    private String string(String field, int maxLength) {
        Object raw = payload.get(field);
        if (!(raw instanceof String value)) {
            violations.add(new FieldViolation(field, FieldViolation.INVALID_TYPE, field + " must be a string"));
            return null;
        }
        if (value.length() > maxLength) {
            violations.add(new FieldViolation(field, FieldViolation.TOO_LONG,
                    field + " must be at most " + maxLength + " characters"));
            return null;
        }
        return value;
    }

    private String matching(String field, String value, Pattern pattern, String description) {
        if (!pattern.matcher(value).matches()) {
            violations.add(new FieldViolation(field, FieldViolation.INVALID_FORMAT, field + " must be " + description));
            return null;
        }
        return value;
    }

    private String oneOf(String field, String value, Set<String> allowed) {
        if (!allowed.contains(value)) {
            violations.add(new FieldViolation(field, FieldViolation.NOT_ALLOWED,
                    field + " must be one of " + allowed.stream().sorted().toList()));
            return null;
        }
        return value;
    }
}
