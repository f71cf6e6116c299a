package com.nzila.api.execution;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scrubs tool-call traces before they are persisted or attested.
 * Values under secret-looking keys are replaced outright; personal data
 * patterns inside strings are masked; long strings are truncated.
 */
@Component
public class TraceSanitizer {

    static final String REDACTED = "[REDACTED]";
    static final int MAX_STRING_LENGTH = 2000;

    private static final Pattern SECRET_KEY = Pattern.compile(
            "(?i).*(password|passwd|secret|token|api[_-]?key|authorization|credential|private[_-]?key|cookie).*");

    private static final Map<Pattern, String> PII_PATTERNS = new LinkedHashMap<>();

    static {
        PII_PATTERNS.put(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), "[EMAIL]");
        PII_PATTERNS.put(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), "[SSN]");
        PII_PATTERNS.put(Pattern.compile("\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b"), "[PHONE]");
        PII_PATTERNS.put(Pattern.compile("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b"), "[IP]");
        PII_PATTERNS.put(Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9._~+/=-]+"), "Bearer " + REDACTED);
    }

    public List<Map<String, Object>> sanitize(List<ToolCall> toolCalls) {
        List<Map<String, Object>> sanitized = new ArrayList<>();
        for (ToolCall call : toolCalls) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("tool", call.tool());
            entry.put("input", sanitizeValue(call.input()));
            entry.put("output", sanitizeValue(call.output()));
            entry.put("durationMs", call.durationMs());
            sanitized.add(entry);
        }
        return sanitized;
    }

    Object sanitizeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> {
                String name = String.valueOf(key);
                copy.put(name, SECRET_KEY.matcher(name).matches() ? REDACTED : sanitizeValue(nested));
            });
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(sanitizeValue(item)));
            return copy;
        }
        if (value instanceof CharSequence text) {
            return sanitizeText(text.toString());
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return sanitizeText(value.toString());
    }

    String sanitizeText(String text) {
        String result = text;
        for (Map.Entry<Pattern, String> pii : PII_PATTERNS.entrySet()) {
            result = pii.getKey().matcher(result).replaceAll(pii.getValue());
        }
        if (result.length() > MAX_STRING_LENGTH) {
            result = result.substring(0, MAX_STRING_LENGTH) + "...[truncated]";
        }
        return result;
    }
}
