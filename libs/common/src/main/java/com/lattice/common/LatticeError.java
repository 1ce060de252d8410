package com.lattice.common;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured description of a failed operation.
 *
 * <p>Every error the boundary translates into a response carries the same four parts, so callers can
 * render a coherent remediation message without parsing free text.
 *
 * @param kind       discriminant that decides how the error is surfaced
 * @param operation  logical operation that failed (e.g. "createTenant")
 * @param details    human-readable description of what went wrong
 * @param suggestion actionable remediation hint (empty when there is nothing useful to add)
 * @param attributes kind-specific values (namespace, levelId, allowedTypes, ...)
 */
public record LatticeError(
        ErrorKind kind,
        String operation,
        String details,
        String suggestion,
        Map<String, Object> attributes
) {

    public LatticeError {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (operation == null || operation.isBlank()) {
            throw new IllegalArgumentException("operation must not be null or blank");
        }
        details = details == null ? "" : details;
        suggestion = suggestion == null ? "" : suggestion;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /** Creates an error without kind-specific attributes. */
    public static LatticeError of(ErrorKind kind, String operation, String details, String suggestion) {
        return new LatticeError(kind, operation, details, suggestion, Map.of());
    }

    /** Returns a copy of this error with one more attribute. Null values are skipped. */
    public LatticeError with(String key, Object value) {
        if (value == null) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        merged.put(key, value);
        return new LatticeError(kind, operation, details, suggestion, merged);
    }

    /** Message used for logs and exception text. */
    public String message() {
        StringBuilder sb = new StringBuilder()
                .append(kind)
                .append(" [")
                .append(operation)
                .append("]: ")
                .append(details);
        if (!suggestion.isEmpty()) {
            sb.append(". ").append(suggestion);
        }
        return sb.toString();
    }
}
