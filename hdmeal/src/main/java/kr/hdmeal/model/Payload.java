package kr.hdmeal.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Value stored for one cache key: either a canonical record ({@link Kind#PRESENT})
 * or an explicit marker that the provider has nothing for that key
 * ({@link Kind#ABSENT}, with a reason such as {@code holiday}).
 */
public record Payload(Kind kind, JsonNode value, String reason) {

    public enum Kind {
        PRESENT,
        ABSENT
    }

    public static final String NO_DATA = "no-data";

    public Payload {
        if (kind == null)
            throw new IllegalArgumentException("kind is required");
        if (kind == Kind.PRESENT && (value == null || value.isNull()))
            throw new IllegalArgumentException("present payload needs a value");
        if (kind == Kind.ABSENT) {
            value = null;
            if (reason == null || reason.isBlank())
                reason = NO_DATA;
        } else {
            reason = null;
        }
    }

    public static Payload present(JsonNode value) {
        return new Payload(Kind.PRESENT, value, null);
    }

    public static Payload absent(String reason) {
        return new Payload(Kind.ABSENT, null, reason);
    }

    public boolean isPresent() {
        return kind == Kind.PRESENT;
    }
}
