package kr.hdmeal.model;

import java.time.Instant;

/**
 * One persisted cache entry and the time it was last synchronized.
 */
public record CacheRecord(CacheKey key, Payload payload, Instant syncedAt) {

    public CacheRecord {
        if (key == null || payload == null || syncedAt == null)
            throw new IllegalArgumentException("key, payload and syncedAt are required");
    }

    public DataType type() {
        return key.type();
    }

    public java.time.LocalDate date() {
        return key.date();
    }
}
