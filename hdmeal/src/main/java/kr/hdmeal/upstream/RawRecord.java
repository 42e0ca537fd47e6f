package kr.hdmeal.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import kr.hdmeal.model.CacheKey;
import kr.hdmeal.model.DataType;

import java.time.LocalDate;

/**
 * Provider rows belonging to one cache key, as returned by a {@link Connector}.
 * The body shape is provider specific; the normalizer turns it into a canonical
 * record.
 */
public record RawRecord(DataType type, LocalDate date, int grade, int classNo, JsonNode body) {

    public static RawRecord of(DataType type, LocalDate date, JsonNode body) {
        return new RawRecord(type, date, 0, 0, body);
    }

    public CacheKey key() {
        return new CacheKey(type, date, grade, classNo);
    }
}
