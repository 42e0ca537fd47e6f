package kr.hdmeal.db;

import kr.hdmeal.model.CacheKey;
import kr.hdmeal.model.CacheRecord;
import kr.hdmeal.model.DataType;
import kr.hdmeal.model.DateRange;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable map from {@link CacheKey} to {@link CacheRecord}.
 *
 * <p>
 * Writes are atomic per key; when two writes race on the same key the one
 * with the later {@code syncedAt} is kept. Implementations throw
 * {@link StoreException} when the backend is unavailable.
 * </p>
 */
public interface CacheStore {

    void upsert(CacheRecord record);

    /**
     * Writes several records. Each key is written atomically; the batch as a
     * whole need not be.
     */
    default void upsertAll(Collection<CacheRecord> records) {
        for (CacheRecord r : records) {
            upsert(r);
        }
    }

    /**
     * All records of a type in the range, ordered by date, then grade and class.
     */
    List<CacheRecord> readRange(DataType type, DateRange range);

    /**
     * Records of one grade/class section in the range, ordered by date.
     */
    List<CacheRecord> readRange(DataType type, DateRange range, int grade, int classNo);

    Optional<Instant> freshnessOf(CacheKey key);

    /**
     * {@code syncedAt} of every stored key of a type in the range.
     */
    Map<CacheKey, Instant> freshnessIn(DataType type, DateRange range);

    /**
     * Most recent {@code syncedAt} of any record of the type.
     */
    Optional<Instant> latestSyncedAt(DataType type);
}
