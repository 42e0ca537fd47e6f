package kr.hdmeal.db;

import kr.hdmeal.model.CacheKey;
import kr.hdmeal.model.CacheRecord;
import kr.hdmeal.model.DataType;
import kr.hdmeal.model.DateRange;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cache store kept in process memory. Used by tests and when
 * {@code cache.store=memory}.
 */
public final class InMemoryCacheStore implements CacheStore {
    private final ConcurrentSkipListMap<CacheKey, CacheRecord> records = new ConcurrentSkipListMap<>();
    private final AtomicInteger writes = new AtomicInteger();

    @Override
    public void upsert(CacheRecord record) {
        records.merge(record.key(), record,
                (old, neu) -> neu.syncedAt().isBefore(old.syncedAt()) ? old : neu);
        writes.incrementAndGet();
    }

    @Override
    public List<CacheRecord> readRange(DataType type, DateRange range) {
        CacheKey from = CacheKey.of(type, range.start());
        CacheKey to = type.isSectioned()
                ? CacheKey.of(type, range.end(), Integer.MAX_VALUE, Integer.MAX_VALUE)
                : CacheKey.of(type, range.end());
        return new ArrayList<>(records.subMap(from, true, to, true).values());
    }

    @Override
    public List<CacheRecord> readRange(DataType type, DateRange range, int grade, int classNo) {
        List<CacheRecord> out = new ArrayList<>();
        for (CacheRecord r : readRange(type, range)) {
            if (r.key().grade() == grade && r.key().classNo() == classNo)
                out.add(r);
        }
        return out;
    }

    @Override
    public Optional<Instant> freshnessOf(CacheKey key) {
        CacheRecord r = records.get(key);
        return r == null ? Optional.empty() : Optional.of(r.syncedAt());
    }

    @Override
    public Map<CacheKey, Instant> freshnessIn(DataType type, DateRange range) {
        Map<CacheKey, Instant> out = new TreeMap<>();
        for (CacheRecord r : readRange(type, range)) {
            out.put(r.key(), r.syncedAt());
        }
        return out;
    }

    @Override
    public Optional<Instant> latestSyncedAt(DataType type) {
        Instant latest = null;
        for (CacheRecord r : records.values()) {
            if (r.type() == type && (latest == null || r.syncedAt().isAfter(latest)))
                latest = r.syncedAt();
        }
        return Optional.ofNullable(latest);
    }

    /**
     * Number of stored keys.
     */
    public int size() {
        return records.size();
    }

    /**
     * Number of single-record writes performed so far.
     */
    public int writeCount() {
        return writes.get();
    }
}
