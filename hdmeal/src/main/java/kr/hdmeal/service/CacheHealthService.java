package kr.hdmeal.service;

import kr.hdmeal.config.AppConfig;
import kr.hdmeal.db.CacheStore;
import kr.hdmeal.model.DataType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reports how recently each data type was synchronized.
 */
public final class CacheHealthService {
    private final AppConfig cfg;
    private final CacheStore store;
    private final Clock clock;

    public CacheHealthService(AppConfig cfg, CacheStore store, Clock clock) {
        this.cfg = cfg;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Health of one data type. {@code stale} is true when nothing was ever
     * synchronized or the latest sync is older than the TTL.
     */
    public record CacheHealth(Instant lastSyncedAt, Duration ttl, boolean stale) {
    }

    public Map<DataType, CacheHealth> healthcheck() {
        Instant now = clock.instant();
        Map<DataType, CacheHealth> out = new EnumMap<>(DataType.class);
        for (DataType t : DataType.values()) {
            Duration ttl = cfg.ttl(t);
            Instant last = store.latestSyncedAt(t).orElse(null);
            boolean stale = last == null || !now.isBefore(last.plus(ttl));
            out.put(t, new CacheHealth(last, ttl, stale));
        }
        return out;
    }
}
