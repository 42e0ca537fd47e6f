package kr.hdmeal.service;

import kr.hdmeal.Fixtures;
import kr.hdmeal.Fixtures.MutableClock;
import kr.hdmeal.config.AppConfig;
import kr.hdmeal.db.InMemoryCacheStore;
import kr.hdmeal.model.*;
import kr.hdmeal.service.CacheHealthService.CacheHealth;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheHealthServiceTest {

    @Test
    void staleWhenNeverSyncedOrOlderThanTtl() {
        AppConfig cfg = Fixtures.config("ttl.meal", "PT3H");
        MutableClock clock = new MutableClock(Instant.parse("2024-03-04T00:00:00Z"));
        InMemoryCacheStore store = new InMemoryCacheStore();
        store.upsert(new CacheRecord(CacheKey.of(DataType.MEAL, LocalDate.of(2024, 3, 4)),
                Payload.absent("holiday"), clock.instant()));
        CacheHealthService health = new CacheHealthService(cfg, store, clock);

        Map<DataType, CacheHealth> now = health.healthcheck();
        assertEquals(DataType.values().length, now.size());
        assertFalse(now.get(DataType.MEAL).stale());
        assertEquals(Duration.ofHours(3), now.get(DataType.MEAL).ttl());
        assertTrue(now.get(DataType.WEATHER).stale());
        assertNull(now.get(DataType.WEATHER).lastSyncedAt());

        clock.advance(Duration.ofHours(3));
        assertTrue(health.healthcheck().get(DataType.MEAL).stale());
    }
}
