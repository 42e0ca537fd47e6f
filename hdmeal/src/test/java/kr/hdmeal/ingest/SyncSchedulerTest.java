package kr.hdmeal.ingest;

import kr.hdmeal.Fixtures;
import kr.hdmeal.Fixtures.MutableClock;
import kr.hdmeal.Main;
import kr.hdmeal.config.AppConfig;
import kr.hdmeal.db.InMemoryCacheStore;
import kr.hdmeal.model.DataType;
import kr.hdmeal.model.DateRange;
import kr.hdmeal.model.SyncResult;
import kr.hdmeal.upstream.UpstreamException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SyncSchedulerTest {

    @Test
    void windowIsCenteredOnTodayInConfiguredZone() {
        AppConfig cfg = Fixtures.config("sync.warmWindowDays", "2");
        // 2024-03-01T16:00Z is already March 2nd in Seoul
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T16:00:00Z"));
        try (SyncEngine engine = engine(cfg, new FakeConnector(), clock)) {
            SyncScheduler s = new SyncScheduler(cfg, engine, clock);

            assertEquals(DateRange.of(LocalDate.of(2024, 2, 29), LocalDate.of(2024, 3, 4)), s.window());
        }
    }

    @Test
    void warmPassSynchronizesWholeWindow() {
        AppConfig cfg = Fixtures.config("sync.warmWindowDays", "1");
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T03:00:00Z"));
        FakeConnector fake = new FakeConnector();
        try (SyncEngine engine = engine(cfg, fake, clock)) {
            SyncResult r = new SyncScheduler(cfg, engine, clock).warmOnce();

            assertTrue(r.isDone());
            assertEquals(3, r.coveredDates().size());
            assertEquals(1, fake.calls(DataType.MEAL));
        }
    }

    @Test
    void failingPassDoesNotStopTheSchedule() throws Exception {
        AppConfig cfg = Fixtures.config("sync.warmWindowDays", "0", "schedule.sync", "PT0.05S");
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T03:00:00Z"));
        CountDownLatch passes = new CountDownLatch(3);
        FakeConnector fake = new FakeConnector().on(DataType.MEAL, (t, r) -> {
            passes.countDown();
            throw new IllegalStateException("boom");
        });
        try (SyncEngine engine = engine(cfg, fake, clock)) {
            SyncScheduler s = new SyncScheduler(cfg, engine, clock);
            s.start();
            try {
                assertTrue(passes.await(5, TimeUnit.SECONDS));
            } finally {
                s.stop();
            }
        }
    }

    private static SyncEngine engine(AppConfig cfg, FakeConnector fake, MutableClock clock) {
        return new SyncEngine(cfg, new InMemoryCacheStore(), List.of(fake),
                new Normalizer(Main.objectMapper(), List.of()), clock);
    }
}
