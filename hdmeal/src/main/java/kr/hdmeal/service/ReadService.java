package kr.hdmeal.service;

import kr.hdmeal.config.AppConfig;
import kr.hdmeal.db.CacheStore;
import kr.hdmeal.ingest.InvalidRangeException;
import kr.hdmeal.ingest.SyncEngine;
import kr.hdmeal.model.*;
import kr.hdmeal.service.DayView.Slot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Read path over the cache. {@link #readDays} synchronizes first and then
 * serves whatever is cached, even when the sync only partly succeeded.
 */
public final class ReadService {
    private static final Logger log = LoggerFactory.getLogger(ReadService.class);

    private final AppConfig cfg;
    private final CacheStore store;
    private final SyncEngine engine;
    private final Clock clock;

    public ReadService(AppConfig cfg, CacheStore store, SyncEngine engine, Clock clock) {
        this.cfg = cfg;
        this.store = store;
        this.engine = engine;
        this.clock = clock;
    }

    /**
     * Result of a day-view read together with the sync outcome behind it.
     */
    public record Days(SyncResult sync, List<DayView> days) {
    }

    /**
     * Cached records of a type without synchronizing.
     */
    public List<CacheRecord> readCached(DataType type, DateRange range) {
        checkSpan(range);
        return store.readRange(type, range);
    }

    /**
     * Cached records of one grade/class section without synchronizing.
     */
    public List<CacheRecord> readCached(DataType type, DateRange range, int grade, int classNo) {
        checkSpan(range);
        if (!type.isSectioned())
            throw new IllegalArgumentException(type + " is not kept per grade/class");
        return store.readRange(type, range, grade, classNo);
    }

    /**
     * Synchronizes the range and returns one view per date.
     */
    public Days readDays(DateRange range) {
        SyncResult sync = engine.ensureSynced(range);
        if (!sync.isDone())
            log.info("Serving {} with {} missing cell(s)", range, sync.missing().size());

        Map<DataType, Map<CacheKey, CacheRecord>> byType = new EnumMap<>(DataType.class);
        for (DataType t : DataType.values()) {
            Map<CacheKey, CacheRecord> m = new HashMap<>();
            for (CacheRecord r : store.readRange(t, range)) {
                m.put(r.key(), r);
            }
            byType.put(t, m);
        }

        List<DayView> days = new ArrayList<>(range.days());
        for (LocalDate d : range.dates()) {
            Map<Integer, Map<Integer, Slot>> timetable = new TreeMap<>();
            for (int g = 1; g <= cfg.numGrades(); g++) {
                Map<Integer, Slot> classes = new TreeMap<>();
                for (int c = 1; c <= cfg.numClasses(); c++) {
                    classes.put(c, slot(byType, CacheKey.of(DataType.TIMETABLE, d, g, c)));
                }
                timetable.put(g, classes);
            }
            days.add(new DayView(
                    d,
                    slot(byType, CacheKey.of(DataType.MEAL, d)),
                    slot(byType, CacheKey.of(DataType.SCHEDULE, d)),
                    slot(byType, CacheKey.of(DataType.WEATHER, d)),
                    slot(byType, CacheKey.of(DataType.WATER_TEMPERATURE, d)),
                    timetable));
        }
        return new Days(sync, days);
    }

    /**
     * Window served when a client names no range: yesterday through a week
     * ahead.
     */
    public DateRange defaultRange() {
        LocalDate today = LocalDate.now(clock.withZone(cfg.clockZoneId()));
        return DateRange.of(today.minusDays(1), today.plusDays(7));
    }

    private static Slot slot(Map<DataType, Map<CacheKey, CacheRecord>> byType, CacheKey key) {
        CacheRecord r = byType.get(key.type()).get(key);
        return r == null ? Slot.noData() : Slot.of(r);
    }

    private void checkSpan(DateRange range) {
        if (range.days() > cfg.maxRangeDays())
            throw new InvalidRangeException("range " + range + " spans " + range.days()
                    + " days; at most " + cfg.maxRangeDays() + " allowed");
    }
}
