package kr.hdmeal.ingest;

import kr.hdmeal.config.AppConfig;
import kr.hdmeal.db.CacheStore;
import kr.hdmeal.db.StoreException;
import kr.hdmeal.ingest.InFlightTable.Claim;
import kr.hdmeal.ingest.InFlightTable.Flight;
import kr.hdmeal.model.*;
import kr.hdmeal.upstream.Connector;
import kr.hdmeal.upstream.RawRecord;
import kr.hdmeal.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Brings the cache up to date for a date range.
 *
 * <p>
 * A pass plans which (type, date) cells are missing or past their TTL, claims
 * them in the {@link InFlightTable} so that concurrent passes never fetch the
 * same cell twice, fetches claimed dates per provider in contiguous sub-ranges,
 * normalizes and persists the result, and reports per-date outcomes. Failures
 * are isolated to the cells they affect.
 * </p>
 */
public final class SyncEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    private final AppConfig cfg;
    private final CacheStore store;
    private final Map<DataType, Connector> connectors = new EnumMap<>(DataType.class);
    private final Normalizer normalizer;
    private final RetryPolicy retry;
    private final Clock clock;
    private final InFlightTable inFlight = new InFlightTable();
    private final ExecutorService flights;

    /**
     * Creates an engine. Every data type must be served by exactly one of the
     * given connectors.
     */
    public SyncEngine(AppConfig cfg, CacheStore store, List<Connector> connectors, Normalizer normalizer,
            Clock clock) {
        this.cfg = cfg;
        this.store = store;
        this.normalizer = normalizer;
        this.clock = clock;
        this.retry = new RetryPolicy(cfg.retryMaxAttempts(), cfg.retryBaseDelay());
        for (Connector c : connectors) {
            for (DataType t : c.dataTypes()) {
                if (this.connectors.put(t, c) != null)
                    throw new IllegalArgumentException("more than one connector serves " + t);
            }
        }
        for (DataType t : DataType.values()) {
            if (!this.connectors.containsKey(t))
                throw new IllegalArgumentException("no connector serves " + t);
        }
        AtomicInteger n = new AtomicInteger();
        this.flights = Executors.newFixedThreadPool(Math.max(1, cfg.syncThreads()), r -> {
            Thread t = new Thread(r, "sync-flight-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Synchronizes every data type over the range, waiting at most the
     * configured {@code sync.wait}.
     */
    public SyncResult ensureSynced(DateRange range) {
        return ensureSynced(range, cfg.syncWait());
    }

    /**
     * Synchronizes every data type over the range, waiting at most {@code wait}.
     * Cells still in flight when the wait expires are reported
     * {@link CellStatus#PENDING}; their flights keep running.
     *
     * @throws InvalidRangeException if the range is longer than
     *                               {@code sync.maxRangeDays}
     */
    public SyncResult ensureSynced(DateRange range, Duration wait) {
        validate(range);
        return run(SyncWindow.all(range), wait);
    }

    /**
     * Synchronizes a window, waiting until every flight it depends on is done.
     */
    public SyncResult synchronize(SyncWindow window) {
        return run(window, null);
    }

    private void validate(DateRange range) {
        if (range.days() > cfg.maxRangeDays()) {
            throw new InvalidRangeException("range " + range + " spans " + range.days()
                    + " days; at most " + cfg.maxRangeDays() + " allowed");
        }
    }

    // ----------------------------
    // pass
    // ----------------------------

    private SyncResult run(SyncWindow window, Duration wait) {
        DateRange range = window.range();
        String pass = UUID.randomUUID().toString().substring(0, 8);
        String previousPass = MDC.get("pass");
        MDC.put("pass", pass);
        try {
            long t0 = System.currentTimeMillis();
            Map<Cell, CellStatus> status = new HashMap<>();
            // (type, date) -> flight that decides its outcome
            Map<Cell, Flight> waitingOn = new HashMap<>();
            Set<Flight> pending = new LinkedHashSet<>();

            for (DataType type : window.types()) {
                Set<LocalDate> stale = staleDates(type, range);
                for (LocalDate d : range.dates()) {
                    if (!stale.contains(d))
                        status.put(new Cell(type, d), CellStatus.FRESH);
                }
                if (stale.isEmpty())
                    continue;

                Claim claim = inFlight.claim(type, stale);
                for (Flight f : claim.attached()) {
                    log.debug("Attached to running flight {}", f);
                    pending.add(f);
                }
                if (claim.owned() != null) {
                    Flight own = claim.owned();
                    pending.add(own);
                    log.debug("Starting flight {}", own);
                    try {
                        flights.execute(() -> fly(own, pass));
                    } catch (RejectedExecutionException e) {
                        log.warn("Flight {} rejected; engine is shutting down", own);
                        inFlight.release(own);
                        own.outcome.complete(Map.of());
                    }
                }
                for (Flight f : pending) {
                    if (f.type != type)
                        continue;
                    for (LocalDate d : f.dates) {
                        if (stale.contains(d))
                            waitingOn.put(new Cell(type, d), f);
                    }
                }
            }

            awaitAll(pending, wait);

            for (var e : waitingOn.entrySet()) {
                status.put(e.getKey(), outcomeOf(e.getValue(), e.getKey().date()));
            }
            SyncResult result = summarize(range, window.types(), status);
            log.info("Sync {} {} -> {} (covered {}/{} day(s), missing {} cell(s)) in {}ms",
                    range, window.types(), result.status(), result.coveredDates().size(), range.days(),
                    result.missing().size(), System.currentTimeMillis() - t0);
            return result;
        } finally {
            if (previousPass == null)
                MDC.remove("pass");
            else
                MDC.put("pass", previousPass);
        }
    }

    private void awaitAll(Collection<Flight> pending, Duration wait) {
        if (pending.isEmpty())
            return;
        CompletableFuture<?>[] all = pending.stream().map(f -> f.outcome).toArray(CompletableFuture[]::new);
        CompletableFuture<Void> joined = CompletableFuture.allOf(all);
        try {
            if (wait == null)
                joined.get();
            else
                joined.get(Math.max(0L, wait.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Stopped waiting after {}ms; unfinished cells reported pending", wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting; unfinished cells reported pending");
        } catch (ExecutionException e) {
            // individual flights never complete exceptionally; outcomes are read per flight below
            log.error("Flight wait failed", e.getCause());
        }
    }

    private static CellStatus outcomeOf(Flight f, LocalDate date) {
        if (!f.outcome.isDone())
            return CellStatus.PENDING;
        if (f.outcome.isCompletedExceptionally())
            return CellStatus.FAILED;
        CellStatus s = f.outcome.join().get(date);
        return s == null ? CellStatus.FAILED : s;
    }

    private static SyncResult summarize(DateRange range, Set<DataType> types, Map<Cell, CellStatus> status) {
        List<LocalDate> covered = new ArrayList<>();
        List<Cell> missing = new ArrayList<>();
        for (LocalDate d : range.dates()) {
            boolean all = true;
            for (DataType t : types) {
                Cell cell = new Cell(t, d);
                CellStatus s = status.getOrDefault(cell, CellStatus.FAILED);
                if (!s.isCovered()) {
                    all = false;
                    missing.add(cell);
                }
            }
            if (all)
                covered.add(d);
        }
        SyncResult.Status st = missing.isEmpty() ? SyncResult.Status.DONE : SyncResult.Status.PARTIAL_FAILURE;
        return new SyncResult(st, range, covered, missing);
    }

    // ----------------------------
    // planning
    // ----------------------------

    /**
     * Dates of the range where any expected cell of the type is missing or past
     * its TTL. Outside the provider's current coverage only missing cells
     * count, since nothing there can be refetched.
     */
    Set<LocalDate> staleDates(DataType type, DateRange range) {
        Map<CacheKey, Instant> synced = store.freshnessIn(type, range);
        DateRange covered = connectors.get(type).coverage(type, range);
        Duration ttl = cfg.ttl(type);
        Instant now = clock.instant();
        Set<LocalDate> stale = new TreeSet<>();
        for (LocalDate d : range.dates()) {
            boolean refetchable = covered != null && covered.contains(d);
            for (CacheKey k : expectedKeys(type, d)) {
                Instant t = synced.get(k);
                if (t == null || (refetchable && !now.isBefore(t.plus(ttl)))) {
                    stale.add(d);
                    break;
                }
            }
        }
        return stale;
    }

    /**
     * Keys a date must have to count as cached: one per date, or one per
     * configured grade and class for sectioned types.
     */
    List<CacheKey> expectedKeys(DataType type, LocalDate date) {
        if (!type.isSectioned())
            return List.of(CacheKey.of(type, date));
        List<CacheKey> out = new ArrayList<>(cfg.numGrades() * cfg.numClasses());
        for (int g = 1; g <= cfg.numGrades(); g++) {
            for (int c = 1; c <= cfg.numClasses(); c++) {
                out.add(CacheKey.of(type, date, g, c));
            }
        }
        return out;
    }

    // ----------------------------
    // flight
    // ----------------------------

    private void fly(Flight flight, String pass) {
        MDC.put("pass", pass);
        Map<LocalDate, CellStatus> out = new TreeMap<>();
        try {
            execute(flight, out);
        } catch (RuntimeException e) {
            log.error("Flight {} failed", flight, e);
        } finally {
            for (LocalDate d : flight.dates) {
                out.putIfAbsent(d, CellStatus.FAILED);
            }
            // persisted before release, released before completion
            inFlight.release(flight);
            flight.outcome.complete(out);
            MDC.remove("pass");
        }
    }

    private void execute(Flight flight, Map<LocalDate, CellStatus> out) {
        DataType type = flight.type;
        DateRange span = DateRange.of(flight.dates.first(), flight.dates.last());

        // a flight that finished just before the claim has already persisted these
        Set<LocalDate> stale = staleDates(type, span);
        stale.retainAll(flight.dates);
        for (LocalDate d : flight.dates) {
            if (!stale.contains(d))
                out.put(d, CellStatus.FRESH);
        }
        if (stale.isEmpty())
            return;

        Connector connector = connectors.get(type);
        boolean storeFailed = false;
        for (DateRange run : DateRange.runsOf(stale)) {
            for (DateRange sub : run.split(connector.maxSpanDays())) {
                if (storeFailed) {
                    mark(out, sub, CellStatus.FAILED);
                    continue;
                }
                try {
                    syncSubRange(connector, type, sub, out);
                } catch (StoreException e) {
                    log.error("Persisting {} {} failed; abandoning remaining ranges", type, sub, e);
                    mark(out, sub, CellStatus.FAILED);
                    storeFailed = true;
                }
            }
        }
    }

    private void syncSubRange(Connector connector, DataType type, DateRange sub, Map<LocalDate, CellStatus> out) {
        DateRange covered = connector.coverage(type, sub);
        List<RawRecord> raws = List.of();
        try {
            if (covered != null) {
                raws = retry.run(connector.name() + " " + type + " " + covered,
                        () -> connector.fetch(type, covered));
            }
        } catch (UpstreamException e) {
            log.warn("Fetching {} {} failed ({}): {}", type, sub, e.kind(), e.getMessage());
            mark(out, sub, CellStatus.FAILED);
            return;
        }

        Instant now = clock.instant();
        Map<CacheKey, CacheRecord> records = new TreeMap<>();
        Set<CacheKey> broken = new HashSet<>();
        Set<LocalDate> brokenDates = new HashSet<>();
        for (RawRecord raw : raws) {
            if (raw.type() != type || !covered.contains(raw.date()))
                continue;
            try {
                records.put(raw.key(), new CacheRecord(raw.key(), normalizer.normalize(raw), now));
            } catch (NormalizationException e) {
                log.warn("Normalization failed, cell skipped: {}", e.getMessage());
                broken.add(raw.key());
                brokenDates.add(raw.date());
            }
        }
        // provider had nothing for these keys; outside its coverage only keys
        // never stored get a marker, existing records are kept as they are
        Map<CacheKey, Instant> existing = covered != null && covered.equals(sub)
                ? Map.of()
                : store.freshnessIn(type, sub);
        for (LocalDate d : sub.dates()) {
            boolean fetched = covered != null && covered.contains(d);
            for (CacheKey k : expectedKeys(type, d)) {
                if (records.containsKey(k) || broken.contains(k))
                    continue;
                if (fetched || !existing.containsKey(k))
                    records.put(k, new CacheRecord(k, Payload.absent(Payload.NO_DATA), now));
            }
        }

        store.upsertAll(records.values());
        log.debug("Persisted {} {} record(s) for {}", records.size(), type, sub);
        for (LocalDate d : sub.dates()) {
            out.put(d, brokenDates.contains(d) ? CellStatus.FAILED : CellStatus.SYNCED);
        }
    }

    private static void mark(Map<LocalDate, CellStatus> out, DateRange sub, CellStatus s) {
        for (LocalDate d : sub.dates()) {
            out.put(d, s);
        }
    }

    /**
     * Number of cells currently in flight.
     */
    int inFlightCells() {
        return inFlight.size();
    }

    /**
     * Stops the flight pool, letting running flights finish for a few seconds.
     */
    @Override
    public void close() {
        flights.shutdown();
        try {
            if (!flights.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Sync flights did not finish in time; interrupting");
                flights.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flights.shutdownNow();
        }
    }
}
