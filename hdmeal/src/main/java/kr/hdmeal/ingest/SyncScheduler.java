package kr.hdmeal.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import kr.hdmeal.config.AppConfig;
import kr.hdmeal.model.DateRange;
import kr.hdmeal.model.SyncResult;
import kr.hdmeal.model.SyncWindow;

import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.*;
import org.slf4j.MDC;

/**
 * Keeps the window around today warm by running a sync pass at a fixed delay.
 * The first pass starts immediately and does not block serving.
 */
public final class SyncScheduler {
    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final ScheduledExecutorService warmExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "sync-warm-window"));

    private final AppConfig cfg;
    private final SyncEngine engine;
    private final Clock clock;

    private ScheduledFuture<?> warmTask;

    public SyncScheduler(AppConfig cfg, SyncEngine engine, Clock clock) {
        this.cfg = cfg;
        this.engine = engine;
        this.clock = clock;
    }

    public void start() {
        warmTask = warmExec.scheduleWithFixedDelay(safe("warm-window", this::warmOnce),
                0, cfg.syncInterval().toMillis(), TimeUnit.MILLISECONDS);
        log.info("Sync scheduler started (every {}, window +/-{} days).", cfg.syncInterval(), cfg.warmWindowDays());
    }

    /**
     * Window synchronized by each pass: {@code [today - W, today + W]}.
     */
    DateRange window() {
        LocalDate today = LocalDate.now(clock.withZone(cfg.clockZoneId()));
        return DateRange.around(today, cfg.warmWindowDays(), cfg.warmWindowDays());
    }

    /**
     * Runs one pass over the warm window.
     */
    SyncResult warmOnce() {
        SyncResult r = engine.synchronize(SyncWindow.all(window()));
        if (!r.isDone())
            log.warn("Warm pass left {} cell(s) missing: {}", r.missing().size(), r.missing());
        return r;
    }

    public void stop() {
        if (warmTask != null)
            warmTask.cancel(true);
        shutdown(warmExec, "warmExec");
    }

    private void shutdown(ScheduledExecutorService es, String name) {
        es.shutdownNow();
        try {
            if (!es.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
