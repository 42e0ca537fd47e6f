/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for HDMeal, a school data ingestion and serving application.
*
* Initializes configuration, the cache store, upstream connectors and the sync engine,
* then starts the warm-window scheduler and the API server. Serving does not wait for
* the first warm pass; the program also handles a graceful shutdown.
*/

package kr.hdmeal;

import kr.hdmeal.api.ApiServer;
import kr.hdmeal.config.AppConfig;
import kr.hdmeal.db.*;
import kr.hdmeal.ingest.*;
import kr.hdmeal.kma.KmaWeatherClient;
import kr.hdmeal.neis.NeisClient;
import kr.hdmeal.seoul.WaterTemperatureClient;
import kr.hdmeal.service.CacheHealthService;
import kr.hdmeal.service.ReadService;
import kr.hdmeal.upstream.UpstreamHttp;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        Clock clock = Clock.system(cfg.clockZoneId());

        ObjectMapper om = objectMapper();

        // Store
        final HikariDataSource ds;
        final CacheStore store;
        if (cfg.cacheStore().equals("jdbc")) {
            ds = Database.createCacheDataSource(cfg);
            JdbcCacheStore jdbc = new JdbcCacheStore(ds, om);
            jdbc.ensureSchema();
            store = jdbc;
        } else {
            log.warn("Using in-memory cache store; data is lost on restart");
            ds = null;
            store = new InMemoryCacheStore();
        }

        // Upstream connectors
        UpstreamHttp http = new UpstreamHttp(om, cfg.upstreamTimeout());
        NeisClient neis = new NeisClient(cfg, http);
        KmaWeatherClient kma = new KmaWeatherClient(cfg, http, clock);
        WaterTemperatureClient water = new WaterTemperatureClient(cfg, http, clock);

        // Engine
        Normalizer normalizer = new Normalizer(om, Normalizer.loadHighlights("delicious.txt"));
        SyncEngine engine = new SyncEngine(cfg, store, List.of(neis, kma, water), normalizer, clock);

        // Scheduler (first warm pass starts immediately in the background)
        SyncScheduler scheduler = new SyncScheduler(cfg, engine, clock);
        scheduler.start();

        // API server
        ReadService reads = new ReadService(cfg, store, engine, clock);
        CacheHealthService health = new CacheHealthService(cfg, store, clock);
        ApiServer api = new ApiServer(cfg, om, reads, health);
        api.start();
        log.info("API server started on port {}", cfg.apiPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                scheduler.stop();
                engine.close();
                if (ds != null)
                    ds.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }

    /**
     * Mapper used for upstream parsing, stored payloads and API responses.
     * Dates and durations are written as ISO-8601 strings.
     */
    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }
}
