/*
* Copyright 2025 Taylor Ketterling
* API Server for HDMeal, a school data ingestion and serving application.
* utilizes Javalin for HTTP server and serves cached meals, schedules, timetables and weather.
* uses Jackson for JSON processing.
*/

package kr.hdmeal.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import kr.hdmeal.config.AppConfig;
import kr.hdmeal.db.StoreException;
import kr.hdmeal.service.CacheHealthService;
import kr.hdmeal.service.ReadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.UUID;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    static final String REQUEST_ID_HEADER = "X-HDMeal-Req-ID";
    static final String RANGE_HEADER = "X-HDMeal-Range";

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final ReadService reads;
    private final CacheHealthService health;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, ReadService reads, CacheHealthService health) {
        this.cfg = cfg;
        this.om = om;
        this.reads = reads;
        this.health = health;
    }

    public void start() {
        start(cfg.apiPort());
    }

    /**
     * Starts on the given port; 0 picks a free one (see {@link #port()}).
     */
    public void start(int port) {
        log.info("Starting API server on port {}", port);
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.jsonMapper(new JavalinJackson(om, false));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            String reqId = ctx.header(REQUEST_ID_HEADER);
            if (reqId == null || reqId.isBlank())
                reqId = UUID.randomUUID().toString();
            ctx.attribute("requestId", reqId);
            ctx.header(REQUEST_ID_HEADER, reqId);
            log.info("Incoming {} {} from {} [{}]", ctx.method(), ctx.path(), ctx.ip(), reqId);
        });

        // After-handler to log response status and duration
        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> badRequest(ctx, e));
        app.exception(DateTimeParseException.class, (e, ctx) -> badRequest(ctx, e));
        app.exception(StoreException.class, (e, ctx) -> {
            log.error("Cache store unavailable on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(503).json(om.createObjectNode().put("error", "service_unavailable"));
        });
        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        registerRoutes();
        app.start(port);
    }

    private void badRequest(Context ctx, Exception e) {
        log.info("Bad request {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
        ctx.status(400).json(om.createObjectNode()
                .put("error", "bad_request")
                .put("message", e.getMessage() == null ? "invalid request" : e.getMessage()));
    }

    private void registerRoutes() {
        ApiRoutesRoot.register(this);
        ApiRoutesDays.register(this);
        ApiRoutesCache.register(this);
        ApiRoutesMetrics.register(this);
    }

    public void stop() {
        if (app != null)
            app.stop();
    }

    /**
     * Port actually bound, valid after {@link #start}.
     */
    public int port() {
        return app.port();
    }

    Javalin app() {
        return app;
    }

    AppConfig cfg() {
        return cfg;
    }

    ObjectMapper om() {
        return om;
    }

    ReadService reads() {
        return reads;
    }

    CacheHealthService health() {
        return health;
    }

    /**
     * Value of the range header: {@code start~end}.
     */
    static String rangeHeader(LocalDate start, LocalDate end) {
        return start + "~" + end;
    }

    static String requestId(Context ctx) {
        String id = ctx.attribute("requestId");
        return id == null ? "" : id;
    }
}
