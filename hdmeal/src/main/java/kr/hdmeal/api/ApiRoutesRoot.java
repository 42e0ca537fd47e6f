package kr.hdmeal.api;

import io.javalin.Javalin;
import kr.hdmeal.model.DataType;
import kr.hdmeal.service.CacheHealthService;
import kr.hdmeal.service.CacheHealthService.CacheHealth;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesRoot() {
    }

    /**
     * Registers root and health endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        CacheHealthService health = api.health();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "hdmeal",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /api/app/days?from=2024-03-01&to=2024-03-07",
                        "GET /api/app/days/2024-03-04",
                        "GET /api/app/meta",
                        "GET /api/cache/meal?from=2024-03-01&to=2024-03-07",
                        "GET /api/cache/timetable?from=2024-03-04&to=2024-03-04&grade=1&class=3",
                        "GET /api/metrics/external"
                })));

        // a failing store surfaces as StoreException -> 503
        app.get("/health", ctx -> {
            Map<DataType, CacheHealth> cache = health.healthcheck();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());
            out.put("cache", cache);
            ctx.json(out);
        });
    }
}
