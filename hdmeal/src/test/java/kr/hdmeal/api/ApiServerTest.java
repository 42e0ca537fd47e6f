package kr.hdmeal.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import kr.hdmeal.Fixtures;
import kr.hdmeal.Fixtures.MutableClock;
import kr.hdmeal.Main;
import kr.hdmeal.StubConnector;
import kr.hdmeal.config.AppConfig;
import kr.hdmeal.db.InMemoryCacheStore;
import kr.hdmeal.ingest.Normalizer;
import kr.hdmeal.ingest.SyncEngine;
import kr.hdmeal.model.DataType;
import kr.hdmeal.service.CacheHealthService;
import kr.hdmeal.service.ReadService;
import kr.hdmeal.upstream.RawRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerTest {
    private final ObjectMapper om = Main.objectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private SyncEngine engine;
    private ApiServer api;

    @BeforeEach
    void setUp() {
        AppConfig cfg = Fixtures.config("app.version", "2.3.0", "app.build", "17");
        MutableClock clock = new MutableClock(Instant.parse("2024-03-04T00:00:00Z"));
        InMemoryCacheStore store = new InMemoryCacheStore();

        ArrayNode meal = om.createArrayNode();
        meal.addObject().put("DDISH_NM", "카레라이스 5.6.").put("CAL_INFO", "650 Kcal");
        StubConnector upstream = new StubConnector().add(RawRecord.of(DataType.MEAL, LocalDate.of(2024, 3, 4), meal));

        engine = new SyncEngine(cfg, store, List.of(upstream), new Normalizer(om, List.of()), clock);
        api = new ApiServer(cfg, om, new ReadService(cfg, store, engine, clock),
                new CacheHealthService(cfg, store, clock));
        api.start(0);
    }

    @AfterEach
    void tearDown() {
        api.stop();
        engine.close();
    }

    private HttpResponse<String> get(String path, String requestId) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create("http://localhost:" + api.port() + path)).GET();
        if (requestId != null)
            b.header(ApiServer.REQUEST_ID_HEADER, requestId);
        return http.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void dayViewCarriesEveryType() throws Exception {
        HttpResponse<String> resp = get("/api/app/days/2024-03-04", "req-1");

        assertEquals(200, resp.statusCode());
        assertEquals("req-1", resp.headers().firstValue(ApiServer.REQUEST_ID_HEADER).orElse(null));
        assertEquals("2024-03-04~2024-03-04", resp.headers().firstValue(ApiServer.RANGE_HEADER).orElse(null));

        JsonNode body = om.readTree(resp.body());
        assertEquals("req-1", body.path("requestId").asText());
        assertEquals("DONE", body.path("sync").asText());
        assertEquals(0, body.path("missing").size());

        JsonNode day = body.path("data");
        assertEquals("2024-03-04", day.path("date").asText());
        assertTrue(day.path("meal").path("available").asBoolean());
        assertEquals("카레라이스", day.path("meal").path("value").path("menus").get(0).path("name").asText());
        assertEquals("no-data", day.path("weather").path("reason").asText());
        assertFalse(day.path("timetable").path("1").path("2").path("available").asBoolean());
    }

    @Test
    void rangeQueryReturnsOneViewPerDate() throws Exception {
        HttpResponse<String> resp = get("/api/app/days?from=2024-03-04&to=2024-03-06", null);

        assertEquals(200, resp.statusCode());
        assertTrue(resp.headers().firstValue(ApiServer.REQUEST_ID_HEADER).isPresent());
        JsonNode body = om.readTree(resp.body());
        assertEquals("2024-03-04~2024-03-06", resp.headers().firstValue(ApiServer.RANGE_HEADER).orElse(null));
        assertEquals("2024-03-06", body.path("range").path("to").asText());
        assertEquals(3, body.path("data").size());
    }

    @Test
    void badInputIsBadRequest() throws Exception {
        assertEquals(400, get("/api/app/days/2024-13-01", null).statusCode());
        assertEquals(400, get("/api/app/days?to=2024-03-04", null).statusCode());
        assertEquals(400, get("/api/app/days?from=2024-03-05&to=2024-03-04", null).statusCode());
        assertEquals(400, get("/api/app/days?from=2024-01-01&to=2024-03-04", null).statusCode());

        HttpResponse<String> resp = get("/api/cache/lunch?from=2024-03-04", null);
        assertEquals(400, resp.statusCode());
        assertEquals("bad_request", om.readTree(resp.body()).path("error").asText());
    }

    @Test
    void cacheEndpointServesStoredRecordsOnly() throws Exception {
        JsonNode before = om.readTree(get("/api/cache/meal?from=2024-03-04", null).body());
        assertEquals(0, before.size());

        get("/api/app/days/2024-03-04", null);

        JsonNode after = om.readTree(get("/api/cache/meal?from=2024-03-04", null).body());
        assertEquals(1, after.size());
        assertEquals(1, om.readTree(get("/api/cache/timetable?from=2024-03-04&grade=1&class=1", null).body()).size());
    }

    @Test
    void healthReportsEveryType() throws Exception {
        HttpResponse<String> resp = get("/health", null);

        assertEquals(200, resp.statusCode());
        JsonNode body = om.readTree(resp.body());
        assertEquals("ok", body.path("status").asText());
        assertTrue(body.path("cache").path("MEAL").path("stale").asBoolean());
    }

    @Test
    void metaReportsConfiguredVersion() throws Exception {
        HttpResponse<String> resp = get("/api/app/meta", "req-meta");

        assertEquals(200, resp.statusCode());
        JsonNode body = om.readTree(resp.body());
        assertEquals("req-meta", body.path("requestId").asText());
        assertEquals("2.3.0", body.path("data").path("version").asText());
        assertEquals(17, body.path("data").path("build").asInt());
        assertFalse(body.path("data").path("debug").asBoolean());
    }

    @Test
    void crossOriginRequestsGetNoCorsHeaders() throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + api.port() + "/api/app/meta"))
                .header("Origin", "https://example.org")
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());

        assertEquals(200, resp.statusCode());
        assertTrue(resp.headers().firstValue("Access-Control-Allow-Origin").isEmpty());
    }
}
