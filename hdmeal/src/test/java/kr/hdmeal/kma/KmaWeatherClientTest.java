package kr.hdmeal.kma;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import kr.hdmeal.Fixtures;
import kr.hdmeal.Fixtures.MutableClock;
import kr.hdmeal.Main;
import kr.hdmeal.StubConnector;
import kr.hdmeal.db.InMemoryCacheStore;
import kr.hdmeal.ingest.Normalizer;
import kr.hdmeal.ingest.SyncEngine;
import kr.hdmeal.model.CacheRecord;
import kr.hdmeal.model.DataType;
import kr.hdmeal.model.DateRange;
import kr.hdmeal.model.SyncResult;
import kr.hdmeal.upstream.RawRecord;
import kr.hdmeal.upstream.UpstreamException;
import kr.hdmeal.upstream.UpstreamHttp;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.*;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KmaWeatherClientTest {
    private final ObjectMapper om = Main.objectMapper();

    @Test
    void baseTimeIsLatestPublishedIssue() {
        LocalDate d = LocalDate.of(2024, 3, 4);

        assertEquals(d.atTime(5, 0), KmaWeatherClient.baseDateTime(d.atTime(5, 10)));
        assertEquals(d.atTime(2, 0), KmaWeatherClient.baseDateTime(d.atTime(5, 9)));
        assertEquals(d.atTime(23, 0), KmaWeatherClient.baseDateTime(d.atTime(23, 59)));
        assertEquals(d.minusDays(1).atTime(23, 0), KmaWeatherClient.baseDateTime(d.atTime(2, 9)));
    }

    @Test
    void itemsAreGroupedByForecastDateWithinRange() throws Exception {
        JsonNode root;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("fixtures/kma-forecast.json")) {
            root = om.readTree(in);
        }
        List<JsonNode> items = KmaWeatherClient.itemsOf(root);

        List<RawRecord> out = KmaWeatherClient.group(items,
                DateRange.of(LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 7)));

        assertEquals(2, out.size());
        assertEquals(8, out.get(0).body().size());
        assertEquals(DataType.WEATHER, out.get(1).type());
        assertEquals(LocalDate.of(2024, 3, 5), out.get(1).date());
    }

    @Test
    void noDataCodeIsEmptyAndQuotaCodeIsTransient() throws Exception {
        JsonNode noData = om.readTree("{\"response\":{\"header\":{\"resultCode\":\"03\",\"resultMsg\":\"NO_DATA\"}}}");
        JsonNode quota = om.readTree(
                "{\"response\":{\"header\":{\"resultCode\":\"22\",\"resultMsg\":\"LIMITED_NUMBER_OF_SERVICE_REQUESTS_EXCEEDS_ERROR\"}}}");
        JsonNode badKey = om.readTree(
                "{\"response\":{\"header\":{\"resultCode\":\"30\",\"resultMsg\":\"SERVICE_KEY_IS_NOT_REGISTERED_ERROR\"}}}");

        assertTrue(KmaWeatherClient.itemsOf(noData).isEmpty());
        assertTrue(assertThrows(UpstreamException.class, () -> KmaWeatherClient.itemsOf(quota)).isTransient());
        assertFalse(assertThrows(UpstreamException.class, () -> KmaWeatherClient.itemsOf(badKey)).isTransient());
    }

    @Test
    void rangeOutsideForecastWindowMakesNoCall() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2024-03-04T00:00:00Z"), ZoneOffset.UTC);
        // unreachable host: any request would fail
        KmaWeatherClient c = new KmaWeatherClient(Fixtures.config(), new UpstreamHttp(om, Duration.ofMillis(200)),
                clock, "http://127.0.0.1:9/unreachable");

        List<RawRecord> out = c.fetch(DataType.WEATHER,
                DateRange.of(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 10)));

        assertTrue(out.isEmpty());
    }

    @Test
    void urlUsesGridAndBaseTime() {
        KmaWeatherClient c = new KmaWeatherClient(Fixtures.config(), new UpstreamHttp(om, Duration.ofSeconds(1)),
                Clock.systemUTC(), "http://kma.test/fcst");

        String url = c.url(ZonedDateTime.of(2024, 3, 4, 9, 30, 0, 0, KmaWeatherClient.KST));

        assertTrue(url.contains("base_date=20240304&base_time=0800"));
        assertTrue(url.endsWith("nx=61&ny=126"));
    }

    @Test
    void coverageIsTodayThroughThreeDaysAhead() {
        // 2024-03-03T16:00Z is 01:00 on March 4th in Seoul
        Clock clock = Clock.fixed(Instant.parse("2024-03-03T16:00:00Z"), ZoneOffset.UTC);
        KmaWeatherClient c = new KmaWeatherClient(Fixtures.config(), new UpstreamHttp(om, Duration.ofSeconds(1)),
                clock, "http://kma.test/fcst");
        LocalDate today = LocalDate.of(2024, 3, 4);

        assertEquals(DateRange.of(today, today.plusDays(3)),
                c.coverage(DataType.WEATHER, DateRange.of(today.minusDays(10), today.plusDays(10))));
        assertNull(c.coverage(DataType.WEATHER, DateRange.single(today.minusDays(1))));
    }

    @Test
    void cachedForecastIsKeptAfterItLeavesTheWindow() throws Exception {
        String body;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("fixtures/kma-forecast.json")) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        AtomicInteger requests = new AtomicInteger();
        Javalin upstream = Javalin.create().get("/fcst", ctx -> {
            requests.incrementAndGet();
            ctx.contentType("application/json").result(body);
        }).start(0);

        // 09:00 in Seoul
        MutableClock clock = new MutableClock(Instant.parse("2024-03-04T00:00:00Z"));
        InMemoryCacheStore store = new InMemoryCacheStore();
        KmaWeatherClient kma = new KmaWeatherClient(Fixtures.config(), new UpstreamHttp(om, Duration.ofSeconds(5)),
                clock, "http://localhost:" + upstream.port() + "/fcst");
        StubConnector others = new StubConnector(EnumSet.complementOf(EnumSet.of(DataType.WEATHER)));
        SyncEngine engine = new SyncEngine(Fixtures.config(), store, List.of(kma, others),
                new Normalizer(om, List.of()), clock);
        DateRange day = DateRange.single(LocalDate.of(2024, 3, 4));
        try {
            engine.ensureSynced(day);
            CacheRecord before = store.readRange(DataType.WEATHER, day).get(0);
            assertTrue(before.payload().isPresent());
            assertEquals(1, requests.get());

            clock.advance(Duration.ofDays(2));
            SyncResult r = engine.ensureSynced(day);

            assertTrue(r.isDone());
            assertEquals(before, store.readRange(DataType.WEATHER, day).get(0));
            assertEquals(1, requests.get());
        } finally {
            engine.close();
            upstream.stop();
        }
    }
}
