/*
* Copyright 2025 Taylor Ketterling
* KMA Client for HDMeal, a school data ingestion and serving application.
* Reads the short-term village forecast of the Korea Meteorological Administration.
*/

package kr.hdmeal.kma;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import kr.hdmeal.config.AppConfig;
import kr.hdmeal.model.DataType;
import kr.hdmeal.model.DateRange;
import kr.hdmeal.upstream.Connector;
import kr.hdmeal.upstream.RawRecord;
import kr.hdmeal.upstream.UpstreamException;
import kr.hdmeal.upstream.UpstreamHttp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Connector for the KMA short-term forecast (getVilageFcst).
 *
 * <p>
 * The provider only knows about today and the next three days, so ranges
 * outside that window return no records without an HTTP call. Each returned
 * record holds all forecast items of one date.
 * </p>
 */
public final class KmaWeatherClient implements Connector {
    private static final Logger log = LoggerFactory.getLogger(KmaWeatherClient.class);

    static final String NAME = "KMA";
    private static final String URL = "https://apis.data.go.kr/1360000/VilageFcstInfoService_2.0/getVilageFcst";
    private static final DateTimeFormatter YMD = DateTimeFormatter.BASIC_ISO_DATE;
    static final ZoneId KST = ZoneId.of("Asia/Seoul");
    private static final int FORECAST_DAYS = 3;

    // forecasts are issued at 02, 05, ..., 23 and published about ten minutes later
    private static final int[] BASE_HOURS = { 23, 20, 17, 14, 11, 8, 5, 2 };

    // NODATA is not an error; quota and gateway problems are retryable
    private static final String NO_DATA = "03";
    private static final Set<String> TRANSIENT_CODES = Set.of("01", "04", "05", "22", "99");

    private final UpstreamHttp http;
    private final AppConfig cfg;
    private final Clock clock;
    private final String url;

    /**
     * Creates a KMA connector using app config, the shared HTTP helper and a
     * clock used to pick the latest forecast base time.
     */
    public KmaWeatherClient(AppConfig cfg, UpstreamHttp http, Clock clock) {
        this(cfg, http, clock, URL);
    }

    KmaWeatherClient(AppConfig cfg, UpstreamHttp http, Clock clock, String url) {
        this.cfg = cfg;
        this.http = http;
        this.clock = clock;
        this.url = url;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<DataType> dataTypes() {
        return EnumSet.of(DataType.WEATHER);
    }

    @Override
    public int maxSpanDays() {
        // one request always returns the whole forecast
        return 31;
    }

    /**
     * Forecasts reach from today to three days ahead.
     */
    @Override
    public DateRange coverage(DataType type, DateRange range) {
        return range.intersect(window(LocalDate.now(clock.withZone(KST))));
    }

    private static DateRange window(LocalDate today) {
        return DateRange.of(today, today.plusDays(FORECAST_DAYS));
    }

    @Override
    public List<RawRecord> fetch(DataType type, DateRange range) throws UpstreamException {
        if (type != DataType.WEATHER)
            throw new IllegalArgumentException("KMA does not serve " + type);

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(KST));
        DateRange wanted = range.intersect(window(now.toLocalDate()));
        if (wanted == null) {
            log.debug("KMA skipped: {} is outside the forecast window", range);
            return List.of();
        }

        JsonNode root = http.getJson(NAME, url(now));
        List<JsonNode> items = itemsOf(root);
        return group(items, wanted);
    }

    /**
     * Builds the request URL for the latest published base time.
     */
    String url(ZonedDateTime now) {
        LocalDateTime base = baseDateTime(now.toLocalDateTime());
        Map<String, String> params = new LinkedHashMap<>();
        params.put("serviceKey", cfg.kmaServiceKey());
        params.put("pageNo", "1");
        params.put("numOfRows", "1000");
        params.put("dataType", "JSON");
        params.put("base_date", base.toLocalDate().format(YMD));
        params.put("base_time", String.format("%02d00", base.getHour()));
        params.put("nx", String.valueOf(cfg.kmaNx()));
        params.put("ny", String.valueOf(cfg.kmaNy()));
        return url + "?" + UpstreamHttp.query(params);
    }

    /**
     * Latest forecast base time published at {@code now} (KST local time).
     * Before 02:10 the previous day's 23:00 issue is used.
     */
    static LocalDateTime baseDateTime(LocalDateTime now) {
        for (int h : BASE_HOURS) {
            LocalDateTime published = now.toLocalDate().atTime(h, 10);
            if (!now.isBefore(published))
                return now.toLocalDate().atTime(h, 0);
        }
        return now.toLocalDate().minusDays(1).atTime(23, 0);
    }

    /**
     * Extracts forecast items, translating KMA result codes.
     */
    static List<JsonNode> itemsOf(JsonNode root) throws UpstreamException {
        JsonNode header = root.path("response").path("header");
        String code = header.path("resultCode").asText("");
        if (code.equals(NO_DATA))
            return List.of();
        if (!code.isEmpty() && !code.equals("00")) {
            String msg = code + " " + header.path("resultMsg").asText("");
            if (TRANSIENT_CODES.contains(code))
                throw UpstreamException.transientFailure(NAME, msg);
            throw UpstreamException.permanentFailure(NAME, msg);
        }
        JsonNode items = root.path("response").path("body").path("items").path("item");
        if (!items.isArray())
            throw UpstreamException.permanentFailure(NAME, "response has no item array");
        List<JsonNode> out = new ArrayList<>(items.size());
        items.forEach(out::add);
        return out;
    }

    /**
     * Groups items by forecast date, keeping dates inside {@code range}.
     */
    static List<RawRecord> group(List<JsonNode> items, DateRange range) {
        Map<LocalDate, ArrayNode> byDate = new TreeMap<>();
        for (JsonNode item : items) {
            LocalDate day;
            try {
                day = LocalDate.parse(item.path("fcstDate").asText(""), YMD);
            } catch (DateTimeParseException e) {
                continue;
            }
            if (!range.contains(day))
                continue;
            byDate.computeIfAbsent(day, d -> JsonNodeFactory.instance.arrayNode()).add(item);
        }
        List<RawRecord> out = new ArrayList<>(byDate.size());
        for (var e : byDate.entrySet()) {
            out.add(RawRecord.of(DataType.WEATHER, e.getKey(), e.getValue()));
        }
        return out;
    }
}
