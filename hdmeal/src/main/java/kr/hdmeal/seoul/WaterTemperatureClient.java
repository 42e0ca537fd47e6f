package kr.hdmeal.seoul;

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

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Connector for the Seoul open data Han river water temperature feed
 * (WPOSInformationTime).
 *
 * <p>
 * The feed only exposes the latest measurements, so only today and yesterday
 * can ever be served.
 * </p>
 */
public final class WaterTemperatureClient implements Connector {
    private static final Logger log = LoggerFactory.getLogger(WaterTemperatureClient.class);

    static final String NAME = "SEOUL";
    private static final String BASE = "http://openapi.seoul.go.kr:8088/";
    private static final String SERVICE = "WPOSInformationTime";
    private static final DateTimeFormatter YMD = DateTimeFormatter.BASIC_ISO_DATE;
    private static final ZoneId KST = ZoneId.of("Asia/Seoul");

    private final UpstreamHttp http;
    private final AppConfig cfg;
    private final Clock clock;
    private final String baseUrl;

    public WaterTemperatureClient(AppConfig cfg, UpstreamHttp http, Clock clock) {
        this(cfg, http, clock, BASE);
    }

    WaterTemperatureClient(AppConfig cfg, UpstreamHttp http, Clock clock, String baseUrl) {
        this.cfg = cfg;
        this.http = http;
        this.clock = clock;
        this.baseUrl = baseUrl;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<DataType> dataTypes() {
        return EnumSet.of(DataType.WATER_TEMPERATURE);
    }

    @Override
    public int maxSpanDays() {
        return 31;
    }

    /**
     * The feed only carries the latest readings: yesterday and today.
     */
    @Override
    public DateRange coverage(DataType type, DateRange range) {
        LocalDate today = LocalDate.now(clock.withZone(KST));
        return range.intersect(DateRange.of(today.minusDays(1), today));
    }

    @Override
    public List<RawRecord> fetch(DataType type, DateRange range) throws UpstreamException {
        if (type != DataType.WATER_TEMPERATURE)
            throw new IllegalArgumentException("Seoul open data does not serve " + type);

        if (coverage(type, range) == null) {
            log.debug("Water temperature skipped: {} has no recent dates", range);
            return List.of();
        }
        String url = baseUrl + UpstreamHttp.enc(cfg.seoulDataToken()) + "/json/" + SERVICE + "/1/5/";
        return group(rowsOf(http.getJson(NAME, url)), range);
    }

    /**
     * Extracts measurement rows, translating the feed's result codes.
     */
    static List<JsonNode> rowsOf(JsonNode root) throws UpstreamException {
        JsonNode service = root.path(SERVICE);
        if (service.isMissingNode()) {
            // errors come back as a bare RESULT object
            JsonNode result = root.path("RESULT");
            String code = result.path("CODE").asText("");
            if (code.equals("INFO-200"))
                return List.of();
            String msg = code.isEmpty() ? "unexpected response shape" : code + " " + result.path("MESSAGE").asText("");
            if (code.startsWith("ERROR-5"))
                throw UpstreamException.transientFailure(NAME, msg);
            throw UpstreamException.permanentFailure(NAME, msg);
        }
        JsonNode rows = service.path("row");
        if (!rows.isArray())
            return List.of();
        List<JsonNode> out = new ArrayList<>(rows.size());
        rows.forEach(out::add);
        return out;
    }

    /**
     * Groups rows by measurement date, keeping dates inside {@code range}.
     */
    static List<RawRecord> group(List<JsonNode> rows, DateRange range) {
        Map<LocalDate, ArrayNode> byDate = new TreeMap<>();
        for (JsonNode row : rows) {
            LocalDate day;
            try {
                day = LocalDate.parse(row.path("YMD").asText("").trim(), YMD);
            } catch (DateTimeParseException e) {
                log.warn("Water temperature row without a usable YMD skipped");
                continue;
            }
            if (range.contains(day))
                byDate.computeIfAbsent(day, d -> JsonNodeFactory.instance.arrayNode()).add(row);
        }
        List<RawRecord> out = new ArrayList<>(byDate.size());
        for (var e : byDate.entrySet()) {
            out.add(RawRecord.of(DataType.WATER_TEMPERATURE, e.getKey(), e.getValue()));
        }
        return out;
    }
}
