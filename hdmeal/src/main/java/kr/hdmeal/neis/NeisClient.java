/*
* Copyright 2025 Taylor Ketterling
* NEIS Client for HDMeal, a school data ingestion and serving application.
* Reads meals, the academic schedule and class timetables from the NEIS Open API.
*/

package kr.hdmeal.neis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import kr.hdmeal.config.AppConfig;
import kr.hdmeal.model.CacheKey;
import kr.hdmeal.model.DataType;
import kr.hdmeal.model.DateRange;
import kr.hdmeal.upstream.Connector;
import kr.hdmeal.upstream.RawRecord;
import kr.hdmeal.upstream.UpstreamException;
import kr.hdmeal.upstream.UpstreamHttp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Connector for the NEIS Open API (open.neis.go.kr).
 *
 * <p>
 * One request per page of up to 1000 rows; rows are grouped per date (and per
 * grade/class for timetables) into {@link RawRecord}s whose body is the array
 * of provider rows for that key.
 * </p>
 */
public final class NeisClient implements Connector {
    private static final Logger log = LoggerFactory.getLogger(NeisClient.class);

    static final String NAME = "NEIS";
    private static final String BASE = "https://open.neis.go.kr/hub/";
    private static final int PAGE_SIZE = 1000;
    private static final DateTimeFormatter YMD = DateTimeFormatter.BASIC_ISO_DATE;

    // NEIS result codes that are worth retrying: daily quota, server and DB errors
    private static final Set<String> TRANSIENT_CODES = Set.of("ERROR-337", "ERROR-500", "ERROR-600");

    private final UpstreamHttp http;
    private final AppConfig cfg;
    private final String baseUrl;

    /**
     * Creates a NEIS connector using app config and the shared HTTP helper.
     */
    public NeisClient(AppConfig cfg, UpstreamHttp http) {
        this(cfg, http, BASE);
    }

    NeisClient(AppConfig cfg, UpstreamHttp http, String baseUrl) {
        this.cfg = cfg;
        this.http = http;
        this.baseUrl = baseUrl;
    }

    /**
     * Endpoint and parameter names per data type.
     */
    enum Endpoint {
        MEAL("mealServiceDietInfo", "MLSV_FROM_YMD", "MLSV_TO_YMD", "MLSV_YMD"),
        SCHEDULE("SchoolSchedule", "AA_FROM_YMD", "AA_TO_YMD", "AA_YMD"),
        TIMETABLE("hisTimetable", "TI_FROM_YMD", "TI_TO_YMD", "ALL_TI_YMD");

        final String service;
        final String fromParam;
        final String toParam;
        final String dateField;

        Endpoint(String service, String fromParam, String toParam, String dateField) {
            this.service = service;
            this.fromParam = fromParam;
            this.toParam = toParam;
            this.dateField = dateField;
        }

        static Endpoint of(DataType type) {
            return switch (type) {
                case MEAL -> MEAL;
                case SCHEDULE -> SCHEDULE;
                case TIMETABLE -> TIMETABLE;
                default -> throw new IllegalArgumentException("NEIS does not serve " + type);
            };
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<DataType> dataTypes() {
        return EnumSet.of(DataType.MEAL, DataType.SCHEDULE, DataType.TIMETABLE);
    }

    @Override
    public int maxSpanDays() {
        return cfg.neisMaxSpanDays();
    }

    @Override
    public List<RawRecord> fetch(DataType type, DateRange range) throws UpstreamException {
        if (range.days() > maxSpanDays()) {
            throw new IllegalArgumentException("NEIS range " + range + " exceeds " + maxSpanDays() + " days");
        }
        Endpoint ep = Endpoint.of(type);
        List<JsonNode> rows = new ArrayList<>();
        int page = 1;
        while (true) {
            JsonNode root = http.getJson(NAME, url(ep, range, page));
            List<JsonNode> pageRows = rowsOf(ep, root);
            rows.addAll(pageRows);
            if (pageRows.size() < PAGE_SIZE)
                break;
            page++;
        }
        log.debug("NEIS {} {} -> {} rows in {} page(s)", ep.service, range, rows.size(), page);
        return group(type, ep, rows);
    }

    /**
     * Builds the request URL for one page.
     */
    String url(Endpoint ep, DateRange range, int page) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("KEY", cfg.neisApiKey());
        params.put("Type", "json");
        params.put("pIndex", String.valueOf(page));
        params.put("pSize", String.valueOf(PAGE_SIZE));
        params.put("ATPT_OFCDC_SC_CODE", cfg.neisOfficeCode());
        params.put("SD_SCHUL_CODE", cfg.neisSchoolCode());
        if (ep == Endpoint.MEAL)
            params.put("MMEAL_SC_CODE", "2"); // lunch
        params.put(ep.fromParam, range.start().format(YMD));
        params.put(ep.toParam, range.end().format(YMD));
        return baseUrl + ep.service + "?" + UpstreamHttp.query(params);
    }

    /**
     * Extracts the row array from a NEIS response, translating result codes.
     */
    static List<JsonNode> rowsOf(Endpoint ep, JsonNode root) throws UpstreamException {
        // Errors and "no data" come back as a bare RESULT object
        JsonNode bare = root.path("RESULT");
        if (!bare.isMissingNode()) {
            checkResult(bare);
            return List.of();
        }

        JsonNode service = root.path(ep.service);
        if (!service.isArray() || service.size() < 2) {
            throw UpstreamException.permanentFailure(NAME, "unexpected response shape for " + ep.service);
        }
        for (JsonNode h : service.get(0).path("head")) {
            if (h.has("RESULT"))
                checkResult(h.get("RESULT"));
        }
        JsonNode rows = service.get(1).path("row");
        if (!rows.isArray())
            return List.of();
        List<JsonNode> out = new ArrayList<>(rows.size());
        rows.forEach(out::add);
        return out;
    }

    /**
     * Throws for any result code other than success or "no data".
     */
    private static void checkResult(JsonNode result) throws UpstreamException {
        String code = result.path("CODE").asText("");
        if (code.equals("INFO-000") || code.equals("INFO-200"))
            return;
        String msg = code + " " + result.path("MESSAGE").asText("");
        if (TRANSIENT_CODES.contains(code))
            throw UpstreamException.transientFailure(NAME, msg);
        throw UpstreamException.permanentFailure(NAME, msg);
    }

    /**
     * Groups provider rows into one raw record per cache key, ordered by key.
     */
    static List<RawRecord> group(DataType type, Endpoint ep, List<JsonNode> rows) {
        Map<CacheKey, ArrayNode> grouped = new TreeMap<>();
        for (JsonNode row : rows) {
            LocalDate day = parseYmd(row.path(ep.dateField).asText(null));
            if (day == null) {
                log.warn("NEIS {} row without a usable {} skipped", ep.service, ep.dateField);
                continue;
            }
            CacheKey key;
            if (type.isSectioned()) {
                Integer grade = parseIntOrNull(row.path("GRADE").asText(null));
                Integer classNo = parseIntOrNull(row.path("CLASS_NM").asText(null));
                if (grade == null || classNo == null) {
                    // special classes use names instead of numbers; they have no section key
                    continue;
                }
                key = CacheKey.of(type, day, grade, classNo);
            } else {
                key = CacheKey.of(type, day);
            }
            grouped.computeIfAbsent(key, k -> JsonNodeFactory.instance.arrayNode()).add(row);
        }

        List<RawRecord> out = new ArrayList<>(grouped.size());
        for (var e : grouped.entrySet()) {
            CacheKey k = e.getKey();
            out.add(new RawRecord(type, k.date(), k.grade(), k.classNo(), e.getValue()));
        }
        return out;
    }

    private static LocalDate parseYmd(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            return LocalDate.parse(s.trim(), YMD);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Integer parseIntOrNull(String s) {
        if (s == null || s.isBlank())
            return null;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
