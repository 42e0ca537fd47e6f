package kr.hdmeal.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.hdmeal.model.*;
import kr.hdmeal.upstream.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns provider rows into canonical per-type records.
 *
 * <p>
 * Pure and deterministic: the same raw record always yields the same payload.
 * Records that are recognizable but carry nothing (a holiday, an empty menu)
 * become {@link Payload.Kind#ABSENT} markers; rows missing required fields
 * raise {@link NormalizationException}.
 * </p>
 */
public final class Normalizer {
    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    static final String SATURDAY_OFF = "토요휴업일";
    private static final Pattern ALLERGY = Pattern.compile("([0-9]+)\\.");
    private static final Pattern TRAILING = Pattern.compile("[ #&*-.=@_]+$");
    private static final Pattern KCAL = Pattern.compile("^\\s*([0-9]+(?:\\.[0-9]+)?)\\s*(?:Kcal|kcal|KCAL)?\\s*$");
    private static final String[] GRADE_FLAGS = {
            "ONE_GRADE_EVENT_YN", "TW_GRADE_EVENT_YN", "THREE_GRADE_EVENT_YN",
            "FR_GRADE_EVENT_YN", "FIV_GRADE_EVENT_YN", "SIX_GRADE_EVENT_YN" };
    private static final String REPRESENTATIVE_SLOT = "0900";
    private static final ZoneId KST = ZoneId.of("Asia/Seoul");
    private static final DateTimeFormatter HR = DateTimeFormatter.ofPattern("H:mm");

    private final ObjectMapper om;
    private final List<String> highlights;

    /**
     * @param om         mapper used to build canonical JSON values
     * @param highlights menu keywords that earn a star prefix
     */
    public Normalizer(ObjectMapper om, Collection<String> highlights) {
        this.om = om;
        this.highlights = List.copyOf(highlights);
    }

    /**
     * Dispatches on the record's type.
     */
    public Payload normalize(RawRecord raw) throws NormalizationException {
        JsonNode body = raw.body();
        if (body == null || !body.isArray() || body.isEmpty())
            return Payload.absent(Payload.NO_DATA);
        return switch (raw.type()) {
            case MEAL -> meal(raw);
            case SCHEDULE -> schedule(raw);
            case TIMETABLE -> timetable(raw);
            case WEATHER -> weather(raw);
            case WATER_TEMPERATURE -> waterTemperature(raw);
        };
    }

    private Payload meal(RawRecord raw) throws NormalizationException {
        JsonNode row = raw.body().get(0);
        JsonNode dishes = row.get("DDISH_NM");
        if (dishes == null || dishes.isNull())
            throw new NormalizationException(raw.key(), "meal row has no DDISH_NM");

        List<MealDay.MenuItem> menus = new ArrayList<>();
        for (String line : dishes.asText().replace("<br/>", "\n").split("\n")) {
            List<Integer> allergies = new ArrayList<>();
            Matcher m = ALLERGY.matcher(line);
            while (m.find()) {
                int code = Integer.parseInt(m.group(1));
                if (code >= 1 && code <= 18)
                    allergies.add(code);
            }
            String name = ALLERGY.matcher(line).replaceAll("").replace("()", "").trim();
            name = TRAILING.matcher(name).replaceAll("");
            if (name.isEmpty())
                continue;
            if (isHighlighted(name))
                name = "⭐" + name;
            menus.add(new MealDay.MenuItem(name, List.copyOf(allergies)));
        }
        if (menus.isEmpty())
            return Payload.absent("no-menu");
        return present(new MealDay(List.copyOf(menus), calories(row.path("CAL_INFO").asText(null))));
    }

    private boolean isHighlighted(String name) {
        for (String k : highlights) {
            if (name.contains(k))
                return true;
        }
        return false;
    }

    /**
     * Parses {@code "612.3 Kcal"}; null when missing or unreadable.
     */
    static Double calories(String s) {
        if (s == null)
            return null;
        Matcher m = KCAL.matcher(s);
        return m.matches() ? Double.valueOf(m.group(1)) : null;
    }

    private Payload schedule(RawRecord raw) throws NormalizationException {
        List<ScheduleDay.Entry> entries = new ArrayList<>();
        for (JsonNode row : raw.body()) {
            JsonNode ev = row.get("EVENT_NM");
            if (ev == null || ev.isNull() || ev.asText().isBlank())
                throw new NormalizationException(raw.key(), "schedule row has no EVENT_NM");
            String name = ev.asText().trim();
            if (name.equals(SATURDAY_OFF))
                continue;
            List<Integer> grades = new ArrayList<>();
            for (int g = 0; g < GRADE_FLAGS.length; g++) {
                if ("Y".equals(row.path(GRADE_FLAGS[g]).asText()))
                    grades.add(g + 1);
            }
            entries.add(new ScheduleDay.Entry(name, List.copyOf(grades)));
        }
        if (entries.isEmpty())
            return Payload.absent("holiday");

        StringJoiner summary = new StringJoiner("\n");
        for (ScheduleDay.Entry e : entries) {
            if (e.grades().isEmpty()) {
                summary.add(e.name());
            } else {
                StringJoiner g = new StringJoiner(", ", "(", ")");
                e.grades().forEach(n -> g.add(n + "학년"));
                summary.add(e.name() + g);
            }
        }
        return present(new ScheduleDay(List.copyOf(entries), summary.toString()));
    }

    private Payload timetable(RawRecord raw) throws NormalizationException {
        TreeMap<Integer, String> byPeriod = new TreeMap<>();
        for (JsonNode row : raw.body()) {
            String subject = row.path("ITRT_CNTNT").asText("").trim();
            if (subject.isEmpty() || subject.equals(SATURDAY_OFF))
                continue;
            String perio = row.path("PERIO").asText("").trim();
            int period;
            try {
                period = Integer.parseInt(perio);
            } catch (NumberFormatException e) {
                throw new NormalizationException(raw.key(), "non-numeric PERIO '" + perio + "'");
            }
            // duplicate periods keep the first row
            byPeriod.putIfAbsent(period, subject);
        }
        if (byPeriod.isEmpty())
            return Payload.absent("no-lessons");
        return present(new TimetableDay(List.copyOf(byPeriod.values())));
    }

    private Payload weather(RawRecord raw) {
        // slot time -> category -> value
        TreeMap<String, Map<String, String>> slots = new TreeMap<>();
        String tmn = null;
        String tmx = null;
        for (JsonNode item : raw.body()) {
            String cat = item.path("category").asText("");
            String value = item.path("fcstValue").asText(null);
            if (cat.equals("TMN"))
                tmn = value;
            else if (cat.equals("TMX"))
                tmx = value;
            slots.computeIfAbsent(item.path("fcstTime").asText(""), t -> new HashMap<>()).put(cat, value);
        }

        String slot = null;
        if (slots.containsKey(REPRESENTATIVE_SLOT) && slots.get(REPRESENTATIVE_SLOT).containsKey("TMP")) {
            slot = REPRESENTATIVE_SLOT;
        } else {
            for (var e : slots.entrySet()) {
                if (e.getValue().containsKey("TMP")) {
                    slot = e.getKey();
                    break;
                }
            }
        }
        if (slot == null)
            return Payload.absent(Payload.NO_DATA);

        Map<String, String> v = slots.get(slot);
        return present(new WeatherDay(
                slot,
                v.get("TMP"),
                tmn,
                tmx,
                sky(v.get("SKY")),
                precipitation(v.get("PTY")),
                v.get("POP"),
                v.get("REH")));
    }

    static String sky(String code) {
        if (code == null)
            return "unknown";
        return switch (code.trim()) {
            case "1" -> "맑음";
            case "3" -> "구름 많음";
            case "4" -> "흐림";
            default -> "unknown";
        };
    }

    static String precipitation(String code) {
        if (code == null)
            return "unknown";
        return switch (code.trim()) {
            case "0" -> "없음";
            case "1" -> "비";
            case "2" -> "비/눈";
            case "3" -> "눈";
            case "4" -> "소나기";
            default -> "unknown";
        };
    }

    private Payload waterTemperature(RawRecord raw) throws NormalizationException {
        double sum = 0.0;
        int samples = 0;
        LocalTime latest = null;
        for (JsonNode row : raw.body()) {
            String watt = row.path("WATT").asText("").trim();
            try {
                sum += Double.parseDouble(watt);
                samples++;
            } catch (NumberFormatException e) {
                // sensor maintenance reports text instead of a value
                continue;
            }
            try {
                LocalTime t = LocalTime.parse(row.path("HR").asText("").trim(), HR);
                if (latest == null || t.isAfter(latest))
                    latest = t;
            } catch (DateTimeParseException e) {
                log.debug("Water temperature row {} has unreadable HR", raw.key());
            }
        }
        if (samples == 0)
            return Payload.absent("sensor-unavailable");
        if (latest == null)
            throw new NormalizationException(raw.key(), "no measurement time on numeric rows");

        double avg = BigDecimal.valueOf(sum / samples).setScale(2, RoundingMode.HALF_UP).doubleValue();
        OffsetDateTime measuredAt = raw.date().atTime(latest).atZone(KST).toOffsetDateTime();
        return present(new WaterTemperatureDay(avg, measuredAt, samples));
    }

    private Payload present(Object canonical) {
        return Payload.present(om.valueToTree(canonical));
    }

    /**
     * Loads highlight keywords (one per line) from a classpath resource. A
     * missing resource yields no keywords.
     */
    public static List<String> loadHighlights(String resource) {
        List<String> out = new ArrayList<>();
        try (InputStream in = Normalizer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Highlight keyword list {} not found; menus will not be starred", resource);
                return out;
            }
            BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while ((line = br.readLine()) != null) {
                if (!line.isBlank())
                    out.add(line.trim());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + resource, e);
        }
        return out;
    }
}
