package kr.hdmeal.config;

import kr.hdmeal.model.DataType;

import java.io.InputStream;
import java.time.*;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, the cache store, the
 * upstream providers (NEIS, KMA, Seoul open data) and the sync engine.
 * </p>
 */
public record AppConfig(
        // API / DB
        int apiPort,
        String cacheStore, // "jdbc" or "memory"
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,

        // NEIS (meals, schedule, timetable)
        String neisApiKey,
        String neisOfficeCode,
        String neisSchoolCode,
        int neisMaxSpanDays,
        int numGrades,
        int numClasses,

        // KMA weather
        String kmaServiceKey,
        int kmaNx,
        int kmaNy,

        // Seoul open data (water temperature)
        String seoulDataToken,

        // Upstream calls
        Duration upstreamTimeout,
        int retryMaxAttempts,
        Duration retryBaseDelay,

        // Sync engine
        Map<DataType, Duration> ttls,
        Duration syncInterval,
        int warmWindowDays,
        int maxRangeDays,
        Duration syncWait,
        int syncThreads,

        // Time
        ZoneId clockZoneId,

        // App metadata
        String appVersion,
        int appBuild,
        boolean debug) {

    public AppConfig {
        ttls = Collections.unmodifiableMap(new EnumMap<>(ttls));
    }

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            throw new IllegalStateException("Could not read application.properties", e);
        }
        return fromProperties(p);
    }

    /**
     * Builds the configuration from a properties fallback, still honoring env
     * vars and -D overrides.
     */
    public static AppConfig fromProperties(Properties p) {
        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8080"));
        String store = envOr(p, "CACHE_STORE", "cache.store", "jdbc").trim().toLowerCase();
        if (!store.equals("jdbc") && !store.equals("memory")) {
            throw new IllegalStateException("cache.store must be 'jdbc' or 'memory', got: " + store);
        }

        // DB settings only matter for the jdbc store
        boolean jdbc = store.equals("jdbc");
        String dbUrl = envOr(p, "DB_JDBC_URL", "db.jdbcUrl", "");
        String dbUser = envOr(p, "DB_USERNAME", "db.username", "");
        if (jdbc) {
            requireNonBlank(dbUrl, "db.jdbcUrl");
            requireNonBlank(dbUser, "db.username");
        }
        String dbPass = envOr(p, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth
        int dbPoolMax = Integer.parseInt(envOr(p, "DB_POOL_MAX", "db.poolMax", "8"));

        // NEIS
        String neisKey = requireNonBlank(envOr(p, "NEIS_OPENAPI_TOKEN", "neis.apiKey", ""), "neis.apiKey");
        String office = requireNonBlank(envOr(p, "ATPT_OFCDC_SC_CODE", "neis.officeCode", ""), "neis.officeCode");
        String school = requireNonBlank(envOr(p, "SD_SCHUL_CODE", "neis.schoolCode", ""), "neis.schoolCode");
        int neisSpan = Integer.parseInt(envOr(p, "NEIS_MAX_SPAN_DAYS", "neis.maxSpanDays", "31"));
        int grades = Integer.parseInt(envOr(p, "NUM_OF_GRADES", "school.grades", "3"));
        int classes = Integer.parseInt(envOr(p, "NUM_OF_CLASSES", "school.classes", "10"));
        if (grades < 1 || classes < 1) {
            throw new IllegalStateException("school.grades and school.classes must be positive");
        }

        // KMA
        String kmaKey = requireNonBlank(envOr(p, "KMA_SERVICE_KEY", "kma.serviceKey", ""), "kma.serviceKey");
        int nx = Integer.parseInt(envOr(p, "KMA_NX", "kma.nx", "61"));
        int ny = Integer.parseInt(envOr(p, "KMA_NY", "kma.ny", "126"));

        // Seoul
        String seoulToken = requireNonBlank(envOr(p, "SEOUL_DATA_TOKEN", "seoul.token", ""), "seoul.token");

        // Upstream
        Duration timeout = Duration.parse(envOr(p, "UPSTREAM_TIMEOUT", "upstream.timeout", "PT10S"));
        int attempts = Integer.parseInt(envOr(p, "RETRY_MAX_ATTEMPTS", "retry.maxAttempts", "3"));
        Duration baseDelay = Duration.parse(envOr(p, "RETRY_BASE_DELAY", "retry.baseDelay", "PT0.5S"));

        // TTLs per data type
        Map<DataType, Duration> ttls = new EnumMap<>(DataType.class);
        ttls.put(DataType.MEAL, Duration.parse(envOr(p, "TTL_MEAL", "ttl.meal", "PT3H")));
        ttls.put(DataType.SCHEDULE, Duration.parse(envOr(p, "TTL_SCHEDULE", "ttl.schedule", "PT3H")));
        ttls.put(DataType.TIMETABLE, Duration.parse(envOr(p, "TTL_TIMETABLE", "ttl.timetable", "PT3H")));
        ttls.put(DataType.WEATHER, Duration.parse(envOr(p, "TTL_WEATHER", "ttl.weather", "PT1H")));
        ttls.put(DataType.WATER_TEMPERATURE,
                Duration.parse(envOr(p, "TTL_WATER_TEMPERATURE", "ttl.waterTemperature", "PT76M")));

        // Schedules / engine
        Duration interval = Duration.parse(envOr(p, "SCHED_SYNC", "schedule.sync", "PT3H"));
        int warm = Integer.parseInt(envOr(p, "WARM_WINDOW_DAYS", "sync.warmWindowDays", "10"));
        int maxRange = Integer.parseInt(envOr(p, "MAX_DAYS_RANGE", "sync.maxRangeDays", "31"));
        Duration wait = Duration.parse(envOr(p, "SYNC_WAIT", "sync.wait", "PT20S"));
        int threads = Integer.parseInt(envOr(p, "SYNC_THREADS", "sync.threads", "8"));

        // Time zone
        ZoneId zoneId = ZoneId.of(envOr(p, "CLOCK_ZONE", "clock.zone", "Asia/Seoul"));

        // Served by /api/app/meta
        String appVersion = envOr(p, "HDMEAL_APP_VERSION", "app.version", "1.0.0");
        int appBuild = Integer.parseInt(envOr(p, "HDMEAL_APP_BUILD", "app.build", "1"));
        boolean debug = Boolean.parseBoolean(envOr(p, "DEBUG", "app.debug", "false"));

        // IMPORTANT: constructor args must match record field order exactly
        return new AppConfig(
                port,
                store,
                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax,

                neisKey,
                office,
                school,
                neisSpan,
                grades,
                classes,

                kmaKey,
                nx,
                ny,

                seoulToken,

                timeout,
                attempts,
                baseDelay,

                ttls,
                interval,
                warm,
                maxRange,
                wait,
                threads,

                zoneId,

                appVersion,
                appBuild,
                debug);
    }

    /**
     * TTL for a data type.
     */
    public Duration ttl(DataType type) {
        return ttls.get(type);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        // optional: allow -Dprop=... override too
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String v, String name) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + name + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }
}
