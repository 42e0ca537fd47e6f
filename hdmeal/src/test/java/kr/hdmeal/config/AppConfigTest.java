package kr.hdmeal.config;

import kr.hdmeal.model.DataType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    private static Properties required() {
        Properties p = new Properties();
        p.setProperty("cache.store", "memory");
        p.setProperty("neis.apiKey", "k");
        p.setProperty("neis.officeCode", "B10");
        p.setProperty("neis.schoolCode", "7010000");
        p.setProperty("kma.serviceKey", "k");
        p.setProperty("seoul.token", "t");
        return p;
    }

    @Test
    void defaultsApplyWhenOnlyRequiredValuesAreSet() {
        AppConfig cfg = AppConfig.fromProperties(required());

        assertEquals(Duration.ofHours(3), cfg.ttl(DataType.MEAL));
        assertEquals(Duration.ofHours(1), cfg.ttl(DataType.WEATHER));
        assertEquals(Duration.ofMinutes(76), cfg.ttl(DataType.WATER_TEMPERATURE));
        assertEquals(31, cfg.maxRangeDays());
        assertEquals(10, cfg.warmWindowDays());
        assertEquals(3, cfg.numGrades());
        assertEquals(10, cfg.numClasses());
        assertEquals(ZoneId.of("Asia/Seoul"), cfg.clockZoneId());
        assertEquals("1.0.0", cfg.appVersion());
        assertEquals(1, cfg.appBuild());
        assertFalse(cfg.debug());
    }

    @Test
    void missingRequiredValueFails() {
        Properties p = required();
        p.remove("neis.schoolCode");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p));
        assertTrue(e.getMessage().contains("neis.schoolCode"));
    }

    @Test
    void jdbcStoreNeedsConnectionSettings() {
        Properties p = required();
        p.setProperty("cache.store", "jdbc");

        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p));
    }

    @Test
    void unknownStoreIsRejected() {
        Properties p = required();
        p.setProperty("cache.store", "redis");

        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p));
    }
}
