package kr.hdmeal;

import kr.hdmeal.config.AppConfig;

import java.time.*;
import java.util.Properties;

/**
 * Shared configuration and clock helpers for tests.
 */
public final class Fixtures {
    private Fixtures() {
    }

    /**
     * Config with every required value set, the memory store, one grade with
     * two classes and near-zero retry delays. Pairs of {@code key, value}
     * override defaults.
     */
    public static AppConfig config(String... overrides) {
        Properties p = new Properties();
        p.setProperty("cache.store", "memory");
        p.setProperty("neis.apiKey", "test-key");
        p.setProperty("neis.officeCode", "B10");
        p.setProperty("neis.schoolCode", "7010000");
        p.setProperty("kma.serviceKey", "kma-key");
        p.setProperty("seoul.token", "seoul-token");
        p.setProperty("school.grades", "1");
        p.setProperty("school.classes", "2");
        p.setProperty("retry.baseDelay", "PT0.001S");
        p.setProperty("sync.wait", "PT10S");
        p.setProperty("sync.threads", "4");
        for (int i = 0; i + 1 < overrides.length; i += 2) {
            p.setProperty(overrides[i], overrides[i + 1]);
        }
        return AppConfig.fromProperties(p);
    }

    /**
     * Clock whose time only moves when told to.
     */
    public static final class MutableClock extends Clock {
        private volatile Instant now;
        private final ZoneId zone;

        public MutableClock(Instant start) {
            this(start, ZoneId.of("Asia/Seoul"));
        }

        private MutableClock(Instant start, ZoneId zone) {
            this.now = start;
            this.zone = zone;
        }

        public void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId z) {
            MutableClock parent = this;
            return new Clock() {
                @Override
                public ZoneId getZone() {
                    return z;
                }

                @Override
                public Clock withZone(ZoneId other) {
                    return parent.withZone(other);
                }

                @Override
                public Instant instant() {
                    return parent.instant();
                }
            };
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
