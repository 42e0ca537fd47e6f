package kr.hdmeal.db;

import kr.hdmeal.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    private Database() {
    }

    /**
     * Builds the pool shared by the sync engine and the read path.
     */
    public static HikariDataSource createCacheDataSource(AppConfig cfg) {
        return createDataSource(cfg.dbJdbcUrl(), cfg.dbUsername(), cfg.dbPassword(), "cache", cfg.dbPoolMax());
    }

    /**
     * Shared helper to build a configured pool with a named role.
     */
    static HikariDataSource createDataSource(String url, String user, String pass, String role, int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(url);
        hc.setUsername(user);
        hc.setPassword(pass);
        hc.setPoolName("hdmeal-" + role);
        hc.setMaximumPoolSize(Math.max(2, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        hc.setLeakDetectionThreshold(0); // enable later if you suspect leaks
        return new HikariDataSource(hc);
    }
}
