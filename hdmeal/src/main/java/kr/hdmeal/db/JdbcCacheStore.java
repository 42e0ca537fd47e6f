/*
* Copyright 2025 Taylor Ketterling
* Cache Store Repository for HDMeal, a school data ingestion and serving application.
* Utilizes HikariCP for database connection pooling and performs upsert operations
*/
package kr.hdmeal.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import kr.hdmeal.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.sql.Date;
import java.time.Instant;
import java.util.*;

/**
 * PostgreSQL-backed cache store. One row per cache key in {@code cache_record},
 * payload kept as jsonb.
 */
public class JdbcCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCacheStore.class);

    private static final String COLUMNS = "data_type, day, grade, class_no, kind, payload, reason, synced_at";

    // an older write never replaces a newer one
    private static final String UPSERT = "INSERT INTO cache_record (" + COLUMNS + ") " +
            "VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?) " +
            "ON CONFLICT (data_type, day, grade, class_no) DO UPDATE SET " +
            "kind=EXCLUDED.kind, payload=EXCLUDED.payload, reason=EXCLUDED.reason, synced_at=EXCLUDED.synced_at " +
            "WHERE cache_record.synced_at <= EXCLUDED.synced_at";

    private final HikariDataSource ds;
    private final ObjectMapper om;

    /**
     * Creates a store backed by the provided datasource and JSON mapper.
     */
    public JdbcCacheStore(HikariDataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
    }

    /**
     * Creates the table and its health index when missing.
     */
    public void ensureSchema() {
        String table = "CREATE TABLE IF NOT EXISTS cache_record (" +
                "data_type text NOT NULL, " +
                "day date NOT NULL, " +
                "grade int NOT NULL DEFAULT 0, " +
                "class_no int NOT NULL DEFAULT 0, " +
                "kind text NOT NULL, " +
                "payload jsonb, " +
                "reason text, " +
                "synced_at timestamptz NOT NULL, " +
                "PRIMARY KEY (data_type, day, grade, class_no))";
        String index = "CREATE INDEX IF NOT EXISTS cache_record_type_synced_idx ON cache_record (data_type, synced_at)";
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute(table);
            st.execute(index);
        } catch (SQLException e) {
            throw new StoreException("Could not create cache_record schema", e);
        }
        log.info("cache_record schema ready");
    }

    @Override
    public void upsert(CacheRecord record) {
        upsertAll(List.of(record));
    }

    @Override
    public void upsertAll(Collection<CacheRecord> records) {
        if (records.isEmpty())
            return;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(UPSERT)) {
            for (CacheRecord r : records) {
                CacheKey k = r.key();
                ps.setString(1, k.type().name());
                ps.setDate(2, Date.valueOf(k.date()));
                ps.setInt(3, k.grade());
                ps.setInt(4, k.classNo());
                ps.setString(5, r.payload().kind().name());
                ps.setString(6, r.payload().isPresent() ? om.writeValueAsString(r.payload().value()) : null);
                ps.setString(7, r.payload().reason());
                ps.setTimestamp(8, Timestamp.from(r.syncedAt()));
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw new StoreException("upsert of " + records.size() + " record(s) failed", e);
        } catch (JsonProcessingException e) {
            throw new StoreException("payload could not be serialized", e);
        }
        log.debug("upsertAll: {} record(s)", records.size());
    }

    @Override
    public List<CacheRecord> readRange(DataType type, DateRange range) {
        String sql = "SELECT " + COLUMNS + " FROM cache_record " +
                "WHERE data_type=? AND day BETWEEN ? AND ? ORDER BY day, grade, class_no";
        return query(sql, ps -> {
            ps.setString(1, type.name());
            ps.setDate(2, Date.valueOf(range.start()));
            ps.setDate(3, Date.valueOf(range.end()));
        });
    }

    @Override
    public List<CacheRecord> readRange(DataType type, DateRange range, int grade, int classNo) {
        String sql = "SELECT " + COLUMNS + " FROM cache_record " +
                "WHERE data_type=? AND day BETWEEN ? AND ? AND grade=? AND class_no=? ORDER BY day";
        return query(sql, ps -> {
            ps.setString(1, type.name());
            ps.setDate(2, Date.valueOf(range.start()));
            ps.setDate(3, Date.valueOf(range.end()));
            ps.setInt(4, grade);
            ps.setInt(5, classNo);
        });
    }

    @Override
    public Optional<Instant> freshnessOf(CacheKey key) {
        String sql = "SELECT synced_at FROM cache_record WHERE data_type=? AND day=? AND grade=? AND class_no=?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key.type().name());
            ps.setDate(2, Date.valueOf(key.date()));
            ps.setInt(3, key.grade());
            ps.setInt(4, key.classNo());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                return Optional.of(rs.getTimestamp(1).toInstant());
            }
        } catch (SQLException e) {
            throw new StoreException("freshness lookup for " + key + " failed", e);
        }
    }

    @Override
    public Map<CacheKey, Instant> freshnessIn(DataType type, DateRange range) {
        String sql = "SELECT day, grade, class_no, synced_at FROM cache_record " +
                "WHERE data_type=? AND day BETWEEN ? AND ?";
        Map<CacheKey, Instant> out = new TreeMap<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, type.name());
            ps.setDate(2, Date.valueOf(range.start()));
            ps.setDate(3, Date.valueOf(range.end()));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    CacheKey k = new CacheKey(type, rs.getDate(1).toLocalDate(), rs.getInt(2), rs.getInt(3));
                    out.put(k, rs.getTimestamp(4).toInstant());
                }
            }
        } catch (SQLException e) {
            throw new StoreException("freshness scan for " + type + " " + range + " failed", e);
        }
        return out;
    }

    @Override
    public Optional<Instant> latestSyncedAt(DataType type) {
        String sql = "SELECT MAX(synced_at) FROM cache_record WHERE data_type=?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, type.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                Timestamp t = rs.getTimestamp(1);
                return t == null ? Optional.empty() : Optional.of(t.toInstant());
            }
        } catch (SQLException e) {
            throw new StoreException("latest sync lookup for " + type + " failed", e);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private List<CacheRecord> query(String sql, Binder binder) {
        List<CacheRecord> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("cache_record query failed", e);
        }
        return out;
    }

    /**
     * Maps the current row to a record.
     */
    private CacheRecord map(ResultSet rs) throws SQLException {
        CacheKey key = new CacheKey(
                DataType.valueOf(rs.getString("data_type")),
                rs.getDate("day").toLocalDate(),
                rs.getInt("grade"),
                rs.getInt("class_no"));
        Payload payload;
        if (Payload.Kind.valueOf(rs.getString("kind")) == Payload.Kind.PRESENT) {
            try {
                JsonNode value = om.readTree(rs.getString("payload"));
                payload = Payload.present(value);
            } catch (JsonProcessingException e) {
                throw new StoreException("stored payload for " + key + " is not valid JSON", e);
            }
        } else {
            payload = Payload.absent(rs.getString("reason"));
        }
        return new CacheRecord(key, payload, rs.getTimestamp("synced_at").toInstant());
    }
}
