package com.storewatch.monitor.repository;

import com.storewatch.monitor.model.PingLog;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-based repository for the append-only {@code ping_logs} table.
 *
 * Ordering between probes of the same store is {@code (checked_at, id)}: the BIGSERIAL
 * id breaks ties between probes that share a timestamp.
 */
@Singleton
public class PingLogRepository {

    private static final Logger log = LoggerFactory.getLogger(PingLogRepository.class);

    private final DataSource dataSource;

    @Inject
    public PingLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Appends a probe record.
     *
     * @param ping the probe to persist (id will be set on return)
     * @return the saved probe
     */
    public PingLog save(PingLog ping) {
        final String sql = """
                INSERT INTO ping_logs
                    (store_id, status_code, response_time_ms, is_up, error_message, checked_at)
                VALUES (?, ?, ?, ?, ?, ?)
                RETURNING id
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, ping.getStoreId());
            if (ping.getStatusCode() == null) {
                ps.setNull(2, Types.INTEGER);
            } else {
                ps.setInt(2, ping.getStatusCode());
            }
            ps.setLong(3, ping.getResponseTimeMs());
            ps.setBoolean(4, ping.isUp());
            if (ping.getErrorMessage() == null) {
                ps.setNull(5, Types.VARCHAR);
            } else {
                ps.setString(5, ping.getErrorMessage());
            }
            ps.setTimestamp(6, Timestamp.from(ping.getCheckedAt()));

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    ping.setId(rs.getLong("id"));
                }
            }

            log.debug("Saved ping_log id={} storeId={} up={}", ping.getId(), ping.getStoreId(), ping.isUp());
            return ping;

        } catch (SQLException e) {
            log.error("Error saving ping_log storeId={}", ping.getStoreId(), e);
            throw new RuntimeException("DB error in save", e);
        }
    }

    /**
     * Finds the probe recorded immediately before the given one for the same store.
     *
     * @param storeId store id
     * @param pingId  id of the probe just written
     * @return the preceding probe, empty for the first probe of a store
     */
    public Optional<PingLog> findPrevious(UUID storeId, long pingId) {
        final String sql = """
                SELECT p.id, p.store_id, p.status_code, p.response_time_ms, p.is_up,
                       p.error_message, p.checked_at
                  FROM ping_logs p
                  JOIN ping_logs cur ON cur.id = ?
                 WHERE p.store_id = ?
                   AND (p.checked_at < cur.checked_at
                        OR (p.checked_at = cur.checked_at AND p.id < cur.id))
                 ORDER BY p.checked_at DESC, p.id DESC
                 LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, pingId);
            ps.setObject(2, storeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findPrevious storeId={} pingId={}", storeId, pingId, e);
            throw new RuntimeException("DB error in findPrevious", e);
        }
        return Optional.empty();
    }

    private PingLog mapRow(ResultSet rs) throws SQLException {
        int statusCode = rs.getInt("status_code");
        boolean statusNull = rs.wasNull();
        return PingLog.builder()
                .id(rs.getLong("id"))
                .storeId(rs.getObject("store_id", UUID.class))
                .statusCode(statusNull ? null : statusCode)
                .responseTimeMs(rs.getLong("response_time_ms"))
                .up(rs.getBoolean("is_up"))
                .errorMessage(rs.getString("error_message"))
                .checkedAt(rs.getTimestamp("checked_at").toInstant())
                .build();
    }
}
