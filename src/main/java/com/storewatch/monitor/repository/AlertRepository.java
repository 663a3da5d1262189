package com.storewatch.monitor.repository;

import com.storewatch.monitor.model.Alert;
import com.storewatch.monitor.model.AlertCategory;
import com.storewatch.monitor.model.AlertSeverity;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-based repository for the {@code alerts} table.
 *
 * The worker only inserts alerts; status changes (acknowledge, resolve) belong to the
 * dashboard and are not modelled here.
 */
@Singleton
public class AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRepository.class);

    private final DataSource dataSource;

    @Inject
    public AlertRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Inserts a new alert.  A random id is assigned when the alert has none.
     *
     * @param alert the alert to persist
     * @return the saved alert with id and creation timestamp set
     */
    public Alert save(Alert alert) {
        final String sql = """
                INSERT INTO alerts
                    (id, store_id, category, step, before_url, after_url, diff_url,
                     diff_percentage, severity, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, NOW())
                RETURNING created_at
                """;

        if (alert.getId() == null) {
            alert.setId(UUID.randomUUID());
        }

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, alert.getId());
            ps.setObject(2, alert.getStoreId());
            ps.setString(3, alert.getCategory().name());
            setNullableString(ps, 4, alert.getStep());
            setNullableString(ps, 5, alert.getBeforeUrl());
            setNullableString(ps, 6, alert.getAfterUrl());
            setNullableString(ps, 7, alert.getDiffUrl());
            if (alert.getDiffPercentage() == null) {
                ps.setNull(8, Types.NUMERIC);
            } else {
                ps.setBigDecimal(8, BigDecimal.valueOf(alert.getDiffPercentage()));
            }
            ps.setString(9, alert.getSeverity().name());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    alert.setCreatedAt(rs.getTimestamp("created_at").toInstant());
                }
            }

            log.info("Saved alert id={} storeId={} category={} severity={}",
                    alert.getId(), alert.getStoreId(), alert.getCategory(), alert.getSeverity());
            return alert;

        } catch (SQLException e) {
            log.error("Error saving alert storeId={} category={}", alert.getStoreId(), alert.getCategory(), e);
            throw new RuntimeException("DB error in save", e);
        }
    }

    /**
     * Creation time of the newest alert of a category for a store.  Used to apply the
     * optional availability re-alert cooldown.
     *
     * @param storeId  store id
     * @param category alert category
     * @return the timestamp, empty when the store never had such an alert
     */
    public Optional<Instant> findLatestCreatedAt(UUID storeId, AlertCategory category) {
        final String sql = """
                SELECT MAX(created_at) AS latest
                  FROM alerts
                 WHERE store_id = ?
                   AND category = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, storeId);
            ps.setString(2, category.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    Timestamp latest = rs.getTimestamp("latest");
                    return latest == null ? Optional.empty() : Optional.of(latest.toInstant());
                }
            }
        } catch (SQLException e) {
            log.error("Error in findLatestCreatedAt storeId={} category={}", storeId, category, e);
            throw new RuntimeException("DB error in findLatestCreatedAt", e);
        }
        return Optional.empty();
    }

    public List<Alert> findByStore(UUID storeId) {
        final String sql = """
                SELECT id, store_id, category, step, before_url, after_url, diff_url,
                       diff_percentage, severity, created_at
                  FROM alerts
                 WHERE store_id = ?
                 ORDER BY created_at DESC
                """;

        List<Alert> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, storeId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    BigDecimal diff = rs.getBigDecimal("diff_percentage");
                    result.add(Alert.builder()
                            .id(rs.getObject("id", UUID.class))
                            .storeId(rs.getObject("store_id", UUID.class))
                            .category(AlertCategory.valueOf(rs.getString("category")))
                            .step(rs.getString("step"))
                            .beforeUrl(rs.getString("before_url"))
                            .afterUrl(rs.getString("after_url"))
                            .diffUrl(rs.getString("diff_url"))
                            .diffPercentage(diff == null ? null : diff.doubleValue())
                            .severity(AlertSeverity.valueOf(rs.getString("severity")))
                            .createdAt(rs.getTimestamp("created_at").toInstant())
                            .build());
                }
            }
        } catch (SQLException e) {
            log.error("Error in findByStore storeId={}", storeId, e);
            throw new RuntimeException("DB error in findByStore", e);
        }
        return result;
    }

    private static void setNullableString(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, value);
        }
    }
}
