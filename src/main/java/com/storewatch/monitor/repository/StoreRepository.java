package com.storewatch.monitor.repository;

import com.storewatch.monitor.model.Store;
import com.storewatch.monitor.model.StoreStatus;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-based repository for the {@code stores} table.
 *
 * The worker never inserts or deletes stores.  Every write touches a single row and a
 * single concern (baseline, failure counter, last-checked) so that concurrent writes
 * from the visual pipeline and the dashboard never overwrite each other's columns.
 */
@Singleton
public class StoreRepository {

    private static final Logger log = LoggerFactory.getLogger(StoreRepository.class);

    private static final String SELECT_COLUMNS = """
            SELECT id, url, status, baseline_url, failed_attempts, last_checked, owner_email
              FROM stores
            """;

    private final DataSource dataSource;

    @Inject
    public StoreRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    // -----------------------------------------------------------------------
    // Read operations
    // -----------------------------------------------------------------------

    /**
     * Lists every store with status ACTIVE, oldest check first so that stores skipped by
     * a previous overrun are served early.
     *
     * @return active stores (may be empty)
     */
    public List<Store> findActive() {
        final String sql = SELECT_COLUMNS + """
                 WHERE status = 'ACTIVE'
                 ORDER BY last_checked ASC NULLS FIRST, id
                """;

        List<Store> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                result.add(mapRow(rs));
            }
        } catch (SQLException e) {
            log.error("Error in findActive", e);
            throw new RuntimeException("DB error in findActive", e);
        }
        return result;
    }

    public Optional<Store> findById(UUID id) {
        final String sql = SELECT_COLUMNS + " WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findById storeId={}", id, e);
            throw new RuntimeException("DB error in findById", e);
        }
        return Optional.empty();
    }

    /**
     * Resolves the alert recipient of a store.
     *
     * @param id store id
     * @return the owner's e-mail, empty when the store is unknown or has no owner address
     */
    public Optional<String> findOwnerEmail(UUID id) {
        final String sql = "SELECT owner_email FROM stores WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String email = rs.getString("owner_email");
                    return email == null || email.isBlank() ? Optional.empty() : Optional.of(email);
                }
            }
        } catch (SQLException e) {
            log.error("Error in findOwnerEmail storeId={}", id, e);
            throw new RuntimeException("DB error in findOwnerEmail", e);
        }
        return Optional.empty();
    }

    /**
     * Reads the current consecutive-failure counter straight from the table rather than
     * from the (possibly stale) store snapshot taken at the start of the cycle.
     *
     * @param id store id
     * @return the counter, 0 when the store does not exist
     */
    public int findFailedAttempts(UUID id) {
        final String sql = "SELECT failed_attempts FROM stores WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt("failed_attempts");
                }
            }
        } catch (SQLException e) {
            log.error("Error in findFailedAttempts storeId={}", id, e);
            throw new RuntimeException("DB error in findFailedAttempts", e);
        }
        return 0;
    }

    // -----------------------------------------------------------------------
    // Write operations
    // -----------------------------------------------------------------------

    /**
     * Points the store's baseline slot at a new screenshot.
     *
     * @param id          store id
     * @param baselineUrl public URL of the accepted screenshot
     */
    public void updateBaseline(UUID id, String baselineUrl) {
        executeUpdate("updateBaseline", "UPDATE stores SET baseline_url = ? WHERE id = ?", id, ps -> {
            ps.setString(1, baselineUrl);
            ps.setObject(2, id);
        });
    }

    public void updateFailedAttempts(UUID id, int failedAttempts) {
        executeUpdate("updateFailedAttempts", "UPDATE stores SET failed_attempts = ? WHERE id = ?", id, ps -> {
            ps.setInt(1, failedAttempts);
            ps.setObject(2, id);
        });
    }

    /**
     * Writes the failure counter and flips the store to INACTIVE in one statement.
     *
     * @param id             store id
     * @param failedAttempts the counter value that crossed the threshold
     */
    public void markInactive(UUID id, int failedAttempts) {
        final String sql = "UPDATE stores SET failed_attempts = ?, status = ? WHERE id = ?";
        executeUpdate("markInactive", sql, id, ps -> {
            ps.setInt(1, failedAttempts);
            ps.setString(2, StoreStatus.INACTIVE.name());
            ps.setObject(3, id);
        });
    }

    public void updateLastChecked(UUID id, Instant lastChecked) {
        executeUpdate("updateLastChecked", "UPDATE stores SET last_checked = ? WHERE id = ?", id, ps -> {
            ps.setTimestamp(1, Timestamp.from(lastChecked));
            ps.setObject(2, id);
        });
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private void executeUpdate(String operation, String sql, UUID id, StatementBinder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            int rows = ps.executeUpdate();
            log.debug("{} storeId={} rows={}", operation, id, rows);

        } catch (SQLException e) {
            log.error("Error in {} storeId={}", operation, id, e);
            throw new RuntimeException("DB error in " + operation, e);
        }
    }

    private Store mapRow(ResultSet rs) throws SQLException {
        Timestamp lastChecked = rs.getTimestamp("last_checked");
        return Store.builder()
                .id(rs.getObject("id", UUID.class))
                .url(rs.getString("url"))
                .status(StoreStatus.valueOf(rs.getString("status")))
                .baselineUrl(rs.getString("baseline_url"))
                .failedAttempts(rs.getInt("failed_attempts"))
                .lastChecked(lastChecked == null ? null : lastChecked.toInstant())
                .ownerEmail(rs.getString("owner_email"))
                .build();
    }
}
