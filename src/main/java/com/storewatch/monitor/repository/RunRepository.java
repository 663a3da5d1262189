package com.storewatch.monitor.repository;

import com.storewatch.monitor.model.Run;
import com.storewatch.monitor.model.RunStatus;
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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JDBC-based repository for the append-only {@code runs} table.
 */
@Singleton
public class RunRepository {

    private static final Logger log = LoggerFactory.getLogger(RunRepository.class);

    private final DataSource dataSource;

    @Inject
    public RunRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Appends a run record.
     *
     * @param run the run to persist (id will be set on return)
     * @return the saved run
     */
    public Run save(Run run) {
        final String sql = """
                INSERT INTO runs
                    (store_id, started_at, finished_at, status, error_message, screenshot_url, diff_percentage)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                RETURNING id
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, run.getStoreId());
            ps.setTimestamp(2, Timestamp.from(run.getStartedAt()));
            ps.setTimestamp(3, Timestamp.from(run.getFinishedAt()));
            ps.setString(4, run.getStatus().name());
            setNullableString(ps, 5, run.getErrorMessage());
            setNullableString(ps, 6, run.getScreenshotUrl());
            if (run.getDiffPercentage() == null) {
                ps.setNull(7, Types.NUMERIC);
            } else {
                ps.setBigDecimal(7, BigDecimal.valueOf(run.getDiffPercentage()));
            }

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    run.setId(rs.getLong("id"));
                }
            }

            log.info("Saved run id={} storeId={} status={} diffPercentage={}",
                    run.getId(), run.getStoreId(), run.getStatus(), run.getDiffPercentage());
            return run;

        } catch (SQLException e) {
            log.error("Error saving run storeId={}", run.getStoreId(), e);
            throw new RuntimeException("DB error in save", e);
        }
    }

    /**
     * Most recent runs of a store, newest first.
     *
     * @param storeId store id
     * @param limit   maximum number of rows
     * @return runs (may be empty)
     */
    public List<Run> findRecentByStore(UUID storeId, int limit) {
        final String sql = """
                SELECT id, store_id, started_at, finished_at, status, error_message,
                       screenshot_url, diff_percentage
                  FROM runs
                 WHERE store_id = ?
                 ORDER BY started_at DESC, id DESC
                 LIMIT ?
                """;

        List<Run> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, storeId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    BigDecimal diff = rs.getBigDecimal("diff_percentage");
                    result.add(Run.builder()
                            .id(rs.getLong("id"))
                            .storeId(rs.getObject("store_id", UUID.class))
                            .startedAt(rs.getTimestamp("started_at").toInstant())
                            .finishedAt(rs.getTimestamp("finished_at").toInstant())
                            .status(RunStatus.valueOf(rs.getString("status")))
                            .errorMessage(rs.getString("error_message"))
                            .screenshotUrl(rs.getString("screenshot_url"))
                            .diffPercentage(diff == null ? null : diff.doubleValue())
                            .build());
                }
            }
        } catch (SQLException e) {
            log.error("Error in findRecentByStore storeId={}", storeId, e);
            throw new RuntimeException("DB error in findRecentByStore", e);
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
