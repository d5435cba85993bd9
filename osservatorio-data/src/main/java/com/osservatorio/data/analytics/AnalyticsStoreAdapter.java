package com.osservatorio.data.analytics;

import com.osservatorio.common.concurrent.CancellationSignal;
import com.osservatorio.common.exception.PersistenceException;
import com.osservatorio.common.exception.ValidationException;
import com.osservatorio.common.model.Subsystem;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Bulk-load and query access to observation data in the embedded columnar store.
 *
 * The store runs over a single embedded connection, so statement access is
 * serialized by {@link #connectionLock}. Bulk loads are additionally queued on a
 * dedicated writer thread: concurrent callers wait in submission order instead of
 * interleaving their batches.
 */
@Slf4j
public class AnalyticsStoreAdapter {

    static final String TABLE = "istat_observations";

    private static final String CREATE_TABLE = """
        CREATE TABLE IF NOT EXISTS istat_observations (
            dataset_id VARCHAR NOT NULL,
            batch_id VARCHAR NOT NULL,
            period_year INTEGER NOT NULL,
            territory_code VARCHAR,
            territory_name VARCHAR,
            measure_code VARCHAR,
            measure_name VARCHAR,
            obs_value DOUBLE,
            obs_status VARCHAR,
            ingested_at TIMESTAMP
        )
        """;

    private static final String INSERT = """
        INSERT INTO istat_observations
            (dataset_id, batch_id, period_year, territory_code, territory_name,
             measure_code, measure_name, obs_value, obs_status, ingested_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final RowMapper<TimeSeriesPoint> TIME_SERIES_MAPPER = (rs, rowNum) -> TimeSeriesPoint.builder()
            .year(rs.getInt("period_year"))
            .territoryCode(rs.getString("territory_code"))
            .territoryName(rs.getString("territory_name"))
            .measureCode(rs.getString("measure_code"))
            .value(nullableDouble(rs, "obs_value"))
            .status(rs.getString("obs_status"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ExecutorService writer;
    private final ReentrantLock connectionLock = new ReentrantLock(true);
    private final Duration loadTimeout;
    private final int batchSize;

    public AnalyticsStoreAdapter(JdbcTemplate jdbcTemplate,
                                 PlatformTransactionManager analyticsTransactionManager,
                                 Duration loadTimeout,
                                 int batchSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(analyticsTransactionManager);
        this.loadTimeout = loadTimeout;
        this.batchSize = batchSize;
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "analytics-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Create the observation table if missing. Called once by the owning configuration.
     */
    public void initializeSchema() {
        execute("initializeSchema", () -> {
            jdbcTemplate.execute(CREATE_TABLE);
            return null;
        });
        log.info("[ANALYTICS] Schema ready | table={}", TABLE);
    }

    /**
     * Load a batch in one analytics transaction. Blocks until the queued write
     * completes; either every row of the batch is visible afterwards or none is.
     *
     * @return number of rows written
     */
    public int loadBatch(ObservationBatch batch, CancellationSignal cancellation) {
        ValidationException.requireNonBlank(batch.getDatasetId(), "datasetId");
        cancellation.throwIfCancelled("analytics load");

        Future<Integer> pending = writer.submit(() -> {
            cancellation.throwIfCancelled("analytics load");
            return execute("loadBatch", () -> transactionTemplate.execute(status -> insertRows(batch)));
        });

        try {
            int written = pending.get(loadTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[ANALYTICS] Batch loaded | datasetId={} | batchId={} | rows={}",
                    batch.getDatasetId(), batch.getBatchId(), written);
            return written;
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for analytics load");
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new PersistenceException(Subsystem.ANALYTICS,
                    "Bulk load timed out after " + loadTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new PersistenceException(Subsystem.ANALYTICS, "Bulk load failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Remove every row of a dataset. Used as the compensating action of a failed
     * composite registration.
     */
    public int deleteByDataset(String datasetId) {
        int deleted = execute("deleteByDataset", () ->
                jdbcTemplate.update("DELETE FROM istat_observations WHERE dataset_id = ?", datasetId));
        log.info("[ANALYTICS] Rows deleted | datasetId={} | rows={}", datasetId, deleted);
        return deleted;
    }

    public int deleteBatch(String datasetId, String batchId) {
        return execute("deleteBatch", () -> jdbcTemplate.update(
                "DELETE FROM istat_observations WHERE dataset_id = ? AND batch_id = ?", datasetId, batchId));
    }

    public long countObservations(String datasetId) {
        Long count = execute("countObservations", () -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM istat_observations WHERE dataset_id = ?", Long.class, datasetId));
        return count != null ? count : 0L;
    }

    /**
     * Time series ordered by year, optionally narrowed to one batch, one
     * territory, one measure and a year range. Null filters are ignored.
     */
    public List<TimeSeriesPoint> getTimeSeries(String datasetId, String batchId, String territoryCode,
                                               String measureCode, Integer startYear, Integer endYear) {
        StringBuilder sql = new StringBuilder("""
            SELECT period_year, territory_code, territory_name, measure_code, obs_value, obs_status
            FROM istat_observations
            WHERE dataset_id = ?
            """);
        List<Object> args = new ArrayList<>();
        args.add(datasetId);
        appendBatch(sql, args, batchId);
        if (territoryCode != null) {
            sql.append(" AND territory_code = ?");
            args.add(territoryCode);
        }
        if (measureCode != null) {
            sql.append(" AND measure_code = ?");
            args.add(measureCode);
        }
        if (startYear != null) {
            sql.append(" AND period_year >= ?");
            args.add(startYear);
        }
        if (endYear != null) {
            sql.append(" AND period_year <= ?");
            args.add(endYear);
        }
        sql.append(" ORDER BY period_year, territory_code, measure_code");

        return execute("getTimeSeries", () -> jdbcTemplate.query(sql.toString(), TIME_SERIES_MAPPER, args.toArray()));
    }

    /**
     * @param batchId restrict to one batch, or null for every row of the dataset
     */
    public DatasetStatistics getDatasetStatistics(String datasetId, String batchId) {
        StringBuilder sql = new StringBuilder("""
            SELECT COUNT(*) AS record_count,
                   MIN(period_year) AS min_year,
                   MAX(period_year) AS max_year,
                   COUNT(DISTINCT territory_code) AS territory_count,
                   COUNT(DISTINCT measure_code) AS measure_count,
                   AVG(obs_value) AS avg_value,
                   MIN(obs_value) AS min_value,
                   MAX(obs_value) AS max_value
            FROM istat_observations
            WHERE dataset_id = ?
            """);
        List<Object> args = new ArrayList<>();
        args.add(datasetId);
        appendBatch(sql, args, batchId);

        return execute("getDatasetStatistics", () -> jdbcTemplate.queryForObject(sql.toString(), (rs, rowNum) -> {
            long count = rs.getLong("record_count");
            if (count == 0) {
                return DatasetStatistics.empty(datasetId);
            }
            return DatasetStatistics.builder()
                    .datasetId(datasetId)
                    .recordCount(count)
                    .minYear(rs.getInt("min_year"))
                    .maxYear(rs.getInt("max_year"))
                    .territoryCount(rs.getLong("territory_count"))
                    .measureCount(rs.getLong("measure_count"))
                    .averageValue(nullableDouble(rs, "avg_value"))
                    .minValue(nullableDouble(rs, "min_value"))
                    .maxValue(nullableDouble(rs, "max_value"))
                    .build();
        }, args.toArray()));
    }

    /**
     * Rank territories by value for one year and measure, highest first. An empty
     * territory list compares every territory present.
     */
    public List<TerritoryComparison> compareTerritories(String datasetId, String batchId, int year,
                                                        String measureCode, List<String> territoryCodes) {
        StringBuilder sql = new StringBuilder("""
            SELECT territory_code, territory_name, obs_value,
                   RANK() OVER (ORDER BY obs_value DESC) AS value_rank
            FROM istat_observations
            WHERE dataset_id = ? AND period_year = ? AND obs_value IS NOT NULL
            """);
        List<Object> args = new ArrayList<>(List.of(datasetId, year));
        appendBatch(sql, args, batchId);
        if (measureCode != null) {
            sql.append(" AND measure_code = ?");
            args.add(measureCode);
        }
        List<String> territories = territoryCodes != null ? territoryCodes : Collections.emptyList();
        if (!territories.isEmpty()) {
            sql.append(" AND territory_code IN (")
                    .append(String.join(", ", Collections.nCopies(territories.size(), "?")))
                    .append(")");
            args.addAll(territories);
        }
        sql.append(" ORDER BY value_rank, territory_code");

        return execute("compareTerritories", () -> jdbcTemplate.query(sql.toString(), (rs, rowNum) ->
                TerritoryComparison.builder()
                    .territoryCode(rs.getString("territory_code"))
                    .territoryName(rs.getString("territory_name"))
                    .value(nullableDouble(rs, "obs_value"))
                    .rank(rs.getInt("value_rank"))
                    .build(), args.toArray()));
    }

    private static void appendBatch(StringBuilder sql, List<Object> args, String batchId) {
        if (batchId != null) {
            sql.append(" AND batch_id = ?");
            args.add(batchId);
        }
    }

    public void ping() {
        execute("ping", () -> jdbcTemplate.queryForObject("SELECT 1", Integer.class));
    }

    @PreDestroy
    public void shutdown() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[ANALYTICS] Writer stopped");
    }

    // ---------------------------------------------------------------------

    private Integer insertRows(ObservationBatch batch) {
        List<Observation> rows = batch.getRows();
        Timestamp ingestedAt = Timestamp.from(batch.getIngestedAt());
        int written = 0;
        for (int from = 0; from < rows.size(); from += batchSize) {
            List<Observation> chunk = rows.subList(from, Math.min(rows.size(), from + batchSize));
            jdbcTemplate.batchUpdate(INSERT, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    Observation o = chunk.get(i);
                    ps.setString(1, batch.getDatasetId());
                    ps.setString(2, batch.getBatchId());
                    if (o.getPeriodYear() != null) {
                        ps.setInt(3, o.getPeriodYear());
                    } else {
                        ps.setNull(3, Types.INTEGER);
                    }
                    ps.setString(4, o.getTerritoryCode());
                    ps.setString(5, o.getTerritoryName());
                    ps.setString(6, o.getMeasureCode());
                    ps.setString(7, o.getMeasureName());
                    if (o.getValue() != null) {
                        ps.setDouble(8, o.getValue());
                    } else {
                        ps.setNull(8, Types.DOUBLE);
                    }
                    ps.setString(9, o.getStatus());
                    ps.setTimestamp(10, ingestedAt);
                }

                @Override
                public int getBatchSize() {
                    return chunk.size();
                }
            });
            written += chunk.size();
        }
        return written;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        connectionLock.lock();
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.warn("[ANALYTICS] Operation failed | operation={} | error={}", operation, e.getMessage());
            throw new PersistenceException(Subsystem.ANALYTICS, operation + " failed: " + e.getMessage(), e);
        } finally {
            connectionLock.unlock();
        }
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
