package com.ospicorp.forecastapi.series.repository;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.series.model.Observation;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTimeSeriesStore implements TimeSeriesStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcTimeSeriesStore.class);

  private static final RowMapper<Observation> OBSERVATION = (rs, i) -> {
    double value = rs.getDouble(2);
    return new Observation(rs.getTimestamp(1).toLocalDateTime(), rs.wasNull() ? 0d : value);
  };

  private final JdbcTemplate jdbc;

  public JdbcTimeSeriesStore(JdbcTemplate jdbc) { this.jdbc = jdbc; }

  @Override
  public List<Observation> getAll(long sourceId) {
    String sql = """
      SELECT ts, value
      FROM datasource_data
      WHERE datasource_id = ?
      ORDER BY ts
    """;
    log.debug("Retrieving all data for data source {}", sourceId);
    return StorageRetry.retryOnce("series read " + sourceId,
        () -> jdbc.query(sql, OBSERVATION, sourceId));
  }

  @Override
  public List<Observation> getLatest(long sourceId, int n) {
    String sql = """
      SELECT ts, value FROM (
        SELECT ts, value FROM datasource_data
        WHERE datasource_id = ?
        ORDER BY ts DESC
        LIMIT ?
      ) latest
      ORDER BY ts
    """;
    log.debug("Retrieving latest {} data points for data source {}", n, sourceId);
    return StorageRetry.retryOnce("latest read " + sourceId,
        () -> jdbc.query(sql, OBSERVATION, sourceId, n));
  }

  @Override
  public int insertObservations(long sourceId, List<Observation> rows) {
    String sql = """
      INSERT INTO datasource_data (datasource_id, ts, value)
      VALUES (?, ?, ?)
      ON CONFLICT (datasource_id, ts) DO NOTHING
    """;
    List<Object[]> args = rows.stream()
        .map(row -> new Object[] {sourceId, Timestamp.valueOf(row.timestamp()), row.value()})
        .toList();
    int[] counts = StorageRetry.retryOnce("data point insert " + sourceId,
        () -> jdbc.batchUpdate(sql, args));
    int inserted = Arrays.stream(counts).filter(c -> c > 0).sum();
    log.info("Inserted {} of {} data points for data source {}", inserted, rows.size(),
        sourceId);
    return inserted;
  }

  @Override
  public Optional<Observation> findObservation(long sourceId, LocalDateTime timestamp) {
    String sql = "SELECT ts, value FROM datasource_data WHERE datasource_id = ? AND ts = ?";
    List<Observation> rows = StorageRetry.retryOnce("data point read " + sourceId,
        () -> jdbc.query(sql, OBSERVATION, sourceId, Timestamp.valueOf(timestamp)));
    return rows.stream().findFirst();
  }

  @Override
  public boolean updateObservation(long sourceId, Observation row) {
    String sql = "UPDATE datasource_data SET value = ? WHERE datasource_id = ? AND ts = ?";
    return StorageRetry.retryOnce("data point update " + sourceId,
        () -> jdbc.update(sql, row.value(), sourceId, Timestamp.valueOf(row.timestamp()))) > 0;
  }

  @Override
  public boolean deleteObservation(long sourceId, LocalDateTime timestamp) {
    String sql = "DELETE FROM datasource_data WHERE datasource_id = ? AND ts = ?";
    return StorageRetry.retryOnce("data point delete " + sourceId,
        () -> jdbc.update(sql, sourceId, Timestamp.valueOf(timestamp))) > 0;
  }

  @Override
  public int countObservations(long sourceId, LocalDateTime from, LocalDateTime to) {
    List<Object> args = new ArrayList<>();
    String sql = "SELECT count(*) FROM datasource_data" + rangeFilter(sourceId, from, to, args);
    Integer count = StorageRetry.retryOnce("data point count " + sourceId,
        () -> jdbc.queryForObject(sql, Integer.class, args.toArray()));
    return count == null ? 0 : count;
  }

  @Override
  public List<Observation> findObservations(long sourceId, LocalDateTime from, LocalDateTime to,
      int offset, int limit) {
    List<Object> args = new ArrayList<>();
    String sql = "SELECT ts, value FROM datasource_data" + rangeFilter(sourceId, from, to, args)
        + " ORDER BY ts DESC LIMIT ? OFFSET ?";
    args.add(limit);
    args.add(offset);
    return StorageRetry.retryOnce("data point page " + sourceId,
        () -> jdbc.query(sql, OBSERVATION, args.toArray()));
  }

  private static String rangeFilter(long sourceId, LocalDateTime from, LocalDateTime to,
      List<Object> args) {
    StringBuilder where = new StringBuilder(" WHERE datasource_id = ?");
    args.add(sourceId);
    if (from != null) {
      where.append(" AND ts >= ?");
      args.add(Timestamp.valueOf(from));
    }
    if (to != null) {
      where.append(" AND ts <= ?");
      args.add(Timestamp.valueOf(to));
    }
    return where.toString();
  }

  @Override
  public Iterator<WriteCheckpoint> insertForecastBatch(List<Observation> rows, long sourceId,
      AlgorithmId algorithm) {
    log.info("Inserting {} forecast rows for data source {} ({})", rows.size(), sourceId,
        algorithm.wireName());
    return new BatchWriter(List.copyOf(rows), sourceId, algorithm);
  }

  private void upsert(Observation row, long sourceId, AlgorithmId algorithm) {
    String sql = """
      INSERT INTO datasource_forecasting (datasource_id, algorithm, ts, value)
      VALUES (?, ?, ?, ?)
      ON CONFLICT (datasource_id, algorithm, ts) DO UPDATE SET value = EXCLUDED.value
    """;
    StorageRetry.retryOnce("forecast upsert " + sourceId,
        () -> jdbc.update(sql, sourceId, algorithm.wireName(), Timestamp.valueOf(row.timestamp()),
            row.value()));
  }

  private final class BatchWriter implements Iterator<WriteCheckpoint> {
    private final List<Observation> rows;
    private final long sourceId;
    private final AlgorithmId algorithm;
    private int written;

    private BatchWriter(List<Observation> rows, long sourceId, AlgorithmId algorithm) {
      this.rows = rows;
      this.sourceId = sourceId;
      this.algorithm = algorithm;
    }

    @Override
    public boolean hasNext() {
      return written < rows.size();
    }

    @Override
    public WriteCheckpoint next() {
      if (!hasNext()) {
        throw new NoSuchElementException("All " + rows.size() + " rows already written");
      }
      int target = Math.min(rows.size(), written + CHECKPOINT_INTERVAL);
      while (written < target) {
        upsert(rows.get(written), sourceId, algorithm);
        written++;
      }
      if (written == rows.size()) {
        log.info("Finished inserting forecasting data for data source {}", sourceId);
      }
      return new WriteCheckpoint(written, rows.size());
    }
  }
}
