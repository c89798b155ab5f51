package com.ospicorp.forecastapi.series.repository;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.series.model.Observation;
import java.time.LocalDateTime;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

public interface TimeSeriesStore {
  int CHECKPOINT_INTERVAL = 10;

  /**
   * All observations of a data source, ascending by timestamp.
   */
  List<Observation> getAll(long sourceId);

  /**
   * The most recent {@code n} observations, ascending by timestamp.
   */
  List<Observation> getLatest(long sourceId, int n);

  /**
   * Inserts observations whose timestamp is not stored yet; existing rows are left untouched.
   *
   * @return the number of rows inserted
   */
  int insertObservations(long sourceId, List<Observation> rows);

  Optional<Observation> findObservation(long sourceId, LocalDateTime timestamp);

  /**
   * @return {@code false} if no observation exists at the row's timestamp
   */
  boolean updateObservation(long sourceId, Observation row);

  boolean deleteObservation(long sourceId, LocalDateTime timestamp);

  /**
   * Number of observations with {@code from <= ts <= to}; either bound may be {@code null}.
   */
  int countObservations(long sourceId, LocalDateTime from, LocalDateTime to);

  /**
   * One window of the observations counted by {@link #countObservations}, newest first.
   */
  List<Observation> findObservations(long sourceId, LocalDateTime from, LocalDateTime to,
      int offset, int limit);

  /**
   * Upserts forecast rows keyed by (source, algorithm, timestamp). Rows are written lazily as
   * the returned iterator advances; a checkpoint is produced after every
   * {@link #CHECKPOINT_INTERVAL}-th row and after the last one.
   */
  Iterator<WriteCheckpoint> insertForecastBatch(List<Observation> rows, long sourceId,
      AlgorithmId algorithm);

  /**
   * Writes every row, ignoring intermediate checkpoints.
   *
   * @return the number of rows written
   */
  default int insertForecastRows(List<Observation> rows, long sourceId, AlgorithmId algorithm) {
    Iterator<WriteCheckpoint> checkpoints = insertForecastBatch(rows, sourceId, algorithm);
    int written = 0;
    while (checkpoints.hasNext()) {
      written = checkpoints.next().rowsWritten();
    }
    return written;
  }
}
