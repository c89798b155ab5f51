package com.ospicorp.forecastapi.series.service;

import com.ospicorp.forecastapi.series.model.DataPoint;
import com.ospicorp.forecastapi.series.model.DataPointPage;
import com.ospicorp.forecastapi.series.model.DataPointsAdded;
import com.ospicorp.forecastapi.series.model.DataSource;
import com.ospicorp.forecastapi.series.model.Observation;
import com.ospicorp.forecastapi.series.repository.DataSourceDirectory;
import com.ospicorp.forecastapi.series.repository.TimeSeriesStore;
import java.time.LocalDateTime;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single-point maintenance and range listing of a data source's observations.
 */
@Service
public class DataPointService {
  private static final Logger log = LoggerFactory.getLogger(DataPointService.class);

  public static final int MAX_PER_PAGE = 1000;

  private final DataSourceDirectory directory;
  private final TimeSeriesStore store;

  public DataPointService(DataSourceDirectory directory, TimeSeriesStore store) {
    this.directory = directory;
    this.store = store;
  }

  /**
   * Adds the points whose timestamps are new to the source and marks it initialized once it
   * holds data.
   */
  public DataPointsAdded add(long sourceId, List<DataPoint> points) {
    DataSource source = requireSource(sourceId);
    List<Observation> rows = points.stream().map(DataPoint::toObservation).toList();
    int added = store.insertObservations(sourceId, rows);
    if (added > 0 && !source.initialized()) {
      directory.markInitialized(sourceId);
    }
    int skipped = rows.size() - added;
    if (skipped > 0) {
      log.info("Skipped {} data points already present in data source {}", skipped, sourceId);
    }
    return new DataPointsAdded(added, skipped);
  }

  public DataPoint get(long sourceId, LocalDateTime ts) {
    requireSource(sourceId);
    return store.findObservation(sourceId, ts)
        .map(DataPoint::from)
        .orElseThrow(() -> missingPoint(sourceId, ts));
  }

  public DataPoint update(long sourceId, DataPoint point) {
    requireSource(sourceId);
    if (!store.updateObservation(sourceId, point.toObservation())) {
      throw missingPoint(sourceId, point.ts());
    }
    log.info("Data point at {} in data source {} updated", point.ts(), sourceId);
    return point;
  }

  public void delete(long sourceId, LocalDateTime ts) {
    requireSource(sourceId);
    if (!store.deleteObservation(sourceId, ts)) {
      throw missingPoint(sourceId, ts);
    }
    log.info("Data point at {} in data source {} deleted", ts, sourceId);
  }

  /**
   * Lists the points in {@code [from, to]}, newest first. Without {@code page} and
   * {@code perPage} the whole range is returned in one unpaged response.
   */
  public DataPointPage list(long sourceId, LocalDateTime from, LocalDateTime to, Integer page,
      Integer perPage) {
    requireSource(sourceId);
    if (from != null && to != null && from.isAfter(to)) {
      throw new IllegalArgumentException("start_date must not be after end_date");
    }
    if ((page == null) != (perPage == null)) {
      throw new IllegalArgumentException("page and per_page must be given together");
    }
    int total = store.countObservations(sourceId, from, to);
    if (page == null) {
      List<DataPoint> all = total == 0
          ? List.of()
          : toPoints(store.findObservations(sourceId, from, to, 0, total));
      return DataPointPage.unpaged(all);
    }

    if (page < 1) {
      throw new IllegalArgumentException("page must be at least 1, got " + page);
    }
    if (perPage < 1 || perPage > MAX_PER_PAGE) {
      throw new IllegalArgumentException(
          "per_page must be between 1 and " + MAX_PER_PAGE + ", got " + perPage);
    }
    int totalPages = (total + perPage - 1) / perPage;
    if (page > Math.max(1, totalPages)) {
      throw new NoSuchElementException(
          "Page " + page + " is out of range. Total pages: " + totalPages);
    }
    List<DataPoint> window =
        toPoints(store.findObservations(sourceId, from, to, (page - 1) * perPage, perPage));
    return new DataPointPage(total, totalPages, page, perPage, window);
  }

  private DataSource requireSource(long sourceId) {
    return directory.find(sourceId).orElseThrow(
        () -> new NoSuchElementException("No data source found with ID " + sourceId));
  }

  private static List<DataPoint> toPoints(List<Observation> rows) {
    return rows.stream().map(DataPoint::from).toList();
  }

  private static NoSuchElementException missingPoint(long sourceId, LocalDateTime ts) {
    return new NoSuchElementException(
        "No data point found for data source ID " + sourceId + " at timestamp " + ts);
  }
}
