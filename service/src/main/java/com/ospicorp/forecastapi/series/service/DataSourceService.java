package com.ospicorp.forecastapi.series.service;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.repository.ParameterStore;
import com.ospicorp.forecastapi.forecasting.service.ForecastContext;
import com.ospicorp.forecastapi.series.model.DataSource;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.repository.DataSourceDirectory;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DataSourceService {
  private static final Logger log = LoggerFactory.getLogger(DataSourceService.class);

  static final List<AlgorithmId> DEFAULT_ALGORITHMS = List.of(AlgorithmId.AUTO_REGRESSION);

  private final DataSourceDirectory directory;
  private final ParameterStore parameters;

  public DataSourceService(DataSourceDirectory directory, ParameterStore parameters) {
    this.directory = directory;
    this.parameters = parameters;
  }

  /**
   * Registers a data source sampled at {@code frequency}. New sources start with
   * auto-regression as their only model until a training request names others.
   */
  public DataSource create(String name, Frequency frequency) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Data source name must be provided");
    }
    if (frequency == null) {
      throw new IllegalArgumentException("Data source period must be provided");
    }
    DataSource created = directory.create(name.trim(), frequency, DEFAULT_ALGORITHMS);
    log.info("Data source created with ID {} ({}, {})", created.id(), created.name(), frequency);
    return created;
  }

  public List<DataSource> findAll() {
    List<DataSource> sources = directory.findAll();
    log.debug("Retrieved {} data sources", sources.size());
    return sources;
  }

  public DataSource get(long id) {
    return directory.find(id)
        .orElseThrow(() -> new NoSuchElementException("No data source found with ID " + id));
  }

  /**
   * Deletes the source, its observations and forecast rows, and the parameters of every model.
   */
  public void delete(long id) {
    if (!directory.delete(id)) {
      throw new NoSuchElementException("No data source found with ID " + id);
    }
    for (AlgorithmId algorithm : AlgorithmId.values()) {
      parameters.delete(ForecastContext.key(id, algorithm));
    }
    log.info("Data source with ID {} deleted", id);
  }
}
