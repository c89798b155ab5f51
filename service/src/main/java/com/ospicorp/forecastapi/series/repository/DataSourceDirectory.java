package com.ospicorp.forecastapi.series.repository;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.series.model.DataSource;
import com.ospicorp.forecastapi.series.model.Frequency;
import java.util.List;
import java.util.Optional;

public interface DataSourceDirectory {

  /**
   * Registers a new, uninitialized and untrained data source.
   */
  DataSource create(String name, Frequency frequency, List<AlgorithmId> algorithms);

  Optional<DataSource> find(long id);

  List<DataSource> findAll();

  void updateAlgorithms(long id, List<AlgorithmId> algorithms);

  void markTrained(long id);

  void markInitialized(long id);

  /**
   * Removes the data source with its observations and forecast rows.
   *
   * @return {@code false} if no such source existed
   */
  boolean delete(long id);
}
