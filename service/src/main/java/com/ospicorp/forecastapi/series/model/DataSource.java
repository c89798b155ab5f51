package com.ospicorp.forecastapi.series.model;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import java.util.List;

public record DataSource(
    long id,
    String name,
    Frequency frequency,
    List<AlgorithmId> algorithms,
    boolean initialized,
    boolean trained) {

  public DataSource {
    algorithms = algorithms == null ? List.of() : List.copyOf(algorithms);
  }

  public DataSource withAlgorithms(List<AlgorithmId> newAlgorithms) {
    return new DataSource(id, name, frequency, newAlgorithms, initialized, trained);
  }

  public DataSource markTrained() {
    return new DataSource(id, name, frequency, algorithms, initialized, true);
  }
}
