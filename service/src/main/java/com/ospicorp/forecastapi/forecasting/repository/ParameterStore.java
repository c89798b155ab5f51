package com.ospicorp.forecastapi.forecasting.repository;

import java.util.Optional;

/**
 * Key-value store for serialized model parameters. Keys have the form
 * {@code "{dataSourceId}_{ALGORITHM_ID}"}.
 */
public interface ParameterStore {

  Optional<String> get(String key);

  void set(String key, String json);

  void delete(String key);
}
