package com.ospicorp.forecastapi.forecasting.service;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.FittedModel;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult;
import com.ospicorp.forecastapi.forecasting.repository.ParameterStore;
import com.ospicorp.forecastapi.forecasting.strategy.ForecastStrategy;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.model.Observation;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One strategy instance bound to a data source. Parameters persisted for the pair are loaded
 * when the context is created; training replaces and persists them under the pair's lock.
 */
public class ForecastContext {
  private static final Logger log = LoggerFactory.getLogger(ForecastContext.class);

  private final long dataSourceId;
  private final String key;
  private final ForecastStrategy strategy;
  private final ParameterStore parameterStore;
  private final ParameterCodec codec;
  private final ModelLocks locks;

  ForecastContext(long dataSourceId, ForecastStrategy strategy, ParameterStore parameterStore,
      ParameterCodec codec, ModelLocks locks) {
    this.dataSourceId = dataSourceId;
    this.key = key(dataSourceId, strategy.algorithm());
    this.strategy = strategy;
    this.parameterStore = parameterStore;
    this.codec = codec;
    this.locks = locks;
    parameterStore.get(key).ifPresent(json -> strategy.restore(codec.decode(algorithm(), json)));
  }

  public static String key(long dataSourceId, AlgorithmId algorithm) {
    return dataSourceId + "_" + algorithm.name();
  }

  public FittedModel train(List<Observation> series, Frequency frequency) {
    return locks.withLock(key, () -> {
      FittedModel model = strategy.train(series, frequency);
      parameterStore.set(key, codec.encode(model.parameters()));
      log.info("Stored {} parameters for data source {}", algorithm().wireName(), dataSourceId);
      return model;
    });
  }

  /** A {@code null} tail is treated as no data. */
  public ForecastResult forecast(List<Observation> tail, LocalDateTime date, int steps,
      Frequency frequency) {
    return strategy.forecast(tail == null ? List.of() : tail, date, steps, frequency);
  }

  public int requiredTrailingObservations() {
    return strategy.requiredTrailingObservations();
  }

  public boolean isTrained() {
    return strategy.parameters().isPresent();
  }

  public AlgorithmId algorithm() {
    return strategy.algorithm();
  }

  public String key() {
    return key;
  }
}
