package com.ospicorp.forecastapi.forecasting.service;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.repository.ParameterStore;
import com.ospicorp.forecastapi.forecasting.strategy.ForecastRegistry;
import org.springframework.stereotype.Component;

@Component
public class ForecastContextFactory {
  private final ForecastRegistry registry;
  private final ParameterStore parameterStore;
  private final ParameterCodec codec;
  private final ModelLocks locks;

  public ForecastContextFactory(ForecastRegistry registry, ParameterStore parameterStore,
      ParameterCodec codec, ModelLocks locks) {
    this.registry = registry;
    this.parameterStore = parameterStore;
    this.codec = codec;
    this.locks = locks;
  }

  public ForecastContext create(long dataSourceId, AlgorithmId algorithm) {
    return new ForecastContext(dataSourceId, registry.create(algorithm), parameterStore, codec,
        locks);
  }
}
