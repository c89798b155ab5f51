package com.ospicorp.forecastapi.forecasting.strategy;

import com.ospicorp.forecastapi.forecasting.UnknownAlgorithmException;
import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed mapping from algorithm id to strategy factory, built once at startup.
 */
public final class ForecastRegistry {
  private final Map<AlgorithmId, StrategyFactory> factories;

  public ForecastRegistry(Map<AlgorithmId, StrategyFactory> factories) {
    this.factories = Collections.unmodifiableMap(new EnumMap<>(factories));
  }

  public static ForecastRegistry withDefaults() {
    Map<AlgorithmId, StrategyFactory> factories = new EnumMap<>(AlgorithmId.class);
    factories.put(AlgorithmId.AUTO_REGRESSION, AutoRegression::new);
    factories.put(AlgorithmId.EXPONENTIAL_SMOOTHING, ExponentialSmoothing::new);
    return new ForecastRegistry(factories);
  }

  public ForecastStrategy create(AlgorithmId algorithm) {
    StrategyFactory factory = algorithm == null ? null : factories.get(algorithm);
    if (factory == null) {
      throw new UnknownAlgorithmException("No algorithm registered for " + algorithm);
    }
    return factory.create();
  }

  public ForecastStrategy create(String algorithm) {
    return create(AlgorithmId.fromValue(algorithm));
  }

  public boolean supports(AlgorithmId algorithm) {
    return factories.containsKey(algorithm);
  }

  public Set<AlgorithmId> algorithms() {
    return factories.keySet();
  }
}
