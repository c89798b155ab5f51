package com.ospicorp.forecastapi.forecasting.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * Additive Holt-Winters state. {@code lastSeason} holds one seasonal component per period of the
 * cycle, oldest first; element 0 applies to the next forecast step.
 */
public record ExponentialSmoothingParameters(
    @JsonProperty("alpha") double alpha,
    @JsonProperty("beta") double beta,
    @JsonProperty("gamma") double gamma,
    @JsonProperty("last_level") double lastLevel,
    @JsonProperty("last_trend") double lastTrend,
    @JsonProperty("last_season") List<Double> lastSeason) implements ModelParameters {

  public ExponentialSmoothingParameters {
    if (lastSeason == null || lastSeason.isEmpty()) {
      throw new IllegalArgumentException("last_season must hold at least one component");
    }
    lastSeason = List.copyOf(lastSeason);
  }

  /**
   * One step of the online recurrence, treating {@code observed} as the value of the next period.
   */
  public ExponentialSmoothingParameters update(double observed) {
    double season = lastSeason.get(0);
    double newLevel = alpha * (observed - season) + (1 - alpha) * (lastLevel + lastTrend);
    double newTrend = beta * (newLevel - lastLevel) + (1 - beta) * lastTrend;
    double newSeason = gamma * (observed - newLevel) + (1 - gamma) * season;

    List<Double> rotated = new ArrayList<>(lastSeason.subList(1, lastSeason.size()));
    rotated.add(newSeason);
    return new ExponentialSmoothingParameters(alpha, beta, gamma, newLevel, newTrend, rotated);
  }

  public double nextForecast() {
    return lastLevel + lastTrend + lastSeason.get(0);
  }

  @JsonIgnore
  public int seasonalPeriods() {
    return lastSeason.size();
  }

  @JsonIgnore
  @Override
  public AlgorithmId algorithm() {
    return AlgorithmId.EXPONENTIAL_SMOOTHING;
  }
}
