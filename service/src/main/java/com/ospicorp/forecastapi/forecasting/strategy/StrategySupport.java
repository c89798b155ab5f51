package com.ospicorp.forecastapi.forecasting.strategy;

import com.ospicorp.forecastapi.forecasting.model.ForecastResult;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult.Unavailability;
import com.ospicorp.forecastapi.series.model.Observation;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

final class StrategySupport {
  private StrategySupport() {
  }

  // Shared preconditions of every forecast call, in the order they are checked
  static Optional<ForecastResult> checkRequest(boolean trained, List<Observation> tail,
      LocalDateTime date) {
    if (!trained) {
      return Optional.of(ForecastResult.unavailable(Unavailability.PARAMETERS_UNSET));
    }
    if (tail == null || tail.isEmpty()) {
      return Optional.of(ForecastResult.unavailable(Unavailability.NO_DATA));
    }
    if (date.isBefore(last(tail).timestamp())) {
      return Optional.of(ForecastResult.unavailable(Unavailability.PAST_DATE));
    }
    return Optional.empty();
  }

  static Observation last(List<Observation> series) {
    return series.get(series.size() - 1);
  }

  static Set<LocalDateTime> timestamps(List<Observation> series) {
    Set<LocalDateTime> out = new HashSet<>(series.size() * 2);
    for (Observation o : series) {
      out.add(o.timestamp());
    }
    return out;
  }
}
