package com.ospicorp.forecastapi.series.model;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;

// Wire form of an observation
public record DataPoint(@NotNull LocalDateTime ts, @NotNull Double value) {

  public static DataPoint from(Observation observation) {
    return new DataPoint(observation.timestamp(), observation.value());
  }

  public Observation toObservation() {
    return new Observation(ts, value);
  }
}
