package com.ospicorp.forecastapi.series.model;

import java.time.LocalDateTime;

// One sample of a series; gaps on a resampling grid are materialised as value 0.0
public record Observation(LocalDateTime timestamp, double value) {

  public Observation withValue(double newValue) {
    return new Observation(timestamp, newValue);
  }
}
