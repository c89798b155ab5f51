package com.ospicorp.forecastapi.forecasting.model;

import com.ospicorp.forecastapi.series.model.Observation;
import java.util.List;

/**
 * Outcome of a forecast call. An unavailable result is not an error: it means no forecast can be
 * produced for the request as posed.
 */
public record ForecastResult(List<Observation> series, Unavailability reason) {

  public enum Unavailability {
    PAST_DATE,
    PARAMETERS_UNSET,
    NO_DATA
  }

  public ForecastResult {
    series = series == null ? List.of() : List.copyOf(series);
  }

  public static ForecastResult available(List<Observation> series) {
    return new ForecastResult(series, null);
  }

  public static ForecastResult unavailable(Unavailability reason) {
    return new ForecastResult(List.of(), reason);
  }

  public boolean isAvailable() {
    return reason == null;
  }
}
