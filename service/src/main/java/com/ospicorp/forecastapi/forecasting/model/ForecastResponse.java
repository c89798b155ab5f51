package com.ospicorp.forecastapi.forecasting.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult.Unavailability;
import java.time.LocalDateTime;
import java.util.List;

public record ForecastResponse(
    List<AlgorithmForecast> forecasts,
    @JsonProperty("operation_time") String operationTime
) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record AlgorithmForecast(
      AlgorithmId algorithm,
      List<LocalDateTime> dates,
      List<Double> values,
      Unavailability unavailable
  ) {

    public static AlgorithmForecast unavailable(AlgorithmId algorithm, Unavailability reason) {
      return new AlgorithmForecast(algorithm, List.of(), List.of(), reason);
    }
  }
}
