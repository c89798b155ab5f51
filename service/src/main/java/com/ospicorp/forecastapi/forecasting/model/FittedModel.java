package com.ospicorp.forecastapi.forecasting.model;

import com.ospicorp.forecastapi.series.model.Observation;
import java.util.List;

// Parameters produced by a training run together with its in-sample one-step predictions
public record FittedModel(ModelParameters parameters, List<Observation> fitted) {

  public FittedModel {
    fitted = List.copyOf(fitted);
  }
}
