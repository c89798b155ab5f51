package com.ospicorp.forecastapi.forecasting;

public class UnsupportedSeasonalityException extends ForecastingException {

  public UnsupportedSeasonalityException(String message) {
    super(message);
  }
}
