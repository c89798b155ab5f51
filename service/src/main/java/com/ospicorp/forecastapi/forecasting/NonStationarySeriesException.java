package com.ospicorp.forecastapi.forecasting;

public class NonStationarySeriesException extends ForecastingException {

  public NonStationarySeriesException(String message) {
    super(message);
  }
}
