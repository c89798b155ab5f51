package com.ospicorp.forecastapi.forecasting;

public class InsufficientDataException extends ForecastingException {

  public InsufficientDataException(String message) {
    super(message);
  }
}
