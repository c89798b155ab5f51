package com.ospicorp.forecastapi.forecasting;

public class ForecastingException extends RuntimeException {

  public ForecastingException(String message) {
    super(message);
  }

  public ForecastingException(String message, Throwable cause) {
    super(message, cause);
  }
}
