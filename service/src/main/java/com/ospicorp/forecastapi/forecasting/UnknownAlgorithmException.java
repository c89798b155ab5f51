package com.ospicorp.forecastapi.forecasting;

public class UnknownAlgorithmException extends ForecastingException {

  public UnknownAlgorithmException(String message) {
    super(message);
  }
}
