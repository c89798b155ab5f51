package com.ospicorp.forecastapi.forecasting.strategy;

@FunctionalInterface
public interface StrategyFactory {

  ForecastStrategy create();
}
