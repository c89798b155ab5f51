package com.ospicorp.forecastapi.forecasting;

// Forecasts need persisted parameters, which exist only once a training job has succeeded
public class DataSourceNotTrainedException extends RuntimeException {
  private final long dataSourceId;

  public DataSourceNotTrainedException(long dataSourceId) {
    super("Data source " + dataSourceId + " must be trained first");
    this.dataSourceId = dataSourceId;
  }

  public long dataSourceId() {
    return dataSourceId;
  }
}
