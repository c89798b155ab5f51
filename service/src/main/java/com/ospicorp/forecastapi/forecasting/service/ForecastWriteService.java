package com.ospicorp.forecastapi.forecasting.service;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.series.model.Observation;
import com.ospicorp.forecastapi.series.repository.TimeSeriesStore;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/** Persists forecast rows off the request thread. */
@Service
public class ForecastWriteService {
  private static final Logger log = LoggerFactory.getLogger(ForecastWriteService.class);

  private final TimeSeriesStore store;

  public ForecastWriteService(TimeSeriesStore store) {
    this.store = store;
  }

  @Async
  public CompletableFuture<Integer> write(long sourceId, AlgorithmId algorithm,
      List<Observation> rows) {
    int written = store.insertForecastRows(rows, sourceId, algorithm);
    log.debug("Wrote {} {} forecast rows for data source {}", written, algorithm.wireName(),
        sourceId);
    return CompletableFuture.completedFuture(written);
  }
}
