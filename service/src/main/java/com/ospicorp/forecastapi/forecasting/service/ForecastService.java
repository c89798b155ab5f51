package com.ospicorp.forecastapi.forecasting.service;

import com.ospicorp.forecastapi.forecasting.DataSourceNotTrainedException;
import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.ForecastResponse;
import com.ospicorp.forecastapi.forecasting.model.ForecastResponse.AlgorithmForecast;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult;
import com.ospicorp.forecastapi.series.model.DataSource;
import com.ospicorp.forecastapi.series.model.Observation;
import com.ospicorp.forecastapi.series.repository.DataSourceDirectory;
import com.ospicorp.forecastapi.series.repository.TimeSeriesStore;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ForecastService {
  private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

  private final DataSourceDirectory directory;
  private final TimeSeriesStore store;
  private final ForecastContextFactory contexts;
  private final ForecastWriteService writer;

  public ForecastService(DataSourceDirectory directory, TimeSeriesStore store,
      ForecastContextFactory contexts, ForecastWriteService writer) {
    this.directory = directory;
    this.store = store;
    this.contexts = contexts;
    this.writer = writer;
  }

  /**
   * Forecasts every model configured on the data source up to {@code date}, returning the last
   * {@code steps} rows per model. Newly forecast rows are persisted asynchronously.
   */
  public ForecastResponse forecast(long sourceId, LocalDateTime date, int steps) {
    if (date == null) {
      throw new IllegalArgumentException("date is required");
    }
    if (steps < 1) {
      throw new IllegalArgumentException("steps must be at least 1, got " + steps);
    }
    long started = System.nanoTime();
    DataSource source = directory.find(sourceId)
        .orElseThrow(() -> new NoSuchElementException("No data source found with ID " + sourceId));
    if (!source.trained()) {
      throw new DataSourceNotTrainedException(sourceId);
    }

    List<AlgorithmForecast> forecasts = new ArrayList<>(source.algorithms().size());
    for (AlgorithmId algorithm : source.algorithms()) {
      forecasts.add(forecastOne(source, algorithm, date, steps));
    }
    double seconds = (System.nanoTime() - started) / 1e9;
    String operationTime = String.format(Locale.ROOT, "%.4fs", seconds);
    log.info("Forecast for data source {} up to {} finished in {}", sourceId, date, operationTime);
    return new ForecastResponse(forecasts, operationTime);
  }

  private AlgorithmForecast forecastOne(DataSource source, AlgorithmId algorithm,
      LocalDateTime date, int steps) {
    ForecastContext context = contexts.create(source.id(), algorithm);
    int required = Math.max(1, context.requiredTrailingObservations());
    List<Observation> tail = store.getLatest(source.id(), required);
    ForecastResult result = context.forecast(tail, date, steps, source.frequency());
    if (!result.isAvailable()) {
      log.info("No {} forecast for data source {}: {}", algorithm.wireName(), source.id(),
          result.reason());
      return AlgorithmForecast.unavailable(algorithm, result.reason());
    }

    List<Observation> series = result.series();
    LocalDateTime lastObserved = tail.get(tail.size() - 1).timestamp();
    List<Observation> fresh = series.stream()
        .filter(o -> o.timestamp().isAfter(lastObserved))
        .toList();
    if (!fresh.isEmpty()) {
      writer.write(source.id(), algorithm, fresh)
          .exceptionally(ex -> {
            log.error("Writing {} forecast rows for data source {} failed",
                algorithm.wireName(), source.id(), ex);
            return 0;
          });
    }

    List<Observation> lastSteps = series.subList(Math.max(0, series.size() - steps), series.size());
    List<LocalDateTime> dates = new ArrayList<>(lastSteps.size());
    List<Double> values = new ArrayList<>(lastSteps.size());
    for (Observation o : lastSteps) {
      dates.add(o.timestamp());
      values.add(Math.max(0d, o.value()));
    }
    return new AlgorithmForecast(algorithm, dates, values, null);
  }
}
