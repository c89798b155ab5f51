package com.ospicorp.forecastapi.forecasting.strategy;

import com.ospicorp.forecastapi.forecasting.InsufficientDataException;
import com.ospicorp.forecastapi.forecasting.UnsupportedSeasonalityException;
import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.ExponentialSmoothingParameters;
import com.ospicorp.forecastapi.forecasting.model.FittedModel;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult;
import com.ospicorp.forecastapi.forecasting.model.ModelParameters;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.model.Observation;
import com.ospicorp.forecastapi.series.service.Resampler;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Additive Holt-Winters. Forecasts are produced from the persisted level/trend/season state
 * alone, feeding each forecast back into the recurrence as if it had been observed.
 */
public final class ExponentialSmoothing implements ForecastStrategy {
  private static final Logger log = LoggerFactory.getLogger(ExponentialSmoothing.class);

  private final boolean dropZeroForecasts;
  private ExponentialSmoothingParameters parameters;

  public ExponentialSmoothing() {
    this(true);
  }

  public ExponentialSmoothing(boolean dropZeroForecasts) {
    this.dropZeroForecasts = dropZeroForecasts;
  }

  @Override
  public AlgorithmId algorithm() {
    return AlgorithmId.EXPONENTIAL_SMOOTHING;
  }

  @Override
  public Optional<ModelParameters> parameters() {
    return Optional.ofNullable(parameters);
  }

  @Override
  public void restore(ModelParameters restored) {
    if (!(restored instanceof ExponentialSmoothingParameters es)) {
      throw new IllegalArgumentException(
          "Expected exponential smoothing parameters but got " + restored.algorithm());
    }
    this.parameters = es;
  }

  @Override
  public FittedModel train(List<Observation> series, Frequency frequency) {
    int m = frequency.seasonalPeriods().orElseThrow(() -> new UnsupportedSeasonalityException(
        "Frequency " + frequency + " has no seasonal period for exponential smoothing"));
    log.info("Training exponential smoothing on {} observations at {} (seasonal periods {})",
        series.size(), frequency, m);

    List<Observation> grid = Resampler.resample(series, frequency);
    if (grid.size() < 2 * m) {
      throw new InsufficientDataException("Exponential smoothing needs at least " + (2 * m)
          + " observations at " + frequency + ", got " + grid.size());
    }
    HoltWinters.Fit fit = HoltWinters.fit(Resampler.values(grid), m);
    this.parameters = fit.parameters();
    log.info("Fitted alpha={}, beta={}, gamma={}", parameters.alpha(), parameters.beta(),
        parameters.gamma());

    Set<LocalDateTime> observed = StrategySupport.timestamps(series);
    List<Observation> fitted = new ArrayList<>();
    double[] predictions = fit.fitted();
    for (int i = 0; i < grid.size(); i++) {
      LocalDateTime ts = grid.get(i).timestamp();
      if (!observed.contains(ts)) continue;
      double value = Double.isNaN(predictions[i]) ? 0d : Math.max(0d, predictions[i]);
      fitted.add(new Observation(ts, value));
    }
    return new FittedModel(parameters, fitted);
  }

  @Override
  public ForecastResult forecast(List<Observation> tail, LocalDateTime date, int steps,
      Frequency frequency) {
    Optional<ForecastResult> rejected =
        StrategySupport.checkRequest(parameters != null, tail, date);
    if (rejected.isPresent()) {
      return rejected.get();
    }

    LocalDateTime last = StrategySupport.last(tail).timestamp();
    List<Observation> extended = new ArrayList<>(tail);
    ExponentialSmoothingParameters state = parameters;
    for (LocalDateTime ts : Resampler.stepsAfter(last, frequency.horizonEnd(date, steps),
        frequency)) {
      double next = state.nextForecast();
      state = state.update(next);
      extended.add(new Observation(ts, next));
    }

    List<Observation> out = new ArrayList<>(extended.size());
    for (Observation o : extended) {
      double clipped = Math.max(0d, o.value());
      if (dropZeroForecasts && clipped == 0d) continue;
      out.add(o.withValue(clipped));
    }
    return ForecastResult.available(out);
  }

  @Override
  public int requiredTrailingObservations() {
    return 1;
  }
}
