package com.ospicorp.forecastapi.forecasting.strategy;

import com.ospicorp.forecastapi.forecasting.InsufficientDataException;
import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.AutoRegressionParameters;
import com.ospicorp.forecastapi.forecasting.model.FittedModel;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult;
import com.ospicorp.forecastapi.forecasting.model.ModelParameters;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.model.Observation;
import com.ospicorp.forecastapi.series.service.Resampler;
import com.ospicorp.forecastapi.series.service.Stationarity;
import com.ospicorp.forecastapi.series.service.Stationarity.StationarySeries;
import com.ospicorp.forecastapi.stats.LeastSquares;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Autoregression with an intercept. The order is picked by a forward search that stops at the
 * first lag whose coefficients are not all significant; optionally the series is differenced
 * until an ADF test accepts it as stationary.
 */
public final class AutoRegression implements ForecastStrategy {
  private static final Logger log = LoggerFactory.getLogger(AutoRegression.class);

  public static final int DEFAULT_MAX_LAGS = 15;
  public static final double DEFAULT_SIGNIFICANCE_LEVEL = 0.05d;

  private final boolean stationary;
  private final int maxLags;
  private final double significanceLevel;
  private final int maxDifferences;
  private AutoRegressionParameters parameters;

  public AutoRegression() {
    this(false, DEFAULT_MAX_LAGS, DEFAULT_SIGNIFICANCE_LEVEL,
        Stationarity.DEFAULT_MAX_DIFFERENCES);
  }

  public AutoRegression(boolean stationary, int maxLags, double significanceLevel,
      int maxDifferences) {
    if (maxLags < 0) {
      throw new IllegalArgumentException("maxLags must not be negative: " + maxLags);
    }
    this.stationary = stationary;
    this.maxLags = maxLags;
    this.significanceLevel = significanceLevel;
    this.maxDifferences = maxDifferences;
  }

  @Override
  public AlgorithmId algorithm() {
    return AlgorithmId.AUTO_REGRESSION;
  }

  @Override
  public Optional<ModelParameters> parameters() {
    return Optional.ofNullable(parameters);
  }

  @Override
  public void restore(ModelParameters restored) {
    if (!(restored instanceof AutoRegressionParameters ar)) {
      throw new IllegalArgumentException(
          "Expected auto-regression parameters but got " + restored.algorithm());
    }
    this.parameters = ar;
  }

  @Override
  public FittedModel train(List<Observation> series, Frequency frequency) {
    if (series.isEmpty()) {
      throw new InsufficientDataException("Cannot train auto-regression on an empty series");
    }
    log.info("Training auto-regression on {} observations at {}", series.size(), frequency);
    List<Observation> grid = Resampler.resample(series, frequency);
    double[] levels = Resampler.values(grid);

    StationarySeries transformed = stationary
        ? Stationarity.autoStationary(levels, maxDifferences)
        : new StationarySeries(levels, 0, new double[0]);
    double[] y = transformed.values();
    int d = transformed.differences();

    int order = selectOrder(y);
    if (y.length <= order) {
      throw new InsufficientDataException(
          "Auto-regression needs more than " + order + " observations, got " + y.length);
    }
    LeastSquares.Fit fit = fit(y, order);
    double[] beta = fit.coefficients();
    List<Double> coefficients = new ArrayList<>(order);
    for (int i = 1; i <= order; i++) {
      coefficients.add(beta[i]);
    }
    AutoRegressionParameters trained = new AutoRegressionParameters(beta[0], coefficients, d);
    this.parameters = trained;
    log.info("Selected AR order {} with differencing order {}", order, d);

    Set<LocalDateTime> observed = StrategySupport.timestamps(series);
    List<Observation> fitted = new ArrayList<>();
    for (int t = order; t < y.length; t++) {
      int gridIndex = t + d;
      LocalDateTime ts = grid.get(gridIndex).timestamp();
      if (!observed.contains(ts)) continue;
      double predicted = predict(trained, y, t);
      if (d > 0) {
        predicted = Stationarity.undifference(predicted, levels, gridIndex, d);
      }
      fitted.add(new Observation(ts, Double.isNaN(predicted) ? 0d : predicted));
    }
    return new FittedModel(trained, fitted);
  }

  @Override
  public ForecastResult forecast(List<Observation> tail, LocalDateTime date, int steps,
      Frequency frequency) {
    Optional<ForecastResult> rejected =
        StrategySupport.checkRequest(parameters != null, tail, date);
    if (rejected.isPresent()) {
      return rejected.get();
    }
    int required = requiredTrailingObservations();
    if (tail.size() < required) {
      throw new InsufficientDataException(
          "Auto-regression needs " + required + " trailing observations, got " + tail.size());
    }

    LocalDateTime last = StrategySupport.last(tail).timestamp();
    List<LocalDateTime> horizon =
        Resampler.stepsAfter(last, frequency.horizonEnd(date, steps), frequency);

    List<Observation> out = new ArrayList<>(tail.size() + horizon.size());
    out.addAll(tail);
    double[] levels = Arrays.copyOf(Resampler.values(tail), tail.size() + horizon.size());
    int size = tail.size();
    for (LocalDateTime ts : horizon) {
      double next = predictNext(levels, size);
      levels[size++] = next;
      out.add(new Observation(ts, next));
    }
    return ForecastResult.available(out);
  }

  @Override
  public int requiredTrailingObservations() {
    return parameters == null ? 0 : parameters.order() + parameters.differencingOrder();
  }

  private double predictNext(double[] levels, int size) {
    int d = parameters.differencingOrder();
    int window = parameters.order() + d;
    double[] recent = Arrays.copyOfRange(levels, size - window, size);
    double[] transformed = Stationarity.difference(recent, d);
    double next = predict(parameters, transformed, transformed.length);
    return d == 0 ? next : Stationarity.undifference(next, levels, size, d);
  }

  // One-step prediction of y[t] from y[t-1] .. y[t-p]
  private static double predict(AutoRegressionParameters p, double[] y, int t) {
    double value = p.intercept();
    List<Double> coefficients = p.coefficients();
    for (int i = 1; i <= coefficients.size(); i++) {
      value += coefficients.get(i - 1) * y[t - i];
    }
    return value;
  }

  /**
   * Forward search over lags 1..maxLags keeping the last lag whose non-intercept coefficients
   * are all significant; stops at the first lag that fails.
   */
  int selectOrder(double[] y) {
    int best = 0;
    for (int lag = 1; lag <= maxLags; lag++) {
      if (y.length - lag <= lag + 1) {
        log.debug("Stopping lag search at {}: only {} observations", lag, y.length);
        break;
      }
      double[] pValues = fit(y, lag).pValues(false);
      boolean significant = true;
      for (int i = 1; i < pValues.length; i++) {
        if (!(pValues[i] < significanceLevel)) {
          significant = false;
          break;
        }
      }
      if (!significant) {
        break;
      }
      best = lag;
    }
    return best;
  }

  private static LeastSquares.Fit fit(double[] y, int order) {
    int rows = y.length - order;
    double[][] design = new double[rows][order + 1];
    double[] response = new double[rows];
    for (int r = 0; r < rows; r++) {
      int t = r + order;
      response[r] = y[t];
      design[r][0] = 1d;
      for (int i = 1; i <= order; i++) {
        design[r][i] = y[t - i];
      }
    }
    return LeastSquares.fit(design, response);
  }
}
