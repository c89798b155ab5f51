package com.ospicorp.forecastapi.series.service;

import com.ospicorp.forecastapi.forecasting.NonStationarySeriesException;
import com.ospicorp.forecastapi.stats.AugmentedDickeyFuller;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Stationarity {
  private static final Logger log = LoggerFactory.getLogger(Stationarity.class);

  public static final double SIGNIFICANCE_LEVEL = 0.05d;
  public static final int DEFAULT_MAX_DIFFERENCES = 10;

  private Stationarity() {
  }

  /**
   * Outcome of {@link #autoStationary}: the differenced values, the differencing order and the
   * leading value dropped by each differencing round (outermost first), which is what
   * {@link #reconstruct()} needs to undo the transform.
   */
  public record StationarySeries(double[] values, int differences, double[] heads) {

    public double[] reconstruct() {
      double[] current = values;
      for (int round = differences - 1; round >= 0; round--) {
        double[] withHead = new double[current.length + 1];
        withHead[0] = heads[round];
        System.arraycopy(current, 0, withHead, 1, current.length);
        current = reconstructSeriesFromStationary(withHead, 1);
      }
      return current;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof StationarySeries that
          && differences == that.differences
          && Arrays.equals(values, that.values)
          && Arrays.equals(heads, that.heads);
    }

    @Override
    public int hashCode() {
      return 31 * (31 * Arrays.hashCode(values) + differences) + Arrays.hashCode(heads);
    }

    @Override
    public String toString() {
      return "StationarySeries[differences=" + differences + ", length=" + values.length + "]";
    }
  }

  public static double[] makeStationary(double[] series, int lag) {
    if (lag < 0) {
      throw new IllegalArgumentException("lag must not be negative: " + lag);
    }
    if (lag == 0) return series.clone();
    if (series.length <= lag) return new double[0];
    double[] out = new double[series.length - lag];
    for (int i = lag; i < series.length; i++) {
      out[i - lag] = series[i] - series[i - lag];
    }
    return out;
  }

  public static StationarySeries autoStationary(double[] series) {
    return autoStationary(series, DEFAULT_MAX_DIFFERENCES);
  }

  public static StationarySeries autoStationary(double[] series, int maxDifferences) {
    double[] current = series;
    List<Double> heads = new ArrayList<>();
    for (int d = 0; d <= maxDifferences; d++) {
      if (isConstant(current)) {
        log.debug("Series is constant after {} difference(s); treating as stationary", d);
        return new StationarySeries(current, d, toArray(heads));
      }
      AugmentedDickeyFuller.Result adf = AugmentedDickeyFuller.test(current);
      log.debug("ADF after {} difference(s): statistic={}, p={}", d, adf.statistic(),
          adf.pValue());
      if (adf.isStationary(SIGNIFICANCE_LEVEL)) {
        return new StationarySeries(current, d, toArray(heads));
      }
      if (d == maxDifferences) {
        break;
      }
      heads.add(current[0]);
      current = makeStationary(current, 1);
    }
    throw new NonStationarySeriesException(
        "Series is still non-stationary after " + maxDifferences + " difference(s)");
  }

  /**
   * Applies cumulative summation {@code differences} times. Callers that need the exact inverse
   * of differencing prepend the dropped head value first.
   */
  public static double[] reconstructSeriesFromStationary(double[] diffSeries, int differences) {
    double[] out = diffSeries.clone();
    for (int round = 0; round < differences; round++) {
      for (int i = 1; i < out.length; i++) {
        out[i] += out[i - 1];
      }
    }
    return out;
  }

  /**
   * Applies first differencing {@code differences} times.
   */
  public static double[] difference(double[] series, int differences) {
    double[] out = series;
    for (int round = 0; round < differences; round++) {
      out = makeStationary(out, 1);
    }
    return out;
  }

  /**
   * Inverse of the {@code differences}-th difference for a single new point:
   * {@code y[t] = diff + sum_{k=1..d} (-1)^(k+1) C(d,k) y[t-k]}, where {@code y[t-1]} is
   * {@code history[end - 1]}.
   */
  public static double undifference(double diff, double[] history, int end, int differences) {
    double level = diff;
    long binomial = 1;
    for (int k = 1; k <= differences; k++) {
      binomial = binomial * (differences - k + 1) / k;
      double sign = (k % 2 == 1) ? 1d : -1d;
      level += sign * binomial * history[end - k];
    }
    return level;
  }

  private static boolean isConstant(double[] values) {
    for (int i = 1; i < values.length; i++) {
      if (values[i] != values[0]) return false;
    }
    return true;
  }

  private static double[] toArray(List<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).toArray();
  }
}
