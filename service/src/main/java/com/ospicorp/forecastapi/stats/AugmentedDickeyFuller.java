package com.ospicorp.forecastapi.stats;

import com.ospicorp.forecastapi.forecasting.InsufficientDataException;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Augmented Dickey-Fuller unit-root test with a constant term. The number of lagged differences is
 * chosen by AIC on a common sample and the p-value is MacKinnon's (1994) surface approximation.
 */
public final class AugmentedDickeyFuller {
  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0d, 1d);

  // MacKinnon (1994) coefficients, constant-only regression, one variable
  private static final double TAU_MAX = 2.74;
  private static final double TAU_MIN = -18.86;
  private static final double TAU_STAR = -1.61;
  private static final double[] TAU_SMALL_P = {2.1659, 1.4412, 0.038269};
  private static final double[] TAU_LARGE_P = {1.7339, 0.93202, -0.12745, -0.010368};

  private AugmentedDickeyFuller() {
  }

  public record Result(double statistic, double pValue, int usedLag, int observations) {
    public boolean isStationary(double significanceLevel) {
      return pValue < significanceLevel;
    }
  }

  public static Result test(double[] series) {
    int n = series.length;
    int maxLag = Math.min(n / 2 - 2, (int) Math.ceil(12d * Math.pow(n / 100d, 0.25d)));
    if (maxLag < 0) {
      throw new InsufficientDataException(
          "Stationarity test needs at least 4 observations, got " + n);
    }
    double[] diff = difference(series);

    int bestLag = 0;
    double bestAic = Double.POSITIVE_INFINITY;
    for (int lag = 0; lag <= maxLag; lag++) {
      // all candidates share the maxLag sample
      double aic = regress(series, diff, lag, maxLag).aic();
      if (aic < bestAic) {
        bestAic = aic;
        bestLag = lag;
      }
    }

    LeastSquares.Fit fit = regress(series, diff, bestLag, bestLag);
    double statistic = fit.tValues(true)[1];
    return new Result(statistic, pValue(statistic), bestLag, fit.observations());
  }

  /**
   * Regresses {@code diff[t]} on a constant, {@code level[t]} and {@code lags} lagged differences,
   * using rows {@code t >= sampleLag}.
   */
  private static LeastSquares.Fit regress(double[] level, double[] diff, int lags, int sampleLag) {
    int rows = diff.length - sampleLag;
    double[][] design = new double[rows][lags + 2];
    double[] response = new double[rows];
    for (int r = 0; r < rows; r++) {
      int t = r + sampleLag;
      response[r] = diff[t];
      design[r][0] = 1d;
      design[r][1] = level[t];
      for (int i = 1; i <= lags; i++) {
        design[r][1 + i] = diff[t - i];
      }
    }
    return LeastSquares.fit(design, response);
  }

  static double pValue(double statistic) {
    if (Double.isNaN(statistic)) {
      return Double.NaN;
    }
    if (statistic > TAU_MAX) {
      return 1d;
    }
    if (statistic < TAU_MIN) {
      return 0d;
    }
    double[] coefficients = statistic <= TAU_STAR ? TAU_SMALL_P : TAU_LARGE_P;
    double z = 0d;
    for (int i = coefficients.length - 1; i >= 0; i--) {
      z = z * statistic + coefficients[i];
    }
    return STANDARD_NORMAL.cumulativeProbability(z);
  }

  private static double[] difference(double[] series) {
    double[] out = new double[series.length - 1];
    for (int i = 1; i < series.length; i++) {
      out[i - 1] = series[i] - series[i - 1];
    }
    return out;
  }
}
