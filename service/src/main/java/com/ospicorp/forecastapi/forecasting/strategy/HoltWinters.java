package com.ospicorp.forecastapi.forecasting.strategy;

import com.ospicorp.forecastapi.forecasting.model.ExponentialSmoothingParameters;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Additive-trend, additive-season Holt-Winters fitting. The initial state is the heuristic one
 * (mean of the first cycle, cycle-over-cycle slope, first-cycle deviations) and the smoothing
 * constants minimise the one-step squared error inside the unit cube.
 */
final class HoltWinters {
  private static final Logger log = LoggerFactory.getLogger(HoltWinters.class);

  private static final double[] INITIAL_GUESS = {0.3d, 0.1d, 0.1d};
  private static final int MAX_EVALUATIONS = 5_000;

  private HoltWinters() {
  }

  record Fit(ExponentialSmoothingParameters parameters, double[] fitted, double sse) {
  }

  static Fit fit(double[] y, int seasonalPeriods) {
    if (y.length < 2 * seasonalPeriods) {
      throw new IllegalArgumentException("Holt-Winters needs two full seasonal cycles");
    }
    double[] best = INITIAL_GUESS;
    try {
      BOBYQAOptimizer optimizer = new BOBYQAOptimizer(7, 0.1d, 1e-8d);
      PointValuePair optimum = optimizer.optimize(
          new MaxEval(MAX_EVALUATIONS),
          new ObjectiveFunction(p -> run(y, seasonalPeriods, p[0], p[1], p[2]).sse()),
          GoalType.MINIMIZE,
          new InitialGuess(INITIAL_GUESS),
          new SimpleBounds(new double[] {0d, 0d, 0d}, new double[] {1d, 1d, 1d}));
      best = optimum.getPoint();
    } catch (TooManyEvaluationsException ex) {
      log.warn("Smoothing constant search did not converge after {} evaluations; "
          + "falling back to alpha={}, beta={}, gamma={}", MAX_EVALUATIONS,
          INITIAL_GUESS[0], INITIAL_GUESS[1], INITIAL_GUESS[2]);
    }
    return run(y, seasonalPeriods, clamp(best[0]), clamp(best[1]), clamp(best[2]));
  }

  static Fit run(double[] y, int m, double alpha, double beta, double gamma) {
    int n = y.length;
    double firstCycle = mean(y, 0, m);
    double level = firstCycle;
    double trend = (mean(y, m, 2 * m) - firstCycle) / m;
    // season[t] is the component applied at time t; slots n..n+m-1 are the ones carried forward
    double[] season = new double[n + m];
    for (int i = 0; i < m; i++) {
      season[i] = y[i] - firstCycle;
    }

    double[] fitted = new double[n];
    double sse = 0d;
    for (int t = 0; t < n; t++) {
      double s = season[t];
      fitted[t] = level + trend + s;
      double error = y[t] - fitted[t];
      sse += error * error;

      double newLevel = alpha * (y[t] - s) + (1 - alpha) * (level + trend);
      double newTrend = beta * (newLevel - level) + (1 - beta) * trend;
      season[t + m] = gamma * (y[t] - newLevel) + (1 - gamma) * s;
      level = newLevel;
      trend = newTrend;
    }

    List<Double> lastSeason = new ArrayList<>(m);
    for (int i = n; i < n + m; i++) {
      lastSeason.add(season[i]);
    }
    ExponentialSmoothingParameters parameters =
        new ExponentialSmoothingParameters(alpha, beta, gamma, level, trend, lastSeason);
    return new Fit(parameters, fitted, sse);
  }

  private static double mean(double[] y, int from, int to) {
    double sum = 0d;
    for (int i = from; i < to; i++) {
      sum += y[i];
    }
    return sum / (to - from);
  }

  private static double clamp(double value) {
    return Math.max(0d, Math.min(1d, value));
  }
}
