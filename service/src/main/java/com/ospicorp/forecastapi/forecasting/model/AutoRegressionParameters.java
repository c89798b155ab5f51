package com.ospicorp.forecastapi.forecasting.model;

import java.util.ArrayList;
import java.util.List;

/**
 * AR(p) state. Stored as the vector {@code [intercept, coef_1 .. coef_p, d]} where {@code coef_i}
 * multiplies the value {@code i} periods back and {@code d} is the differencing order applied
 * before fitting.
 */
public record AutoRegressionParameters(double intercept, List<Double> coefficients,
    int differencingOrder) implements ModelParameters {

  public AutoRegressionParameters {
    coefficients = List.copyOf(coefficients);
    if (differencingOrder < 0) {
      throw new IllegalArgumentException("differencing order must not be negative");
    }
  }

  public static AutoRegressionParameters fromVector(List<Double> vector) {
    if (vector == null || vector.size() < 2) {
      throw new IllegalArgumentException(
          "Auto-regression vector needs an intercept and a differencing order");
    }
    double order = vector.get(vector.size() - 1);
    return new AutoRegressionParameters(vector.get(0),
        vector.subList(1, vector.size() - 1), (int) Math.round(order));
  }

  public List<Double> toVector() {
    List<Double> out = new ArrayList<>(coefficients.size() + 2);
    out.add(intercept);
    out.addAll(coefficients);
    out.add((double) differencingOrder);
    return out;
  }

  public int order() {
    return coefficients.size();
  }

  @Override
  public AlgorithmId algorithm() {
    return AlgorithmId.AUTO_REGRESSION;
  }
}
