package com.ospicorp.forecastapi.stats;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Ordinary least squares solved through the SVD pseudo-inverse, so rank-deficient designs (for
 * example a constant regressor next to the intercept) still produce the minimum-norm solution.
 */
public final class LeastSquares {
  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0d, 1d);

  private LeastSquares() {
  }

  public static Fit fit(double[][] design, double[] response) {
    if (design.length == 0 || design.length != response.length) {
      throw new IllegalArgumentException(
          "Design has " + design.length + " rows but response has " + response.length);
    }
    RealMatrix x = MatrixUtils.createRealMatrix(design);
    RealMatrix pinv = new SingularValueDecomposition(x).getSolver().getInverse();
    RealVector y = MatrixUtils.createRealVector(response);
    RealVector beta = pinv.operate(y);
    RealVector residuals = y.subtract(x.operate(beta));
    double ssr = residuals.dotProduct(residuals);
    // (X'X)^+ == X^+ (X^+)'
    RealMatrix unscaledCovariance = pinv.multiply(pinv.transpose());
    return new Fit(beta.toArray(), ssr, response.length, unscaledCovariance);
  }

  public static final class Fit {
    private final double[] coefficients;
    private final double ssr;
    private final int observations;
    private final RealMatrix unscaledCovariance;

    Fit(double[] coefficients, double ssr, int observations, RealMatrix unscaledCovariance) {
      this.coefficients = coefficients;
      this.ssr = ssr;
      this.observations = observations;
      this.unscaledCovariance = unscaledCovariance;
    }

    public double[] coefficients() {
      return coefficients.clone();
    }

    public double coefficient(int index) {
      return coefficients[index];
    }

    public int parameters() {
      return coefficients.length;
    }

    public int observations() {
      return observations;
    }

    public double ssr() {
      return ssr;
    }

    /**
     * Standard errors with the residual variance estimated as {@code ssr / (n - k)} when
     * {@code degreesOfFreedomCorrected}, otherwise as {@code ssr / n}.
     */
    public double[] standardErrors(boolean degreesOfFreedomCorrected) {
      int dof = degreesOfFreedomCorrected ? observations - coefficients.length : observations;
      double sigma2 = dof > 0 ? ssr / dof : Double.NaN;
      double[] out = new double[coefficients.length];
      for (int i = 0; i < out.length; i++) {
        out[i] = Math.sqrt(sigma2 * unscaledCovariance.getEntry(i, i));
      }
      return out;
    }

    public double[] tValues(boolean degreesOfFreedomCorrected) {
      double[] se = standardErrors(degreesOfFreedomCorrected);
      double[] out = new double[coefficients.length];
      for (int i = 0; i < out.length; i++) {
        out[i] = coefficients[i] / se[i];
      }
      return out;
    }

    /**
     * Two-sided p-values against the standard normal. NaN when a statistic is undefined.
     */
    public double[] pValues(boolean degreesOfFreedomCorrected) {
      double[] t = tValues(degreesOfFreedomCorrected);
      double[] out = new double[t.length];
      for (int i = 0; i < out.length; i++) {
        out[i] = Double.isNaN(t[i])
            ? Double.NaN
            : 2d * (1d - STANDARD_NORMAL.cumulativeProbability(Math.abs(t[i])));
      }
      return out;
    }

    /**
     * Akaike information criterion of the Gaussian likelihood.
     */
    public double aic() {
      double n = observations;
      double llf = -n / 2d * (Math.log(2d * Math.PI) + Math.log(ssr / n) + 1d);
      return -2d * llf + 2d * coefficients.length;
    }
  }
}
