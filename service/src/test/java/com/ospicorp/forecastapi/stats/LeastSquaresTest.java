package com.ospicorp.forecastapi.stats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Random;
import org.junit.jupiter.api.Test;

class LeastSquaresTest {

  @Test
  void recoversExactLine() {
    double[][] design = new double[10][];
    double[] response = new double[10];
    for (int i = 0; i < 10; i++) {
      design[i] = new double[] {1, i};
      response[i] = 2 + 3 * i;
    }

    var fit = LeastSquares.fit(design, response);

    assertThat(fit.coefficient(0)).isCloseTo(2, within(1e-9));
    assertThat(fit.coefficient(1)).isCloseTo(3, within(1e-9));
    assertThat(fit.ssr()).isCloseTo(0, within(1e-12));
    assertThat(fit.parameters()).isEqualTo(2);
    assertThat(fit.observations()).isEqualTo(10);
  }

  @Test
  void rankDeficientDesignGivesMinimumNormSolution() {
    double[][] design = {{1, 1}, {1, 1}, {1, 1}};
    double[] response = {4, 4, 4};

    var fit = LeastSquares.fit(design, response);

    assertThat(fit.coefficient(0)).isCloseTo(2, within(1e-9));
    assertThat(fit.coefficient(1)).isCloseTo(2, within(1e-9));
  }

  @Test
  void strongRegressorIsSignificantAndNoiseIsNot() {
    Random random = new Random(3);
    int n = 200;
    double[][] design = new double[n][];
    double[] response = new double[n];
    for (int i = 0; i < n; i++) {
      double x = random.nextGaussian();
      double unrelated = random.nextGaussian();
      design[i] = new double[] {1, x, unrelated};
      response[i] = 5 * x + 0.1 * random.nextGaussian();
    }

    var fit = LeastSquares.fit(design, response);
    double[] p = fit.pValues(false);

    assertThat(p[1]).isLessThan(1e-6);
    assertThat(fit.tValues(true)[1]).isGreaterThan(100);
    assertThat(fit.standardErrors(true)[1]).isGreaterThan(fit.standardErrors(false)[1]);
  }

  @Test
  void mismatchedShapesAreRejected() {
    assertThatThrownBy(() -> LeastSquares.fit(new double[][] {{1}}, new double[] {1, 2}))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
