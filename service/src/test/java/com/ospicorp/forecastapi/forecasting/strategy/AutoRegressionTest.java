package com.ospicorp.forecastapi.forecasting.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.forecastapi.forecasting.InsufficientDataException;
import com.ospicorp.forecastapi.forecasting.model.AutoRegressionParameters;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult.Unavailability;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.model.Observation;
import com.ospicorp.forecastapi.series.service.Resampler;
import com.ospicorp.forecastapi.series.service.Stationarity;
import com.ospicorp.forecastapi.support.Series;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class AutoRegressionTest {

  @Test
  void constantSeriesForecastsTheConstant() {
    var series = Series.of(Frequency.DAILY, 30, i -> 10d);
    var ar = new AutoRegression();

    ar.train(series, Frequency.DAILY);
    var tail = Series.tail(series, Math.max(1, ar.requiredTrailingObservations()));
    var last = series.get(series.size() - 1).timestamp();
    var result = ar.forecast(tail, last.plusDays(1), 2, Frequency.DAILY);

    assertThat(result.isAvailable()).isTrue();
    var values = result.series();
    assertThat(values).hasSize(tail.size() + 2);
    assertThat(values.get(values.size() - 2).timestamp()).isEqualTo(last.plusDays(1));
    assertThat(values.get(values.size() - 1).timestamp()).isEqualTo(last.plusDays(2));
    assertThat(values.get(values.size() - 2).value()).isCloseTo(10d, within(0.1));
    assertThat(values.get(values.size() - 1).value()).isCloseTo(10d, within(0.1));
  }

  @Test
  void recoversFirstOrderCoefficient() {
    Random random = new Random(5);
    double[] y = new double[500];
    y[0] = 6;
    for (int t = 1; t < y.length; t++) {
      y[t] = 2 + 0.7 * y[t - 1] + random.nextGaussian();
    }
    var series = Series.of(Frequency.DAILY, y.length, i -> y[i]);
    var ar = new AutoRegression();

    ar.train(series, Frequency.DAILY);
    var parameters = (AutoRegressionParameters) ar.parameters().orElseThrow();

    assertThat(parameters.order()).isGreaterThanOrEqualTo(1);
    assertThat(parameters.coefficients().get(0)).isCloseTo(0.7, within(0.1));
    assertThat(parameters.differencingOrder()).isZero();
    assertThat(ar.requiredTrailingObservations())
        .isEqualTo(parameters.coefficients().size() + parameters.differencingOrder());
  }

  @Test
  void stationaryModePersistsDifferencingOrder() {
    Random random = new Random(9);
    double[] y = new double[200];
    for (int t = 1; t < y.length; t++) {
      y[t] = y[t - 1] + 0.5 + random.nextGaussian();
    }
    var series = Series.of(Frequency.DAILY, y.length, i -> y[i]);
    var ar = new AutoRegression(true, 15, 0.05, Stationarity.DEFAULT_MAX_DIFFERENCES);

    ar.train(series, Frequency.DAILY);
    var parameters = (AutoRegressionParameters) ar.parameters().orElseThrow();

    int expected = Stationarity.autoStationary(Resampler.values(series)).differences();
    assertThat(parameters.differencingOrder()).isEqualTo(expected);
    assertThat(parameters.toVector().get(parameters.toVector().size() - 1))
        .isEqualTo((double) expected);
    assertThat(ar.requiredTrailingObservations()).isEqualTo(parameters.order() + expected);
  }

  @Test
  void forecastUsesCoefficientsInLagOrder() {
    var ar = new AutoRegression();
    ar.restore(new AutoRegressionParameters(1d, List.of(0.5, 0.25), 0));
    var tail = Series.of(Frequency.DAILY, 2, i -> i == 0 ? 8d : 4d);
    var last = tail.get(1).timestamp();

    var result = ar.forecast(tail, last.plusDays(1), 1, Frequency.DAILY);

    // 1 + 0.5 * 4 + 0.25 * 8
    assertThat(result.series().get(2).value()).isCloseTo(5d, within(1e-12));
  }

  @Test
  void forecastUndoesDifferencing() {
    var ar = new AutoRegression();
    ar.restore(new AutoRegressionParameters(0d, List.of(0.5), 1));
    var tail = Series.of(Frequency.DAILY, 2, i -> i == 0 ? 1d : 3d);
    var last = tail.get(1).timestamp();

    var result = ar.forecast(tail, last.plusDays(2), 1, Frequency.DAILY);

    List<Double> values = result.series().stream().map(Observation::value).toList();
    assertThat(values).hasSize(4);
    assertThat(values.get(2)).isCloseTo(4d, within(1e-12));
    assertThat(values.get(3)).isCloseTo(4.5d, within(1e-12));
  }

  @Test
  void pastDateReturnsSentinel() {
    var series = Series.of(Frequency.DAILY, 30, i -> 10d);
    var ar = new AutoRegression();
    ar.train(series, Frequency.DAILY);

    var tail = Series.tail(series, Math.max(1, ar.requiredTrailingObservations()));
    var result = ar.forecast(tail, series.get(0).timestamp(), 3, Frequency.DAILY);

    assertThat(result.isAvailable()).isFalse();
    assertThat(result.reason()).isEqualTo(Unavailability.PAST_DATE);
    assertThat(result.series()).isEmpty();
  }

  @Test
  void untrainedAndEmptyRequestsReturnSentinels() {
    var ar = new AutoRegression();
    var tail = Series.of(Frequency.DAILY, 3, i -> 1d);

    assertThat(ar.forecast(tail, Series.START.plusDays(5), 1, Frequency.DAILY).reason())
        .isEqualTo(Unavailability.PARAMETERS_UNSET);
    assertThat(ar.requiredTrailingObservations()).isZero();

    ar.restore(new AutoRegressionParameters(1d, List.of(0.5), 0));
    assertThat(ar.forecast(List.of(), Series.START, 1, Frequency.DAILY).reason())
        .isEqualTo(Unavailability.NO_DATA);
  }

  @Test
  void shortTailIsRejected() {
    var ar = new AutoRegression();
    ar.restore(new AutoRegressionParameters(1d, List.of(0.5, 0.2, 0.1), 0));
    var tail = Series.of(Frequency.DAILY, 2, i -> 1d);

    assertThatThrownBy(() -> ar.forecast(tail, Series.START.plusDays(3), 1, Frequency.DAILY))
        .isInstanceOf(InsufficientDataException.class);
  }

  @Test
  void fittedValuesOnlyCoverObservedTimestamps() {
    List<Observation> series = new ArrayList<>(Series.of(Frequency.DAILY, 40, i -> 5 + (i % 3)));
    series.remove(20);
    var ar = new AutoRegression();

    var model = ar.train(series, Frequency.DAILY);

    var observed = series.stream().map(Observation::timestamp).toList();
    assertThat(model.fitted()).allSatisfy(o -> assertThat(observed).contains(o.timestamp()));
    assertThat(model.parameters()).isEqualTo(ar.parameters().orElseThrow());
  }

  @Test
  void emptySeriesCannotBeTrained() {
    assertThatThrownBy(() -> new AutoRegression().train(List.of(), Frequency.DAILY))
        .isInstanceOf(InsufficientDataException.class);
  }
}
