package com.ospicorp.forecastapi.forecasting.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.AutoRegressionParameters;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult.Unavailability;
import com.ospicorp.forecastapi.forecasting.strategy.ForecastRegistry;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.support.InMemoryParameterStore;
import com.ospicorp.forecastapi.support.Series;
import org.junit.jupiter.api.Test;

class ForecastContextTest {
  private final InMemoryParameterStore store = new InMemoryParameterStore();
  private final ParameterCodec codec = new ParameterCodec(new ObjectMapper());
  private final ForecastContextFactory factory =
      new ForecastContextFactory(ForecastRegistry.withDefaults(), store, codec, new ModelLocks());

  @Test
  void keyCombinesSourceAndAlgorithmName() {
    assertThat(ForecastContext.key(7, AlgorithmId.EXPONENTIAL_SMOOTHING))
        .isEqualTo("7_EXPONENTIAL_SMOOTHING");
    assertThat(factory.create(7, AlgorithmId.AUTO_REGRESSION).key()).isEqualTo("7_AUTO_REGRESSION");
  }

  @Test
  void missingParametersLeaveContextUntrained() {
    var context = factory.create(1, AlgorithmId.AUTO_REGRESSION);

    assertThat(context.isTrained()).isFalse();
    assertThat(context.forecast(null, Series.START, 1, Frequency.DAILY).reason())
        .isEqualTo(Unavailability.PARAMETERS_UNSET);
  }

  @Test
  void persistedParametersAreLoadedEagerly() {
    store.set("3_AUTO_REGRESSION", "[1.0,0.5,0.0]");

    var context = factory.create(3, AlgorithmId.AUTO_REGRESSION);
    var tail = Series.of(Frequency.DAILY, 1, i -> 4d);
    var result = context.forecast(tail, Series.START.plusDays(1), 1, Frequency.DAILY);

    assertThat(context.isTrained()).isTrue();
    assertThat(context.requiredTrailingObservations()).isEqualTo(1);
    assertThat(result.series().get(1).value()).isEqualTo(3d);
  }

  @Test
  void nullTailMeansNoData() {
    store.set("4_AUTO_REGRESSION", "[1.0,0.0]");

    var context = factory.create(4, AlgorithmId.AUTO_REGRESSION);

    assertThat(context.forecast(null, Series.START, 1, Frequency.DAILY).reason())
        .isEqualTo(Unavailability.NO_DATA);
  }

  @Test
  void trainingPersistsParametersForLaterContexts() {
    var series = Series.of(Frequency.DAILY, 60, i -> 10 + (i % 2));

    var model = factory.create(5, AlgorithmId.AUTO_REGRESSION).train(series, Frequency.DAILY);

    assertThat(store.contains("5_AUTO_REGRESSION")).isTrue();
    var reloaded = factory.create(5, AlgorithmId.AUTO_REGRESSION);
    assertThat(reloaded.isTrained()).isTrue();
    assertThat(codec.decode(AlgorithmId.AUTO_REGRESSION, store.get("5_AUTO_REGRESSION").get()))
        .isEqualTo(model.parameters());
    assertThat(model.parameters()).isInstanceOf(AutoRegressionParameters.class);
    assertThat(factory.create(6, AlgorithmId.AUTO_REGRESSION).isTrained()).isFalse();
    assertThat(reloaded.algorithm()).isEqualTo(AlgorithmId.AUTO_REGRESSION);
  }
}
