package com.ospicorp.forecastapi.forecasting.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.forecastapi.forecasting.DataSourceNotTrainedException;
import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult.Unavailability;
import com.ospicorp.forecastapi.forecasting.strategy.ForecastRegistry;
import com.ospicorp.forecastapi.series.model.DataSource;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.support.InMemoryDataSourceDirectory;
import com.ospicorp.forecastapi.support.InMemoryParameterStore;
import com.ospicorp.forecastapi.support.InMemoryTimeSeriesStore;
import com.ospicorp.forecastapi.support.Series;
import java.time.LocalDateTime;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ForecastServiceTest {
  private final InMemoryDataSourceDirectory directory = new InMemoryDataSourceDirectory();
  private final InMemoryTimeSeriesStore store = new InMemoryTimeSeriesStore();
  private final InMemoryParameterStore parameters = new InMemoryParameterStore();
  private ForecastService service;
  private LocalDateTime last;

  @BeforeEach
  void setUp() {
    var contexts = new ForecastContextFactory(ForecastRegistry.withDefaults(), parameters,
        new ParameterCodec(new ObjectMapper()), new ModelLocks());
    service = new ForecastService(directory, store, contexts, new ForecastWriteService(store));

    var series = Series.of(Frequency.DAILY, 3, i -> 2d + i);
    store.put(1, series);
    last = series.get(2).timestamp();
    directory.put(new DataSource(1, "load", Frequency.DAILY,
        List.of(AlgorithmId.AUTO_REGRESSION, AlgorithmId.EXPONENTIAL_SMOOTHING), true, true));
  }

  @Test
  void returnsLastStepsAndWritesNewRows() {
    parameters.set("1_AUTO_REGRESSION", "[1.0,0.5,0.0]");

    var response = service.forecast(1, last.plusDays(1), 2);

    var ar = response.forecasts().get(0);
    assertThat(ar.algorithm()).isEqualTo(AlgorithmId.AUTO_REGRESSION);
    assertThat(ar.unavailable()).isNull();
    assertThat(ar.dates()).containsExactly(last.plusDays(1), last.plusDays(2));
    // 1 + 0.5 * 4, then 1 + 0.5 * 3
    assertThat(ar.values()).containsExactly(3d, 2.5d);
    assertThat(store.forecasts(1, AlgorithmId.AUTO_REGRESSION)).containsOnlyKeys(
        last.plusDays(1), last.plusDays(2));
    assertThat(response.operationTime()).matches("\\d+\\.\\d{4}s");
  }

  @Test
  void unavailableModelsAreReportedWithReason() {
    parameters.set("1_AUTO_REGRESSION", "[1.0,0.5,0.0]");

    var response = service.forecast(1, last.minusDays(1), 1);

    assertThat(response.forecasts()).hasSize(2);
    assertThat(response.forecasts().get(0).unavailable()).isEqualTo(Unavailability.PAST_DATE);
    assertThat(response.forecasts().get(1).unavailable())
        .isEqualTo(Unavailability.PARAMETERS_UNSET);
    assertThat(store.forecasts(1, AlgorithmId.AUTO_REGRESSION)).isEmpty();
  }

  @Test
  void negativeForecastsAreClippedInTheResponse() {
    parameters.set("1_AUTO_REGRESSION", "[-100.0,0.0,0.0]");

    var response = service.forecast(1, last.plusDays(1), 1);

    assertThat(response.forecasts().get(0).values()).containsExactly(0d);
    assertThat(store.forecasts(1, AlgorithmId.AUTO_REGRESSION).get(last.plusDays(1)))
        .isEqualTo(-100d);
  }

  @Test
  void stepsCoveringTheTailIncludeObservedRows() {
    parameters.set("1_AUTO_REGRESSION", "[1.0,0.5,0.0]");

    var response = service.forecast(1, last, 1);

    var ar = response.forecasts().get(0);
    assertThat(ar.dates()).containsExactly(last);
    assertThat(ar.values()).containsExactly(4d);
    assertThat(store.forecasts(1, AlgorithmId.AUTO_REGRESSION)).isEmpty();
  }

  @Test
  void unknownSourceIsNotFound() {
    assertThatThrownBy(() -> service.forecast(99, last, 1))
        .isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void untrainedSourceIsRejected() {
    directory.put(new DataSource(2, "fresh", Frequency.DAILY,
        List.of(AlgorithmId.AUTO_REGRESSION), true, false));

    assertThatThrownBy(() -> service.forecast(2, last, 1))
        .isInstanceOf(DataSourceNotTrainedException.class)
        .hasMessageContaining("Data source 2");
  }

  @Test
  void nonPositiveStepsAreRejected() {
    assertThatThrownBy(() -> service.forecast(1, last, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
