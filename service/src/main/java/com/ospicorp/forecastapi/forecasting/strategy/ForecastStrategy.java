package com.ospicorp.forecastapi.forecasting.strategy;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.FittedModel;
import com.ospicorp.forecastapi.forecasting.model.ForecastResult;
import com.ospicorp.forecastapi.forecasting.model.ModelParameters;
import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.model.Observation;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * A forecasting algorithm bound to the parameters of one (data source, algorithm) pair.
 *
 * <p>Instances are short-lived: they are created per call by the
 * {@link ForecastRegistry}, seeded with persisted parameters through {@link #restore}, and
 * discarded afterwards.
 */
public sealed interface ForecastStrategy permits AutoRegression, ExponentialSmoothing {

  AlgorithmId algorithm();

  Optional<ModelParameters> parameters();

  /**
   * Installs previously persisted parameters.
   *
   * @throws IllegalArgumentException if the parameters belong to another algorithm
   */
  void restore(ModelParameters parameters);

  /**
   * Resamples {@code series} onto {@code frequency}, fits the model and keeps the resulting
   * parameters on this instance.
   *
   * @return the new parameters with the in-sample one-step predictions, restricted to the
   *     timestamps present in {@code series}
   */
  FittedModel train(List<Observation> series, Frequency frequency);

  /**
   * Extends {@code tail} one period at a time up to {@code date + frequency * (steps - 1)}.
   *
   * @param tail the most recent observations, ascending; may be {@code null}
   * @return the tail followed by the synthetic rows, or an unavailable result
   */
  ForecastResult forecast(List<Observation> tail, LocalDateTime date, int steps,
      Frequency frequency);

  /**
   * Number of trailing observations {@link #forecast} needs.
   */
  int requiredTrailingObservations();
}
