package com.ospicorp.forecastapi.training;

import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import java.time.Instant;
import java.util.List;

/** Immutable view of a training job at one point in time. */
public record TrainingJob(
    String id,
    long dataSourceId,
    List<AlgorithmId> algorithms,
    TrainingJobState state,
    TrainingProgress progress,
    String error,
    Instant submittedAt,
    Instant finishedAt
) {

  public TrainingJob {
    algorithms = List.copyOf(algorithms);
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }
}
