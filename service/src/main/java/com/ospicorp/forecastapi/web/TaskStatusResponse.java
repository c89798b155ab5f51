package com.ospicorp.forecastapi.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.forecastapi.training.TrainingJob;
import com.ospicorp.forecastapi.training.TrainingJobState;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusResponse(
    @JsonProperty("task_id") String taskId,
    TrainingJobState status,
    String progress,
    @JsonProperty("current_model") Integer currentModel,
    @JsonProperty("total_models") Integer totalModels,
    String error
) {

  static TaskStatusResponse from(TrainingJob job) {
    var progress = job.progress();
    String percent = String.format(Locale.ROOT, "%.0f%%", progress.percentComplete());
    return new TaskStatusResponse(job.id(), job.state(), percent, progress.modelIndex(),
        progress.totalModels(), job.error());
  }
}
