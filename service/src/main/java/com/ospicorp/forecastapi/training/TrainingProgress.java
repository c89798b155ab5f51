package com.ospicorp.forecastapi.training;

/**
 * Row progress within the current model ({@code current} of {@code total} rows written) and the
 * zero-based index of that model among {@code totalModels}.
 */
public record TrainingProgress(int current, int total, int modelIndex, int totalModels) {

  public static TrainingProgress notStarted(int totalModels) {
    return new TrainingProgress(0, 0, 0, totalModels);
  }

  public static TrainingProgress completed(int totalModels) {
    return new TrainingProgress(0, 0, totalModels, totalModels);
  }

  public double percentComplete() {
    if (totalModels <= 0) {
      return 0d;
    }
    double withinModel = total <= 0 ? 0d : (double) current / total;
    return Math.min(100d, (modelIndex + withinModel) / totalModels * 100d);
  }
}
