package com.ospicorp.forecastapi.training;

public enum TrainingJobState {
  PENDING,
  RUNNING,
  PROGRESS,
  SUCCEEDED,
  FAILED,
  ABORTED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == ABORTED;
  }
}
