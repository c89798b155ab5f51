package com.ospicorp.forecastapi.training;

public class TrainingJobException extends RuntimeException {
  private final String jobId;

  public TrainingJobException(String jobId, String message, Throwable cause) {
    super(message, cause);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
