package com.ospicorp.forecastapi.series.repository;

// Emitted while forecast rows are written: rowsWritten of totalRows are persisted
public record WriteCheckpoint(int rowsWritten, int totalRows) {

  public boolean isComplete() {
    return rowsWritten >= totalRows;
  }
}
