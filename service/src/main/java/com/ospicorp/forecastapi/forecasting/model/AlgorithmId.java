package com.ospicorp.forecastapi.forecasting.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ospicorp.forecastapi.forecasting.UnknownAlgorithmException;
import java.util.Locale;

public enum AlgorithmId {
  AUTO_REGRESSION("auto-regression"),
  EXPONENTIAL_SMOOTHING("exponential smoothing");

  private final String wireName;

  AlgorithmId(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /**
   * Accepts the wire name ({@code "auto-regression"}) as well as the constant name
   * ({@code "AUTO_REGRESSION"}), case-insensitively.
   */
  @JsonCreator
  public static AlgorithmId fromValue(String value) {
    if (value != null) {
      String normalized = value.trim();
      for (AlgorithmId id : values()) {
        if (id.wireName.equalsIgnoreCase(normalized)
            || id.name().equals(normalized.toUpperCase(Locale.ROOT))) {
          return id;
        }
      }
    }
    throw new UnknownAlgorithmException("No algorithm registered for " + value);
  }
}
