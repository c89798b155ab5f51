package com.ospicorp.forecastapi.series.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum PeriodType {
  MINUTE('T'),
  HOUR('H'),
  DAY('D'),
  WEEK('W'),
  MONTH('M'),
  YEAR('Y');

  private final char code;

  PeriodType(char code) {
    this.code = code;
  }

  public char code() {
    return code;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static PeriodType fromCode(char code) {
    char upper = Character.toUpperCase(code);
    for (PeriodType type : values()) {
      if (type.code == upper) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unsupported frequency code: " + code);
  }

  /**
   * Accepts the lower-case name used on the wire ({@code "day"}), the constant name or the
   * single-letter frequency code.
   */
  @JsonCreator
  public static PeriodType fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Period type must be provided");
    }
    String trimmed = value.trim();
    if (trimmed.length() == 1) {
      return fromCode(trimmed.charAt(0));
    }
    try {
      return valueOf(trimmed.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported period type: " + value, ex);
    }
  }
}
