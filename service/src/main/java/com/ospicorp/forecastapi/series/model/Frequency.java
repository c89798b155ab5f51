package com.ospicorp.forecastapi.series.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ospicorp.forecastapi.series.model.enums.PeriodType;
import java.time.LocalDateTime;
import java.util.OptionalInt;

/**
 * Resampling frequency such as {@code 1D}, {@code 15T} or {@code 2H}: a positive step count and a
 * period unit.
 */
public record Frequency(int amount, PeriodType type) {

  public static final Frequency DAILY = new Frequency(1, PeriodType.DAY);

  public Frequency {
    if (amount < 1) {
      throw new IllegalArgumentException("Frequency amount must be positive: " + amount);
    }
    if (type == null) {
      throw new IllegalArgumentException("Frequency type must be provided");
    }
  }

  @JsonCreator
  public static Frequency parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Frequency must be provided");
    }
    String trimmed = value.trim();
    char code = trimmed.charAt(trimmed.length() - 1);
    String digits = trimmed.substring(0, trimmed.length() - 1);
    int amount;
    try {
      amount = digits.isEmpty() ? 1 : Integer.parseInt(digits);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid frequency: " + value, ex);
    }
    return new Frequency(amount, PeriodType.fromCode(code));
  }

  public LocalDateTime plus(LocalDateTime timestamp, long periods) {
    long total = periods * amount;
    return switch (type) {
      case MINUTE -> timestamp.plusMinutes(total);
      case HOUR -> timestamp.plusHours(total);
      case DAY -> timestamp.plusDays(total);
      case WEEK -> timestamp.plusWeeks(total);
      case MONTH -> timestamp.plusMonths(total);
      case YEAR -> timestamp.plusYears(total);
    };
  }

  /**
   * Last timestamp covered by a request for {@code steps} periods starting at {@code date}.
   */
  public LocalDateTime horizonEnd(LocalDateTime date, int steps) {
    return plus(date, steps - 1L);
  }

  public OptionalInt seasonalPeriods() {
    int periods = switch (type) {
      case MINUTE -> 1440 / amount;
      case HOUR -> 24 / amount;
      case DAY, WEEK, MONTH, YEAR -> 0;
    };
    return periods > 0 ? OptionalInt.of(periods) : OptionalInt.empty();
  }

  @JsonValue
  @Override
  public String toString() {
    return amount + String.valueOf(type.code());
  }
}
