package com.ospicorp.forecastapi.web;

import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.model.enums.PeriodType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record DataSourceRequest(@NotBlank String name, @NotNull @Valid Period period) {

  public record Period(@NotNull PeriodType type, @NotNull @Min(1) Integer value) {

    Frequency toFrequency() {
      return new Frequency(value, type);
    }
  }
}
