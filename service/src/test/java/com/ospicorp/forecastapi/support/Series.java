package com.ospicorp.forecastapi.support;

import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.model.Observation;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

public final class Series {
  public static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

  private Series() {
  }

  public static List<Observation> of(Frequency frequency, int size, IntToDoubleFunction value) {
    List<Observation> out = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      out.add(new Observation(frequency.plus(START, i), value.applyAsDouble(i)));
    }
    return out;
  }

  public static List<Observation> dailySeasonal(int hours) {
    return of(Frequency.parse("1H"), hours, h -> 50 + 10 * Math.sin(2 * Math.PI * h / 24d));
  }

  public static List<Observation> tail(List<Observation> series, int n) {
    return series.subList(Math.max(0, series.size() - n), series.size());
  }
}
