package com.ospicorp.forecastapi.series.service;

import com.ospicorp.forecastapi.series.model.Frequency;
import com.ospicorp.forecastapi.series.model.Observation;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class Resampler {
  public static final double GAP_VALUE = 0.0d;

  private Resampler() {
  }

  /**
   * Reindexes observations onto the contiguous grid {@code min(ts)..max(ts)} stepped by
   * {@code frequency}. Observations off the grid are dropped, grid points without an observation
   * get {@link #GAP_VALUE}.
   */
  public static List<Observation> resample(List<Observation> in, Frequency frequency) {
    if (in.isEmpty()) return List.of();
    Map<LocalDateTime, Double> byTimestamp = new HashMap<>(in.size() * 2);
    LocalDateTime min = in.get(0).timestamp();
    LocalDateTime max = min;
    for (Observation o : in) {
      byTimestamp.put(o.timestamp(), o.value());
      if (o.timestamp().isBefore(min)) min = o.timestamp();
      if (o.timestamp().isAfter(max)) max = o.timestamp();
    }

    List<Observation> out = new ArrayList<>();
    for (LocalDateTime ts : grid(min, max, frequency)) {
      Double value = byTimestamp.get(ts);
      out.add(new Observation(ts, value == null || value.isNaN() ? GAP_VALUE : value));
    }
    return out;
  }

  public static List<LocalDateTime> grid(LocalDateTime start, LocalDateTime end,
      Frequency frequency) {
    List<LocalDateTime> out = new ArrayList<>();
    // offset from start each time so month steps do not drift after a short month
    for (long i = 0; ; i++) {
      LocalDateTime ts = frequency.plus(start, i);
      if (ts.isAfter(end)) break;
      out.add(ts);
    }
    return out;
  }

  /**
   * Timestamps strictly after {@code start}, up to and including {@code end}.
   */
  public static List<LocalDateTime> stepsAfter(LocalDateTime start, LocalDateTime end,
      Frequency frequency) {
    List<LocalDateTime> points = grid(start, end, frequency);
    return points.isEmpty() ? points : points.subList(1, points.size());
  }

  public static double[] values(List<Observation> in) {
    double[] out = new double[in.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = in.get(i).value();
    }
    return out;
  }
}
