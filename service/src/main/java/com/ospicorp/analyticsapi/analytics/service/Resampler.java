package com.ospicorp.analyticsapi.analytics.service;

import com.ospicorp.analyticsapi.analytics.model.DataPoint;
import com.ospicorp.analyticsapi.analytics.model.Frequency;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class Resampler {
  private static final int MIN_POINTS_FOR_INFERENCE = 3;

  private Resampler() {
  }

  /**
   * Infers the sampling frequency of ascending timestamps. Empty when there are fewer than three
   * points, duplicates, or no single regular step.
   */
  public static Optional<Frequency> inferFrequency(List<Instant> times) {
    if (times.size() < MIN_POINTS_FOR_INFERENCE) {
      return Optional.empty();
    }
    List<LocalDateTime> local = times.stream()
        .map(t -> LocalDateTime.ofInstant(t, ZoneOffset.UTC))
        .toList();

    Duration step = Duration.between(local.get(0), local.get(1));
    boolean fixedStep = !step.isNegative() && !step.isZero();
    for (int i = 2; i < local.size() && fixedStep; i++) {
      fixedStep = Duration.between(local.get(i - 1), local.get(i)).equals(step);
    }
    if (fixedStep) {
      if (step.equals(Duration.ofHours(1))) return Optional.of(Frequency.H);
      if (step.equals(Duration.ofDays(1))) return Optional.of(Frequency.D);
      if (step.equals(Duration.ofDays(7))) return Optional.of(Frequency.W);
    }
    return inferCalendarFrequency(local);
  }

  public static List<DataPoint> align(List<DataPoint> in, Frequency to) {
    Map<Instant, Double> buckets = new LinkedHashMap<>();
    for (DataPoint p : in) {
      buckets.put(bucket(p.time(), to), p.value());
    }
    List<DataPoint> out = new ArrayList<>(buckets.size());
    for (var e : buckets.entrySet()) {
      out.add(new DataPoint(e.getKey(), e.getValue()));
    }
    return out;
  }

  private static Optional<Frequency> inferCalendarFrequency(List<LocalDateTime> local) {
    LocalDateTime first = local.get(0);
    boolean monthEnds = true;
    boolean sameDay = true;
    long months = -1;
    for (int i = 0; i < local.size(); i++) {
      LocalDateTime t = local.get(i);
      if (!t.toLocalTime().equals(first.toLocalTime())) {
        return Optional.empty();
      }
      LocalDate date = t.toLocalDate();
      monthEnds &= date.equals(date.with(TemporalAdjusters.lastDayOfMonth()));
      sameDay &= date.getDayOfMonth() == first.getDayOfMonth();
      if (i > 0) {
        long diff = ChronoUnit.MONTHS.between(YearMonth.from(local.get(i - 1)), YearMonth.from(t));
        if (diff <= 0 || (months >= 0 && diff != months)) {
          return Optional.empty();
        }
        months = diff;
      }
    }
    if (!monthEnds && !sameDay) {
      return Optional.empty();
    }
    if (months == 1) return Optional.of(Frequency.M);
    if (months == 3) return Optional.of(Frequency.Q);
    if (months == 12) return Optional.of(Frequency.A);
    return Optional.empty();
  }

  private static Instant bucket(Instant time, Frequency to) {
    LocalDateTime t = LocalDateTime.ofInstant(time, ZoneOffset.UTC);
    LocalDateTime bucket = switch (to) {
      case H -> t.truncatedTo(ChronoUnit.HOURS);
      case D -> t.toLocalDate().atStartOfDay();
      case W -> t.toLocalDate().with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY)).atStartOfDay();
      case M -> t.toLocalDate().with(TemporalAdjusters.lastDayOfMonth()).atStartOfDay();
      case Q -> endOfQuarter(t.toLocalDate()).atStartOfDay();
      case A -> t.toLocalDate().with(TemporalAdjusters.lastDayOfYear()).atStartOfDay();
    };
    return bucket.toInstant(ZoneOffset.UTC);
  }

  private static LocalDate endOfQuarter(LocalDate date) {
    int quarterEndMonth = ((date.getMonthValue() - 1) / 3 + 1) * 3;
    return LocalDate.of(date.getYear(), quarterEndMonth, 1)
        .with(TemporalAdjusters.lastDayOfMonth());
  }
}
