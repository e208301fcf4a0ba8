package com.ospicorp.analyticsapi.analytics.service;

import com.ospicorp.analyticsapi.analytics.model.DataPoint;
import com.ospicorp.analyticsapi.analytics.model.Insight;
import com.ospicorp.analyticsapi.analytics.model.InsightReport;
import com.ospicorp.analyticsapi.analytics.model.InsightType;
import com.ospicorp.analyticsapi.dataset.model.ColumnType;
import com.ospicorp.analyticsapi.dataset.model.DatetimeColumn;
import com.ospicorp.analyticsapi.dataset.model.NumericColumn;
import com.ospicorp.analyticsapi.dataset.model.Table;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class InsightService {
  private static final Logger log = LoggerFactory.getLogger(InsightService.class);

  static final int MAX_SUMMARY_COLUMNS = 10;
  static final int MAX_OUTLIER_COLUMNS = 5;
  static final int MIN_TREND_POINTS = 4;
  static final int MIN_OUTLIER_VALUES = 8;
  static final double DUPLICATE_CORRELATION = 0.999;

  public InsightReport generate(Table table) {
    if (table.isEmpty()) {
      return InsightReport.empty();
    }
    List<Insight> insights = new ArrayList<>();
    insights.add(profile(table));

    List<NumericColumn> numeric = table.numericColumns();
    for (NumericColumn column : numeric.subList(0, Math.min(MAX_SUMMARY_COLUMNS, numeric.size()))) {
      summary(column).ifPresent(insights::add);
    }
    List<DatetimeColumn> datetimes = table.datetimeColumns();
    if (!datetimes.isEmpty() && !numeric.isEmpty()) {
      trend(datetimes.get(0), numeric.get(0)).ifPresent(insights::add);
    }
    if (numeric.size() >= 2) {
      strongestCorrelation(numeric).ifPresent(insights::add);
    }
    for (NumericColumn column : numeric.subList(0, Math.min(MAX_OUTLIER_COLUMNS, numeric.size()))) {
      outliers(column).ifPresent(insights::add);
    }

    log.debug("Generated {} insights for {} rows x {} columns", insights.size(),
        table.rowCount(), table.columnCount());
    return new InsightReport(table.rowCount(), table.columnCount(), insights);
  }

  private Insight profile(Table table) {
    long numeric = table.countOf(ColumnType.NUMERIC);
    long datetime = table.countOf(ColumnType.DATETIME);
    long categorical = table.countOf(ColumnType.CATEGORICAL);
    Map<String, Double> metrics = new LinkedHashMap<>();
    metrics.put("rows", (double) table.rowCount());
    metrics.put("columns", (double) table.columnCount());
    metrics.put("numeric_columns", (double) numeric);
    metrics.put("datetime_columns", (double) datetime);
    metrics.put("categorical_columns", (double) categorical);
    String text = format("Dataset profile: %d rows x %d columns (%d numeric, %d datetime, "
        + "%d categorical).", table.rowCount(), table.columnCount(), numeric, datetime, categorical);
    return new Insight(InsightType.PROFILE, table.columnNames(), metrics, text);
  }

  Optional<Insight> summary(NumericColumn column) {
    double[] values = column.presentValues();
    if (values.length == 0) {
      return Optional.empty();
    }
    Statistics.Summary s = Statistics.summarize(values);
    Map<String, Double> metrics = new LinkedHashMap<>();
    metrics.put("mean", s.mean());
    metrics.put("median", s.median());
    metrics.put("std", s.std());
    metrics.put("min", s.min());
    metrics.put("max", s.max());
    String text = format("'%s': mean=%.2f, median=%.2f, std=%.2f, min=%.2f, max=%.2f.",
        column.name(), s.mean(), s.median(), s.std(), s.min(), s.max());
    return Optional.of(new Insight(InsightType.SUMMARY, List.of(column.name()), metrics, text));
  }

  Optional<Insight> trend(DatetimeColumn time, NumericColumn value) {
    List<DataPoint> observations = new ArrayList<>();
    for (int row = 0; row < time.size(); row++) {
      if (!time.isMissing(row) && !value.isMissing(row)) {
        observations.add(new DataPoint(time.value(row), value.value(row)));
      }
    }
    if (observations.size() < MIN_TREND_POINTS) {
      return Optional.empty();
    }
    observations.sort(Comparator.comparing(DataPoint::time));
    double first = observations.get(0).value();
    double last = observations.get(observations.size() - 1).value();
    // a zero baseline is replaced by 1, so the result is last * 100
    double baseline = first == 0d ? 1d : first;
    double change = (last - first) / baseline * 100d;

    Map<String, Double> metrics = new LinkedHashMap<>();
    metrics.put("first", first);
    metrics.put("last", last);
    metrics.put("change_pct", change);
    metrics.put("points", (double) observations.size());
    String text = format("Time trend on '%s' shows a %.2f%% change from start to end.",
        value.name(), change);
    return Optional.of(new Insight(InsightType.TREND, List.of(time.name(), value.name()),
        metrics, text));
  }

  Optional<Insight> strongestCorrelation(List<NumericColumn> columns) {
    String bestLeft = null;
    String bestRight = null;
    double best = -1d;
    for (int i = 0; i < columns.size(); i++) {
      for (int j = i + 1; j < columns.size(); j++) {
        NumericColumn left = columns.get(i);
        NumericColumn right = columns.get(j);
        double r = Math.abs(pairwiseCorrelation(left, right));
        if (Double.isNaN(r)) {
          continue;
        }
        if (r >= DUPLICATE_CORRELATION && left.values().equals(right.values())) {
          continue;
        }
        if (r > best) {
          best = r;
          bestLeft = left.name();
          bestRight = right.name();
        }
      }
    }
    if (bestLeft == null) {
      return Optional.empty();
    }
    String text = format("Strongest correlation: %s ~ %s (|r|=%.2f).", bestLeft, bestRight, best);
    return Optional.of(new Insight(InsightType.CORRELATION, List.of(bestLeft, bestRight),
        Map.of("abs_r", best), text));
  }

  Optional<Insight> outliers(NumericColumn column) {
    double[] values = column.presentValues();
    if (values.length < MIN_OUTLIER_VALUES) {
      return Optional.empty();
    }
    Statistics.Quartiles quartiles = Statistics.quartiles(values);
    double lower = quartiles.lowerFence();
    double upper = quartiles.upperFence();
    int count = 0;
    for (double v : values) {
      if (v < lower || v > upper) {
        count++;
      }
    }
    if (count == 0) {
      return Optional.empty();
    }
    Map<String, Double> metrics = new LinkedHashMap<>();
    metrics.put("count", (double) count);
    metrics.put("q1", quartiles.q1());
    metrics.put("q3", quartiles.q3());
    metrics.put("lower_fence", lower);
    metrics.put("upper_fence", upper);
    String text = format("%d potential outliers detected in '%s' via IQR fence.", count,
        column.name());
    return Optional.of(new Insight(InsightType.OUTLIERS, List.of(column.name()), metrics, text));
  }

  private static double pairwiseCorrelation(NumericColumn left, NumericColumn right) {
    List<double[]> pairs = new ArrayList<>();
    for (int row = 0; row < left.size(); row++) {
      if (!left.isMissing(row) && !right.isMissing(row)) {
        pairs.add(new double[] {left.value(row), right.value(row)});
      }
    }
    double[] x = new double[pairs.size()];
    double[] y = new double[pairs.size()];
    for (int i = 0; i < pairs.size(); i++) {
      x[i] = pairs.get(i)[0];
      y[i] = pairs.get(i)[1];
    }
    return Statistics.pearson(x, y);
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
