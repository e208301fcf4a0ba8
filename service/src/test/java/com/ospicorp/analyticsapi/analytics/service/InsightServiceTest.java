package com.ospicorp.analyticsapi.analytics.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.analyticsapi.analytics.model.Insight;
import com.ospicorp.analyticsapi.analytics.model.InsightReport;
import com.ospicorp.analyticsapi.analytics.model.InsightType;
import com.ospicorp.analyticsapi.dataset.model.Table;
import com.ospicorp.analyticsapi.dataset.service.SchemaInferencer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InsightServiceTest {

  private final InsightService service = new InsightService();

  @Test
  void emptyTableHasNoInsights() {
    InsightReport report = service.generate(Table.empty());

    assertThat(report.rowCount()).isZero();
    assertThat(report.columnCount()).isZero();
    assertThat(report.insights()).isEmpty();
  }

  @Test
  void reportsStatsAndCorrelationForProportionalColumns() {
    Table table = SchemaInferencer.infer(List.of(
        row("x", 1, "x2", 2),
        row("x", 2, "x2", 4),
        row("x", 3, "x2", 6),
        row("x", 4, "x2", 8)));

    InsightReport report = service.generate(table);

    assertThat(report.rowCount()).isEqualTo(4);
    assertThat(report.columnCount()).isEqualTo(2);
    assertThat(report.texts()).containsExactly(
        "Dataset profile: 4 rows x 2 columns (2 numeric, 0 datetime, 0 categorical).",
        "'x': mean=2.50, median=2.50, std=1.12, min=1.00, max=4.00.",
        "'x2': mean=5.00, median=5.00, std=2.24, min=2.00, max=8.00.",
        "Strongest correlation: x ~ x2 (|r|=1.00).");
    Insight correlation = report.insights().get(3);
    assertThat(correlation.type()).isEqualTo(InsightType.CORRELATION);
    assertThat(correlation.metric("abs_r")).isCloseTo(1d, within(1e-9));
  }

  @Test
  void trendSortsByTimeAndUsesFirstValueAsBaseline() {
    Table table = SchemaInferencer.infer(List.of(
        row("date", "2024-01-03", "sales", 11),
        row("date", "2024-01-01", "sales", 10),
        row("date", "2024-01-04", "sales", 15),
        row("date", "2024-01-02", "sales", 12)));

    Insight trend = only(service.generate(table), InsightType.TREND);

    assertThat(trend.text()).isEqualTo("Time trend on 'sales' shows a 50.00% change from start to end.");
    assertThat(trend.metric("points")).isEqualTo(4d);
  }

  @Test
  void zeroBaselineIsReplacedByOne() {
    Table table = SchemaInferencer.infer(List.of(
        row("date", "2024-01-01", "v", 0),
        row("date", "2024-01-02", "v", 1),
        row("date", "2024-01-03", "v", 2),
        row("date", "2024-01-04", "v", 3)));

    Insight trend = only(service.generate(table), InsightType.TREND);

    assertThat(trend.metric("change_pct")).isEqualTo(300d);
  }

  @Test
  void trendNeedsFourCompleteRows() {
    Table table = SchemaInferencer.infer(List.of(
        row("date", "2024-01-01", "v", 1),
        row("date", "2024-01-02", "v", 2),
        row("date", "", "v", 3),
        row("date", "2024-01-04", "v", 4)));

    assertThat(service.generate(table).insights())
        .extracting(Insight::type)
        .doesNotContain(InsightType.TREND);
  }

  @Test
  void identicalColumnsAreSkippedWhenLookingForCorrelation() {
    Table table = SchemaInferencer.infer(List.of(
        row("a", 1, "b", 1, "c", 4),
        row("a", 2, "b", 2, "c", 1),
        row("a", 3, "b", 3, "c", 3),
        row("a", 4, "b", 4, "c", 2)));

    Insight correlation = only(service.generate(table), InsightType.CORRELATION);

    assertThat(correlation.text()).isEqualTo("Strongest correlation: a ~ c (|r|=0.40).");
  }

  @Test
  void constantColumnHasNoCorrelation() {
    Table table = SchemaInferencer.infer(List.of(
        row("a", 1, "k", 5),
        row("a", 2, "k", 5),
        row("a", 3, "k", 5)));

    assertThat(service.generate(table).insights())
        .extracting(Insight::type)
        .doesNotContain(InsightType.CORRELATION);
  }

  @Test
  void outliersUseInterpolatedQuartileFences() {
    List<Map<String, Object>> records = new ArrayList<>();
    for (int v : new int[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 100}) {
      records.add(row("v", v));
    }

    Insight outliers = only(service.generate(SchemaInferencer.infer(records)),
        InsightType.OUTLIERS);

    assertThat(outliers.text()).isEqualTo("1 potential outliers detected in 'v' via IQR fence.");
    assertThat(outliers.metric("q1")).isEqualTo(3.25d);
    assertThat(outliers.metric("q3")).isEqualTo(7.75d);
    assertThat(outliers.metric("upper_fence")).isEqualTo(14.5d);
  }

  @Test
  void outliersNeedEightValues() {
    List<Map<String, Object>> records = new ArrayList<>();
    for (int v : new int[] {1, 2, 3, 4, 5, 6, 1000}) {
      records.add(row("v", v));
    }

    assertThat(service.generate(SchemaInferencer.infer(records)).insights())
        .extracting(Insight::type)
        .doesNotContain(InsightType.OUTLIERS);
  }

  @Test
  void summarizesAtMostTenNumericColumns() {
    Map<String, Object> record = new LinkedHashMap<>();
    for (int i = 0; i < 12; i++) {
      record.put("c" + i, i);
    }
    record.put("label", "only");

    InsightReport report = service.generate(SchemaInferencer.infer(List.of(record)));

    assertThat(report.insights().get(0).text())
        .isEqualTo("Dataset profile: 1 rows x 13 columns (12 numeric, 0 datetime, 1 categorical).");
    assertThat(report.insights()).filteredOn(i -> i.type() == InsightType.SUMMARY).hasSize(10);
  }

  private static Insight only(InsightReport report, InsightType type) {
    List<Insight> matches = report.insights().stream().filter(i -> i.type() == type).toList();
    assertThat(matches).hasSize(1);
    return matches.get(0);
  }

  private static Map<String, Object> row(Object... keyValues) {
    Map<String, Object> record = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      record.put((String) keyValues[i], keyValues[i + 1]);
    }
    return record;
  }
}
