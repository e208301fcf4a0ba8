package com.ospicorp.analyticsapi.analytics.service;

import com.ospicorp.analyticsapi.analytics.model.AnomalyMethod;
import com.ospicorp.analyticsapi.analytics.model.AnomalyResult;
import com.ospicorp.analyticsapi.dataset.model.Column;
import com.ospicorp.analyticsapi.dataset.model.NumericColumn;
import com.ospicorp.analyticsapi.dataset.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class AnomalyService {
  private static final Logger log = LoggerFactory.getLogger(AnomalyService.class);

  private final ModelingCapabilities capabilities;
  private final AnomalyModel primary;
  private final AnomalyModel fallback = new ZScoreDetector();

  @Autowired
  public AnomalyService(ModelingCapabilities capabilities) {
    this(capabilities, new IsolationForest());
  }

  AnomalyService(ModelingCapabilities capabilities, AnomalyModel primary) {
    this.capabilities = capabilities;
    this.primary = primary;
  }

  /**
   * Detects anomalous rows over the requested numeric columns, or over every numeric column
   * when none are requested. Requested names that are absent or not numeric are ignored.
   */
  public AnomalyResult detect(Table table, List<String> requestedColumns) {
    if (table.isEmpty()) {
      return AnomalyResult.none();
    }
    List<NumericColumn> selected = select(table, requestedColumns);
    if (selected.isEmpty()) {
      return AnomalyResult.none();
    }

    List<Integer> rowIds = new ArrayList<>();
    List<double[]> rows = new ArrayList<>();
    for (int row = 0; row < table.rowCount(); row++) {
      double[] values = completeRow(selected, row);
      if (values != null) {
        rowIds.add(row);
        rows.add(values);
      }
    }
    if (rows.isEmpty()) {
      return AnomalyResult.none();
    }
    double[][] matrix = rows.toArray(new double[0][]);

    if (capabilities.isolationForestEnabled()) {
      try {
        return collect(rowIds, primary.classify(matrix), AnomalyMethod.ISOLATION_FOREST);
      } catch (RuntimeException ex) {
        log.debug("Isolation forest failed on {} rows, using z-score: {}", matrix.length,
            ex.getMessage());
      }
    }
    return collect(rowIds, fallback.classify(matrix), AnomalyMethod.Z_SCORE);
  }

  private List<NumericColumn> select(Table table, List<String> requestedColumns) {
    if (requestedColumns == null || requestedColumns.isEmpty()) {
      return table.numericColumns();
    }
    List<NumericColumn> selected = new ArrayList<>();
    for (String name : requestedColumns) {
      Optional<Column> column = table.column(name);
      if (column.isPresent() && column.get() instanceof NumericColumn numeric) {
        if (!selected.contains(numeric)) {
          selected.add(numeric);
        }
      } else {
        log.debug("Ignoring anomaly column '{}': not a numeric column of the dataset", name);
      }
    }
    return selected;
  }

  private static double[] completeRow(List<NumericColumn> columns, int row) {
    double[] values = new double[columns.size()];
    for (int j = 0; j < columns.size(); j++) {
      Double value = columns.get(j).value(row);
      if (value == null) {
        return null;
      }
      values[j] = value;
    }
    return values;
  }

  private static AnomalyResult collect(List<Integer> rowIds, boolean[] flags,
      AnomalyMethod method) {
    if (flags.length != rowIds.size()) {
      throw new ModelingException("Expected " + rowIds.size() + " flags, got " + flags.length);
    }
    List<Integer> anomalies = new ArrayList<>();
    for (int i = 0; i < flags.length; i++) {
      if (flags[i]) {
        anomalies.add(rowIds.get(i));
      }
    }
    return new AnomalyResult(anomalies, method);
  }
}
