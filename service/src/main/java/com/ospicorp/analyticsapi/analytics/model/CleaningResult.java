package com.ospicorp.analyticsapi.analytics.model;

import com.ospicorp.analyticsapi.dataset.model.Table;
import java.util.List;

/** Cleaned table plus the counts and log lines describing what changed. */
public record CleaningResult(Table table, int removedDuplicates, int filledValues,
    int droppedRows, List<String> log) {

  public CleaningResult {
    log = List.copyOf(log);
  }
}
