package com.ospicorp.analyticsapi.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record DatasetProfile(
    @JsonProperty("total_rows") int totalRows,
    @JsonProperty("total_columns") int totalColumns,
    @JsonProperty("missing_values") int missingValues,
    @JsonProperty("duplicate_rows") int duplicateRows,
    List<ColumnProfile> columns
) {

  public DatasetProfile {
    columns = List.copyOf(columns);
  }
}
