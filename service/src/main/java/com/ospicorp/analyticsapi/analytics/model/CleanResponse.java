package com.ospicorp.analyticsapi.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public record CleanResponse(
    @JsonProperty("row_count") int rowCount,
    @JsonProperty("removed_duplicates") int removedDuplicates,
    @JsonProperty("filled_values") int filledValues,
    @JsonProperty("dropped_rows") int droppedRows,
    List<String> log,
    List<Map<String, Object>> data
) {

  public static CleanResponse from(CleaningResult result) {
    return new CleanResponse(result.table().rowCount(), result.removedDuplicates(),
        result.filledValues(), result.droppedRows(), result.log(), result.table().toRecords());
  }
}
