package com.ospicorp.analyticsapi.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

public record CleanRequest(
    @NotNull List<Map<String, Object>> data,
    @JsonProperty("remove_duplicates") @Schema(description = "Drop repeated rows, keeping the "
        + "first occurrence", defaultValue = "true") Boolean removeDuplicates,
    @Schema(description = "Missing value handling: keep, fill or drop", defaultValue = "fill",
        example = "fill") String missing
) {

  public boolean removeDuplicatesOrDefault() {
    return removeDuplicates == null || removeDuplicates;
  }

  public String missingOrDefault() {
    return missing == null ? MissingValuePolicy.FILL.code() : missing;
  }
}
