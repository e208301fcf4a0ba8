package com.ospicorp.analyticsapi.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "type", "missing_count", "unique_count", "min", "max", "mean",
    "median", "std"})
public record ColumnProfile(
    String name,
    String type,
    @JsonProperty("missing_count") int missingCount,
    @JsonProperty("unique_count") int uniqueCount,
    Double min,
    Double max,
    Double mean,
    Double median,
    Double std
) {}
