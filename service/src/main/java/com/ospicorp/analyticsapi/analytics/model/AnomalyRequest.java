package com.ospicorp.analyticsapi.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

public record AnomalyRequest(
    @NotNull List<Map<String, Object>> data,
    @JsonProperty("numeric_columns") @Schema(description = "Columns to inspect; every numeric "
        + "column when omitted or empty") List<String> numericColumns
) {}
