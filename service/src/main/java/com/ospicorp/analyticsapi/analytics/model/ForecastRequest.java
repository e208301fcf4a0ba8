package com.ospicorp.analyticsapi.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

public record ForecastRequest(
    @NotNull List<Map<String, Object>> data,
    @JsonProperty("target_column") @Schema(description = "Numeric column to project",
        example = "sales") String targetColumn,
    @JsonProperty("date_column") @Schema(description = "Optional time column; the first "
        + "datetime column is used when omitted", example = "date") String dateColumn
) {}
