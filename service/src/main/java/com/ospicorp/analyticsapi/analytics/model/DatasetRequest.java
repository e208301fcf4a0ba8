package com.ospicorp.analyticsapi.analytics.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

@Schema(description = "A dataset as a list of row records")
public record DatasetRequest(
    @NotNull @Schema(description = "Row records, field name to scalar value")
    List<Map<String, Object>> data
) {}
