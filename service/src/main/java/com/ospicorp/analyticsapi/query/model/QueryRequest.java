package com.ospicorp.analyticsapi.query.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

public record QueryRequest(
    @NotNull List<Map<String, Object>> data,
    @Schema(description = "Question about the dataset", example = "Which region sells most?")
    String question
) {}
