package com.ospicorp.analyticsapi.analytics.controller;

import com.ospicorp.analyticsapi.analytics.model.AnomalyRequest;
import com.ospicorp.analyticsapi.analytics.model.AnomalyResponse;
import com.ospicorp.analyticsapi.analytics.model.CleanRequest;
import com.ospicorp.analyticsapi.analytics.model.CleanResponse;
import com.ospicorp.analyticsapi.analytics.model.CleaningResult;
import com.ospicorp.analyticsapi.analytics.model.DatasetProfile;
import com.ospicorp.analyticsapi.analytics.model.DatasetRequest;
import com.ospicorp.analyticsapi.analytics.model.ForecastRequest;
import com.ospicorp.analyticsapi.analytics.model.ForecastResponse;
import com.ospicorp.analyticsapi.analytics.model.InsightsResponse;
import com.ospicorp.analyticsapi.analytics.model.MissingValuePolicy;
import com.ospicorp.analyticsapi.analytics.service.AnomalyService;
import com.ospicorp.analyticsapi.analytics.service.CleaningService;
import com.ospicorp.analyticsapi.analytics.service.ForecastService;
import com.ospicorp.analyticsapi.analytics.service.InsightService;
import com.ospicorp.analyticsapi.analytics.service.ProfileService;
import com.ospicorp.analyticsapi.config.CsvHttpMessageConverter;
import com.ospicorp.analyticsapi.dataset.model.Table;
import com.ospicorp.analyticsapi.dataset.service.SchemaInferencer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Validated
@Tag(name = "Analytics")
public class AnalyticsController {
  static final int INVALID_FORMAT = 2001;
  static final int INVALID_MISSING_POLICY = 2003;

  private final InsightService insightService;
  private final ForecastService forecastService;
  private final AnomalyService anomalyService;
  private final ProfileService profileService;
  private final CleaningService cleaningService;
  private final Executor executor;

  public AnalyticsController(InsightService insightService, ForecastService forecastService,
      AnomalyService anomalyService, ProfileService profileService,
      CleaningService cleaningService, @Qualifier("analyticsExecutor") Executor executor) {
    this.insightService = insightService;
    this.forecastService = forecastService;
    this.anomalyService = anomalyService;
    this.profileService = profileService;
    this.cleaningService = cleaningService;
    this.executor = executor;
  }

  @PostMapping(value = "/insights", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Generate insights",
      description = "Infer column types and report profile, summary statistics, trend, "
          + "strongest correlation and outliers.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Insights in generation order",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = InsightsResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompletableFuture<InsightsResponse> insights(@Valid @RequestBody DatasetRequest request) {
    return async(() -> insightsOf(request.data()));
  }

  @PostMapping(value = "/insights", consumes = "text/csv")
  @Operation(summary = "Generate insights from CSV",
      description = "Same as the JSON variant for a CSV body with a header row.")
  public CompletableFuture<InsightsResponse> insightsFromCsv(
      @RequestBody List<Map<String, Object>> records) {
    return async(() -> insightsOf(records));
  }

  @PostMapping(value = "/forecast", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Forecast a numeric column",
      description = "Project the target column 12 steps ahead with ARIMA(1,1,1), falling back "
          + "to a moving average. A missing target is answered with a message and an empty "
          + "forecast.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast or rejection message",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ForecastResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompletableFuture<ForecastResponse> forecast(@Valid @RequestBody ForecastRequest request) {
    return async(() -> {
      Table table = SchemaInferencer.infer(request.data());
      return ForecastResponse.from(
          forecastService.forecast(table, request.targetColumn(), request.dateColumn()));
    });
  }

  @PostMapping(value = "/anomaly", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Detect anomalous rows",
      description = "Flag rows by original position using an isolation forest, falling back "
          + "to a z-score rule.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Anomalous row identifiers",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = AnomalyResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompletableFuture<AnomalyResponse> anomaly(@Valid @RequestBody AnomalyRequest request) {
    return async(() -> {
      Table table = SchemaInferencer.infer(request.data());
      return AnomalyResponse.from(anomalyService.detect(table, request.numericColumns()));
    });
  }

  @PostMapping(value = "/profile", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Profile a dataset",
      description = "Per-column types, missing and unique counts, and numeric statistics.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Dataset profile",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = DatasetProfile.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompletableFuture<ResponseEntity<?>> profile(@Valid @RequestBody DatasetRequest request,
      @RequestParam(name = "format", defaultValue = "json")
      @Parameter(description = "Response format: json or csv") String format) {
    boolean csv = parseFormat(format);
    return async(() -> profileOf(request.data(), csv));
  }

  @PostMapping(value = "/profile", consumes = "text/csv")
  @Operation(summary = "Profile a CSV dataset")
  public CompletableFuture<ResponseEntity<?>> profileFromCsv(
      @RequestBody List<Map<String, Object>> records,
      @RequestParam(name = "format", defaultValue = "json") String format) {
    boolean csv = parseFormat(format);
    return async(() -> profileOf(records, csv));
  }

  @PostMapping(value = "/clean", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Clean a dataset",
      description = "Remove duplicate rows and keep, fill or drop missing values. Returns typed "
          + "rows with a log of the changes, or the cleaned rows alone as CSV.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Cleaned dataset",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = CleanResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompletableFuture<ResponseEntity<?>> clean(@Valid @RequestBody CleanRequest request,
      @RequestParam(name = "format", defaultValue = "json")
      @Parameter(description = "Response format: json or csv") String format) {
    boolean csv = parseFormat(format);
    MissingValuePolicy missing = parseMissing(request.missingOrDefault());
    return async(() -> {
      CleaningResult result = cleaningService.clean(SchemaInferencer.infer(request.data()),
          request.removeDuplicatesOrDefault(), missing);
      if (csv) {
        return ResponseEntity.ok()
            .contentType(CsvHttpMessageConverter.TEXT_CSV)
            .body(result.table().toRecords());
      }
      return ResponseEntity.ok()
          .contentType(MediaType.APPLICATION_JSON)
          .body(CleanResponse.from(result));
    });
  }

  private InsightsResponse insightsOf(List<Map<String, Object>> records) {
    Table table = SchemaInferencer.infer(records);
    return InsightsResponse.from(insightService.generate(table));
  }

  private ResponseEntity<?> profileOf(List<Map<String, Object>> records, boolean csv) {
    DatasetProfile profile = profileService.profile(SchemaInferencer.infer(records));
    if (csv) {
      return ResponseEntity.ok()
          .contentType(CsvHttpMessageConverter.TEXT_CSV)
          .body(profile.columns());
    }
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(profile);
  }

  private static boolean parseFormat(String format) {
    String normalized = format.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "json" -> false;
      case "csv" -> true;
      default -> throw new InvalidParameterException(
          "Unsupported format '" + format + "'. Use json or csv.", INVALID_FORMAT);
    };
  }

  private static MissingValuePolicy parseMissing(String missing) {
    return MissingValuePolicy.fromCode(missing).orElseThrow(() -> new InvalidParameterException(
        "Unsupported missing value policy '" + missing + "'. Use keep, fill or drop.",
        INVALID_MISSING_POLICY));
  }

  private <T> CompletableFuture<T> async(Supplier<T> task) {
    return CompletableFuture.supplyAsync(task, executor);
  }
}
