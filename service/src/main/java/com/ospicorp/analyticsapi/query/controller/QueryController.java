package com.ospicorp.analyticsapi.query.controller;

import com.ospicorp.analyticsapi.analytics.controller.InvalidParameterException;
import com.ospicorp.analyticsapi.query.model.QueryAnswer;
import com.ospicorp.analyticsapi.query.model.QueryRequest;
import com.ospicorp.analyticsapi.query.service.DatasetQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Query")
public class QueryController {
  static final int MISSING_QUESTION = 2002;

  private final DatasetQueryService queryService;
  private final Executor executor;

  public QueryController(DatasetQueryService queryService,
      @Qualifier("analyticsExecutor") Executor executor) {
    this.queryService = queryService;
    this.executor = executor;
  }

  @PostMapping(value = "/query", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Ask a question about a dataset",
      description = "Answers a natural-language question with the configured language model "
          + "and suggests up to three charts. Model failures are reported in the answer.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Answer and chart suggestions",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = QueryAnswer.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompletableFuture<QueryAnswer> query(@Valid @RequestBody QueryRequest request) {
    if (!StringUtils.hasText(request.question())) {
      throw new InvalidParameterException("Parameter 'question' must not be blank",
          MISSING_QUESTION);
    }
    return CompletableFuture.supplyAsync(
        () -> queryService.ask(request.data(), request.question()), executor);
  }
}
