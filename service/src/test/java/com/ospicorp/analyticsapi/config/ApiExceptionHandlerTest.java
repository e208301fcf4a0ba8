package com.ospicorp.analyticsapi.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void saturatedExecutorIsServiceUnavailable() {
    Executor saturated = task -> {
      throw new TaskRejectedException("Executor did not accept task");
    };
    TaskRejectedException rejected = null;
    try {
      CompletableFuture.supplyAsync(() -> "report", saturated);
    } catch (TaskRejectedException ex) {
      rejected = ex;
    }
    assertThat(rejected).isNotNull();

    ResponseEntity<ProblemDetail> response =
        handler.handleRejected(rejected, new MockHttpServletRequest("POST", "/api/insights"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    ProblemDetail body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.getType())
        .isEqualTo(URI.create("https://docs.analytics-api.dev/problems/service-unavailable"));
    assertThat(body.getDetail()).isEqualTo("Analysis capacity exhausted, retry later");
    assertThat(body.getInstance()).isEqualTo(URI.create("/api/insights"));
  }

  @Test
  void unexpectedFailureIsInternalError() {
    ResponseEntity<ProblemDetail> response = handler.handleServerError(
        new IllegalStateException("boom"), new MockHttpServletRequest("POST", "/api/profile"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getType())
        .isEqualTo(URI.create("https://docs.analytics-api.dev/problems/internal-error"));
  }
}
