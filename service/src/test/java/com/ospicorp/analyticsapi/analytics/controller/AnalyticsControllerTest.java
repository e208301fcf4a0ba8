package com.ospicorp.analyticsapi.analytics.controller;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AnalyticsControllerTest {

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
      new ParameterizedTypeReference<>() {};

  @Autowired
  private TestRestTemplate restTemplate;

  @Test
  void insightsForProportionalColumns() {
    Map<String, Object> body = Map.of("data", List.of(
        Map.of("x", 1, "x2", 2),
        Map.of("x", 2, "x2", 4),
        Map.of("x", 3, "x2", 6),
        Map.of("x", 4, "x2", 8)));

    ResponseEntity<Map<String, Object>> response = post("/api/insights", body);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("row_count", 4).containsEntry("column_count", 2);
    assertThat(insights(response)).contains("Strongest correlation: x ~ x2 (|r|=1.00).");
  }

  @Test
  void insightsFromCsvBody() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.valueOf("text/csv"));
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    String csv = "date,sales,region\n"
        + "2024-01-01,10,north\n"
        + "2024-01-02,12,south\n"
        + "2024-01-03,,north\n"
        + "2024-01-04,11,south\n"
        + "2024-01-05,15,north\n";

    ResponseEntity<Map<String, Object>> response = restTemplate.exchange("/api/insights",
        HttpMethod.POST, new HttpEntity<>(csv, headers), JSON_MAP);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(insights(response)).contains(
        "Dataset profile: 5 rows x 3 columns (1 numeric, 1 datetime, 1 categorical).",
        "Time trend on 'sales' shows a 50.00% change from start to end.");
  }

  @Test
  void emptyDataReturnsEmptyInsights() {
    ResponseEntity<Map<String, Object>> response = post("/api/insights",
        Map.of("data", List.of()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("row_count", 0);
    assertThat(insights(response)).isEmpty();
  }

  @Test
  void forecastWithMissingTargetReturnsMessage() {
    ResponseEntity<Map<String, Object>> response = post("/api/forecast",
        Map.of("data", List.of(Map.of("v", 1)), "target_column", "sales"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .containsEntry("message", "No data or missing target.")
        .containsEntry("forecast", List.of())
        .doesNotContainKey("steps");
  }

  @Test
  void forecastOnShortSeriesUsesMovingAverage() {
    List<Map<String, Object>> data = new ArrayList<>();
    for (int i = 1; i <= 5; i++) {
      data.add(Map.of("date", "2024-01-0" + i, "sales", i));
    }

    ResponseEntity<Map<String, Object>> response = post("/api/forecast",
        Map.of("data", data, "target_column", "sales", "date_column", "date"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .containsEntry("steps", 12)
        .containsEntry("method", "moving_average")
        .doesNotContainKey("message");
    assertThat(response.getBody().get("forecast"))
        .asInstanceOf(InstanceOfAssertFactories.LIST)
        .hasSize(12)
        .containsOnly(4.5d);
  }

  @Test
  void anomalyFlagsRowWithFarValue() {
    List<Map<String, Object>> data = new ArrayList<>();
    for (int v : new int[] {1, 2, 3, 2, 1, 2, 3, 500}) {
      data.add(Map.of("v", v));
    }

    ResponseEntity<Map<String, Object>> response = post("/api/anomaly",
        Map.of("data", data, "numeric_columns", List.of("v")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .containsEntry("anomalies", List.of(7))
        .containsEntry("method", "isolation_forest");
  }

  @Test
  void profileAsJson() {
    ResponseEntity<Map<String, Object>> response = post("/api/profile", Map.of("data", List.of(
        Map.of("region", "north", "sales", 1),
        Map.of("region", "north", "sales", 1),
        Map.of("region", "south", "sales", 3))));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .containsEntry("total_rows", 3)
        .containsEntry("duplicate_rows", 1)
        .containsKey("columns");
  }

  @Test
  void profileAsCsv() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    Map<String, Object> body = Map.of("data", List.of(
        Map.of("sales", 1),
        Map.of("sales", 3)));

    ResponseEntity<String> response = restTemplate.exchange("/api/profile?format=csv",
        HttpMethod.POST, new HttpEntity<>(body, headers), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType()).isNotNull();
    assertThat(response.getHeaders().getContentType().isCompatibleWith(
        MediaType.valueOf("text/csv"))).isTrue();
    assertThat(response.getBody())
        .startsWith("name,type,missing_count,unique_count,min,max,mean,median,std")
        .contains("sales,numeric,0,2,1.0,3.0,2.0,2.0,1.0");
  }

  @Test
  void unsupportedProfileFormatIsRejected() {
    ResponseEntity<Map<String, Object>> response = post("/api/profile?format=xml",
        Map.of("data", List.of(Map.of("v", 1))));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .containsEntry("errorCode", 2001)
        .containsEntry("moreInfo", "https://docs.analytics-api.dev/errors/2001")
        .containsEntry("path", "/api/profile");
  }

  @Test
  void cleanRemovesDuplicatesAndFillsMissingValues() {
    List<Map<String, Object>> data = new ArrayList<>();
    data.add(record("north", 1));
    data.add(record("north", 1));
    data.add(record(null, 3));
    data.add(record("south", null));

    ResponseEntity<Map<String, Object>> response = post("/api/clean", Map.of("data", data));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .containsEntry("row_count", 3)
        .containsEntry("removed_duplicates", 1)
        .containsEntry("filled_values", 2)
        .containsEntry("dropped_rows", 0)
        .containsEntry("log", List.of(
            "Removed 1 duplicate records",
            "Filled 2 missing values",
            "Typed 1 numeric, 0 datetime and 1 categorical columns"));
    assertThat(response.getBody().get("data"))
        .asInstanceOf(InstanceOfAssertFactories.LIST)
        .containsExactly(
            Map.of("region", "north", "sales", 1.0),
            Map.of("region", "Unknown", "sales", 3.0),
            Map.of("region", "south", "sales", 0.0));
  }

  @Test
  void cleanAsCsvDropsIncompleteRows() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    Map<String, Object> incomplete = new LinkedHashMap<>();
    incomplete.put("date", "2024-01-02");
    incomplete.put("sales", null);
    Map<String, Object> body = Map.of("missing", "drop", "data", List.of(
        Map.of("date", "2024-01-01", "sales", 10),
        incomplete,
        Map.of("date", "2024-01-01", "sales", 10)));

    ResponseEntity<String> response = restTemplate.exchange("/api/clean?format=csv",
        HttpMethod.POST, new HttpEntity<>(body, headers), String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType()).isNotNull();
    assertThat(response.getHeaders().getContentType().isCompatibleWith(
        MediaType.valueOf("text/csv"))).isTrue();
    assertThat(response.getBody().lines().toList())
        .containsExactly("date,sales", "2024-01-01T00:00:00Z,10.0");
  }

  @Test
  void unsupportedMissingPolicyIsRejected() {
    ResponseEntity<Map<String, Object>> response = post("/api/clean",
        Map.of("missing", "median", "data", List.of(Map.of("v", 1))));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .containsEntry("errorCode", 2003)
        .containsEntry("path", "/api/clean");
  }

  @Test
  void requestIdIsEchoed() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.set("X-Request-Id", "test-request-1");

    ResponseEntity<Map<String, Object>> response = restTemplate.exchange("/api/anomaly",
        HttpMethod.POST, new HttpEntity<>(Map.of("data", List.of()), headers), JSON_MAP);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getFirst("X-Request-Id")).isEqualTo("test-request-1");
    assertThat(response.getBody()).containsEntry("anomalies", List.of());
  }

  private ResponseEntity<Map<String, Object>> post(String path, Object body) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    return restTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(body, headers), JSON_MAP);
  }

  private static Map<String, Object> record(String region, Integer sales) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("region", region);
    record.put("sales", sales);
    return record;
  }

  @SuppressWarnings("unchecked")
  private static List<String> insights(ResponseEntity<Map<String, Object>> response) {
    assertThat(response.getBody()).isNotNull();
    return (List<String>) response.getBody().get("insights");
  }
}
