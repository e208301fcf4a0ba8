package com.ospicorp.analyticsapi.query.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.analyticsapi.dataset.model.Column;
import com.ospicorp.analyticsapi.dataset.model.Table;
import com.ospicorp.analyticsapi.dataset.service.SchemaInferencer;
import com.ospicorp.analyticsapi.query.client.LanguageModelClient;
import com.ospicorp.analyticsapi.query.model.ChartSuggestion;
import com.ospicorp.analyticsapi.query.model.QueryAnswer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DatasetQueryService {
  private static final Logger log = LoggerFactory.getLogger(DatasetQueryService.class);

  static final int PREVIEW_ROWS = 10;
  static final int MAX_SUGGESTIONS = 3;
  static final String SYSTEM_PROMPT =
      "You are a helpful data analyst that only returns JSON when asked.";

  private final LanguageModelClient client;
  private final ObjectMapper mapper;

  public DatasetQueryService(LanguageModelClient client, ObjectMapper mapper) {
    this.client = client;
    this.mapper = mapper;
  }

  public QueryAnswer ask(List<Map<String, Object>> records, String question) {
    try {
      String prompt = buildPrompt(records, question);
      String reply = client.complete(SYSTEM_PROMPT, prompt);
      return parseAnswer(reply);
    } catch (Exception ex) {
      log.warn("Dataset question could not be answered: {}", ex.getMessage());
      return new QueryAnswer("Could not process the question: " + ex.getMessage(), List.of());
    }
  }

  String buildPrompt(List<Map<String, Object>> records, String question)
      throws JsonProcessingException {
    Table table = SchemaInferencer.infer(records);
    Map<String, String> schema = new LinkedHashMap<>();
    for (Column column : table.columns()) {
      schema.put(column.name(), column.type().code());
    }
    List<Map<String, Object>> preview = records == null ? List.of()
        : records.subList(0, Math.min(PREVIEW_ROWS, records.size()));

    return """
        You are an AI data analyst.
        Dataset schema (column: type): %s
        Sample rows (first %d): %s
        User question: %s

        Task:
        1) Provide a concise, business-friendly answer.
        2) Suggest up to %d useful visualizations based on the data and question.
        3) Each suggestion must include fields: type (bar/line/pie/scatter/table/none), x, y,
           category (nullable).

        Respond with JSON ONLY in this exact structure:
        {"answer": "...", "suggestions": [{"type": "...", "x": "column or null",
         "y": "column or null", "category": "column or null"}]}
        """.formatted(mapper.writeValueAsString(schema), PREVIEW_ROWS,
        mapper.writeValueAsString(preview), question, MAX_SUGGESTIONS);
  }

  QueryAnswer parseAnswer(String reply) throws JsonProcessingException {
    JsonNode root = mapper.readTree(stripCodeFence(reply));
    if (root == null || !root.isObject() || !root.path("answer").isTextual()) {
      throw new IllegalStateException("Reply is not a JSON object with an answer");
    }
    List<ChartSuggestion> suggestions = new ArrayList<>();
    for (JsonNode node : root.path("suggestions")) {
      if (suggestions.size() == MAX_SUGGESTIONS) {
        break;
      }
      if (node.isObject()) {
        suggestions.add(new ChartSuggestion(
            textOrNull(node, "type"),
            textOrNull(node, "x"),
            textOrNull(node, "y"),
            textOrNull(node, "category")));
      }
    }
    return new QueryAnswer(root.path("answer").asText(), suggestions);
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull()) {
      return null;
    }
    String text = value.asText();
    return "null".equals(text) ? null : text;
  }

  private static String stripCodeFence(String reply) {
    String text = reply.strip();
    if (text.startsWith("```")) {
      int firstLine = text.indexOf('\n');
      int closing = text.lastIndexOf("```");
      if (firstLine > 0 && closing > firstLine) {
        return text.substring(firstLine + 1, closing).strip();
      }
    }
    return text;
  }
}
