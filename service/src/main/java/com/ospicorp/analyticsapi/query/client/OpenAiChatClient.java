package com.ospicorp.analyticsapi.query.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/** Calls an OpenAI-compatible {@code /chat/completions} endpoint. */
@Component
public class OpenAiChatClient implements LanguageModelClient {
  private static final double TEMPERATURE = 0.2;

  private final RestTemplate restTemplate;
  private final String baseUrl;
  private final String apiKey;
  private final String model;

  public OpenAiChatClient(RestTemplate restTemplate,
      @Value("${llm.base-url:https://api.openai.com/v1}") String baseUrl,
      @Value("${llm.api-key:}") String apiKey,
      @Value("${llm.model:gpt-4o-mini}") String model) {
    this.restTemplate = restTemplate;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.apiKey = apiKey;
    this.model = model;
  }

  @Override
  public String complete(String systemPrompt, String userPrompt) {
    if (!StringUtils.hasText(apiKey)) {
      throw new IllegalStateException("Language model API key is not configured");
    }
    Map<String, Object> body = Map.of(
        "model", model,
        "temperature", TEMPERATURE,
        "messages", List.of(
            Map.of("role", "system", "content", systemPrompt),
            Map.of("role", "user", "content", userPrompt)));

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(apiKey);
    HttpEntity<Map<String, Object>> entity = new HttpEntity<>(body, headers);

    ResponseEntity<JsonNode> response = restTemplate.exchange(baseUrl + "/chat/completions",
        HttpMethod.POST, entity, JsonNode.class);
    JsonNode reply = response.getBody();
    String content = reply == null ? null
        : reply.path("choices").path(0).path("message").path("content").asText(null);
    if (!StringUtils.hasText(content)) {
      throw new IllegalStateException("Language model returned no content");
    }
    return content;
  }
}
