package com.ospicorp.analyticsapi.query.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

class OpenAiChatClientTest {

  private RestTemplate restTemplate;
  private MockRestServiceServer server;

  @BeforeEach
  void setUp() {
    restTemplate = new RestTemplate();
    server = MockRestServiceServer.bindTo(restTemplate).build();
  }

  @Test
  void postsChatCompletionAndReturnsContent() {
    server.expect(requestTo("https://llm.example.test/v1/chat/completions"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer secret"))
        .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
        .andExpect(jsonPath("$.messages[1].content").value("question"))
        .andRespond(withSuccess(
            "{\"choices\": [{\"message\": {\"role\": \"assistant\", \"content\": \"{}\"}}]}",
            MediaType.APPLICATION_JSON));
    OpenAiChatClient client = new OpenAiChatClient(restTemplate, "https://llm.example.test/v1/",
        "secret", "gpt-4o-mini");

    assertThat(client.complete("system", "question")).isEqualTo("{}");
    server.verify();
  }

  @Test
  void missingApiKeyFailsBeforeCallingServer() {
    OpenAiChatClient client = new OpenAiChatClient(restTemplate, "https://llm.example.test/v1",
        "", "gpt-4o-mini");

    assertThatThrownBy(() -> client.complete("system", "question"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("API key");
    server.verify();
  }

  @Test
  void serverErrorPropagates() {
    server.expect(requestTo("https://llm.example.test/v1/chat/completions"))
        .andRespond(withServerError());
    OpenAiChatClient client = new OpenAiChatClient(restTemplate, "https://llm.example.test/v1",
        "secret", "gpt-4o-mini");

    assertThatThrownBy(() -> client.complete("system", "question"))
        .isInstanceOf(HttpServerErrorException.class);
  }

  @Test
  void emptyChoicesAreRejected() {
    server.expect(requestTo("https://llm.example.test/v1/chat/completions"))
        .andRespond(withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));
    OpenAiChatClient client = new OpenAiChatClient(restTemplate, "https://llm.example.test/v1",
        "secret", "gpt-4o-mini");

    assertThatThrownBy(() -> client.complete("system", "question"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("no content");
  }
}
