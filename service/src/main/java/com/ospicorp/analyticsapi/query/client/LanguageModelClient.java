package com.ospicorp.analyticsapi.query.client;

/** Chat-style text completion used by the dataset query assistant. */
public interface LanguageModelClient {

  /**
   * Returns the assistant's reply to a single system/user exchange.
   *
   * @throws RuntimeException when the model cannot be reached or returns no content
   */
  String complete(String systemPrompt, String userPrompt);
}
