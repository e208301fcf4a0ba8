package com.ospicorp.analyticsapi.query.model;

import java.util.List;

public record QueryAnswer(String answer, List<ChartSuggestion> suggestions) {

  public QueryAnswer {
    suggestions = List.copyOf(suggestions);
  }
}
