package com.ospicorp.analyticsapi.query.model;

public record ChartSuggestion(String type, String x, String y, String category) {}
