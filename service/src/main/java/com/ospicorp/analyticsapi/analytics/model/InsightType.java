package com.ospicorp.analyticsapi.analytics.model;

public enum InsightType {
  PROFILE,
  SUMMARY,
  TREND,
  CORRELATION,
  OUTLIERS
}
