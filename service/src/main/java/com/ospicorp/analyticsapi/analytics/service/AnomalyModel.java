package com.ospicorp.analyticsapi.analytics.service;

/** Flags rows of a complete numeric matrix ({@code rows[i][j]}: row i, selected column j). */
@FunctionalInterface
public interface AnomalyModel {

  boolean[] classify(double[][] rows);
}
