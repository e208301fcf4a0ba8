package com.ospicorp.analyticsapi.analytics.service;

/**
 * Which primary modeling strategies this process may use. Resolved once at startup; services
 * branch on these flags before trying a model.
 */
public record ModelingCapabilities(boolean arimaEnabled, boolean isolationForestEnabled) {

  public static ModelingCapabilities all() {
    return new ModelingCapabilities(true, true);
  }

  public static ModelingCapabilities none() {
    return new ModelingCapabilities(false, false);
  }
}
