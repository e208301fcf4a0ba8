package com.ospicorp.analyticsapi.analytics.model;

/** Regular sampling frequencies recognised on a datetime axis. */
public enum Frequency {
  H,
  D,
  W,
  M,
  Q,
  A
}
