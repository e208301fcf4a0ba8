package com.ospicorp.analyticsapi.analytics.model;

import java.util.Locale;
import java.util.Optional;

/** What cleaning does with a missing cell. */
public enum MissingValuePolicy {
  /** Leave missing cells as they are. */
  KEEP,
  /** Numeric cells become 0, categorical cells "Unknown", datetime cells the cleaning time. */
  FILL,
  /** Remove every row with at least one missing cell. */
  DROP;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<MissingValuePolicy> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    String normalized = code.trim().toUpperCase(Locale.ROOT);
    for (MissingValuePolicy policy : values()) {
      if (policy.name().equals(normalized)) {
        return Optional.of(policy);
      }
    }
    return Optional.empty();
  }
}
