package com.aiadvent.ci.llm;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Intent {
  QUESTION,
  REQUEST,
  COMPLAINT,
  OTHER;

  /** Upper-cases and trims {@code label}; empty when it is not one of the known intents. */
  public static Optional<Intent> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String normalized = label.strip().toUpperCase(Locale.ROOT);
    return Arrays.stream(values()).filter(intent -> intent.name().equals(normalized)).findFirst();
  }
}
