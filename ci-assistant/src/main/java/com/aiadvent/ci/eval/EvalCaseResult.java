package com.aiadvent.ci.eval;

import com.aiadvent.ci.llm.Intent;
import java.time.Duration;

/**
 * Outcome of one golden case. {@code actual} is the classified intent, or a short description of
 * what went wrong ({@code TIMEOUT (>30s)}, {@code ERROR: ...}).
 */
public record EvalCaseResult(
    String id, Intent expected, String actual, boolean passed, Duration elapsed) {

  public String describe() {
    return passed
        ? "[PASS] %s: %s == %s".formatted(id, actual, expected)
        : "[FAIL] %s: got %s, expected %s".formatted(id, actual, expected);
  }
}
