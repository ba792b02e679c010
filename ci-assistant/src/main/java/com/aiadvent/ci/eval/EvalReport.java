package com.aiadvent.ci.eval;

import java.time.Duration;
import java.util.List;

/**
 * Results of an evaluation run. {@code aborted} is set when the cumulative budget ran out before
 * every case was attempted.
 */
public record EvalReport(List<EvalCaseResult> results, boolean aborted, Duration elapsed) {

  public EvalReport {
    results = List.copyOf(results);
  }

  public long passedCount() {
    return results.stream().filter(EvalCaseResult::passed).count();
  }

  public long failedCount() {
    return results.size() - passedCount();
  }

  public List<EvalCaseResult> failures() {
    return results.stream().filter(result -> !result.passed()).toList();
  }

  public boolean successful() {
    return !aborted && failedCount() == 0;
  }
}
