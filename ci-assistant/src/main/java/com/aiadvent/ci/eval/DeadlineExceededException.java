package com.aiadvent.ci.eval;

import com.aiadvent.ci.shared.CiAssistantException;
import java.time.Duration;

public class DeadlineExceededException extends CiAssistantException {

  private final Duration budget;

  public DeadlineExceededException(Duration budget) {
    super("Deadline of " + budget.toSeconds() + "s exceeded");
    this.budget = budget;
  }

  public Duration getBudget() {
    return budget;
  }
}
