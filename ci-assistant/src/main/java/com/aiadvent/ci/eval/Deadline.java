package com.aiadvent.ci.eval;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Wall-clock budget for a unit of work. Checks are cooperative: nothing interrupts a call that is
 * already running, the owner checks before and after it.
 */
public final class Deadline {

  private final Clock clock;
  private final Duration budget;
  private final Instant expiresAt;

  private Deadline(Clock clock, Duration budget) {
    this.clock = clock;
    this.budget = budget;
    this.expiresAt = clock.instant().plus(budget);
  }

  public static Deadline after(Duration budget, Clock clock) {
    Objects.requireNonNull(budget, "budget");
    Objects.requireNonNull(clock, "clock");
    if (budget.isNegative() || budget.isZero()) {
      throw new IllegalArgumentException("budget must be positive");
    }
    return new Deadline(clock, budget);
  }

  public boolean isExpired() {
    return clock.instant().isAfter(expiresAt);
  }

  public Duration remaining() {
    Duration remaining = Duration.between(clock.instant(), expiresAt);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public Duration budget() {
    return budget;
  }

  public void check() {
    if (isExpired()) {
      throw new DeadlineExceededException(budget);
    }
  }
}
