package com.aiadvent.ci.eval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DeadlineTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));

  @Test
  void expiresOnlyAfterBudgetElapsed() {
    Deadline deadline = Deadline.after(Duration.ofSeconds(30), clock);

    clock.advance(Duration.ofSeconds(30));
    assertThat(deadline.isExpired()).isFalse();
    assertThatCode(deadline::check).doesNotThrowAnyException();

    clock.advance(Duration.ofMillis(1));
    assertThat(deadline.isExpired()).isTrue();
    assertThat(deadline.remaining()).isZero();
    assertThatThrownBy(deadline::check)
        .isInstanceOf(DeadlineExceededException.class)
        .hasMessage("Deadline of 30s exceeded");
  }

  @Test
  void reportsRemainingTime() {
    Deadline deadline = Deadline.after(Duration.ofSeconds(10), clock);

    clock.advance(Duration.ofSeconds(4));

    assertThat(deadline.remaining()).isEqualTo(Duration.ofSeconds(6));
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThatThrownBy(() -> Deadline.after(Duration.ZERO, clock))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
