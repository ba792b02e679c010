package com.aiadvent.ci.eval;

import com.aiadvent.ci.llm.Intent;
import com.aiadvent.ci.llm.IntentClassifier;
import com.aiadvent.ci.shared.CiAssistantException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs golden cases through the {@link IntentClassifier}. Each case gets its own {@link Deadline};
 * the loop stops starting new cases once the cumulative budget has elapsed.
 */
public class EvalRunner {

  private static final Logger log = LoggerFactory.getLogger(EvalRunner.class);

  private final IntentClassifier classifier;
  private final Clock clock;
  private final Duration perCaseTimeout;
  private final Duration totalTimeout;

  public EvalRunner(
      IntentClassifier classifier, Clock clock, Duration perCaseTimeout, Duration totalTimeout) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.perCaseTimeout = Objects.requireNonNull(perCaseTimeout, "perCaseTimeout");
    this.totalTimeout = Objects.requireNonNull(totalTimeout, "totalTimeout");
  }

  public EvalReport run(List<GoldenCase> cases, Consumer<EvalCaseResult> listener) {
    Instant start = clock.instant();
    Deadline total = Deadline.after(totalTimeout, clock);
    List<EvalCaseResult> results = new ArrayList<>();
    boolean aborted = false;
    for (GoldenCase goldenCase : cases) {
      if (total.isExpired()) {
        log.warn("Total eval budget of {}s exceeded after {} cases", totalTimeout.toSeconds(),
            results.size());
        aborted = true;
        break;
      }
      EvalCaseResult result = runCase(goldenCase);
      results.add(result);
      listener.accept(result);
    }
    return new EvalReport(results, aborted, Duration.between(start, clock.instant()));
  }

  EvalCaseResult runCase(GoldenCase goldenCase) {
    Instant started = clock.instant();
    Deadline deadline = Deadline.after(perCaseTimeout, clock);
    String actual;
    boolean passed;
    try {
      deadline.check();
      Intent intent = classifier.classify(goldenCase.inputText());
      deadline.check();
      actual = intent.name();
      passed = intent == goldenCase.expectedIntent();
    } catch (DeadlineExceededException ex) {
      actual = "TIMEOUT (>" + perCaseTimeout.toSeconds() + "s)";
      passed = false;
    } catch (CiAssistantException | IllegalArgumentException ex) {
      log.debug("Eval case {} failed", goldenCase.id(), ex);
      actual = "ERROR: " + ex.getMessage();
      passed = false;
    }
    return new EvalCaseResult(
        goldenCase.id(),
        goldenCase.expectedIntent(),
        actual,
        passed,
        Duration.between(started, clock.instant()));
  }
}
