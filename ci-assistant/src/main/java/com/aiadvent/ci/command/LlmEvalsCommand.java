package com.aiadvent.ci.command;

import com.aiadvent.ci.config.CiAssistantProperties;
import com.aiadvent.ci.eval.EvalCaseResult;
import com.aiadvent.ci.eval.EvalReport;
import com.aiadvent.ci.eval.EvalRunner;
import com.aiadvent.ci.eval.GoldenCase;
import com.aiadvent.ci.eval.GoldenSetLoader;
import com.aiadvent.ci.llm.IntentClassifier;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Runs the intent golden set against the live model and fails the job on any mismatch. */
@Component
public class LlmEvalsCommand implements CiCommand {

  private static final String RULE = "=".repeat(60);
  private static final String SEPARATOR = "-".repeat(60);

  private final WorkflowEnvironment environment;
  private final WorkflowAnnotations annotations;
  private final GoldenSetLoader goldenSetLoader;
  private final IntentClassifier classifier;
  private final Clock clock;
  private final CiAssistantProperties.Evals settings;

  public LlmEvalsCommand(
      WorkflowEnvironment environment,
      WorkflowAnnotations annotations,
      GoldenSetLoader goldenSetLoader,
      IntentClassifier classifier,
      Clock clock,
      CiAssistantProperties properties) {
    this.environment = environment;
    this.annotations = annotations;
    this.goldenSetLoader = goldenSetLoader;
    this.classifier = classifier;
    this.clock = clock;
    this.settings = properties.getEvals();
  }

  @Override
  public String name() {
    return "llm-evals";
  }

  @Override
  public int run() {
    if (!environment.hasLlmCredential()) {
      annotations.notice("OPENAI_API_KEY not configured. Skipping LLM evals.");
      annotations.print("To run LLM evals locally, set OPENAI_API_KEY environment variable.");
      return 0;
    }
    annotations.print(RULE);
    annotations.print("LLM Intent Classification Evals");
    annotations.print(RULE);

    List<GoldenCase> cases = goldenSetLoader.load(settings.getGoldenFile());
    annotations.print("Loaded %d test cases from %s".formatted(cases.size(), settings.getGoldenFile()));
    annotations.print("Per-test timeout: " + settings.getPerTestTimeout().toSeconds() + "s");
    annotations.print("Total timeout: " + settings.getTotalTimeout().toSeconds() + "s");
    annotations.print(SEPARATOR);

    EvalRunner runner =
        new EvalRunner(classifier, clock, settings.getPerTestTimeout(), settings.getTotalTimeout());
    EvalReport report = runner.run(cases, result -> annotations.print(result.describe()));
    if (report.aborted()) {
      annotations.error(
          "Total timeout exceeded (" + settings.getTotalTimeout().toSeconds() + "s)");
    }

    annotations.print(SEPARATOR);
    annotations.print("Results: %d/%d passed".formatted(report.passedCount(), report.results().size()));
    annotations.print(
        String.format(Locale.ROOT, "Time: %.2fs", report.elapsed().toMillis() / 1000.0d));

    if (report.failedCount() > 0) {
      annotations.print("Failed tests:");
      for (EvalCaseResult failure : report.failures()) {
        annotations.print(
            "  - %s: got %s, expected %s"
                .formatted(failure.id(), failure.actual(), failure.expected()));
      }
      annotations.error(report.failedCount() + " LLM eval(s) failed");
      return 1;
    }
    if (report.aborted()) {
      annotations.error("LLM evals aborted due to total timeout");
      return 1;
    }
    annotations.print("All LLM evals passed!");
    return 0;
  }
}
