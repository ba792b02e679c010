package com.aiadvent.ci.command;

import com.aiadvent.ci.annotation.AnnotationMarker;
import com.aiadvent.ci.annotation.AnnotationSync;
import com.aiadvent.ci.annotation.ReconcileResult;
import com.aiadvent.ci.annotation.ResourceRef;
import com.aiadvent.ci.budget.BudgetedContent;
import com.aiadvent.ci.budget.ContentBudgeter;
import com.aiadvent.ci.budget.FileChange;
import com.aiadvent.ci.config.CiAssistantProperties;
import com.aiadvent.ci.github.GitHubPullRequestReader;
import com.aiadvent.ci.github.PullRequestSnapshot;
import com.aiadvent.ci.llm.ChatCompletionClient;
import com.aiadvent.ci.llm.ChatCompletionRequest;
import com.aiadvent.ci.llm.PromptTemplates;
import com.aiadvent.ci.redaction.PatternRedactor;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Summarises a pull request and keeps the summary in a single marked comment. */
@Component
public class PrSummaryCommand implements CiCommand {

  private final WorkflowEnvironment environment;
  private final WorkflowAnnotations annotations;
  private final GitHubPullRequestReader pullRequestReader;
  private final PatternRedactor redactor;
  private final ContentBudgeter budgeter;
  private final PromptTemplates promptTemplates;
  private final ChatCompletionClient completionClient;
  private final AnnotationSync annotationSync;
  private final CiAssistantProperties.Summary settings;

  public PrSummaryCommand(
      WorkflowEnvironment environment,
      WorkflowAnnotations annotations,
      GitHubPullRequestReader pullRequestReader,
      PatternRedactor redactor,
      ContentBudgeter budgeter,
      PromptTemplates promptTemplates,
      ChatCompletionClient completionClient,
      AnnotationSync annotationSync,
      CiAssistantProperties properties) {
    this.environment = environment;
    this.annotations = annotations;
    this.pullRequestReader = pullRequestReader;
    this.redactor = redactor;
    this.budgeter = budgeter;
    this.promptTemplates = promptTemplates;
    this.completionClient = completionClient;
    this.annotationSync = annotationSync;
    this.settings = properties.getSummary();
  }

  @Override
  public String name() {
    return "pr-summary";
  }

  @Override
  public int run() {
    if (!environment.hasLlmCredential()) {
      annotations.notice("OPENAI_API_KEY not configured. Skipping AI processing.");
      return 0;
    }
    environment.requireGitHubToken();
    ResourceRef pullRequest = environment.pullRequest();
    AnnotationMarker marker = AnnotationMarker.of(settings.getMarker());
    annotations.print("Generating AI summary for PR #%d in %s"
        .formatted(pullRequest.number(), pullRequest.repository()));

    PullRequestSnapshot snapshot = pullRequestReader.read(pullRequest);
    annotations.print("Fetched PR: %s (%d files)".formatted(snapshot.title(), snapshot.fileCount()));

    BudgetedContent diff =
        budgeter.renderWithinLimit(redactPatches(snapshot.files()), settings.limits());
    if (diff.truncated()) {
      annotations.notice("Diff was truncated due to size");
    }
    String body = redactor.redact(snapshot.body());
    String prompt =
        promptTemplates.render(
            settings.getPromptTemplate(),
            Map.of(
                "title", redactor.redact(snapshot.title()),
                "body", StringUtils.hasText(body) ? body : "(No description provided)",
                "file_count", snapshot.fileCount(),
                "diff_content", diff.content()));

    annotations.print("Calling OpenAI API...");
    String summary =
        completionClient.complete(
            new ChatCompletionRequest(
                settings.getSystemPrompt(), prompt, settings.getMaxTokens(), settings.getTemperature()));

    ReconcileResult result = annotationSync.reconcile(pullRequest, marker, summary);
    annotations.print(
        (result.created() ? "Created new PR comment " : "Updated existing comment ")
            + result.comment().id());
    return 0;
  }

  private List<FileChange> redactPatches(List<FileChange> files) {
    return files.stream()
        .map(file -> file.hasPatch() ? file.withPatch(redactor.redact(file.patch())) : file)
        .toList();
  }
}
