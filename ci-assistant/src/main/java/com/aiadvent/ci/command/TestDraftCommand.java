package com.aiadvent.ci.command;

import com.aiadvent.ci.annotation.AnnotationMarker;
import com.aiadvent.ci.annotation.AnnotationSync;
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

/**
 * Drafts pytest suggestions for the Python sources a pull request touches. The full answer goes to
 * an artifact, a short excerpt to a marked comment.
 */
@Component
public class TestDraftCommand implements CiCommand {

  private final WorkflowEnvironment environment;
  private final WorkflowAnnotations annotations;
  private final GitHubPullRequestReader pullRequestReader;
  private final PatternRedactor redactor;
  private final ContentBudgeter budgeter;
  private final PromptTemplates promptTemplates;
  private final ChatCompletionClient completionClient;
  private final AnnotationSync annotationSync;
  private final ArtifactWriter artifactWriter;
  private final CiAssistantProperties.TestDraft settings;
  private final SourceFileFilter fileFilter;
  private final DraftCommentRenderer renderer;

  public TestDraftCommand(
      WorkflowEnvironment environment,
      WorkflowAnnotations annotations,
      GitHubPullRequestReader pullRequestReader,
      PatternRedactor redactor,
      ContentBudgeter budgeter,
      PromptTemplates promptTemplates,
      ChatCompletionClient completionClient,
      AnnotationSync annotationSync,
      ArtifactWriter artifactWriter,
      CiAssistantProperties properties) {
    this.environment = environment;
    this.annotations = annotations;
    this.pullRequestReader = pullRequestReader;
    this.redactor = redactor;
    this.budgeter = budgeter;
    this.promptTemplates = promptTemplates;
    this.completionClient = completionClient;
    this.annotationSync = annotationSync;
    this.artifactWriter = artifactWriter;
    this.settings = properties.getTestDraft();
    this.fileFilter =
        new SourceFileFilter(
            settings.getIncludePatterns(),
            settings.getExcludePatterns(),
            settings.getRequiredExtension());
    this.renderer =
        new DraftCommentRenderer(
            settings.getCommentFileLimit(),
            settings.getCommentCodeBlocks(),
            settings.getArtifactName());
  }

  @Override
  public String name() {
    return "test-draft";
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
    annotations.print("Generating draft tests for PR #%d in %s"
        .formatted(pullRequest.number(), pullRequest.repository()));

    PullRequestSnapshot snapshot = pullRequestReader.read(pullRequest);
    annotations.print("Fetched PR: %s (%d files)".formatted(snapshot.title(), snapshot.fileCount()));

    List<FileChange> relevant = fileFilter.filter(snapshot.files());
    annotations.print("Found %d relevant Python source files".formatted(relevant.size()));
    if (relevant.isEmpty()) {
      annotations.notice("No relevant Python source files found. Skipping test generation.");
      annotationSync.reconcile(pullRequest, marker, DraftCommentRenderer.NO_SOURCES_BODY);
      return 0;
    }

    List<FileChange> redacted =
        relevant.stream()
            .map(file -> file.hasPatch() ? file.withPatch(redactor.redact(file.patch())) : file)
            .toList();
    BudgetedContent context = budgeter.renderPerFile(redacted, settings.limits());
    List<String> files = context.includedFiles();
    String title = redactor.redact(snapshot.title());
    String prompt =
        promptTemplates.render(
            settings.getPromptTemplate(),
            Map.of(
                "pr_title", title,
                "file_count", files.size(),
                "file_list", String.join("\n", files.stream().map(f -> "- `" + f + "`").toList()),
                "file_details", context.content()));

    annotations.print("Calling OpenAI API...");
    String output =
        completionClient.complete(
            new ChatCompletionRequest(
                settings.getSystemPrompt(), prompt, settings.getMaxTokens(), settings.getTemperature()));

    artifactWriter.write(settings.getArtifactName(), renderer.artifact(title, files, output));
    annotationSync.reconcile(pullRequest, marker, renderer.comment(title, files, output));
    annotations.print("Done!");
    return 0;
  }
}
