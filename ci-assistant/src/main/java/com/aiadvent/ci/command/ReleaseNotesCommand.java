package com.aiadvent.ci.command;

import com.aiadvent.ci.config.CiAssistantProperties;
import com.aiadvent.ci.github.GitHubReleaseService;
import com.aiadvent.ci.github.ReleaseCommits;
import com.aiadvent.ci.llm.ChatCompletionClient;
import com.aiadvent.ci.llm.ChatCompletionRequest;
import com.aiadvent.ci.llm.PromptTemplates;
import com.aiadvent.ci.redaction.PatternRedactor;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Drafts release notes for a tag and stores them on a draft GitHub release. */
@Component
public class ReleaseNotesCommand implements CiCommand {

  private final WorkflowEnvironment environment;
  private final WorkflowAnnotations annotations;
  private final GitHubReleaseService releaseService;
  private final PatternRedactor redactor;
  private final PromptTemplates promptTemplates;
  private final ChatCompletionClient completionClient;
  private final ArtifactWriter artifactWriter;
  private final CiAssistantProperties.ReleaseNotes settings;

  public ReleaseNotesCommand(
      WorkflowEnvironment environment,
      WorkflowAnnotations annotations,
      GitHubReleaseService releaseService,
      PatternRedactor redactor,
      PromptTemplates promptTemplates,
      ChatCompletionClient completionClient,
      ArtifactWriter artifactWriter,
      CiAssistantProperties properties) {
    this.environment = environment;
    this.annotations = annotations;
    this.releaseService = releaseService;
    this.redactor = redactor;
    this.promptTemplates = promptTemplates;
    this.completionClient = completionClient;
    this.artifactWriter = artifactWriter;
    this.settings = properties.getReleaseNotes();
  }

  @Override
  public String name() {
    return "release-notes";
  }

  @Override
  public int run() {
    if (!environment.hasLlmCredential()) {
      annotations.notice("OPENAI_API_KEY not configured. Skipping AI processing.");
      return 0;
    }
    environment.requireGitHubToken();
    String repository = environment.repository();
    String tag = environment.tag();
    annotations.print("Generating release notes for %s in %s".formatted(tag, repository));

    Optional<String> previousTag = releaseService.findPreviousTag(repository, tag);
    boolean firstRelease = previousTag.isEmpty();
    annotations.print(
        firstRelease
            ? "No previous tag found - this is the first release"
            : "Previous tag: " + previousTag.get());

    ReleaseCommits commits =
        releaseService.collectCommits(repository, previousTag, tag, settings.getMaxCommits());
    annotations.print(
        "Found %d commits (processing %d)"
            .formatted(commits.totalCount(), commits.commits().size()));

    if (commits.isEmpty()) {
      annotations.warning("No commits found between tags");
      publish(repository, tag, "## " + tag + "\n\nNo changes detected.");
      return 0;
    }
    if (commits.omitted() > 0) {
      annotations.notice(commits.omitted() + " commits omitted due to size limits");
    }

    String changes = redactor.redact(releaseService.describeChanges(repository, commits.commits()));
    String prompt =
        promptTemplates.render(
            settings.getPromptTemplate(),
            Map.of(
                "tag", tag,
                "changes", changes,
                "first_release_note", releaseNote(firstRelease, commits.omitted())));

    annotations.print("Calling OpenAI API...");
    String notes =
        completionClient.complete(
            new ChatCompletionRequest(
                settings.getSystemPrompt(), prompt, settings.getMaxTokens(), settings.getTemperature()));
    publish(repository, tag, notes);
    annotations.print("Done!");
    return 0;
  }

  private void publish(String repository, String tag, String body) {
    releaseService.publishDraft(repository, tag, body);
    artifactWriter.write(settings.getArtifactName(), body);
  }

  static String releaseNote(boolean firstRelease, int omitted) {
    if (firstRelease) {
      return "**Note:** This is the first release. Include all listed changes in the notes.";
    }
    if (omitted > 0) {
      return "**Note:** " + omitted + " additional commits were omitted due to size limits.";
    }
    return "";
  }
}
