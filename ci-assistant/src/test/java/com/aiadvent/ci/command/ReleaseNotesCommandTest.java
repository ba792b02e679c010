package com.aiadvent.ci.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.aiadvent.ci.config.CiAssistantProperties;
import com.aiadvent.ci.github.GitHubReleaseService;
import com.aiadvent.ci.github.ReleaseCommits;
import com.aiadvent.ci.github.ReleaseCommits.CommitInfo;
import com.aiadvent.ci.llm.ChatCompletionClient;
import com.aiadvent.ci.llm.ChatCompletionRequest;
import com.aiadvent.ci.llm.PromptTemplates;
import com.aiadvent.ci.redaction.PatternRedactor;
import com.aiadvent.ci.shared.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;

@ExtendWith(MockitoExtension.class)
class ReleaseNotesCommandTest {

  @Mock private GitHubReleaseService releaseService;
  @Mock private ChatCompletionClient completionClient;
  @TempDir Path artifactsDir;

  private final CiAssistantProperties properties = new CiAssistantProperties();

  @BeforeEach
  void setUp() {
    properties.setArtifactsDir(artifactsDir.toString());
  }

  @Test
  void requiresTag() {
    CommandTestSupport support = new CommandTestSupport().withCredentials().with("REPO", "acme/demo");

    assertThatThrownBy(() -> command(support).run())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("TAG");
    verifyNoInteractions(releaseService);
  }

  @Test
  void publishesPlaceholderWithoutCallingModelWhenNoCommits() throws IOException {
    CommandTestSupport support = releaseSupport();
    when(releaseService.findPreviousTag("acme/demo", "v1.1.0")).thenReturn(Optional.of("v1.0.0"));
    when(releaseService.collectCommits("acme/demo", Optional.of("v1.0.0"), "v1.1.0", 50))
        .thenReturn(new ReleaseCommits(List.of(), 0));

    assertThat(command(support).run()).isZero();

    verify(releaseService).publishDraft("acme/demo", "v1.1.0", "## v1.1.0\n\nNo changes detected.");
    verifyNoInteractions(completionClient);
    assertThat(Files.readString(artifactsDir.resolve("release_notes.md")))
        .isEqualTo("## v1.1.0\n\nNo changes detected.");
    assertThat(support.output()).contains("::warning::No commits found between tags");
  }

  @Test
  void draftsNotesFromRedactedChangeList() throws IOException {
    CommandTestSupport support = releaseSupport();
    List<CommitInfo> commits = List.of(new CommitInfo("abc123", "Add uploads"));
    when(releaseService.findPreviousTag("acme/demo", "v1.1.0")).thenReturn(Optional.of("v1.0.0"));
    when(releaseService.collectCommits("acme/demo", Optional.of("v1.0.0"), "v1.1.0", 50))
        .thenReturn(new ReleaseCommits(commits, 60));
    when(releaseService.describeChanges(eq("acme/demo"), anyList()))
        .thenReturn("- Add uploads (#12)\n- Use token=abcdefghijklmnopqrstuvwxyz1234");
    when(completionClient.complete(any())).thenReturn("## v1.1.0\n\n### Features\n- Uploads");

    assertThat(command(support).run()).isZero();

    ArgumentCaptor<ChatCompletionRequest> captor =
        ArgumentCaptor.forClass(ChatCompletionRequest.class);
    verify(completionClient).complete(captor.capture());
    assertThat(captor.getValue().userPrompt())
        .contains("Generate release notes for version v1.1.0.")
        .contains("- Add uploads (#12)")
        .contains("token=[REDACTED]")
        .contains("59 additional commits were omitted");
    verify(releaseService).publishDraft("acme/demo", "v1.1.0", "## v1.1.0\n\n### Features\n- Uploads");
    assertThat(Files.readString(artifactsDir.resolve("release_notes.md")))
        .isEqualTo("## v1.1.0\n\n### Features\n- Uploads");
    assertThat(support.output()).contains("::notice::59 commits omitted due to size limits");
  }

  @Test
  void firstReleaseNoteTakesPrecedence() {
    assertThat(ReleaseNotesCommand.releaseNote(true, 5)).contains("first release");
    assertThat(ReleaseNotesCommand.releaseNote(false, 0)).isEmpty();
  }

  private CommandTestSupport releaseSupport() {
    return new CommandTestSupport().withCredentials().with("REPO", "acme/demo").with("TAG", "v1.1.0");
  }

  private ReleaseNotesCommand command(CommandTestSupport support) {
    return new ReleaseNotesCommand(
        support.workflowEnvironment(),
        support.annotations,
        releaseService,
        new PatternRedactor(),
        new PromptTemplates(new DefaultResourceLoader()),
        completionClient,
        new ArtifactWriter(properties),
        properties);
  }
}
