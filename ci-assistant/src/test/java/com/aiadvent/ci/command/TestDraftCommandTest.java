package com.aiadvent.ci.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.aiadvent.ci.annotation.AnnotationSync;
import com.aiadvent.ci.annotation.InMemoryCommentStore;
import com.aiadvent.ci.annotation.ManagedComment;
import com.aiadvent.ci.annotation.ResourceRef;
import com.aiadvent.ci.budget.ContentBudgeter;
import com.aiadvent.ci.budget.FileChange;
import com.aiadvent.ci.config.CiAssistantProperties;
import com.aiadvent.ci.github.GitHubPullRequestReader;
import com.aiadvent.ci.github.PullRequestSnapshot;
import com.aiadvent.ci.llm.ChatCompletionClient;
import com.aiadvent.ci.llm.ChatCompletionRequest;
import com.aiadvent.ci.llm.PromptTemplates;
import com.aiadvent.ci.redaction.PatternRedactor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;

@ExtendWith(MockitoExtension.class)
class TestDraftCommandTest {

  private static final ResourceRef PR = new ResourceRef("acme/demo", 4);

  @Mock private GitHubPullRequestReader pullRequestReader;
  @Mock private ChatCompletionClient completionClient;
  @TempDir Path artifactsDir;

  private final InMemoryCommentStore commentStore = new InMemoryCommentStore(100);
  private final CiAssistantProperties properties = new CiAssistantProperties();
  private CommandTestSupport support;

  @BeforeEach
  void setUp() {
    properties.setArtifactsDir(artifactsDir.toString());
    support =
        new CommandTestSupport().withCredentials().with("REPO", "acme/demo").with("PR_NUMBER", "4");
  }

  @Test
  void explainsSkipWhenNoPythonSourcesChanged() {
    when(pullRequestReader.read(PR))
        .thenReturn(
            new PullRequestSnapshot(
                "Docs only",
                "",
                List.of(
                    new FileChange("README.md", "modified", 3, 1, "+docs"),
                    new FileChange("tests/test_api.py", "modified", 3, 1, "+assert"))));

    int exitCode = command().run();

    assertThat(exitCode).isZero();
    verifyNoInteractions(completionClient);
    assertThat(commentStore.comments())
        .singleElement()
        .extracting(ManagedComment::body)
        .isEqualTo("<!-- ai-test-draft-bot -->\n\n" + DraftCommentRenderer.NO_SOURCES_BODY);
  }

  @Test
  void writesArtifactAndPostsShortComment() throws IOException {
    when(pullRequestReader.read(PR))
        .thenReturn(
            new PullRequestSnapshot(
                "Add pricing",
                "",
                List.of(
                    new FileChange("src/shop/pricing.py", "added", 5, 0, "+def price(x):\n+    return x"),
                    new FileChange("src/shop/test_pricing.py", "added", 5, 0, "+def test(): pass"))));
    when(completionClient.complete(any()))
        .thenReturn("Suggestions\n```python\ndef test_price_identity():\n    assert price(2) == 2\n```");

    int exitCode = command().run();

    assertThat(exitCode).isZero();
    ArgumentCaptor<ChatCompletionRequest> captor =
        ArgumentCaptor.forClass(ChatCompletionRequest.class);
    verify(completionClient).complete(captor.capture());
    assertThat(captor.getValue().userPrompt())
        .contains("- `src/shop/pricing.py`")
        .doesNotContain("test_pricing.py");
    assertThat(captor.getValue().maxTokens()).isEqualTo(3000);

    String artifact = Files.readString(artifactsDir.resolve("draft_tests.md"));
    assertThat(artifact).contains("## PR: Add pricing").contains("def test_price_identity()");
    assertThat(commentStore.comments())
        .singleElement()
        .extracting(ManagedComment::body)
        .asString()
        .startsWith("<!-- ai-test-draft-bot -->\n\n" + DraftCommentRenderer.HEADING)
        .contains("def test_price_identity()");
  }

  private TestDraftCommand command() {
    return new TestDraftCommand(
        support.workflowEnvironment(),
        support.annotations,
        pullRequestReader,
        new PatternRedactor(),
        new ContentBudgeter(),
        new PromptTemplates(new DefaultResourceLoader()),
        completionClient,
        new AnnotationSync(commentStore, null),
        new ArtifactWriter(properties),
        properties);
  }
}
