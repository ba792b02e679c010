package com.aiadvent.ci.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class CiAssistantPropertiesTest {

  @Test
  void defaultsMatchWorkflowConventions() {
    CiAssistantProperties properties = bind(Map.of());
    properties.afterPropertiesSet();

    assertThat(properties.getSummary().getMarker()).isEqualTo("<!-- ai-pr-summary-bot -->");
    assertThat(properties.getSummary().limits().maxTotalChars()).isEqualTo(50_000);
    assertThat(properties.getSummary().getMaxTokens()).isEqualTo(1500);
    assertThat(properties.getTestDraft().getMarker()).isEqualTo("<!-- ai-test-draft-bot -->");
    assertThat(properties.getTestDraft().limits().maxPatchChars()).isEqualTo(2_000);
    assertThat(properties.getReleaseNotes().getMaxCommits()).isEqualTo(50);
    assertThat(properties.getEvals().getTotalTimeout()).isEqualTo(Duration.ofMinutes(5));
  }

  @Test
  void bindsOverrides() {
    Map<String, String> props = new HashMap<>();
    props.put("ci.assistant.artifacts-dir", "out");
    props.put("ci.assistant.summary.max-diff-chars", "1000");
    props.put("ci.assistant.summary.temperature", "0.1");
    props.put("ci.assistant.test-draft.include-patterns[0]", "lib/**/*.py");
    props.put("ci.assistant.evals.per-test-timeout", "5s");

    CiAssistantProperties properties = bind(props);
    properties.afterPropertiesSet();

    assertThat(properties.getArtifactsDir()).isEqualTo("out");
    assertThat(properties.getSummary().getMaxDiffChars()).isEqualTo(1000);
    assertThat(properties.getSummary().getTemperature()).isEqualTo(0.1d);
    assertThat(properties.getTestDraft().getIncludePatterns()).containsExactly("lib/**/*.py");
    assertThat(properties.getEvals().getPerTestTimeout()).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void rejectsNonPositiveBudgets() {
    CiAssistantProperties properties =
        bind(Map.of("ci.assistant.test-draft.max-total-chars", "0"));

    assertThatThrownBy(properties::afterPropertiesSet).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void bindsLlmAndGitHubSettings() {
    Map<String, String> props = new HashMap<>();
    props.put("ci.llm.api-key", "sk-test");
    props.put("ci.llm.read-timeout", "90s");
    props.put("github.backend.token", "ghp_test");
    props.put("github.backend.page-size", "50");

    Binder binder = new Binder(new MapConfigurationPropertySource(props));
    LlmProperties llm = binder.bind("ci.llm", Bindable.of(LlmProperties.class)).get();
    GitHubBackendProperties gitHub =
        binder.bind("github.backend", Bindable.of(GitHubBackendProperties.class)).get();

    assertThat(llm.hasApiKey()).isTrue();
    assertThat(llm.getReadTimeout()).isEqualTo(Duration.ofSeconds(90));
    assertThat(llm.getModel()).isEqualTo("gpt-4o-mini");
    assertThat(gitHub.hasToken()).isTrue();
    assertThat(gitHub.getPageSize()).isEqualTo(50);
    assertThat(gitHub.getMaxPages()).isEqualTo(100);
  }

  private CiAssistantProperties bind(Map<String, String> props) {
    Binder binder = new Binder(new MapConfigurationPropertySource(props));
    return binder
        .bind("ci.assistant", Bindable.of(CiAssistantProperties.class))
        .orElseGet(CiAssistantProperties::new);
  }
}
