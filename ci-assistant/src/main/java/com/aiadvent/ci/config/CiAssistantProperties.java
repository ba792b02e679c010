package com.aiadvent.ci.config;

import com.aiadvent.ci.budget.BudgetLimits;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "ci.assistant")
public class CiAssistantProperties implements InitializingBean {

  private String artifactsDir = "artifacts";
  private final Summary summary = new Summary();
  private final TestDraft testDraft = new TestDraft();
  private final ReleaseNotes releaseNotes = new ReleaseNotes();
  private final Evals evals = new Evals();

  public String getArtifactsDir() {
    return artifactsDir;
  }

  public void setArtifactsDir(String artifactsDir) {
    this.artifactsDir = artifactsDir;
  }

  public Summary getSummary() {
    return summary;
  }

  public TestDraft getTestDraft() {
    return testDraft;
  }

  public ReleaseNotes getReleaseNotes() {
    return releaseNotes;
  }

  public Evals getEvals() {
    return evals;
  }

  @Override
  public void afterPropertiesSet() {
    if (!StringUtils.hasText(artifactsDir)) {
      throw new IllegalStateException("ci.assistant.artifacts-dir must not be blank");
    }
    summary.limits();
    testDraft.limits();
    if (releaseNotes.getMaxCommits() <= 0) {
      throw new IllegalStateException("ci.assistant.release-notes.max-commits must be positive");
    }
    if (isNotPositive(evals.getPerTestTimeout()) || isNotPositive(evals.getTotalTimeout())) {
      throw new IllegalStateException("ci.assistant.evals timeouts must be positive");
    }
  }

  private static boolean isNotPositive(Duration duration) {
    return duration == null || duration.isZero() || duration.isNegative();
  }

  /** Shared generation settings of a command that sends a prompt to the model. */
  public abstract static class Generation {

    private String promptTemplate;
    private String systemPrompt;
    private int maxTokens;
    private double temperature = 0.3d;

    protected Generation(String promptTemplate, String systemPrompt, int maxTokens) {
      this.promptTemplate = promptTemplate;
      this.systemPrompt = systemPrompt;
      this.maxTokens = maxTokens;
    }

    public String getPromptTemplate() {
      return promptTemplate;
    }

    public void setPromptTemplate(String promptTemplate) {
      this.promptTemplate = promptTemplate;
    }

    public String getSystemPrompt() {
      return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
      this.systemPrompt = systemPrompt;
    }

    public int getMaxTokens() {
      return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
      this.maxTokens = maxTokens;
    }

    public double getTemperature() {
      return temperature;
    }

    public void setTemperature(double temperature) {
      this.temperature = temperature;
    }
  }

  public static class Summary extends Generation {

    private String marker = "<!-- ai-pr-summary-bot -->";
    private int maxDiffChars = 50_000;
    private int maxPatchChars = 500;

    public Summary() {
      super(
          "classpath:prompts/pr_summary.md",
          "You are a helpful code review assistant. Provide concise, actionable PR summaries.",
          1500);
    }

    public String getMarker() {
      return marker;
    }

    public void setMarker(String marker) {
      this.marker = marker;
    }

    public int getMaxDiffChars() {
      return maxDiffChars;
    }

    public void setMaxDiffChars(int maxDiffChars) {
      this.maxDiffChars = maxDiffChars;
    }

    public int getMaxPatchChars() {
      return maxPatchChars;
    }

    public void setMaxPatchChars(int maxPatchChars) {
      this.maxPatchChars = maxPatchChars;
    }

    public BudgetLimits limits() {
      return new BudgetLimits(maxDiffChars, maxPatchChars);
    }
  }

  public static class TestDraft extends Generation {

    private String marker = "<!-- ai-test-draft-bot -->";
    private int maxTotalChars = 30_000;
    private int maxPatchChars = 2_000;
    private List<String> includePatterns = new ArrayList<>(List.of("src/**/*.py"));
    private List<String> excludePatterns =
        new ArrayList<>(
            List.of(
                "**/venv/**",
                "**/.venv/**",
                "**/*.lock",
                "**/*.md",
                "**/test_*.py",
                "**/tests/**",
                "**/__pycache__/**",
                "**/conftest.py"));
    private String requiredExtension = ".py";
    private String artifactName = "draft_tests.md";
    private int commentFileLimit = 10;
    private int commentCodeBlocks = 2;

    public TestDraft() {
      super(
          "classpath:prompts/test_generation.md",
          "You are an expert Python testing assistant. Generate high-quality, practical pytest "
              + "test suggestions. Focus on testing behavior, edge cases, and error handling. "
              + "Use clear test names following test_<function>_<scenario> convention.",
          3000);
    }

    public String getMarker() {
      return marker;
    }

    public void setMarker(String marker) {
      this.marker = marker;
    }

    public int getMaxTotalChars() {
      return maxTotalChars;
    }

    public void setMaxTotalChars(int maxTotalChars) {
      this.maxTotalChars = maxTotalChars;
    }

    public int getMaxPatchChars() {
      return maxPatchChars;
    }

    public void setMaxPatchChars(int maxPatchChars) {
      this.maxPatchChars = maxPatchChars;
    }

    public List<String> getIncludePatterns() {
      return includePatterns;
    }

    public void setIncludePatterns(List<String> includePatterns) {
      this.includePatterns = includePatterns;
    }

    public List<String> getExcludePatterns() {
      return excludePatterns;
    }

    public void setExcludePatterns(List<String> excludePatterns) {
      this.excludePatterns = excludePatterns;
    }

    public String getRequiredExtension() {
      return requiredExtension;
    }

    public void setRequiredExtension(String requiredExtension) {
      this.requiredExtension = requiredExtension;
    }

    public String getArtifactName() {
      return artifactName;
    }

    public void setArtifactName(String artifactName) {
      this.artifactName = artifactName;
    }

    public int getCommentFileLimit() {
      return commentFileLimit;
    }

    public void setCommentFileLimit(int commentFileLimit) {
      this.commentFileLimit = commentFileLimit;
    }

    public int getCommentCodeBlocks() {
      return commentCodeBlocks;
    }

    public void setCommentCodeBlocks(int commentCodeBlocks) {
      this.commentCodeBlocks = commentCodeBlocks;
    }

    public BudgetLimits limits() {
      return new BudgetLimits(maxTotalChars, maxPatchChars);
    }
  }

  public static class ReleaseNotes extends Generation {

    private int maxCommits = 50;
    private String artifactName = "release_notes.md";

    public ReleaseNotes() {
      super(
          "classpath:prompts/release_notes.md",
          "You are a release notes writer. Generate concise, user-facing release notes.",
          2000);
    }

    public int getMaxCommits() {
      return maxCommits;
    }

    public void setMaxCommits(int maxCommits) {
      this.maxCommits = maxCommits;
    }

    public String getArtifactName() {
      return artifactName;
    }

    public void setArtifactName(String artifactName) {
      this.artifactName = artifactName;
    }
  }

  public static class Evals {

    private String goldenFile = "evals/golden_intent.json";
    private Duration perTestTimeout = Duration.ofSeconds(30);
    private Duration totalTimeout = Duration.ofMinutes(5);

    public String getGoldenFile() {
      return goldenFile;
    }

    public void setGoldenFile(String goldenFile) {
      this.goldenFile = goldenFile;
    }

    public Duration getPerTestTimeout() {
      return perTestTimeout;
    }

    public void setPerTestTimeout(Duration perTestTimeout) {
      this.perTestTimeout = perTestTimeout;
    }

    public Duration getTotalTimeout() {
      return totalTimeout;
    }

    public void setTotalTimeout(Duration totalTimeout) {
      this.totalTimeout = totalTimeout;
    }
  }
}
