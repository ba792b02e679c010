package com.aiadvent.ci.command;

import com.aiadvent.ci.annotation.ResourceRef;
import com.aiadvent.ci.config.GitHubBackendProperties;
import com.aiadvent.ci.config.LlmProperties;
import com.aiadvent.ci.shared.ConfigurationException;
import java.util.Objects;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Identifiers and credentials a workflow step receives through its environment. */
@Component
public class WorkflowEnvironment {

  static final String REPO = "REPO";
  static final String PR_NUMBER = "PR_NUMBER";
  static final String TAG = "TAG";

  private final Environment environment;
  private final GitHubBackendProperties gitHubProperties;
  private final LlmProperties llmProperties;

  WorkflowEnvironment(
      Environment environment,
      GitHubBackendProperties gitHubProperties,
      LlmProperties llmProperties) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.gitHubProperties = Objects.requireNonNull(gitHubProperties, "gitHubProperties");
    this.llmProperties = Objects.requireNonNull(llmProperties, "llmProperties");
  }

  public boolean hasLlmCredential() {
    return llmProperties.hasApiKey();
  }

  public void requireGitHubToken() {
    if (!gitHubProperties.hasToken()) {
      throw missing("GITHUB_TOKEN");
    }
  }

  public String repository() {
    return require(REPO);
  }

  public String tag() {
    return require(TAG);
  }

  public ResourceRef pullRequest() {
    String number = require(PR_NUMBER);
    String repository = require(REPO);
    int parsed;
    try {
      parsed = Integer.parseInt(number.strip());
    } catch (NumberFormatException ex) {
      throw new ConfigurationException("PR_NUMBER is not a number: " + number, ex);
    }
    try {
      return new ResourceRef(repository, parsed);
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(ex.getMessage(), ex);
    }
  }

  private String require(String name) {
    String value = environment.getProperty(name);
    if (!StringUtils.hasText(value)) {
      throw missing(name);
    }
    return value.strip();
  }

  private static ConfigurationException missing(String name) {
    return new ConfigurationException("Missing required environment variable: " + name);
  }
}
