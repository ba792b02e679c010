package com.aiadvent.ci.github;

import com.aiadvent.ci.config.GitHubBackendProperties;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.kohsuke.github.GHException;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs blocking GitHub API calls and converts every library failure into a {@link
 * GitHubClientException}. The client is created lazily, so commands that stop before touching
 * GitHub never need a token.
 */
@Component
class GitHubClientExecutor {

  private static final Logger log = LoggerFactory.getLogger(GitHubClientExecutor.class);

  private final GitHubClientFactory clientFactory;
  private final GitHubBackendProperties properties;
  private final AtomicReference<GitHub> client = new AtomicReference<>();

  GitHubClientExecutor(GitHubClientFactory clientFactory, GitHubBackendProperties properties) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  <T> T execute(String description, GitHubOperation<T> operation) {
    Objects.requireNonNull(operation, "operation");
    try {
      return operation.apply(client());
    } catch (IOException | GHException ex) {
      log.debug("GitHub call failed: {}", description, ex);
      throw new GitHubClientException("GitHub API call failed: " + description, ex);
    }
  }

  <T> T executeOnRepository(
      String repository, String description, RepositoryOperation<T> operation) {
    return execute(description, github -> operation.apply(github.getRepository(repository)));
  }

  private GitHub client() throws IOException {
    GitHub current = client.get();
    if (current != null) {
      return current;
    }
    if (!properties.hasToken()) {
      throw new GitHubClientException("GitHub token is not configured (github.backend.token)");
    }
    GitHub created = clientFactory.createTokenClient(properties.getToken());
    return client.compareAndSet(null, created) ? created : client.get();
  }

  @FunctionalInterface
  interface GitHubOperation<T> {
    T apply(GitHub github) throws IOException;
  }

  @FunctionalInterface
  interface RepositoryOperation<T> {
    T apply(GHRepository repository) throws IOException;
  }
}
