package com.aiadvent.ci.github;

import com.aiadvent.ci.config.GitHubBackendProperties;
import java.io.IOException;
import java.util.Objects;
import okhttp3.OkHttpClient;
import org.kohsuke.github.AbuseLimitHandler;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.RateLimitHandler;
import org.kohsuke.github.extras.okhttp3.OkHttpGitHubConnector;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class GitHubClientFactory {

  private final GitHubBackendProperties properties;

  GitHubClientFactory(GitHubBackendProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  GitHub createTokenClient(String token) throws IOException {
    if (!StringUtils.hasText(token)) {
      throw new IllegalArgumentException("token must not be blank");
    }
    return configure(newBuilder()).withOAuthToken(token.trim()).build();
  }

  private GitHubBuilder newBuilder() {
    return new GitHubBuilder();
  }

  private GitHubBuilder configure(GitHubBuilder builder) {
    // A CI job fails fast instead of sleeping until the rate-limit window resets.
    builder.withRateLimitHandler(RateLimitHandler.FAIL);
    builder.withAbuseLimitHandler(AbuseLimitHandler.FAIL);
    builder.withConnector(new OkHttpGitHubConnector(httpClient()));
    if (StringUtils.hasText(properties.getBaseUrl())) {
      builder.withEndpoint(properties.getBaseUrl().trim());
    }
    return builder;
  }

  private OkHttpClient httpClient() {
    return new OkHttpClient.Builder()
        .connectTimeout(properties.getConnectTimeout())
        .readTimeout(properties.getReadTimeout())
        .writeTimeout(properties.getReadTimeout())
        .build();
  }
}
