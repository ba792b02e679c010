package com.aiadvent.ci.github;

import com.aiadvent.ci.annotation.PageFetcher;
import com.aiadvent.ci.annotation.PagedSequence;
import com.aiadvent.ci.annotation.ResourceRef;
import com.aiadvent.ci.budget.FileChange;
import com.aiadvent.ci.config.GitHubBackendProperties;
import java.util.List;
import java.util.Objects;
import org.kohsuke.github.GHPullRequest;
import org.kohsuke.github.GHPullRequestFileDetail;
import org.kohsuke.github.PagedIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class GitHubPullRequestReader {

  private static final Logger log = LoggerFactory.getLogger(GitHubPullRequestReader.class);

  private final GitHubClientExecutor executor;
  private final GitHubBackendProperties properties;

  GitHubPullRequestReader(GitHubClientExecutor executor, GitHubBackendProperties properties) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public PullRequestSnapshot read(ResourceRef pullRequest) {
    Objects.requireNonNull(pullRequest, "pullRequest");
    GHPullRequest pr =
        executor.executeOnRepository(
            pullRequest.repository(),
            "read pull request " + pullRequest,
            repository -> repository.getPullRequest(pullRequest.number()));
    List<FileChange> files = listFiles(pr, pullRequest).items().toList();
    log.debug("Read {} changed files of {}", files.size(), pullRequest);
    return new PullRequestSnapshot(pr.getTitle(), pr.getBody(), files);
  }

  PagedSequence<FileChange> listFiles(GHPullRequest pr, ResourceRef pullRequest) {
    return PagedSequence.restartable(
        () -> openCursor(pr, pullRequest), properties.getMaxPages());
  }

  private PageFetcher<FileChange> openCursor(GHPullRequest pr, ResourceRef pullRequest) {
    PagedIterator<GHPullRequestFileDetail> cursor =
        executor.execute(
            "list files of " + pullRequest,
            github -> pr.listFiles().withPageSize(properties.getPageSize()).iterator());
    return pageNumber ->
        executor.execute(
            "list files of " + pullRequest + " (page " + pageNumber + ")",
            github ->
                cursor.hasNext()
                    ? cursor.nextPage().stream().map(this::toFileChange).toList()
                    : List.of());
  }

  private FileChange toFileChange(GHPullRequestFileDetail detail) {
    return new FileChange(
        detail.getFilename(),
        detail.getStatus(),
        detail.getAdditions(),
        detail.getDeletions(),
        detail.getPatch());
  }
}
