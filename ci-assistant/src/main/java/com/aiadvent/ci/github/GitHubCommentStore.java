package com.aiadvent.ci.github;

import com.aiadvent.ci.annotation.CommentStore;
import com.aiadvent.ci.annotation.ManagedComment;
import com.aiadvent.ci.annotation.PageFetcher;
import com.aiadvent.ci.annotation.PagedSequence;
import com.aiadvent.ci.annotation.ResourceRef;
import com.aiadvent.ci.config.GitHubBackendProperties;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.kohsuke.github.GHIssue;
import org.kohsuke.github.GHIssueComment;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.PagedIterator;
import org.springframework.stereotype.Component;

/**
 * Issue-comment thread of a pull request. Pull requests share the issue comment API, which is
 * where conversation comments (as opposed to review comments on diff lines) live.
 */
@Component
public class GitHubCommentStore implements CommentStore {

  private final GitHubClientExecutor executor;
  private final GitHubBackendProperties properties;
  private final Map<Long, GHIssueComment> seenComments = new ConcurrentHashMap<>();

  GitHubCommentStore(GitHubClientExecutor executor, GitHubBackendProperties properties) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Override
  public PagedSequence<ManagedComment> listComments(ResourceRef resource) {
    Objects.requireNonNull(resource, "resource");
    return PagedSequence.restartable(() -> openCursor(resource), properties.getMaxPages());
  }

  @Override
  public ManagedComment createComment(ResourceRef resource, String body) {
    Objects.requireNonNull(resource, "resource");
    GHIssueComment created =
        executor.executeOnRepository(
            resource.repository(),
            "create comment on " + resource,
            repository -> issue(repository, resource).comment(body));
    seenComments.put(created.getId(), created);
    return new ManagedComment(created.getId(), body);
  }

  @Override
  public ManagedComment updateComment(ResourceRef resource, long commentId, String body) {
    Objects.requireNonNull(resource, "resource");
    return executor.executeOnRepository(
        resource.repository(),
        "update comment " + commentId + " on " + resource,
        repository -> {
          GHIssueComment comment = seenComments.get(commentId);
          if (comment == null) {
            comment = lookup(issue(repository, resource), commentId);
          }
          comment.update(body);
          return new ManagedComment(commentId, body);
        });
  }

  private PageFetcher<ManagedComment> openCursor(ResourceRef resource) {
    PagedIterator<GHIssueComment> cursor =
        executor.executeOnRepository(
            resource.repository(),
            "list comments of " + resource,
            repository ->
                issue(repository, resource)
                    .listComments()
                    .withPageSize(properties.getPageSize())
                    .iterator());
    return pageNumber ->
        executor.execute(
            "list comments of " + resource + " (page " + pageNumber + ")",
            github -> cursor.hasNext() ? remember(cursor.nextPage()) : List.of());
  }

  private List<ManagedComment> remember(List<GHIssueComment> page) {
    page.forEach(comment -> seenComments.put(comment.getId(), comment));
    return page.stream()
        .map(comment -> new ManagedComment(comment.getId(), comment.getBody()))
        .toList();
  }

  private GHIssueComment lookup(GHIssue issue, long commentId) throws IOException {
    for (GHIssueComment comment : issue.listComments().withPageSize(properties.getPageSize())) {
      if (comment.getId() == commentId) {
        seenComments.put(commentId, comment);
        return comment;
      }
    }
    throw new GitHubClientException(
        "Comment %d not found on issue #%d".formatted(commentId, issue.getNumber()));
  }

  private GHIssue issue(GHRepository repository, ResourceRef resource) throws IOException {
    return repository.getIssue(resource.number());
  }
}
