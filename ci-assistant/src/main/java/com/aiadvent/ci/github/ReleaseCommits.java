package com.aiadvent.ci.github;

import java.util.List;

/**
 * Commits selected for a release.
 *
 * @param commits at most the configured number of commits, oldest first as GitHub returns them
 * @param totalCount number of commits in the range before capping
 */
public record ReleaseCommits(List<CommitInfo> commits, int totalCount) {

  public ReleaseCommits {
    commits = List.copyOf(commits);
  }

  public int omitted() {
    return Math.max(0, totalCount - commits.size());
  }

  public boolean isEmpty() {
    return commits.isEmpty();
  }

  public record CommitInfo(String sha, String subject) {}
}
