package com.aiadvent.ci.github;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.aiadvent.ci.github.ReleaseCommits.CommitInfo;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.kohsuke.github.GHPullRequest;

class GitHubReleaseServiceTest {

  private final GitHubClientExecutor executor = mock(GitHubClientExecutor.class);
  private final GitHubReleaseService service = new GitHubReleaseService(executor);

  @Test
  void prefersPullRequestTitleOverCommitSubject() {
    GHPullRequest pr = mock(GHPullRequest.class);
    when(pr.getTitle()).thenReturn("Add uploads");
    when(pr.getNumber()).thenReturn(12);
    when(executor.executeOnRepository(eq("acme/demo"), anyString(), any()))
        .thenReturn(Optional.of(pr));

    String changes =
        service.describeChanges("acme/demo", List.of(new CommitInfo("abc", "wip uploads")));

    assertThat(changes).isEqualTo("- Add uploads (#12)");
  }

  @Test
  void fallsBackToSubjectWhenLookupFailsOrFindsNothing() {
    when(executor.executeOnRepository(eq("acme/demo"), anyString(), any()))
        .thenThrow(new GitHubClientException("GitHub API call failed: list pull requests"))
        .thenReturn(Optional.empty());

    String changes =
        service.describeChanges(
            "acme/demo",
            List.of(
                new CommitInfo("a1", "Fix crash on start"),
                new CommitInfo("b2", "Bump version"),
                new CommitInfo("c3", "")));

    assertThat(changes).isEqualTo("- Fix crash on start\n- Bump version");
  }

  @Test
  void omittedCountNeverNegative() {
    ReleaseCommits commits = new ReleaseCommits(List.of(new CommitInfo("a", "x")), 0);

    assertThat(commits.omitted()).isZero();
    assertThat(new ReleaseCommits(List.of(), 0).isEmpty()).isTrue();
  }
}
