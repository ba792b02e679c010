package com.aiadvent.ci.github;

import com.aiadvent.ci.github.ReleaseCommits.CommitInfo;
import com.aiadvent.ci.shared.UpstreamServiceException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.kohsuke.github.GHCommit;
import org.kohsuke.github.GHCompare;
import org.kohsuke.github.GHPullRequest;
import org.kohsuke.github.GHRelease;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GHTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Tag, commit and release operations used to draft release notes. */
@Component
public class GitHubReleaseService {

  private static final Logger log = LoggerFactory.getLogger(GitHubReleaseService.class);

  private final GitHubClientExecutor executor;

  GitHubReleaseService(GitHubClientExecutor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Tag listed right after {@code tag}. GitHub lists tags newest first, so this is the previous
   * release; empty when {@code tag} is the oldest tag or is not listed.
   */
  public Optional<String> findPreviousTag(String repository, String tag) {
    return executor.executeOnRepository(
        repository,
        "list tags of " + repository,
        repo -> {
          boolean foundCurrent = false;
          for (GHTag candidate : repo.listTags().withPageSize(100)) {
            if (foundCurrent) {
              return Optional.of(candidate.getName());
            }
            foundCurrent = tag.equals(candidate.getName());
          }
          return Optional.empty();
        });
  }

  /**
   * Commits in {@code base...head}, or the most recent commits reachable from {@code head} when
   * there is no base, capped at {@code maxCommits}.
   */
  public ReleaseCommits collectCommits(
      String repository, Optional<String> base, String head, int maxCommits) {
    return executor.executeOnRepository(
        repository,
        "collect commits up to " + head,
        repo -> {
          if (base.isPresent()) {
            GHCompare compare = repo.getCompare(base.get(), head);
            GHCompare.Commit[] commits = compare.getCommits();
            List<CommitInfo> infos = new ArrayList<>();
            for (GHCompare.Commit commit : commits) {
              if (infos.size() >= maxCommits) {
                break;
              }
              infos.add(toCommitInfo(commit));
            }
            int total = Math.max(compare.getTotalCommits(), commits.length);
            return new ReleaseCommits(infos, total);
          }
          List<CommitInfo> infos = new ArrayList<>();
          for (GHCommit commit : repo.queryCommits().from(head).pageSize(maxCommits).list()) {
            if (infos.size() >= maxCommits) {
              break;
            }
            infos.add(toCommitInfo(commit));
          }
          return new ReleaseCommits(infos, infos.size());
        });
  }

  /**
   * One Markdown bullet per commit: the associated pull request title and number when GitHub
   * knows one, the commit subject otherwise. Commits with neither are skipped.
   */
  public String describeChanges(String repository, List<CommitInfo> commits) {
    List<String> lines = new ArrayList<>();
    for (CommitInfo commit : commits) {
      Optional<GHPullRequest> pullRequest = findPullRequest(repository, commit.sha());
      if (pullRequest.isPresent() && StringUtils.hasText(pullRequest.get().getTitle())) {
        lines.add("- %s (#%d)".formatted(pullRequest.get().getTitle(), pullRequest.get().getNumber()));
        continue;
      }
      if (StringUtils.hasText(commit.subject())) {
        lines.add("- " + commit.subject());
      }
    }
    return String.join("\n", lines);
  }

  /**
   * Creates a draft release for {@code tag}, or rewrites the body of the release that already
   * exists for it. Drafts are only visible through the release listing, so the lookup scans it
   * instead of asking for the tag directly.
   */
  public ReleasePublication publishDraft(String repository, String tag, String body) {
    return executor.executeOnRepository(
        repository,
        "publish draft release " + tag,
        repo -> {
          Optional<GHRelease> existing = findRelease(repo, tag);
          if (existing.isPresent()) {
            GHRelease updated = existing.get().update().body(body).draft(true).update();
            log.info("Updated existing release for {}", tag);
            return new ReleasePublication(updated.getId(), tag, false);
          }
          GHRelease created = repo.createRelease(tag).name(tag).body(body).draft(true).create();
          log.info("Created draft release for {}", tag);
          return new ReleasePublication(created.getId(), tag, true);
        });
  }

  private Optional<GHRelease> findRelease(GHRepository repo, String tag) throws IOException {
    for (GHRelease release : repo.listReleases().withPageSize(100)) {
      if (tag.equals(release.getTagName())) {
        return Optional.of(release);
      }
    }
    return Optional.empty();
  }

  private Optional<GHPullRequest> findPullRequest(String repository, String sha) {
    try {
      return executor.executeOnRepository(
          repository,
          "list pull requests of commit " + sha,
          repo -> {
            for (GHPullRequest pr : repo.getCommit(sha).listPullRequests()) {
              return Optional.of(pr);
            }
            return Optional.<GHPullRequest>empty();
          });
    } catch (UpstreamServiceException ex) {
      // The commit subject is an acceptable description; the lookup only enriches it.
      log.debug("No pull request resolved for commit {}: {}", sha, ex.getMessage());
      return Optional.empty();
    }
  }

  private CommitInfo toCommitInfo(GHCommit commit) throws IOException {
    String message = commit.getCommitShortInfo().getMessage();
    String subject = message == null ? "" : message.split("\n", 2)[0].strip();
    return new CommitInfo(commit.getSHA1(), subject);
  }
}
