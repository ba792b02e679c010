package com.aiadvent.ci.github;

import com.aiadvent.ci.budget.FileChange;
import java.util.List;

/** Title, description and changed files of a pull request at the time it was read. */
public record PullRequestSnapshot(String title, String body, List<FileChange> files) {

  public PullRequestSnapshot {
    title = title == null ? "" : title;
    body = body == null ? "" : body;
    files = List.copyOf(files);
  }

  public int fileCount() {
    return files.size();
  }
}
