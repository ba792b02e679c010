package com.aiadvent.ci.budget;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * One changed file of a pull request, in the order the listing returned it.
 *
 * @param patch unified diff hunk text, {@code null} when the source could not provide one (binary
 *     or oversized files)
 */
public record FileChange(
    String path, String status, int additions, int deletions, @Nullable String patch) {

  public FileChange {
    if (!StringUtils.hasText(path)) {
      path = "unknown";
    }
    if (!StringUtils.hasText(status)) {
      status = "modified";
    }
  }

  public boolean hasPatch() {
    return StringUtils.hasLength(patch);
  }

  public FileChange withPatch(@Nullable String newPatch) {
    return new FileChange(path, status, additions, deletions, newPatch);
  }
}
