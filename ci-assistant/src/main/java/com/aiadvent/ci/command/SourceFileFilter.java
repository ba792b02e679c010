package com.aiadvent.ci.command;

import com.aiadvent.ci.budget.FileChange;
import java.util.List;
import org.springframework.util.AntPathMatcher;

/**
 * Keeps changed files that match an include pattern, match no exclude pattern and carry the
 * required extension. Patterns use Ant syntax; {@code **} also matches zero directories.
 */
public class SourceFileFilter {

  private final AntPathMatcher matcher = new AntPathMatcher();
  private final List<String> includePatterns;
  private final List<String> excludePatterns;
  private final String requiredExtension;

  public SourceFileFilter(
      List<String> includePatterns, List<String> excludePatterns, String requiredExtension) {
    this.includePatterns = List.copyOf(includePatterns);
    this.excludePatterns = List.copyOf(excludePatterns);
    this.requiredExtension = requiredExtension == null ? "" : requiredExtension;
  }

  public List<FileChange> filter(List<FileChange> files) {
    return files.stream().filter(file -> accepts(file.path())).toList();
  }

  public boolean accepts(String path) {
    return matchesAny(path, includePatterns)
        && !matchesAny(path, excludePatterns)
        && path.endsWith(requiredExtension);
  }

  private boolean matchesAny(String path, List<String> patterns) {
    return patterns.stream().anyMatch(pattern -> matcher.match(pattern, path));
  }
}
