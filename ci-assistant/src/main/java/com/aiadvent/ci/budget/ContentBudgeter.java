package com.aiadvent.ci.budget;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders pull-request file changes into Markdown under a character budget.
 *
 * <p>Every input file ends up in exactly one of three states: rendered in full, rendered as an
 * excerpt carrying an inline {@value #TRUNCATION_MARKER} marker, or counted in a trailing
 * "omitted" note. Files keep their input order. The budget covers rendered blocks and the line
 * breaks between them; only the fixed notices may go past it.
 *
 * <p>The class holds no state and its output depends only on its arguments.
 */
public class ContentBudgeter {

  static final String TRUNCATION_MARKER = "... (truncated)";
  static final String NO_PATCH_NOTE = "*(no patch available; possibly binary or too large)*";
  static final String TRUNCATED_NOTICE = "**Note: Diff truncated due to size.**\n";

  /**
   * Single-limit mode. Renders every patch in full; when the result exceeds {@code
   * limits.maxTotalChars()} it is thrown away and replaced by a compact listing with excerpts of
   * at most {@code limits.maxPatchChars()} characters, prefixed by a truncation notice.
   *
   * <p>{@link BudgetedContent#truncated()} is {@code true} exactly when the full rendering did not
   * fit.
   */
  public BudgetedContent renderWithinLimit(List<FileChange> files, BudgetLimits limits) {
    Objects.requireNonNull(files, "files");
    Objects.requireNonNull(limits, "limits");

    List<String> fullBlocks = new ArrayList<>(files.size());
    List<String> paths = new ArrayList<>(files.size());
    for (FileChange file : files) {
      fullBlocks.add(fullBlock(file));
      paths.add(file.path());
    }
    String full = String.join("\n", fullBlocks);
    if (full.length() <= limits.maxTotalChars()) {
      return new BudgetedContent(full, false, paths, 0);
    }

    Accumulator accumulator = new Accumulator(limits.maxTotalChars());
    for (int i = 0; i < files.size(); i++) {
      FileChange file = files.get(i);
      if (!accumulator.offer(compactBlock(file, limits.maxPatchChars()), file.path())) {
        accumulator.omit(files.size() - i);
        break;
      }
    }
    String content = withOmittedNote(TRUNCATED_NOTICE + "\n" + accumulator.render(), accumulator);
    return new BudgetedContent(
        content, true, accumulator.includedFiles(), accumulator.omittedFiles());
  }

  /**
   * Per-file-cap mode. Walks the files in order, rendering each with a patch excerpt of at most
   * {@code limits.maxPatchChars()} characters, and stops at the first block that would push the
   * running total past {@code limits.maxTotalChars()}. Blocks already accepted are kept as they
   * are.
   */
  public BudgetedContent renderPerFile(List<FileChange> files, BudgetLimits limits) {
    Objects.requireNonNull(files, "files");
    Objects.requireNonNull(limits, "limits");

    Accumulator accumulator = new Accumulator(limits.maxTotalChars());
    boolean excerptCut = false;
    for (int i = 0; i < files.size(); i++) {
      FileChange file = files.get(i);
      StringBuilder block = new StringBuilder();
      block.append("### ").append(file.path()).append('\n');
      block.append("**Status**: ").append(file.status()).append(' ');
      block.append("(+").append(file.additions()).append("/-").append(file.deletions()).append(")\n\n");
      boolean cut = false;
      if (file.hasPatch()) {
        Excerpt excerpt = excerpt(file.patch(), limits.maxPatchChars());
        cut = excerpt.truncated();
        block.append("```diff\n").append(excerpt.text()).append("\n```\n");
      } else {
        block.append(NO_PATCH_NOTE).append('\n');
      }
      if (!accumulator.offer(block.toString(), file.path())) {
        accumulator.omit(files.size() - i);
        break;
      }
      excerptCut |= cut;
    }
    String content = withOmittedNote(accumulator.render(), accumulator);
    return new BudgetedContent(
        content,
        excerptCut || accumulator.omittedFiles() > 0,
        accumulator.includedFiles(),
        accumulator.omittedFiles());
  }

  private static String withOmittedNote(String content, Accumulator accumulator) {
    if (accumulator.omittedFiles() == 0) {
      return content;
    }
    return content + "\n\n" + omittedNote(accumulator.omittedFiles()) + "\n";
  }

  static String omittedNote(int count) {
    return "**Note:** " + count + " additional files omitted due to size constraints.";
  }

  static Excerpt excerpt(String patch, int maxChars) {
    if (patch.length() <= maxChars) {
      return new Excerpt(patch, false);
    }
    int end = maxChars;
    if (Character.isHighSurrogate(patch.charAt(end - 1))) {
      end--;
    }
    return new Excerpt(patch.substring(0, end) + "\n" + TRUNCATION_MARKER, true);
  }

  private String fullBlock(FileChange file) {
    if (file.hasPatch()) {
      return "### " + file.path() + "\n```diff\n" + file.patch() + "\n```\n";
    }
    return "### " + file.path() + "\n" + NO_PATCH_NOTE + "\n";
  }

  private String compactBlock(FileChange file, int maxPatchChars) {
    String summary =
        "- `%s` (%s: +%d/-%d)"
            .formatted(file.path(), file.status(), file.additions(), file.deletions());
    if (!file.hasPatch()) {
      return summary + " " + NO_PATCH_NOTE;
    }
    Excerpt excerpt = excerpt(file.patch(), maxPatchChars);
    return summary + "\n```diff\n" + excerpt.text() + "\n```\n";
  }

  record Excerpt(String text, boolean truncated) {}

  /** Joins blocks with line breaks while keeping blocks plus separators under the budget. */
  private static final class Accumulator {

    private final int budget;
    private final List<String> blocks = new ArrayList<>();
    private final List<String> includedFiles = new ArrayList<>();
    private int used;
    private int omitted;

    private Accumulator(int budget) {
      this.budget = budget;
    }

    boolean offer(String block, String path) {
      int cost = block.length() + (blocks.isEmpty() ? 0 : 1);
      if (used + cost > budget) {
        return false;
      }
      blocks.add(block);
      includedFiles.add(path);
      used += cost;
      return true;
    }

    void omit(int count) {
      omitted = count;
    }

    String render() {
      return String.join("\n", blocks);
    }

    List<String> includedFiles() {
      return includedFiles;
    }

    int omittedFiles() {
      return omitted;
    }
  }
}
