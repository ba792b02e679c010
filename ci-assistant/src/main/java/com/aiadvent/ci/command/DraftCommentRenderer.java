package com.aiadvent.ci.command;

import java.util.ArrayList;
import java.util.List;

/** Markdown for the test-draft artifact and for the shorter pull-request comment built from it. */
public class DraftCommentRenderer {

  static final String HEADING = "## 🧪 Draft Test Suggestions";
  static final String NO_SOURCES_BODY =
      HEADING
          + "\n\nNo Python source files under `src/` were changed in this PR. "
          + "Test generation skipped.";
  static final String ARTIFACT_FOOTER =
      "*Generated by AI Test Draft Bot. These are suggestions only - review and adapt before use.*";

  private static final int MAX_BLOCK_CHARS = 800;
  private static final int MAX_BLOCK_LINES = 20;
  private static final int PREVIEW_LINES = 40;

  private final int fileLimit;
  private final int codeBlockLimit;
  private final String artifactName;

  public DraftCommentRenderer(int fileLimit, int codeBlockLimit, String artifactName) {
    this.fileLimit = fileLimit;
    this.codeBlockLimit = codeBlockLimit;
    this.artifactName = artifactName;
  }

  public String artifact(String title, List<String> files, String modelOutput) {
    return "# Draft Test Suggestions\n\n"
        + "## PR: " + title + "\n\n"
        + "**Files analyzed:** " + files.size() + "\n\n"
        + "### Files Touched\n"
        + bulletList(files) + "\n\n"
        + "---\n\n"
        + modelOutput + "\n\n"
        + "---\n\n"
        + ARTIFACT_FOOTER + "\n";
  }

  public String comment(String title, List<String> files, String modelOutput) {
    StringBuilder comment = new StringBuilder();
    comment.append(HEADING).append("\n\n");
    comment.append("**PR:** ").append(title).append('\n');
    comment.append("**Files analyzed:** ").append(files.size()).append("\n\n");
    comment.append("### Files Covered\n");
    files.stream().limit(fileLimit).forEach(f -> comment.append("- `").append(f).append("`\n"));
    if (files.size() > fileLimit) {
      comment.append("- ... and ").append(files.size() - fileLimit).append(" more\n");
    }
    comment.append("\n### Sample Test Suggestions\n\n");

    List<String> blocks = pythonBlocks(modelOutput);
    if (blocks.isEmpty()) {
      comment.append(preview(modelOutput));
    } else {
      blocks.stream().limit(codeBlockLimit).forEach(b -> comment.append(shorten(b)).append("\n\n"));
    }

    comment.append("\n---\n\n");
    comment.append("📦 **Full output available in workflow artifacts** (`")
        .append(artifactName)
        .append("`)\n\n");
    comment.append(
        "*These are AI-generated suggestions. Review and adapt before adding to your test suite.*\n");
    return comment.toString();
  }

  static List<String> pythonBlocks(String output) {
    List<String> blocks = new ArrayList<>();
    List<String> current = null;
    for (String line : output.split("\n", -1)) {
      String stripped = line.strip();
      if (stripped.startsWith("```py")) {
        current = new ArrayList<>();
        current.add(line);
      } else if (current != null && stripped.equals("```")) {
        current.add(line);
        blocks.add(String.join("\n", current));
        current = null;
      } else if (current != null) {
        current.add(line);
      }
    }
    return blocks;
  }

  private static String shorten(String block) {
    if (block.length() <= MAX_BLOCK_CHARS) {
      return block;
    }
    String[] lines = block.split("\n", -1);
    String head = String.join("\n", List.of(lines).subList(0, Math.min(lines.length, MAX_BLOCK_LINES)));
    return head.endsWith("```") ? head : head + "\n# ... (truncated)\n```";
  }

  private static String preview(String output) {
    String[] lines = output.split("\n", -1);
    if (lines.length <= PREVIEW_LINES) {
      return output;
    }
    return String.join("\n", List.of(lines).subList(0, PREVIEW_LINES))
        + "\n\n... (see artifact for full output)";
  }

  private static String bulletList(List<String> files) {
    return String.join("\n", files.stream().map(f -> "- `" + f + "`").toList());
  }
}
