package com.aiadvent.ci.budget;

import java.util.List;

/**
 * Result of a budgeting pass.
 *
 * @param content rendered Markdown
 * @param truncated whether anything was cut, summarised or omitted compared to the full rendering
 * @param includedFiles paths rendered into {@code content}, in input order
 * @param omittedFiles number of trailing files that did not fit and are only counted in a note
 */
public record BudgetedContent(
    String content, boolean truncated, List<String> includedFiles, int omittedFiles) {

  public BudgetedContent {
    includedFiles = List.copyOf(includedFiles);
  }
}
