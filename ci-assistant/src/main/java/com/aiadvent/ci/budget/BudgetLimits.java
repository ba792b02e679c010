package com.aiadvent.ci.budget;

/**
 * Character ceilings applied by {@link ContentBudgeter}.
 *
 * @param maxTotalChars ceiling for the whole rendered content, notices excluded
 * @param maxPatchChars ceiling for a single file's patch excerpt
 */
public record BudgetLimits(int maxTotalChars, int maxPatchChars) {

  public BudgetLimits {
    if (maxTotalChars <= 0) {
      throw new IllegalArgumentException("maxTotalChars must be positive");
    }
    if (maxPatchChars <= 0) {
      throw new IllegalArgumentException("maxPatchChars must be positive");
    }
  }
}
