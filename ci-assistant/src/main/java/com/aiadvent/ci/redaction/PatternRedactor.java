package com.aiadvent.ci.redaction;

import java.util.List;
import java.util.Objects;

/**
 * Masks secret-shaped substrings before text leaves the runner, either towards the LLM or into a
 * public pull-request comment.
 *
 * <p>The rules are folded over the input in list order. Every placeholder is bracket-delimited and
 * contains no run of characters any rule accepts, so {@code redact(redact(x)) == redact(x)}.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public class PatternRedactor {

  private final List<RedactionRule> rules;

  public PatternRedactor() {
    this(RedactionRules.defaults());
  }

  public PatternRedactor(List<RedactionRule> rules) {
    Objects.requireNonNull(rules, "rules");
    this.rules = List.copyOf(rules);
  }

  public String redact(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String current = text;
    for (RedactionRule rule : rules) {
      current = rule.apply(current);
    }
    return current;
  }

  public List<RedactionRule> rules() {
    return rules;
  }
}
