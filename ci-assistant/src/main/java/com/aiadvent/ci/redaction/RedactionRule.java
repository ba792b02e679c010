package com.aiadvent.ci.redaction;

import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * A single step of the redaction cascade.
 *
 * @param category short name of the secret kind, used in diagnostics only
 * @param pattern compiled match pattern; case and multi-line flags are part of it
 * @param replacement {@link java.util.regex.Matcher#replaceAll(String)} template, may reference
 *     capture groups such as {@code $1}
 */
public record RedactionRule(String category, Pattern pattern, String replacement) {

  public RedactionRule {
    if (!StringUtils.hasText(category)) {
      throw new IllegalArgumentException("category must not be blank");
    }
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(replacement, "replacement");
  }

  public static RedactionRule of(String category, String regex, String replacement) {
    return new RedactionRule(category, Pattern.compile(regex), replacement);
  }

  public static RedactionRule of(String category, String regex, int flags, String replacement) {
    return new RedactionRule(category, Pattern.compile(regex, flags), replacement);
  }

  public boolean caseInsensitive() {
    return (pattern.flags() & Pattern.CASE_INSENSITIVE) != 0;
  }

  public boolean multiline() {
    return (pattern.flags() & Pattern.MULTILINE) != 0;
  }

  String apply(String text) {
    return pattern.matcher(text).replaceAll(replacement);
  }
}
