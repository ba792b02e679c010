package com.aiadvent.ci.annotation;

import org.springframework.util.StringUtils;

/**
 * Hidden HTML comment placed on the first line of every comment this pipeline manages, e.g.
 * {@code <!-- ai-pr-summary-bot -->}. GitHub does not render it, so it identifies the comment
 * without showing up to readers.
 */
public record AnnotationMarker(String value) {

  static final String SEPARATOR = "\n\n";

  public AnnotationMarker {
    if (!StringUtils.hasText(value)) {
      throw new IllegalArgumentException("marker must not be blank");
    }
    value = value.trim();
    if (!value.startsWith("<!--") || !value.endsWith("-->") || value.length() < 8) {
      throw new IllegalArgumentException("marker must be an HTML comment: " + value);
    }
    if (value.indexOf('\n') >= 0) {
      throw new IllegalArgumentException("marker must fit on a single line");
    }
  }

  public static AnnotationMarker of(String value) {
    return new AnnotationMarker(value);
  }

  public boolean isPresentIn(String body) {
    return body != null && body.contains(value);
  }

  public String decorate(String payload) {
    return value + SEPARATOR + (payload == null ? "" : payload);
  }

  @Override
  public String toString() {
    return value;
  }
}
