package com.aiadvent.ci.annotation;

import org.springframework.util.StringUtils;

/**
 * Pull request (or issue) whose conversation holds the managed comment.
 *
 * @param repository {@code owner/name}
 * @param number pull request number
 */
public record ResourceRef(String repository, int number) {

  public ResourceRef {
    if (!StringUtils.hasText(repository) || repository.indexOf('/') <= 0) {
      throw new IllegalArgumentException("repository must be in owner/name form: " + repository);
    }
    repository = repository.trim();
    if (number <= 0) {
      throw new IllegalArgumentException("number must be positive: " + number);
    }
  }

  @Override
  public String toString() {
    return repository + "#" + number;
  }
}
