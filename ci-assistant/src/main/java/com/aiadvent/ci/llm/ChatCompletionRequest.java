package com.aiadvent.ci.llm;

import java.util.Objects;
import org.springframework.util.StringUtils;

/** A single system + user turn sent to the chat model. */
public record ChatCompletionRequest(
    String systemPrompt, String userPrompt, int maxTokens, double temperature) {

  public ChatCompletionRequest {
    Objects.requireNonNull(systemPrompt, "systemPrompt");
    if (!StringUtils.hasText(userPrompt)) {
      throw new IllegalArgumentException("userPrompt must not be blank");
    }
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be positive");
    }
  }
}
