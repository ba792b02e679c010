package com.aiadvent.ci.llm;

/**
 * Blocking chat completion. Implementations return the assistant text stripped of surrounding
 * whitespace and throw {@link ChatCompletionException} for transport failures and empty answers.
 */
public interface ChatCompletionClient {

  String complete(ChatCompletionRequest request);
}
