package com.aiadvent.ci.llm;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aiadvent.ci.config.LlmProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class OpenAiChatCompletionClientTest {

  @Test
  void failsWithoutApiKeyBeforeAnyNetworkCall() {
    OpenAiChatCompletionClient client =
        new OpenAiChatCompletionClient(new LlmProperties(), new SimpleMeterRegistry());

    assertThatThrownBy(
            () -> client.complete(new ChatCompletionRequest("system", "hello", 10, 0.0d)))
        .isInstanceOf(ChatCompletionException.class)
        .hasMessageContaining("ci.llm.api-key");
  }

  @Test
  void requestRejectsBlankUserPrompt() {
    assertThatThrownBy(() -> new ChatCompletionRequest("system", " ", 10, 0.0d))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ChatCompletionRequest("system", "hi", 0, 0.0d))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
