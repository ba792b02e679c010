package com.aiadvent.ci.llm;

import com.aiadvent.ci.config.LlmProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.lang.Nullable;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * {@link ChatCompletionClient} over Spring AI's OpenAI model. The model is assembled from {@link
 * LlmProperties} on first use so that a missing API key only matters to commands that call it.
 */
public class OpenAiChatCompletionClient implements ChatCompletionClient {

  private static final Logger log = LoggerFactory.getLogger(OpenAiChatCompletionClient.class);

  private final LlmProperties properties;
  private final Timer callTimer;
  private volatile ChatClient chatClient;

  public OpenAiChatCompletionClient(LlmProperties properties, @Nullable MeterRegistry meterRegistry) {
    this.properties = Objects.requireNonNull(properties, "properties");
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.callTimer =
        Timer.builder("ci_llm_call_duration")
            .description("Duration of chat completion calls")
            .tag("model", String.valueOf(properties.getModel()))
            .register(registry);
  }

  @Override
  public String complete(ChatCompletionRequest request) {
    Objects.requireNonNull(request, "request");
    OpenAiChatOptions options =
        OpenAiChatOptions.builder()
            .model(properties.getModel())
            .temperature(request.temperature())
            .maxTokens(request.maxTokens())
            .build();
    String content;
    try {
      content =
          callTimer.recordCallable(
              () ->
                  chatClient()
                      .prompt()
                      .system(request.systemPrompt())
                      .user(request.userPrompt())
                      .options(options)
                      .call()
                      .content());
    } catch (ChatCompletionException ex) {
      throw ex;
    } catch (Exception ex) {
      throw new ChatCompletionException("Chat completion failed: " + ex.getMessage(), ex);
    }
    if (!StringUtils.hasText(content)) {
      throw new ChatCompletionException("Chat completion returned an empty response");
    }
    return content.strip();
  }

  private ChatClient chatClient() {
    ChatClient client = chatClient;
    if (client == null) {
      synchronized (this) {
        client = chatClient;
        if (client == null) {
          client = buildChatClient();
          chatClient = client;
        }
      }
    }
    return client;
  }

  private ChatClient buildChatClient() {
    if (!properties.hasApiKey()) {
      throw new ChatCompletionException("ci.llm.api-key is not configured");
    }
    log.info(
        "Building OpenAI chat client (baseUrl={}, model={})",
        properties.getBaseUrl(),
        properties.getModel());
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.getConnectTimeout());
    requestFactory.setReadTimeout(properties.getReadTimeout());
    OpenAiApi openAiApi =
        OpenAiApi.builder()
            .baseUrl(properties.getBaseUrl())
            .apiKey(properties.getApiKey())
            .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
            .build();
    RetryTemplate retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(Math.max(1, properties.getMaxAttempts()))
            .fixedBackoff(1000)
            .build();
    OpenAiChatModel chatModel =
        OpenAiChatModel.builder()
            .openAiApi(openAiApi)
            .defaultOptions(OpenAiChatOptions.builder().model(properties.getModel()).build())
            .retryTemplate(retryTemplate)
            .build();
    return ChatClient.builder(chatModel).build();
  }
}
