package com.aiadvent.ci.llm;

import com.aiadvent.ci.shared.ModelOutputValidationException;
import java.util.Arrays;
import java.util.Objects;
import org.springframework.util.StringUtils;

/** Maps a free-form message to one {@link Intent} with a zero-temperature model call. */
public class IntentClassifier {

  static final String SYSTEM_PROMPT =
      """
      You are an intent classifier. Classify the user's message into exactly one of these categories:
      - QUESTION: The user is asking a question or seeking information
      - REQUEST: The user is asking for an action to be performed
      - COMPLAINT: The user is expressing dissatisfaction or a problem
      - OTHER: The message doesn't fit the above categories

      Respond with ONLY the category name in uppercase (QUESTION, REQUEST, COMPLAINT, or OTHER).
      Do not include any other text, punctuation, or explanation.""";

  static final int MAX_TOKENS = 10;

  private final ChatCompletionClient completionClient;

  public IntentClassifier(ChatCompletionClient completionClient) {
    this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
  }

  public Intent classify(String text) {
    if (!StringUtils.hasText(text)) {
      throw new IllegalArgumentException("Text cannot be empty");
    }
    String answer =
        completionClient.complete(new ChatCompletionRequest(SYSTEM_PROMPT, text, MAX_TOKENS, 0.0d));
    return Intent.fromLabel(answer)
        .orElseThrow(
            () ->
                new ModelOutputValidationException(
                    "Invalid intent '%s' returned by model. Expected one of: %s"
                        .formatted(answer.strip(), Arrays.toString(Intent.values())),
                    answer));
  }
}
