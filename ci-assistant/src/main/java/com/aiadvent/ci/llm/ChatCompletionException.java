package com.aiadvent.ci.llm;

import com.aiadvent.ci.shared.UpstreamServiceException;

public class ChatCompletionException extends UpstreamServiceException {

  public ChatCompletionException(String message) {
    super(message);
  }

  public ChatCompletionException(String message, Throwable cause) {
    super(message, cause);
  }
}
