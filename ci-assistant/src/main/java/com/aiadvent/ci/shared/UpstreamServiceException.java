package com.aiadvent.ci.shared;

/**
 * Failure of an external service (GitHub API, LLM provider): transport error, non-2xx response
 * or a payload that could not be read.
 */
public class UpstreamServiceException extends CiAssistantException {

  public UpstreamServiceException(String message) {
    super(message);
  }

  public UpstreamServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
