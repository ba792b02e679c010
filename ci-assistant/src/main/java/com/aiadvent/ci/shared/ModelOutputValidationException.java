package com.aiadvent.ci.shared;

/**
 * The model answered, but the answer is outside the closed set the caller accepts. Kept apart
 * from {@link UpstreamServiceException} so that "model produced invalid output" can be reported
 * separately from "service unreachable".
 */
public class ModelOutputValidationException extends CiAssistantException {

  private final String rawOutput;

  public ModelOutputValidationException(String message, String rawOutput) {
    super(message);
    this.rawOutput = rawOutput;
  }

  public String getRawOutput() {
    return rawOutput;
  }
}
