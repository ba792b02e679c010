package com.aiadvent.ci.shared;

/** A required identifier is missing or malformed. */
public class ConfigurationException extends CiAssistantException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
