package com.aiadvent.ci.shared;

/**
 * Root of the exceptions raised by the CI assistant. Commands map subclasses to process exit
 * codes; nothing below the command layer catches them.
 */
public class CiAssistantException extends RuntimeException {

  public CiAssistantException(String message) {
    super(message);
  }

  public CiAssistantException(String message, Throwable cause) {
    super(message, cause);
  }
}
