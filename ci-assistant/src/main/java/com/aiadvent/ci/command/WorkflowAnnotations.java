package com.aiadvent.ci.command;

import java.io.PrintStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes GitHub Actions workflow commands ({@code ::notice::}, {@code ::warning::}, {@code
 * ::error::}) and plain progress lines to the job output. Each line is mirrored to the log.
 */
public class WorkflowAnnotations {

  private static final Logger log = LoggerFactory.getLogger(WorkflowAnnotations.class);

  private final PrintStream out;

  public WorkflowAnnotations(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  public void notice(String message) {
    log.info("notice: {}", message);
    out.println("::notice::" + message);
  }

  public void warning(String message) {
    log.warn("warning: {}", message);
    out.println("::warning::" + message);
  }

  public void error(String message) {
    log.error("error: {}", message);
    out.println("::error::" + message);
  }

  public void print(String line) {
    log.debug(line);
    out.println(line);
  }
}
