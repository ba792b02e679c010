package com.aiadvent.ci.command;

/** A workflow step selected by name on the command line. */
public interface CiCommand {

  String name();

  /**
   * Runs the step and returns the process exit code. Failures are thrown; the dispatcher maps
   * them to exit codes.
   */
  int run();
}
