package com.aiadvent.ci.command;

import com.aiadvent.ci.shared.CiAssistantException;
import com.aiadvent.ci.shared.ConfigurationException;
import com.aiadvent.ci.shared.ModelOutputValidationException;
import com.aiadvent.ci.shared.UpstreamServiceException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the command named by the first non-option argument and records its exit code. This is the
 * only place that turns failures into exit codes.
 */
@Component
public class CommandDispatcher implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

  private final Map<String, CiCommand> commands = new LinkedHashMap<>();
  private final WorkflowAnnotations annotations;
  private int exitCode;

  public CommandDispatcher(List<CiCommand> commands, WorkflowAnnotations annotations) {
    this.annotations = Objects.requireNonNull(annotations, "annotations");
    for (CiCommand command : commands) {
      CiCommand previous = this.commands.putIfAbsent(command.name(), command);
      if (previous != null) {
        throw new IllegalStateException("Duplicate command name: " + command.name());
      }
    }
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> names = args.getNonOptionArgs();
    if (names.isEmpty()) {
      annotations.error("No command given. Available commands: " + commands.keySet());
      exitCode = 1;
      return;
    }
    exitCode = dispatch(names.get(0));
  }

  public int dispatch(String name) {
    CiCommand command = commands.get(name);
    if (command == null) {
      annotations.error("Unknown command '" + name + "'. Available commands: " + commands.keySet());
      return 1;
    }
    log.info("Running command {}", name);
    try {
      return command.run();
    } catch (ConfigurationException ex) {
      annotations.error(ex.getMessage());
      return 1;
    } catch (ModelOutputValidationException ex) {
      log.debug("Rejected model output: {}", ex.getRawOutput());
      annotations.error(ex.getMessage());
      return 1;
    } catch (UpstreamServiceException ex) {
      log.error("Command {} failed", name, ex);
      annotations.error(ex.getMessage());
      return 1;
    } catch (CiAssistantException
        | UncheckedIOException
        | IllegalArgumentException
        | IllegalStateException ex) {
      log.error("Command {} failed", name, ex);
      annotations.error(name + " failed: " + ex.getMessage());
      return 1;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
