package com.aiadvent.ci.command;

import com.aiadvent.ci.config.CiAssistantProperties;
import com.aiadvent.ci.shared.CiAssistantException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes Markdown artifacts into the configured artifacts directory for upload by the job. */
@Component
public class ArtifactWriter {

  private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

  private final CiAssistantProperties properties;

  public ArtifactWriter(CiAssistantProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public Path write(String fileName, String content) {
    Path directory = Path.of(properties.getArtifactsDir());
    Path target = directory.resolve(fileName).normalize();
    if (!target.startsWith(directory.normalize())) {
      throw new IllegalArgumentException("Artifact name escapes artifacts directory: " + fileName);
    }
    try {
      Files.createDirectories(directory);
      Files.writeString(target, content, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new CiAssistantException("Failed to write artifact " + target, ex);
    }
    log.info("Wrote artifact to {}", target);
    return target;
  }
}
