package com.aiadvent.ci.eval;

import com.aiadvent.ci.shared.ConfigurationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

/**
 * Reads the golden file: a JSON array of {@code {id, input_text, expected_intent}} objects. Plain
 * paths resolve against the working directory, {@code classpath:} locations against the classpath.
 */
public class GoldenSetLoader {

  private static final TypeReference<List<GoldenCase>> CASES = new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final ResourceLoader resourceLoader;

  public GoldenSetLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
  }

  public List<GoldenCase> load(String location) {
    Resource resource = resourceLoader.getResource(resolve(location));
    if (!resource.exists()) {
      throw new ConfigurationException("Golden file not found: " + location);
    }
    List<GoldenCase> cases;
    try (InputStream input = resource.getInputStream()) {
      cases = objectMapper.readValue(input, CASES);
    } catch (IOException ex) {
      throw new ConfigurationException("Golden file is not valid: " + location, ex);
    }
    if (cases == null || cases.isEmpty()) {
      throw new ConfigurationException("Golden file is empty: " + location);
    }
    for (GoldenCase goldenCase : cases) {
      if (goldenCase == null
          || !StringUtils.hasText(goldenCase.id())
          || goldenCase.expectedIntent() == null) {
        throw new ConfigurationException("Golden file has an incomplete case: " + location);
      }
    }
    return List.copyOf(cases);
  }

  private static String resolve(String location) {
    if (!StringUtils.hasText(location)) {
      throw new ConfigurationException("ci.assistant.evals.golden-file must not be blank");
    }
    return location.contains(":") ? location : "file:" + location;
  }
}
