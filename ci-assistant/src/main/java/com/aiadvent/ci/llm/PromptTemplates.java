package com.aiadvent.ci.llm;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

/** Loads Markdown prompt templates by resource location and fills their {@code {name}} slots. */
public class PromptTemplates {

  private final ResourceLoader resourceLoader;
  private final Map<String, String> cache = new ConcurrentHashMap<>();

  public PromptTemplates(ResourceLoader resourceLoader) {
    this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
  }

  public String render(String location, Map<String, Object> variables) {
    return new PromptTemplate(load(location)).render(variables);
  }

  String load(String location) {
    return cache.computeIfAbsent(location, this::read);
  }

  private String read(String location) {
    Resource resource = resourceLoader.getResource(location);
    try (InputStream input = resource.getInputStream()) {
      return StreamUtils.copyToString(input, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new IllegalStateException("Unable to load template: " + location, ex);
    }
  }
}
