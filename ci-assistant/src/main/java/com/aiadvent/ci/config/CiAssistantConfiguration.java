package com.aiadvent.ci.config;

import com.aiadvent.ci.annotation.AnnotationSync;
import com.aiadvent.ci.annotation.CommentStore;
import com.aiadvent.ci.budget.ContentBudgeter;
import com.aiadvent.ci.command.WorkflowAnnotations;
import com.aiadvent.ci.eval.GoldenSetLoader;
import com.aiadvent.ci.llm.ChatCompletionClient;
import com.aiadvent.ci.llm.IntentClassifier;
import com.aiadvent.ci.llm.OpenAiChatCompletionClient;
import com.aiadvent.ci.llm.PromptTemplates;
import com.aiadvent.ci.redaction.PatternRedactor;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
@EnableConfigurationProperties({
  GitHubBackendProperties.class,
  LlmProperties.class,
  CiAssistantProperties.class
})
public class CiAssistantConfiguration {

  @Bean
  PatternRedactor patternRedactor() {
    return new PatternRedactor();
  }

  @Bean
  ContentBudgeter contentBudgeter() {
    return new ContentBudgeter();
  }

  @Bean
  AnnotationSync annotationSync(
      CommentStore commentStore, ObjectProvider<MeterRegistry> meterRegistry) {
    return new AnnotationSync(commentStore, meterRegistry.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean(ChatCompletionClient.class)
  ChatCompletionClient chatCompletionClient(
      LlmProperties properties, ObjectProvider<MeterRegistry> meterRegistry) {
    return new OpenAiChatCompletionClient(properties, meterRegistry.getIfAvailable());
  }

  @Bean
  IntentClassifier intentClassifier(ChatCompletionClient chatCompletionClient) {
    return new IntentClassifier(chatCompletionClient);
  }

  @Bean
  PromptTemplates promptTemplates(ResourceLoader resourceLoader) {
    return new PromptTemplates(resourceLoader);
  }

  @Bean
  GoldenSetLoader goldenSetLoader(
      ObjectProvider<ObjectMapper> objectMapper, ResourceLoader resourceLoader) {
    return new GoldenSetLoader(objectMapper.getIfAvailable(ObjectMapper::new), resourceLoader);
  }

  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  WorkflowAnnotations workflowAnnotations() {
    return new WorkflowAnnotations(System.out);
  }
}
