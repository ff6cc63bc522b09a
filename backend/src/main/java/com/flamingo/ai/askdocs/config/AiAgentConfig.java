package com.flamingo.ai.askdocs.config;

import com.flamingo.ai.askdocs.agent.GroundedAnswerAgent;
import com.flamingo.ai.askdocs.service.rag.model.LanguageModelProvider;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: agent interfaces declare @SystemMessage/@UserMessage, concrete implementations are
 * built with AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Grounded answer agent bound to the configured completion model. */
  @Bean
  public GroundedAnswerAgent groundedAnswerAgent(
      LanguageModelProvider languageModelProvider, RagConfig ragConfig) {
    return AiServices.builder(GroundedAnswerAgent.class)
        .chatModel(languageModelProvider.chatModel(ragConfig.getCompletion().getModelName()))
        .build();
  }
}
