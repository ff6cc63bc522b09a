package com.flamingo.ai.askdocs.config;

import com.flamingo.ai.askdocs.service.rag.model.LanguageModelProvider;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j models. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.embedding-timeout:30s}")
  private Duration embeddingTimeout;

  @Value("${langchain4j.openai.chat-timeout:60s}")
  private Duration chatTimeout;

  @Bean
  public LanguageModelProvider languageModelProvider(RagConfig ragConfig) {
    return new OpenAiLanguageModelProvider(
        openAiApiKey,
        baseUrl,
        ragConfig.getEmbedding().getDimensions(),
        ragConfig.getCompletion().getMaxCompletionTokens(),
        embeddingTimeout,
        chatTimeout);
  }
}
