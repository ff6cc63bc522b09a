package com.flamingo.ai.askdocs.config;

import com.flamingo.ai.askdocs.service.rag.model.LanguageModelProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/** OpenAI-backed models, built lazily and cached per model name. */
@Slf4j
public class OpenAiLanguageModelProvider implements LanguageModelProvider {

  private final String apiKey;
  private final String baseUrl;
  private final int embeddingDimensions;
  private final int maxCompletionTokens;
  private final Duration embeddingTimeout;
  private final Duration chatTimeout;

  private final Map<String, EmbeddingModel> embeddingModels = new ConcurrentHashMap<>();
  private final Map<String, ChatModel> chatModels = new ConcurrentHashMap<>();

  public OpenAiLanguageModelProvider(
      String apiKey,
      String baseUrl,
      int embeddingDimensions,
      int maxCompletionTokens,
      Duration embeddingTimeout,
      Duration chatTimeout) {
    this.apiKey = apiKey;
    this.baseUrl = baseUrl;
    this.embeddingDimensions = embeddingDimensions;
    this.maxCompletionTokens = maxCompletionTokens;
    this.embeddingTimeout = embeddingTimeout;
    this.chatTimeout = chatTimeout;
  }

  @Override
  public EmbeddingModel embeddingModel(String modelName) {
    return embeddingModels.computeIfAbsent(
        modelName,
        name -> {
          validateApiKey();
          log.info("Creating embedding model {} ({} dimensions)", name, embeddingDimensions);
          return OpenAiEmbeddingModel.builder()
              .apiKey(apiKey)
              .baseUrl(baseUrl)
              .modelName(name)
              .dimensions(embeddingDimensions)
              .timeout(embeddingTimeout)
              .build();
        });
  }

  @Override
  public ChatModel chatModel(String modelName) {
    return chatModels.computeIfAbsent(
        modelName,
        name -> {
          validateApiKey();
          log.info("Creating chat model {}", name);
          return OpenAiChatModel.builder()
              .apiKey(apiKey)
              .baseUrl(baseUrl)
              .modelName(name)
              .maxCompletionTokens(maxCompletionTokens)
              .timeout(chatTimeout)
              .responseFormat("json_object")
              .logRequests(false)
              .logResponses(false)
              .build();
        });
  }

  private void validateApiKey() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
