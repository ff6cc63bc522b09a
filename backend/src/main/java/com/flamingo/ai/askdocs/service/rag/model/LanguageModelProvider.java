package com.flamingo.ai.askdocs.service.rag.model;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;

/**
 * Resolves models by name.
 *
 * <p>Callers always pass the model name explicitly so that passages and questions are embedded
 * with the same model.
 */
public interface LanguageModelProvider {

  /**
   * Returns the embedding model registered under the given name.
   *
   * @param modelName the embedding model name
   * @return the embedding model
   */
  EmbeddingModel embeddingModel(String modelName);

  /**
   * Returns the chat model registered under the given name.
   *
   * @param modelName the chat model name
   * @return the chat model
   */
  ChatModel chatModel(String modelName);
}
