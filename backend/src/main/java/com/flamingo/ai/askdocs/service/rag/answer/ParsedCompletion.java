package com.flamingo.ai.askdocs.service.rag.answer;

import java.util.List;

/**
 * Structured view of a completion.
 *
 * @param answer the answer text
 * @param citedSources file names the model says it used, empty when it cited none
 * @param structured false when the completion was not the requested JSON object
 */
public record ParsedCompletion(String answer, List<String> citedSources, boolean structured) {}
