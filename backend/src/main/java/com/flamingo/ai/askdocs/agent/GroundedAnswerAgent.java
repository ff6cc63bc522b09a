package com.flamingo.ai.askdocs.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that answers a question from retrieved document excerpts only.
 *
 * <p>Returns a JSON object {@code {"answer": "...", "sources": ["file name", ...]}}.
 */
public interface GroundedAnswerAgent {

  /** Answer text the model is told to use when the excerpts do not contain the answer. */
  String UNKNOWN_ANSWER = "I do not know based on the available documents.";

  @SystemMessage(
      """
        You answer questions about a collection of documents.

        Rules:
        - Use ONLY the document excerpts supplied in the user message.
        - Do not use prior knowledge, do not guess, and do not invent facts or file names.
        - If the excerpts do not contain the answer, set "answer" to exactly:
          I do not know based on the available documents.
        - In "sources", list the file names of the excerpts you actually relied on.

        Respond with a single JSON object and nothing else:
        {"answer": "<answer text>", "sources": ["<file name>", ...]}
        """)
  @UserMessage(
      """
        Document excerpts:
        {{context}}

        Question: {{question}}
        """)
  String answer(@V("context") String context, @V("question") String question);
}
