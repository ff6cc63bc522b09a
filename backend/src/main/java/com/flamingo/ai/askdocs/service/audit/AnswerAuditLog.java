package com.flamingo.ai.askdocs.service.audit;

import com.flamingo.ai.askdocs.domain.entity.InteractionLog;
import com.flamingo.ai.askdocs.service.rag.answer.Answer;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Records questions and their outcomes.
 *
 * <p>Recording is best effort: implementations never let a write failure reach the caller.
 */
public interface AnswerAuditLog {

  void recordAnswer(String userName, String question, Answer answer);

  void recordFailure(String userName, String question, Throwable error);

  /** The 100 most recent interactions asked within {@code [start, end]}, newest first. */
  List<InteractionLog> history(LocalDateTime start, LocalDateTime end);
}
