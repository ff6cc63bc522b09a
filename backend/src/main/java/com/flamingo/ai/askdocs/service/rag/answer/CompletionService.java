package com.flamingo.ai.askdocs.service.rag.answer;

import com.flamingo.ai.askdocs.agent.GroundedAnswerAgent;
import com.flamingo.ai.askdocs.exception.CompletionFailedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Single call to the completion model per question. Failures are not retried. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompletionService {

  private final GroundedAnswerAgent groundedAnswerAgent;
  private final MeterRegistry meterRegistry;

  /**
   * Asks the completion model to answer from the given excerpts.
   *
   * @param excerpts formatted document excerpts
   * @param question the question
   * @return the raw completion text
   * @throws CompletionFailedException if the model call fails or returns nothing
   */
  @Timed(value = "completion.complete", description = "Time for the grounded completion call")
  @CircuitBreaker(name = "completion", fallbackMethod = "completeFallback")
  public String complete(String excerpts, String question) {
    String raw;
    try {
      raw = groundedAnswerAgent.answer(excerpts, question);
    } catch (RuntimeException e) {
      throw new CompletionFailedException("Completion call failed: " + e.getMessage(), e);
    }
    if (raw == null || raw.isBlank()) {
      throw new CompletionFailedException("Completion returned no content", null);
    }
    meterRegistry.counter("completion.requests.success").increment();
    return raw;
  }

  @SuppressWarnings("unused")
  private String completeFallback(String excerpts, String question, Throwable t) {
    log.error("Completion failed: {}", t.getMessage());
    meterRegistry.counter("completion.requests.failure").increment();
    if (t instanceof CompletionFailedException e) {
      throw e;
    }
    throw new CompletionFailedException("Completion service unavailable: " + t.getMessage(), t);
  }
}
