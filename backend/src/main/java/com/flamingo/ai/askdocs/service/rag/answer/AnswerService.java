package com.flamingo.ai.askdocs.service.rag.answer;

import com.flamingo.ai.askdocs.agent.GroundedAnswerAgent;
import com.flamingo.ai.askdocs.config.RagConfig;
import com.flamingo.ai.askdocs.domain.enums.GroundingStatus;
import com.flamingo.ai.askdocs.service.audit.AnswerAuditLog;
import com.flamingo.ai.askdocs.service.rag.retrieval.ContextBundle;
import com.flamingo.ai.askdocs.service.rag.retrieval.RetrievalService;
import com.flamingo.ai.askdocs.service.rag.retrieval.RetrievedChunk;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers questions from retrieved context only.
 *
 * <p>An empty context produces the fixed no-information answer without calling the completion
 * model. Otherwise exactly one completion call is made, and its citations are checked against the
 * files that were supplied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerService {

  private final RetrievalService retrievalService;
  private final CompletionService completionService;
  private final CompletionResponseParser completionResponseParser;
  private final SourceAttributionVerifier sourceAttributionVerifier;
  private final AnswerAuditLog answerAuditLog;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Answers a question on behalf of a user and records the interaction.
   *
   * @param userName the caller, may be null
   * @param question the question
   * @return the answer
   */
  public Answer ask(String userName, String question) {
    try {
      Answer answer = answer(question);
      answerAuditLog.recordAnswer(userName, question, answer);
      return answer;
    } catch (RuntimeException e) {
      answerAuditLog.recordFailure(userName, question, e);
      throw e;
    }
  }

  /** Answers with the configured retrieval parameters. */
  public Answer answer(String question) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("question must not be blank");
    }
    return answer(question.trim(), retrievalService.retrieve(question.trim()));
  }

  /**
   * Generates the answer for an already retrieved context.
   *
   * @param question the question
   * @param bundle the retrieved context
   * @return the answer, whose sources are the bundle's sources
   */
  @Timed(value = "answer.generate", description = "Time to generate a grounded answer")
  public Answer answer(String question, ContextBundle bundle) {
    if (bundle.isEmpty()) {
      log.info("No context retrieved, answering without completion");
      meterRegistry.counter("answer.no_context").increment();
      return Answer.noInformation(question);
    }

    String raw = completionService.complete(formatExcerpts(bundle), question);
    ParsedCompletion parsed = completionResponseParser.parse(raw);
    if (GroundedAnswerAgent.UNKNOWN_ANSWER.equals(parsed.answer())) {
      log.info("Model found no answer in {} retrieved chunks", bundle.chunks().size());
      meterRegistry.counter("answer.unknown").increment();
    }

    GroundingStatus grounding = GroundingStatus.VERIFIED;
    List<String> unknown = List.of();
    if (ragConfig.getVerification().isEnabled()) {
      SourceAttributionVerifier.VerificationResult result =
          sourceAttributionVerifier.verify(parsed.citedSources(), bundle.sources());
      grounding = result.status();
      unknown = result.unknownSources();
    }

    log.info(
        "Answered from {} chunks of {} file(s), grounding={}",
        bundle.chunks().size(),
        bundle.sources().size(),
        grounding);
    return new Answer(question, parsed.answer(), bundle.sources(), grounding, unknown);
  }

  /** Formats each chunk under a header naming its file, separated by a blank line. */
  static String formatExcerpts(ContextBundle bundle) {
    return bundle.chunks().stream()
        .map(AnswerService::formatExcerpt)
        .collect(Collectors.joining("\n\n"));
  }

  private static String formatExcerpt(RetrievedChunk chunk) {
    return "[Source: " + chunk.fileName() + ", part " + chunk.chunkId() + "]\n" + chunk.text();
  }
}
