package com.flamingo.ai.askdocs.service.rag.answer;

import com.flamingo.ai.askdocs.domain.enums.GroundingStatus;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Checks that the files an answer cites were part of the context it was given. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceAttributionVerifier {

  private final MeterRegistry meterRegistry;

  /**
   * Compares cited file names against the supplied sources.
   *
   * @param cited file names cited by the completion
   * @param supplied file names present in the context
   * @return the verification outcome
   */
  public VerificationResult verify(Collection<String> cited, Set<String> supplied) {
    List<String> unknown = cited.stream().filter(c -> !supplied.contains(c)).distinct().toList();
    if (unknown.isEmpty()) {
      meterRegistry.counter("answer.verification", "result", "verified").increment();
      return new VerificationResult(GroundingStatus.VERIFIED, List.of());
    }
    log.warn(
        "Answer cites files outside the supplied context: {} (supplied: {})", unknown, supplied);
    meterRegistry.counter("answer.verification", "result", "unverified").increment();
    return new VerificationResult(GroundingStatus.UNVERIFIED_CITATIONS, unknown);
  }

  /**
   * Outcome of a citation check.
   *
   * @param status grounding status
   * @param unknownSources cited file names that were not supplied
   */
  public record VerificationResult(GroundingStatus status, List<String> unknownSources) {}
}
