package com.flamingo.ai.askdocs.service.rag.answer;

import com.flamingo.ai.askdocs.domain.enums.GroundingStatus;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A grounded answer.
 *
 * @param question the question asked
 * @param answer the answer text
 * @param sources file names of the context the answer was generated from
 * @param grounding citation check outcome
 * @param unverifiedCitations cited file names that were not part of the context
 */
public record Answer(
    String question,
    String answer,
    Set<String> sources,
    GroundingStatus grounding,
    List<String> unverifiedCitations) {

  /** Answer text used when nothing relevant has been retrieved. */
  public static final String NO_INFORMATION =
      "I could not find any information about that in the available documents.";

  public Answer {
    sources = Collections.unmodifiableSet(new LinkedHashSet<>(sources));
    unverifiedCitations = List.copyOf(unverifiedCitations);
  }

  /** The answer returned when retrieval found nothing; no completion is requested. */
  public static Answer noInformation(String question) {
    return new Answer(question, NO_INFORMATION, Set.of(), GroundingStatus.NO_CONTEXT, List.of());
  }
}
