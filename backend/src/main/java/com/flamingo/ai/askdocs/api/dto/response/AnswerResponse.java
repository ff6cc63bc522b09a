package com.flamingo.ai.askdocs.api.dto.response;

import com.flamingo.ai.askdocs.domain.enums.GroundingStatus;
import com.flamingo.ai.askdocs.service.rag.answer.Answer;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnswerResponse {

  private String question;
  private String answer;
  private List<String> sources;
  private GroundingStatus grounding;
  private List<String> unverifiedCitations;

  /** Creates an AnswerResponse from an Answer. */
  public static AnswerResponse fromAnswer(Answer answer) {
    return AnswerResponse.builder()
        .question(answer.question())
        .answer(answer.answer())
        .sources(new ArrayList<>(answer.sources()))
        .grounding(answer.grounding())
        .unverifiedCitations(answer.unverifiedCitations())
        .build();
  }
}
