package com.flamingo.ai.askdocs.api.dto.response;

import com.flamingo.ai.askdocs.domain.entity.InteractionLog;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an audited question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionLogResponse {

  private UUID id;
  private String userName;
  private String question;
  private LocalDateTime askedAt;
  private boolean success;
  private String response;
  private String errorMessage;

  /** Creates an InteractionLogResponse from an InteractionLog entity. */
  public static InteractionLogResponse fromEntity(InteractionLog log) {
    return InteractionLogResponse.builder()
        .id(log.getId())
        .userName(log.getUserName())
        .question(log.getQuestion())
        .askedAt(log.getAskedAt())
        .success(log.isSuccess())
        .response(log.getResponse())
        .errorMessage(log.getErrorMessage())
        .build();
  }
}
