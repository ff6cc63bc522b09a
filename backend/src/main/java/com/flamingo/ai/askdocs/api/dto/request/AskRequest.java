package com.flamingo.ai.askdocs.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 4000, message = "Question must be at most 4000 characters")
  private String question;
}
