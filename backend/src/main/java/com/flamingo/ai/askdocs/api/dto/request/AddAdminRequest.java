package com.flamingo.ai.askdocs.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for adding an admin. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddAdminRequest {

  @NotBlank(message = "Username is required")
  private String username;
}
