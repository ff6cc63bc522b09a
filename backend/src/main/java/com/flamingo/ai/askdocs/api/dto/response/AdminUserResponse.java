package com.flamingo.ai.askdocs.api.dto.response;

import com.flamingo.ai.askdocs.domain.entity.AdminUser;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an allowlisted admin. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminUserResponse {

  private String username;
  private String addedBy;
  private LocalDateTime addedAt;

  /** Creates an AdminUserResponse from an AdminUser entity. */
  public static AdminUserResponse fromEntity(AdminUser admin) {
    return AdminUserResponse.builder()
        .username(admin.getUsername())
        .addedBy(admin.getAddedBy())
        .addedAt(admin.getAddedAt())
        .build();
  }
}
