package com.flamingo.ai.askdocs.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A user allowed to manage the corpus. */
@Entity
@Table(name = "admin_users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdminUser {

  /** Lower-cased user name. */
  @Id private String username;

  private String addedBy;

  @Column(nullable = false, updatable = false)
  private LocalDateTime addedAt;

  @PrePersist
  protected void onCreate() {
    addedAt = LocalDateTime.now();
  }
}
