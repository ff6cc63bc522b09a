package com.flamingo.ai.askdocs.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Audit row for one question asked of the corpus. */
@Entity
@Table(name = "interaction_logs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InteractionLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  private String userName;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String question;

  @Column(nullable = false)
  private LocalDateTime askedAt;

  private boolean success;

  /** Serialized answer, null when the request failed. */
  @Column(columnDefinition = "TEXT")
  private String response;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @PrePersist
  protected void onCreate() {
    if (askedAt == null) {
      askedAt = LocalDateTime.now();
    }
  }
}
