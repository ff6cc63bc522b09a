package com.flamingo.ai.askdocs.domain.entity;

import com.flamingo.ai.askdocs.domain.enums.IngestionStatus;
import com.flamingo.ai.askdocs.domain.enums.IngestionStep;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

/** One ingested source file. At most one record exists per file name. */
@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false, unique = true)
  private String fileName;

  /** Name of the blob in the staging area this record was parsed from. */
  @Column(nullable = false)
  private String stagedName;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String parsedContent;

  /** Generation tag shared with the chunks produced by the same run. */
  @Column(nullable = false)
  private String ingestionId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private IngestionStatus status = IngestionStatus.PARSED;

  @Enumerated(EnumType.STRING)
  private IngestionStep failedStep;

  @Column(columnDefinition = "TEXT")
  private String processingError;

  private Integer chunkCount;

  @Column(nullable = false, updatable = false)
  private LocalDateTime ingestedAt;

  private LocalDateTime completedAt;

  @PrePersist
  protected void onCreate() {
    ingestedAt = LocalDateTime.now();
  }

  /** Records that the chunks for this run were stored. */
  public void markChunked(int chunkCount) {
    this.status = IngestionStatus.CHUNKED;
    this.chunkCount = chunkCount;
  }

  /** Marks the document as fully embedded. */
  public void markReady() {
    this.status = IngestionStatus.READY;
    this.failedStep = null;
    this.processingError = null;
    this.completedAt = LocalDateTime.now();
  }

  /** Marks the document as failed at the given step. */
  public void markFailed(IngestionStep step, String errorMessage) {
    this.status = IngestionStatus.FAILED;
    this.failedStep = step;
    this.processingError = errorMessage;
    this.completedAt = LocalDateTime.now();
  }
}
