package com.flamingo.ai.askdocs.api.dto.response;

import com.flamingo.ai.askdocs.domain.enums.IngestionStatus;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for corpus statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreStats {
  private Map<IngestionStatus, Long> documentsByStatus;
  private long totalChunks;
  private long embeddedChunks;
  private long stagedFiles;
  private LocalDateTime timestamp;
}
