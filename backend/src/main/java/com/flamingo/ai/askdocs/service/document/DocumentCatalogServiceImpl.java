package com.flamingo.ai.askdocs.service.document;

import com.flamingo.ai.askdocs.api.dto.response.StoreStats;
import com.flamingo.ai.askdocs.domain.entity.Document;
import com.flamingo.ai.askdocs.domain.enums.IngestionStatus;
import com.flamingo.ai.askdocs.domain.repository.ChunkStore;
import com.flamingo.ai.askdocs.domain.repository.DocumentRepository;
import com.flamingo.ai.askdocs.exception.DocumentNotFoundException;
import com.flamingo.ai.askdocs.service.staging.StagingArea;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of DocumentCatalogService. */
@Service
@RequiredArgsConstructor
public class DocumentCatalogServiceImpl implements DocumentCatalogService {

  private final DocumentRepository documentRepository;
  private final ChunkStore chunkStore;
  private final StagingArea stagingArea;

  @Override
  @Transactional(readOnly = true)
  public List<String> listFiles() {
    return documentRepository.findByStatusOrderByFileNameAsc(IngestionStatus.READY).stream()
        .map(Document::getFileName)
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public String getDocumentText(String fileName) {
    return documentRepository
        .findByFileName(fileName)
        .map(Document::getParsedContent)
        .orElseThrow(() -> new DocumentNotFoundException(fileName));
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "catalog.stats", description = "Time to compute corpus statistics")
  public StoreStats storeStats() {
    Map<IngestionStatus, Long> byStatus = new EnumMap<>(IngestionStatus.class);
    for (IngestionStatus status : IngestionStatus.values()) {
      byStatus.put(status, documentRepository.countByStatus(status));
    }
    return StoreStats.builder()
        .documentsByStatus(byStatus)
        .totalChunks(chunkStore.countChunks())
        .embeddedChunks(chunkStore.countEmbeddedChunks())
        .stagedFiles(stagingArea.listAll().size())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
