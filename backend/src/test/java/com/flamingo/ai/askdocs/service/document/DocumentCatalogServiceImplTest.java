package com.flamingo.ai.askdocs.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.flamingo.ai.askdocs.api.dto.response.StoreStats;
import com.flamingo.ai.askdocs.domain.entity.Document;
import com.flamingo.ai.askdocs.domain.enums.IngestionStatus;
import com.flamingo.ai.askdocs.domain.repository.DocumentRepository;
import com.flamingo.ai.askdocs.elasticsearch.DocumentChunk;
import com.flamingo.ai.askdocs.exception.DocumentNotFoundException;
import com.flamingo.ai.askdocs.service.staging.FileSystemStagingArea;
import com.flamingo.ai.askdocs.support.InMemoryChunkStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentCatalogService Tests")
class DocumentCatalogServiceImplTest {

  @TempDir Path tempDir;

  @Mock private DocumentRepository documentRepository;

  private InMemoryChunkStore chunkStore;
  private FileSystemStagingArea stagingArea;
  private DocumentCatalogServiceImpl service;

  @BeforeEach
  void setUp() {
    chunkStore = new InMemoryChunkStore();
    stagingArea = new FileSystemStagingArea(tempDir.resolve("stage"));
    service = new DocumentCatalogServiceImpl(documentRepository, chunkStore, stagingArea);
  }

  @Test
  @DisplayName("Should list only ready documents")
  void shouldListReadyDocuments() {
    when(documentRepository.findByStatusOrderByFileNameAsc(IngestionStatus.READY))
        .thenReturn(
            List.of(
                Document.builder().fileName("a.pdf").build(),
                Document.builder().fileName("b.txt").build()));

    assertThat(service.listFiles()).containsExactly("a.pdf", "b.txt");
  }

  @Test
  @DisplayName("Should return the parsed text of a document")
  void shouldReturnDocumentText() {
    when(documentRepository.findByFileName("a.pdf"))
        .thenReturn(
            Optional.of(Document.builder().fileName("a.pdf").parsedContent("text").build()));

    assertThat(service.getDocumentText("a.pdf")).isEqualTo("text");
  }

  @Test
  @DisplayName("Should fail for an unknown document")
  void shouldFailForUnknownDocument() {
    when(documentRepository.findByFileName("x.pdf")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getDocumentText("x.pdf"))
        .isInstanceOf(DocumentNotFoundException.class);
  }

  @Test
  @DisplayName("Should count documents, chunks and staged files")
  void shouldComputeStats() throws IOException {
    when(documentRepository.countByStatus(any(IngestionStatus.class))).thenReturn(0L);
    when(documentRepository.countByStatus(IngestionStatus.READY)).thenReturn(2L);
    chunkStore.insertChunks(
        List.of(
            DocumentChunk.builder().id("r:1").fileName("a.pdf").chunkId(1).chunkText("x").build(),
            DocumentChunk.builder().id("r:2").fileName("a.pdf").chunkId(2).chunkText("y").build()));
    chunkStore.updateEmbeddings(Map.of("r:1", List.of(1f, 0f)));
    stagingArea.put(Files.writeString(tempDir.resolve("a.pdf"), "x"), "a.pdf");

    StoreStats stats = service.storeStats();

    assertThat(stats.getDocumentsByStatus())
        .containsEntry(IngestionStatus.READY, 2L)
        .containsEntry(IngestionStatus.FAILED, 0L);
    assertThat(stats.getTotalChunks()).isEqualTo(2);
    assertThat(stats.getEmbeddedChunks()).isEqualTo(1);
    assertThat(stats.getStagedFiles()).isEqualTo(1);
  }
}
