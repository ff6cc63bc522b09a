package com.flamingo.ai.askdocs.service.ingestion;

import com.flamingo.ai.askdocs.config.RagConfig;
import com.flamingo.ai.askdocs.domain.entity.Document;
import com.flamingo.ai.askdocs.domain.enums.IngestionStatus;
import com.flamingo.ai.askdocs.domain.enums.IngestionStep;
import com.flamingo.ai.askdocs.domain.repository.ChunkStore;
import com.flamingo.ai.askdocs.domain.repository.DocumentRepository;
import com.flamingo.ai.askdocs.elasticsearch.DocumentChunk;
import com.flamingo.ai.askdocs.exception.ChunkInsertFailedException;
import com.flamingo.ai.askdocs.exception.ConcurrentIngestionException;
import com.flamingo.ai.askdocs.exception.DocumentNotFoundException;
import com.flamingo.ai.askdocs.exception.EmbeddingFailedException;
import com.flamingo.ai.askdocs.exception.IngestionException;
import com.flamingo.ai.askdocs.exception.ParseFailedException;
import com.flamingo.ai.askdocs.exception.StagedFileNotFoundException;
import com.flamingo.ai.askdocs.exception.StagingFailedException;
import com.flamingo.ai.askdocs.service.rag.chunking.LineWindowChunker;
import com.flamingo.ai.askdocs.service.rag.chunking.TextChunk;
import com.flamingo.ai.askdocs.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.askdocs.service.rag.parsing.DocumentParseService;
import com.flamingo.ai.askdocs.service.staging.StagedFile;
import com.flamingo.ai.askdocs.service.staging.StagingArea;
import com.flamingo.ai.askdocs.service.staging.StagingNames;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DocumentIngestionService. */
@Service
@Slf4j
public class DocumentIngestionServiceImpl implements DocumentIngestionService {

  private static final Set<String> SUPPORTED_MIME_TYPES =
      Set.of(
          "application/pdf",
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "text/plain");

  private static final long MAX_UPLOAD_BYTES = 50L * 1024 * 1024;

  private final DocumentRepository documentRepository;
  private final ChunkStore chunkStore;
  private final StagingArea stagingArea;
  private final DocumentParseService documentParseService;
  private final LineWindowChunker chunker;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  /** File names with a run in progress. */
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public DocumentIngestionServiceImpl(
      DocumentRepository documentRepository,
      ChunkStore chunkStore,
      StagingArea stagingArea,
      DocumentParseService documentParseService,
      LineWindowChunker chunker,
      EmbeddingService embeddingService,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.documentRepository = documentRepository;
    this.chunkStore = chunkStore;
    this.stagingArea = stagingArea;
    this.documentParseService = documentParseService;
    this.chunker = chunker;
    this.embeddingService = embeddingService;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.clock = Clock.systemUTC();
  }

  @Override
  @Timed(value = "ingestion.run", description = "Time to ingest a document")
  public IngestionResult ingest(String fileName, IngestionSource source) {
    requireFileName(fileName);
    acquire(fileName);
    try {
      IngestionResult result = runPipeline(fileName, source);
      meterRegistry.counter("ingestion.success").increment();
      return result;
    } catch (IngestionException e) {
      meterRegistry.counter("ingestion.failure", "step", e.getStep().name()).increment();
      log.error("[INGEST] {} failed at step={}: {}", fileName, e.getStep(), e.getMessage(), e);
      throw e;
    } finally {
      inFlight.remove(fileName);
    }
  }

  private IngestionResult runPipeline(String fileName, IngestionSource source) {
    String ingestionId = UUID.randomUUID().toString();
    log.info("[INGEST] {} run={} source={}", fileName, ingestionId, describe(source));

    String previousStagedName;
    try {
      previousStagedName =
          documentRepository.findByFileName(fileName).map(Document::getStagedName).orElse(null);
    } catch (RuntimeException e) {
      throw new IngestionException(
          fileName, IngestionStep.DEDUP, "Failed to look up existing document", e);
    }

    // Resolve before deleting anything, so a missing file leaves the corpus untouched
    StagedFile existing = null;
    if (source instanceof IngestionSource.ExistingStaged) {
      existing = resolveStaged(fileName, previousStagedName);
    }

    dedup(fileName);

    StagedFile staged;
    if (source instanceof IngestionSource.NewUpload upload) {
      staged = stageUpload(fileName, upload.localFile());
      if (previousStagedName != null && !previousStagedName.equals(staged.name())) {
        removeStagedQuietly(previousStagedName);
      }
    } else {
      staged = existing;
    }

    Document document = parse(fileName, staged, ingestionId);
    int chunkCount = chunk(document);
    int embedded = embed(document);

    document.markReady();
    document = documentRepository.save(document);
    log.info(
        "[INGEST] {} ready: {} chunks, {} embedded, staged as {}",
        fileName,
        chunkCount,
        embedded,
        staged.name());
    return new IngestionResult(
        fileName, staged.name(), ingestionId, chunkCount, embedded, document.getStatus());
  }

  private void dedup(String fileName) {
    log.info("[INGEST] {} step=DEDUP", fileName);
    try {
      long chunks = chunkStore.deleteByFileName(fileName);
      int documents = documentRepository.deleteByFileName(fileName);
      log.info(
          "[INGEST] {} step=DEDUP removed {} chunks, {} document(s)", fileName, chunks, documents);
    } catch (RuntimeException e) {
      throw new IngestionException(
          fileName, IngestionStep.DEDUP, "Failed to delete previous records", e);
    }
  }

  /**
   * Finds the staged blob for a re-ingestion: the previously recorded blob, a blob named exactly
   * like the file, or the first blob whose name contains the file name.
   */
  private StagedFile resolveStaged(String fileName, String previousStagedName) {
    try {
      Optional<StagedFile> found = Optional.empty();
      if (previousStagedName != null) {
        found = stagingArea.find(previousStagedName);
      }
      if (found.isEmpty()) {
        found = stagingArea.find(fileName);
      }
      if (found.isEmpty()) {
        found = stagingArea.list(fileName).stream().findFirst();
      }
      StagedFile staged = found.orElseThrow(() -> new StagedFileNotFoundException(fileName));
      log.info("[INGEST] {} step=STAGE using staged file {}", fileName, staged.name());
      return staged;
    } catch (IngestionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StagingFailedException(fileName, "Failed to look up staged file", e);
    }
  }

  private StagedFile stageUpload(String fileName, Path localFile) {
    log.info("[INGEST] {} step=STAGE", fileName);
    String stagedName = StagingNames.uploadName(fileName, clock);
    Path tempCopy = localFile.toAbsolutePath().resolveSibling(stagedName);
    try {
      Files.copy(localFile, tempCopy);
      stagingArea.put(tempCopy, stagedName);
      boolean present =
          stagingArea.list(stagedName).stream().anyMatch(f -> f.name().equals(stagedName));
      if (!present) {
        throw new StagingFailedException(
            fileName, "Staged file " + stagedName + " not found after transfer", null);
      }
      StagedFile staged =
          stagingArea
              .find(stagedName)
              .orElseThrow(
                  () ->
                      new StagingFailedException(
                          fileName, "Staged file " + stagedName + " disappeared", null));
      log.info(
          "[INGEST] {} step=STAGE staged as {} ({} bytes)", fileName, stagedName, staged.size());
      return staged;
    } catch (IngestionException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      throw new StagingFailedException(fileName, "Failed to stage " + localFile, e);
    } finally {
      deleteLocalQuietly(tempCopy);
    }
  }

  private Document parse(String fileName, StagedFile staged, String ingestionId) {
    log.info("[INGEST] {} step=PARSE mode={}", fileName, ragConfig.getParsing().getMode());
    try {
      String content = documentParseService.parse(staged, ragConfig.getParsing().getMode());
      Document document =
          Document.builder()
              .fileName(fileName)
              .stagedName(staged.name())
              .parsedContent(content)
              .ingestionId(ingestionId)
              .status(IngestionStatus.PARSED)
              .build();
      document = documentRepository.save(document);
      log.info("[INGEST] {} step=PARSE stored {} chars", fileName, content.length());
      return document;
    } catch (RuntimeException e) {
      throw new ParseFailedException(fileName, "Failed to parse " + staged.name(), e);
    }
  }

  private int chunk(Document document) {
    String fileName = document.getFileName();
    log.info("[INGEST] {} step=CHUNK", fileName);
    try {
      List<TextChunk> windows = chunker.chunk(document.getParsedContent());
      List<DocumentChunk> chunks =
          windows.stream()
              .map(
                  w ->
                      DocumentChunk.builder()
                          .id(DocumentChunk.idFor(document.getIngestionId(), w.chunkId()))
                          .fileName(fileName)
                          .chunkId(w.chunkId())
                          .chunkText(w.text())
                          .ingestionId(document.getIngestionId())
                          .build())
              .toList();
      chunkStore.insertChunks(chunks);
      document.markChunked(chunks.size());
      documentRepository.save(document);
      log.info("[INGEST] {} step=CHUNK stored {} chunks", fileName, chunks.size());
      return chunks.size();
    } catch (RuntimeException e) {
      markFailed(document, IngestionStep.CHUNK, e);
      throw new ChunkInsertFailedException(fileName, "Failed to store chunks", e);
    }
  }

  private int embed(Document document) {
    String fileName = document.getFileName();
    log.info("[INGEST] {} step=EMBED model={}", fileName, embeddingService.modelName());
    try {
      int embedded = embedMissing(fileName);
      log.info("[INGEST] {} step=EMBED embedded {} chunks", fileName, embedded);
      return embedded;
    } catch (RuntimeException e) {
      markFailed(document, IngestionStep.EMBED, e);
      throw new EmbeddingFailedException(fileName, "Failed to embed chunks", e);
    }
  }

  /** Only a run whose chunks were stored can be finished by embedding. */
  private static void requireEmbeddable(Document document) {
    IngestionStatus status = document.getStatus();
    boolean failedAtEmbed =
        status == IngestionStatus.FAILED && document.getFailedStep() == IngestionStep.EMBED;
    if (status != IngestionStatus.CHUNKED && status != IngestionStatus.READY && !failedAtEmbed) {
      String fileName = document.getFileName();
      throw new IngestionException(
          fileName,
          IngestionStep.EMBED,
          "Cannot embed "
              + fileName
              + " in state "
              + status
              + " (failed step "
              + document.getFailedStep()
              + ")",
          null,
          "The chunks of " + fileName + " were never stored. Re-ingest the file.");
    }
  }

  private void requireComplete(Document document) {
    String fileName = document.getFileName();
    int expected = document.getChunkCount() != null ? document.getChunkCount() : 0;
    int stored = chunkStore.findByFileName(fileName).size();
    int pending = chunkStore.findWithoutEmbedding(fileName).size();
    if (stored != expected || pending > 0) {
      throw new IngestionException(
          fileName,
          IngestionStep.EMBED,
          "Expected "
              + expected
              + " embedded chunks for "
              + fileName
              + " but found "
              + stored
              + " stored, "
              + pending
              + " without embedding",
          null,
          "The chunks of " + fileName + " are incomplete. Re-ingest the file.");
    }
  }

  /** Embeds every chunk of the file that has no embedding. Returns how many were embedded. */
  private int embedMissing(String fileName) {
    List<DocumentChunk> pending = chunkStore.findWithoutEmbedding(fileName);
    if (pending.isEmpty()) {
      return 0;
    }
    List<List<Float>> vectors =
        embeddingService.embedPassages(pending.stream().map(DocumentChunk::getChunkText).toList());
    Map<String, List<Float>> byId = new LinkedHashMap<>();
    for (int i = 0; i < pending.size(); i++) {
      byId.put(pending.get(i).getId(), vectors.get(i));
    }
    chunkStore.updateEmbeddings(byId);
    return pending.size();
  }

  @Override
  public IngestionResult ingestUpload(MultipartFile file) {
    validateFile(file);
    String fileName = baseName(file.getOriginalFilename());
    Path uploadDir = Paths.get(ragConfig.getStaging().getUploadDirectory());
    Path upload = uploadDir.resolve(UUID.randomUUID() + StagingNames.extensionOf(fileName));
    try {
      Files.createDirectories(uploadDir);
      file.transferTo(upload);
    } catch (IOException e) {
      deleteLocalQuietly(upload);
      throw new StagingFailedException(fileName, "Failed to receive upload", e);
    }
    try {
      return ingestNew(fileName, upload);
    } finally {
      deleteLocalQuietly(upload);
    }
  }

  @Override
  @Timed(value = "ingestion.embed_pending", description = "Time to embed pending chunks")
  public IngestionResult embedPending(String fileName) {
    requireFileName(fileName);
    acquire(fileName);
    try {
      Document document =
          documentRepository
              .findByFileName(fileName)
              .orElseThrow(() -> new DocumentNotFoundException(fileName));
      requireEmbeddable(document);
      int embedded = embed(document);
      requireComplete(document);
      document.markReady();
      document = documentRepository.save(document);
      int chunkCount = document.getChunkCount() != null ? document.getChunkCount() : 0;
      return new IngestionResult(
          fileName,
          document.getStagedName(),
          document.getIngestionId(),
          chunkCount,
          embedded,
          document.getStatus());
    } catch (IngestionException e) {
      meterRegistry.counter("ingestion.failure", "step", e.getStep().name()).increment();
      throw e;
    } finally {
      inFlight.remove(fileName);
    }
  }

  @Override
  @Timed(value = "ingestion.remove", description = "Time to remove a document")
  public RemovalResult remove(String fileName) {
    requireFileName(fileName);
    acquire(fileName);
    try {
      String stagedName =
          documentRepository.findByFileName(fileName).map(Document::getStagedName).orElse(null);
      long chunks = chunkStore.deleteByFileName(fileName);
      boolean documentRemoved = documentRepository.deleteByFileName(fileName) > 0;

      boolean stagedRemoved = false;
      try {
        if (stagedName != null) {
          stagedRemoved = stagingArea.remove(stagedName);
        } else {
          // No remembered blob: fall back to blobs named after the file
          stagedRemoved = stagingArea.removeMatching(fileName) > 0;
        }
      } catch (RuntimeException e) {
        log.warn(
            "Removed records for {} but could not remove its staged file: {}",
            fileName,
            e.getMessage());
        meterRegistry.counter("ingestion.remove.staging_failure").increment();
      }

      log.info(
          "Removed {}: {} chunks, document={}, stagedFile={}",
          fileName,
          chunks,
          documentRemoved,
          stagedRemoved);
      meterRegistry.counter("document.removed").increment();
      return new RemovalResult(fileName, chunks, documentRemoved, stagedRemoved);
    } finally {
      inFlight.remove(fileName);
    }
  }

  private void acquire(String fileName) {
    if (!inFlight.add(fileName)) {
      throw new ConcurrentIngestionException(fileName);
    }
  }

  private void markFailed(Document document, IngestionStep step, Exception cause) {
    try {
      document.markFailed(step, cause.getMessage());
      documentRepository.save(document);
    } catch (RuntimeException e) {
      log.warn(
          "Could not record failure of {} at {}: {}",
          document.getFileName(),
          step,
          e.getMessage());
    }
  }

  private void removeStagedQuietly(String stagedName) {
    try {
      if (stagingArea.remove(stagedName)) {
        log.info("Removed superseded staged file {}", stagedName);
      }
    } catch (RuntimeException e) {
      log.warn("Could not remove superseded staged file {}: {}", stagedName, e.getMessage());
    }
  }

  private void deleteLocalQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete local file {}: {}", path, e.getMessage());
    }
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("Please upload a non-empty file");
    }
    String contentType = file.getContentType();
    if (contentType == null || !SUPPORTED_MIME_TYPES.contains(contentType)) {
      throw new IllegalArgumentException(
          "Unsupported file type: " + contentType + ". Supported formats: PDF, DOCX, TXT");
    }
    if (file.getSize() > MAX_UPLOAD_BYTES) {
      throw new IllegalArgumentException("Maximum file size is 50MB");
    }
  }

  private static void requireFileName(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      throw new IllegalArgumentException("fileName must not be blank");
    }
  }

  /** Strips any client-side directory, keeping the last path segment. */
  static String baseName(String originalFileName) {
    if (originalFileName == null) {
      throw new IllegalArgumentException("Uploaded file has no name");
    }
    int separator = Math.max(originalFileName.lastIndexOf('/'), originalFileName.lastIndexOf('\\'));
    String name = originalFileName.substring(separator + 1);
    if (name.isBlank()) {
      throw new IllegalArgumentException("Uploaded file has no name");
    }
    return name.trim();
  }

  private static String describe(IngestionSource source) {
    return source instanceof IngestionSource.NewUpload ? "new upload" : "existing staged file";
  }
}
