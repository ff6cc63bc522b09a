package com.flamingo.ai.askdocs.service.staging;

import com.flamingo.ai.askdocs.config.RagConfig;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Deletes leftover uploads that were never cleaned up by their request. */
@Component
@RequiredArgsConstructor
@Slf4j
public class UploadCleanupJob {

  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** Runs at startup and then every 4 hours by default. */
  @Scheduled(initialDelay = 0, fixedDelayString = "${rag.staging.cleanup-interval-ms:14400000}")
  public void cleanupUploads() {
    Path uploadDir = Paths.get(ragConfig.getStaging().getUploadDirectory());
    Instant cutoff = Instant.now().minus(ragConfig.getStaging().getUploadMaxAge());
    try {
      int deleted = deleteOlderThan(uploadDir, cutoff);
      if (deleted > 0) {
        log.info("Upload cleanup removed {} file(s) from {}", deleted, uploadDir);
      }
    } catch (UncheckedIOException e) {
      log.error("Upload cleanup failed for {}: {}", uploadDir, e.getMessage(), e);
    }
  }

  /** Deletes regular files in {@code dir} last modified before {@code cutoff}. */
  @VisibleForTesting
  int deleteOlderThan(Path dir, Instant cutoff) {
    if (!Files.isDirectory(dir)) {
      return 0;
    }
    List<Path> files;
    try (Stream<Path> stream = Files.list(dir)) {
      files = stream.filter(Files::isRegularFile).toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + dir, e);
    }
    int deleted = 0;
    for (Path file : files) {
      try {
        if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)
            && Files.deleteIfExists(file)) {
          deleted++;
        }
      } catch (IOException e) {
        log.warn("Could not delete old upload {}: {}", file, e.getMessage());
      }
    }
    meterRegistry.counter("uploads.cleaned").increment(deleted);
    return deleted;
  }
}
