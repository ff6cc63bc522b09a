package com.flamingo.ai.askdocs.service.rag.chunking;

import com.flamingo.ai.askdocs.config.RagConfig;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits parsed content into fixed windows of consecutive lines.
 *
 * <p>Lines are split on {@code \n} (trailing empty lines included), grouped in windows of {@code
 * linesPerChunk}, and joined back with {@code \n}. Windows whose text is not longer than {@code
 * minChunkLength} are dropped. The output depends only on the content.
 */
@Component
@Slf4j
public class LineWindowChunker {

  private final int linesPerChunk;
  private final int minChunkLength;

  @Autowired
  public LineWindowChunker(RagConfig ragConfig) {
    this(ragConfig.getChunking().getLinesPerChunk(), ragConfig.getChunking().getMinChunkLength());
  }

  @VisibleForTesting
  public LineWindowChunker(int linesPerChunk, int minChunkLength) {
    if (linesPerChunk < 1) {
      throw new IllegalArgumentException("linesPerChunk must be positive: " + linesPerChunk);
    }
    this.linesPerChunk = linesPerChunk;
    this.minChunkLength = minChunkLength;
  }

  public List<TextChunk> chunk(String content) {
    if (content == null || content.isEmpty()) {
      return List.of();
    }
    String[] lines = content.split("\n", -1);
    List<TextChunk> chunks = new ArrayList<>();
    int dropped = 0;
    for (int start = 0; start < lines.length; start += linesPerChunk) {
      int end = Math.min(start + linesPerChunk, lines.length);
      String text = String.join("\n", Arrays.asList(lines).subList(start, end));
      if (text.length() > minChunkLength) {
        chunks.add(new TextChunk(chunks.size() + 1, text));
      } else {
        dropped++;
      }
    }
    log.debug(
        "Chunked {} lines into {} chunks ({} short windows dropped)",
        lines.length,
        chunks.size(),
        dropped);
    return chunks;
  }
}
