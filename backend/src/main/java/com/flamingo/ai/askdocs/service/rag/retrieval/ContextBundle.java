package com.flamingo.ai.askdocs.service.rag.retrieval;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The context handed to answer generation: ordered chunks plus the set of files they came from.
 */
public record ContextBundle(List<RetrievedChunk> chunks, Set<String> sources) {

  public ContextBundle {
    chunks = List.copyOf(chunks);
    sources = Collections.unmodifiableSet(new LinkedHashSet<>(sources));
  }

  public static ContextBundle empty() {
    return new ContextBundle(List.of(), Set.of());
  }

  /** Builds a bundle whose sources are the distinct file names of the chunks, in order. */
  public static ContextBundle of(List<RetrievedChunk> chunks) {
    Set<String> sources =
        chunks.stream()
            .map(RetrievedChunk::fileName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    return new ContextBundle(chunks, sources);
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }
}
