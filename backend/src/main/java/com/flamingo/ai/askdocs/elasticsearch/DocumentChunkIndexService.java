package com.flamingo.ai.askdocs.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.json.JsonData;
import com.flamingo.ai.askdocs.config.RagConfig;
import com.flamingo.ai.askdocs.domain.repository.ChunkStore;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for document chunks.
 *
 * <p>Holds the chunk relation: {@code fileName} and {@code chunkId} identify a chunk, {@code
 * embedding} is a cosine dense vector that is absent until the chunk has been embedded.
 *
 * <p>Nearest-neighbour queries score every embedded chunk with an exact {@code script_score}
 * cosine, so the best chunks are never lost to approximate kNN.
 */
@Service
@Slf4j
public class DocumentChunkIndexService extends AbstractElasticsearchIndexService<DocumentChunk>
    implements ChunkStore {

  static final String FILE_NAME = "fileName";
  static final String CHUNK_ID = "chunkId";
  static final String CHUNK_TEXT = "chunkText";
  static final String INGESTION_ID = "ingestionId";
  static final String EMBEDDING = "embedding";

  private static final int MAX_RESULT_WINDOW = 10_000;

  /** Shifted by one because script scores must not be negative. */
  private static final String COSINE_SCRIPT =
      "cosineSimilarity(params.query_vector, '" + EMBEDDING + "') + 1.0";

  @Value("${elasticsearch.index-name:askdocs-chunks}")
  private String indexName;

  private int vectorDimensions;

  @Autowired
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, RagConfig ragConfig) {
    super(elasticsearchClient, meterRegistry);
    this.vectorDimensions = ragConfig.getEmbedding().getDimensions();
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // fileName and ingestionId MUST be keyword type for exact matching
    properties.put(FILE_NAME, Property.of(p -> p.keyword(k -> k)));
    properties.put(INGESTION_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(CHUNK_ID, Property.of(p -> p.integer(i -> i)));
    properties.put(CHUNK_TEXT, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(DocumentChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(FILE_NAME, chunk.getFileName());
    document.put(CHUNK_ID, chunk.getChunkId());
    document.put(CHUNK_TEXT, chunk.getChunkText());
    document.put(INGESTION_ID, chunk.getIngestionId());
    return document;
  }

  @Override
  protected DocumentChunk convertFromDocument(Map<String, Object> source) {
    return DocumentChunk.builder()
        .id((String) source.get("id"))
        .fileName((String) source.get(FILE_NAME))
        .chunkId(((Number) source.get(CHUNK_ID)).intValue())
        .chunkText((String) source.get(CHUNK_TEXT))
        .ingestionId((String) source.get(INGESTION_ID))
        .embedding(toFloatList(source.get(EMBEDDING)))
        .build();
  }

  @Override
  protected String getDocumentId(DocumentChunk entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    int k = Math.min(topK, MAX_RESULT_WINDOW);
    log.debug("exact vectorSearch topK={} embedding size={}", k, queryEmbedding.size());

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .query(
                    q ->
                        q.scriptScore(
                            ss ->
                                ss.query(inner -> inner.exists(e -> e.field(EMBEDDING)))
                                    .script(
                                        sc ->
                                            sc.source(src -> src.scriptString(COSINE_SCRIPT))
                                                .params(
                                                    "query_vector",
                                                    JsonData.of(queryEmbedding)))))
                .trackScores(true)
                .sort(so -> so.score(sc -> sc.order(SortOrder.Desc)))
                .sort(so -> so.field(f -> f.field(FILE_NAME).order(SortOrder.Asc)))
                .sort(so -> so.field(f -> f.field(CHUNK_ID).order(SortOrder.Asc)))
                .size(k));
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    String fileName = (String) criteria.get(FILE_NAME);
    if (fileName == null) {
      throw new IllegalArgumentException("deleteBy requires fileName in criteria");
    }
    return fileNameQuery(fileName);
  }

  @Override
  protected String getMetricPrefix() {
    return "document_chunk";
  }

  @Override
  @Timed(value = "chunks.delete", description = "Time to delete the chunks of a file")
  @CircuitBreaker(name = "elasticsearch")
  public long deleteByFileName(String fileName) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(FILE_NAME, fileName);
    return deleteBy(criteria);
  }

  @Override
  @Timed(value = "chunks.insert", description = "Time to store chunks")
  @CircuitBreaker(name = "elasticsearch")
  public void insertChunks(List<DocumentChunk> chunks) {
    indexDocuments(chunks);
  }

  @Override
  @Timed(value = "chunks.find", description = "Time to read the chunks of a file")
  @CircuitBreaker(name = "elasticsearch")
  public List<DocumentChunk> findByFileName(String fileName) {
    return searchAll(fileNameQuery(fileName), CHUNK_ID);
  }

  @Override
  @Timed(value = "chunks.find_unembedded", description = "Time to read unembedded chunks")
  @CircuitBreaker(name = "elasticsearch")
  public List<DocumentChunk> findWithoutEmbedding(String fileName) {
    Query query =
        Query.of(
            q ->
                q.bool(
                    b ->
                        b.filter(f -> f.term(t -> t.field(FILE_NAME).value(fileName)))
                            .mustNot(m -> m.exists(e -> e.field(EMBEDDING)))));
    return searchAll(query, CHUNK_ID);
  }

  @Override
  @Timed(value = "chunks.update_embeddings", description = "Time to store embeddings")
  @CircuitBreaker(name = "elasticsearch")
  public void updateEmbeddings(Map<String, List<Float>> embeddingsById) {
    Map<String, Map<String, Object>> updates = new LinkedHashMap<>();
    embeddingsById.forEach((id, vector) -> updates.put(id, Map.of(EMBEDDING, vector)));
    updateDocuments(updates);
  }

  @Override
  @Timed(value = "chunks.find_nearest", description = "Time for exact nearest-chunk search")
  @CircuitBreaker(name = "elasticsearch")
  public List<DocumentChunk> findNearest(List<Float> queryEmbedding, int k) {
    List<DocumentChunk> hits = vectorSearch(Map.of(), queryEmbedding, k);
    for (DocumentChunk hit : hits) {
      if (hit.getRelevanceScore() != null) {
        hit.setRelevanceScore(hit.getRelevanceScore() - 1);
      }
    }
    return hits;
  }

  @Override
  @Timed(value = "chunks.find_range", description = "Time to read a range of chunks")
  @CircuitBreaker(name = "elasticsearch")
  public List<DocumentChunk> findRange(String fileName, int fromChunkId, int toChunkId) {
    Query query =
        Query.of(
            q ->
                q.bool(
                    b ->
                        b.filter(f -> f.term(t -> t.field(FILE_NAME).value(fileName)))
                            .filter(
                                f ->
                                    f.range(
                                        r ->
                                            r.number(
                                                n ->
                                                    n.field(CHUNK_ID)
                                                        .gte((double) fromChunkId)
                                                        .lte((double) toChunkId))))));
    return searchAll(query, CHUNK_ID);
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public long countChunks() {
    return count(Query.of(q -> q.matchAll(m -> m)));
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public long countEmbeddedChunks() {
    return count(Query.of(q -> q.exists(e -> e.field(EMBEDDING))));
  }

  private static Query fileNameQuery(String fileName) {
    return Query.of(q -> q.term(t -> t.field(FILE_NAME).value(fileName)));
  }

  private static List<Float> toFloatList(Object value) {
    if (!(value instanceof List<?> values)) {
      return null;
    }
    List<Float> result = new ArrayList<>(values.size());
    for (Object v : values) {
      result.add(((Number) v).floatValue());
    }
    return result;
  }
}
