package com.flamingo.ai.askdocs.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides common functionality for indexing, updating, searching, and deleting documents with
 * vector embeddings. Subclasses define document-specific schema and conversion logic. Writes use
 * an immediate refresh so the next read of the pipeline sees them. Failures propagate to the
 * caller.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  /** Page size for {@link #searchAll(Query, String)}; also the default max result window. */
  protected static final int PAGE_SIZE = 1000;

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Returns the vector embedding dimensions.
   *
   * @return the vector dimensions, which must match the embedding model output
   */
  protected abstract int getVectorDimensions();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /**
   * Builds the vector search request with filters.
   *
   * @param filterCriteria the filter criteria
   * @param queryEmbedding the query embedding
   * @param topK the number of results
   * @return the search request
   */
  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Builds the delete by query request with criteria.
   *
   * @param criteria the delete criteria
   * @return the delete query
   */
  protected abstract Query buildDeleteQuery(Map<String, Object> criteria);

  /** Returns the metric prefix for this index (e.g., "document_chunk"). */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (Exception e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false: only the declared fields are mapped
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches.
   *
   * <p>Elasticsearch allows adding new fields via the Put Mapping API but does not allow changing
   * the type of existing fields, so a mismatch fails startup and the index has to be recreated.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      String field = entry.getKey();
      Property expected = entry.getValue();
      Property actual = actualProperties.get(field);
      if (actual != null && expected._kind() != actual._kind()) {
        String msg =
            String.format(
                "Mapping mismatch in index '%s': field '%s' expected type '%s' but found '%s'. "
                    + "Delete the index and restart the application to apply correct mappings.",
                getIndexName(), field, expected._kind(), actual._kind());
        log.error(msg);
        mismatches.add(msg);
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s). "
              + String.join("; ", mismatches));
    }

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      if (!actualProperties.containsKey(entry.getKey())) {
        missingFields.put(entry.getKey(), entry.getValue());
      }
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.True);
    for (T document : documents) {
      String id = getDocumentId(document);
      Map<String, Object> docMap = convertToDocument(document);
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
    }
    executeBulk(bulkBuilder.build(), "index", documents.size());
    meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
  }

  @Override
  public void updateDocuments(Map<String, Map<String, Object>> fieldsById) {
    if (fieldsById.isEmpty()) {
      return;
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.True);
    for (Map.Entry<String, Map<String, Object>> entry : fieldsById.entrySet()) {
      String id = entry.getKey();
      Map<String, Object> fields = entry.getValue();
      bulkBuilder.operations(
          op -> op.update(u -> u.index(getIndexName()).id(id).action(a -> a.doc(fields))));
    }
    executeBulk(bulkBuilder.build(), "update", fieldsById.size());
    meterRegistry.counter(getMetricPrefix() + ".updated").increment(fieldsById.size());
  }

  private void executeBulk(BulkRequest request, String action, int size) {
    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(request);
    } catch (IOException e) {
      log.error(
          "Bulk {} of {} documents failed for {}: {}",
          action,
          size,
          getIndexName(),
          e.getMessage(),
          e);
      throw new UncheckedIOException("Bulk " + action + " failed for " + getIndexName(), e);
    }
    if (response.errors()) {
      List<String> reasons = new ArrayList<>();
      for (BulkResponseItem item : response.items()) {
        if (item.error() != null) {
          reasons.add(item.id() + ": " + item.error().reason());
        }
      }
      meterRegistry.counter(getMetricPrefix() + "." + action + ".errors").increment();
      log.error(
          "{} of {} documents failed to {} in {}: {}",
          reasons.size(),
          size,
          action,
          getIndexName(),
          reasons);
      throw new IllegalStateException(
          reasons.size()
              + " document(s) failed to "
              + action
              + " in "
              + getIndexName()
              + ": "
              + reasons.get(0));
    }
    log.debug("Bulk {} of {} documents to {}", action, size, getIndexName());
  }

  @Override
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(filterCriteria, queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      logSearchResults("vectorSearch", response);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new UncheckedIOException("Vector search failed", e);
    }
  }

  @Override
  public List<T> searchAll(Query query, String sortField) {
    List<T> results = new ArrayList<>();
    Long searchAfter = null;
    try {
      while (true) {
        Long after = searchAfter;
        SearchRequest request =
            SearchRequest.of(
                s -> {
                  s.index(getIndexName())
                      .query(query)
                      .size(PAGE_SIZE)
                      .sort(so -> so.field(f -> f.field(sortField).order(SortOrder.Asc)));
                  if (after != null) {
                    s.searchAfter(List.of(FieldValue.of(after)));
                  }
                  return s;
                });
        SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
        List<Hit<Map>> hits = response.hits().hits();
        results.addAll(mapHitsToDocuments(hits));
        if (hits.size() < PAGE_SIZE) {
          return results;
        }
        List<FieldValue> sortValues = hits.get(hits.size() - 1).sort();
        searchAfter = sortValues.get(0).longValue();
      }
    } catch (IOException e) {
      log.error("Search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new UncheckedIOException("Search failed", e);
    }
  }

  @Override
  public long count(Query query) {
    try {
      return elasticsearchClient.count(c -> c.index(getIndexName()).query(query)).count();
    } catch (IOException e) {
      log.error("Count failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new UncheckedIOException("Count failed", e);
    }
  }

  @Override
  public long deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildDeleteQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery).refresh(true));
      DeleteByQueryResponse response = elasticsearchClient.deleteByQuery(request);
      long deleted = response.deleted() != null ? response.deleted() : 0L;
      log.info("Deleted {} documents from {} with criteria: {}", deleted, getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
      return deleted;
    } catch (IOException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new UncheckedIOException("Failed to delete documents", e);
    }
  }

  private void logSearchResults(String searchType, SearchResponse<Map> response) {
    List<Hit<Map>> hits = response.hits().hits();
    long totalHits =
        response.hits().total() != null ? response.hits().total().value() : hits.size();
    log.info(
        "[{}] index={} totalHits={} returned={}",
        searchType,
        getIndexName(),
        totalHits,
        hits.size());
    if (log.isDebugEnabled()) {
      for (int i = 0; i < hits.size(); i++) {
        Hit<Map> hit = hits.get(i);
        log.debug("  [{}] rank={} id={} score={}", searchType, i + 1, hit.id(), hit.score());
      }
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  /** Marker interface for documents that support relevance scoring. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
