package com.flamingo.ai.askdocs.elasticsearch;

import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Indexes multiple documents in bulk. Changes are visible to search when this returns.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Applies partial updates in bulk. Changes are visible to search when this returns.
   *
   * @param fieldsById fields to set, keyed by document ID
   */
  void updateDocuments(Map<ID, Map<String, Object>> fieldsById);

  /**
   * Performs approximate nearest-neighbour search over the embedding field.
   *
   * @param filterCriteria key-value pairs for filtering, may be empty
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return list of matching documents ordered by similarity
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Returns every document matching the query, ordered ascending by the sort field.
   *
   * @param query the query
   * @param sortField a numeric field that is unique among the matching documents
   * @return the matching documents
   */
  List<T> searchAll(Query query, String sortField);

  /**
   * Counts documents matching the query.
   *
   * @param query the query
   * @return the number of matching documents
   */
  long count(Query query);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to delete
   * @return the number of deleted documents
   */
  long deleteBy(Map<String, Object> criteria);

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
