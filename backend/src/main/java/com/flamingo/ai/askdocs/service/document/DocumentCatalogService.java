package com.flamingo.ai.askdocs.service.document;

import com.flamingo.ai.askdocs.api.dto.response.StoreStats;
import java.util.List;

/** Read-only views over the ingested corpus. */
public interface DocumentCatalogService {

  /**
   * Lists the files that can be asked about.
   *
   * @return names of READY documents, sorted
   */
  List<String> listFiles();

  /**
   * Gets the parsed text of a document, whatever its status.
   *
   * @throws com.flamingo.ai.askdocs.exception.DocumentNotFoundException if no record exists
   */
  String getDocumentText(String fileName);

  StoreStats storeStats();
}
