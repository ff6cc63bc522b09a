package com.flamingo.ai.askdocs.domain.repository;

import com.flamingo.ai.askdocs.domain.entity.Document;
import com.flamingo.ai.askdocs.domain.enums.IngestionStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  Optional<Document> findByFileName(String fileName);

  /** Deletes the record for a file name, returning the number of rows removed. */
  @Transactional
  @Modifying
  @Query("DELETE FROM Document d WHERE d.fileName = :fileName")
  int deleteByFileName(@Param("fileName") String fileName);

  List<Document> findByStatusOrderByFileNameAsc(IngestionStatus status);

  long countByStatus(IngestionStatus status);
}
