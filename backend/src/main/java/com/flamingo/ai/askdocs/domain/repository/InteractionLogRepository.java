package com.flamingo.ai.askdocs.domain.repository;

import com.flamingo.ai.askdocs.domain.entity.InteractionLog;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for InteractionLog entities. */
@Repository
public interface InteractionLogRepository extends JpaRepository<InteractionLog, UUID> {

  /** Most recent 100 interactions in the window, newest first. */
  List<InteractionLog> findTop100ByAskedAtBetweenOrderByAskedAtDesc(
      LocalDateTime start, LocalDateTime end);
}
