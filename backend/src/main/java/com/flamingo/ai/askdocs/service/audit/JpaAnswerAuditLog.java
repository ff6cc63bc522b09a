package com.flamingo.ai.askdocs.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.askdocs.domain.entity.InteractionLog;
import com.flamingo.ai.askdocs.domain.repository.InteractionLogRepository;
import com.flamingo.ai.askdocs.service.rag.answer.Answer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Stores interactions in the {@code interaction_logs} table. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaAnswerAuditLog implements AnswerAuditLog {

  private final InteractionLogRepository interactionLogRepository;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  @Override
  public void recordAnswer(String userName, String question, Answer answer) {
    String response;
    try {
      response = objectMapper.writeValueAsString(answer);
    } catch (JsonProcessingException e) {
      log.warn("Could not serialize answer for audit: {}", e.getMessage());
      response = answer.answer();
    }
    save(
        InteractionLog.builder()
            .userName(userName)
            .question(question)
            .askedAt(LocalDateTime.now())
            .success(true)
            .response(response)
            .build());
  }

  @Override
  public void recordFailure(String userName, String question, Throwable error) {
    save(
        InteractionLog.builder()
            .userName(userName)
            .question(question)
            .askedAt(LocalDateTime.now())
            .success(false)
            .errorMessage(error.getMessage())
            .build());
  }

  @Override
  @Transactional(readOnly = true)
  public List<InteractionLog> history(LocalDateTime start, LocalDateTime end) {
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must not be after end");
    }
    return interactionLogRepository.findTop100ByAskedAtBetweenOrderByAskedAtDesc(start, end);
  }

  private void save(InteractionLog entry) {
    try {
      interactionLogRepository.save(entry);
    } catch (RuntimeException e) {
      log.warn("Failed to write audit row for user {}: {}", entry.getUserName(), e.getMessage());
      meterRegistry.counter("audit.write.failure").increment();
    }
  }
}
