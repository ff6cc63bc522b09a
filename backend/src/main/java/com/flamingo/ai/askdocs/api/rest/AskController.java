package com.flamingo.ai.askdocs.api.rest;

import com.flamingo.ai.askdocs.api.dto.request.AskRequest;
import com.flamingo.ai.askdocs.api.dto.response.AnswerResponse;
import com.flamingo.ai.askdocs.api.dto.response.InteractionLogResponse;
import com.flamingo.ai.askdocs.service.audit.AnswerAuditLog;
import com.flamingo.ai.askdocs.service.document.DocumentCatalogService;
import com.flamingo.ai.askdocs.service.rag.answer.Answer;
import com.flamingo.ai.askdocs.service.rag.answer.AnswerService;
import jakarta.validation.Valid;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for asking questions about the corpus. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AskController {

  /** Header carrying the caller identity, set by the authenticating proxy. */
  public static final String REMOTE_USER_HEADER = "X-Remote-User";

  private final AnswerService answerService;
  private final DocumentCatalogService documentCatalogService;
  private final AnswerAuditLog answerAuditLog;

  /** Answers a question from the ingested documents. */
  @PostMapping("/ask")
  public ResponseEntity<AnswerResponse> ask(
      @RequestHeader(value = REMOTE_USER_HEADER, required = false) String user,
      @Valid @RequestBody AskRequest request) {
    Answer answer = answerService.ask(user, request.getQuestion());
    return ResponseEntity.ok(AnswerResponse.fromAnswer(answer));
  }

  /** Lists the files that can be asked about. */
  @GetMapping("/files")
  public ResponseEntity<List<String>> listFiles() {
    return ResponseEntity.ok(documentCatalogService.listFiles());
  }

  /** Lists recent questions, by default those of the last seven days. */
  @GetMapping("/history")
  public ResponseEntity<List<InteractionLogResponse>> history(
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          LocalDateTime start,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          LocalDateTime end) {
    LocalDateTime to = end != null ? end : LocalDateTime.now();
    LocalDateTime from = start != null ? start : to.minusDays(7);
    List<InteractionLogResponse> responses =
        answerAuditLog.history(from, to).stream().map(InteractionLogResponse::fromEntity).toList();
    return ResponseEntity.ok(responses);
  }
}
