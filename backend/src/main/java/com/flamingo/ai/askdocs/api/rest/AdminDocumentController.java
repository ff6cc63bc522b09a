package com.flamingo.ai.askdocs.api.rest;

import static com.flamingo.ai.askdocs.api.rest.AskController.REMOTE_USER_HEADER;

import com.flamingo.ai.askdocs.api.dto.request.AddAdminRequest;
import com.flamingo.ai.askdocs.api.dto.response.AdminUserResponse;
import com.flamingo.ai.askdocs.api.dto.response.StoreStats;
import com.flamingo.ai.askdocs.domain.entity.AdminUser;
import com.flamingo.ai.askdocs.service.admin.AdminAllowlistService;
import com.flamingo.ai.askdocs.service.document.DocumentCatalogService;
import com.flamingo.ai.askdocs.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.askdocs.service.ingestion.IngestionResult;
import com.flamingo.ai.askdocs.service.ingestion.RemovalResult;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for corpus management. Every route requires an allowlisted caller. */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminDocumentController {

  private final DocumentIngestionService documentIngestionService;
  private final DocumentCatalogService documentCatalogService;
  private final AdminAllowlistService adminAllowlistService;

  /** Uploads and ingests a new document. */
  @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IngestionResult> uploadDocument(
      @RequestHeader(REMOTE_USER_HEADER) String user, @RequestParam("file") MultipartFile file) {
    adminAllowlistService.requireAdmin(user);
    IngestionResult result = documentIngestionService.ingestUpload(file);
    return ResponseEntity.status(HttpStatus.CREATED).body(result);
  }

  /** Re-ingests a document from its staged file. */
  @PostMapping("/documents/reprocess")
  public ResponseEntity<IngestionResult> reprocessDocument(
      @RequestHeader(REMOTE_USER_HEADER) String user, @RequestParam String fileName) {
    adminAllowlistService.requireAdmin(user);
    return ResponseEntity.ok(documentIngestionService.ingestExisting(fileName));
  }

  /** Embeds the chunks of a document that have no embedding yet. */
  @PostMapping("/documents/embed")
  public ResponseEntity<IngestionResult> embedPending(
      @RequestHeader(REMOTE_USER_HEADER) String user, @RequestParam String fileName) {
    adminAllowlistService.requireAdmin(user);
    return ResponseEntity.ok(documentIngestionService.embedPending(fileName));
  }

  /** Removes a document, its chunks and its staged file. */
  @DeleteMapping("/documents")
  public ResponseEntity<RemovalResult> removeDocument(
      @RequestHeader(REMOTE_USER_HEADER) String user, @RequestParam String fileName) {
    adminAllowlistService.requireAdmin(user);
    return ResponseEntity.ok(documentIngestionService.remove(fileName));
  }

  /** Gets the parsed text of a document. */
  @GetMapping("/documents/text")
  public ResponseEntity<Map<String, String>> getDocumentText(
      @RequestHeader(REMOTE_USER_HEADER) String user, @RequestParam String fileName) {
    adminAllowlistService.requireAdmin(user);
    String text = documentCatalogService.getDocumentText(fileName);
    return ResponseEntity.ok(Map.of("fileName", fileName, "text", text));
  }

  /** Returns corpus statistics. */
  @GetMapping("/stats")
  public ResponseEntity<StoreStats> stats(@RequestHeader(REMOTE_USER_HEADER) String user) {
    adminAllowlistService.requireAdmin(user);
    return ResponseEntity.ok(documentCatalogService.storeStats());
  }

  /** Lists the admins. */
  @GetMapping("/admins")
  public ResponseEntity<List<AdminUserResponse>> listAdmins(
      @RequestHeader(REMOTE_USER_HEADER) String user) {
    adminAllowlistService.requireAdmin(user);
    List<AdminUserResponse> responses =
        adminAllowlistService.list().stream().map(AdminUserResponse::fromEntity).toList();
    return ResponseEntity.ok(responses);
  }

  /** Adds an admin. */
  @PostMapping("/admins")
  public ResponseEntity<AdminUserResponse> addAdmin(
      @RequestHeader(REMOTE_USER_HEADER) String user,
      @Valid @RequestBody AddAdminRequest request) {
    adminAllowlistService.requireAdmin(user);
    AdminUser admin = adminAllowlistService.add(request.getUsername(), user);
    return ResponseEntity.status(HttpStatus.CREATED).body(AdminUserResponse.fromEntity(admin));
  }

  /** Removes an admin. The last admin cannot be removed. */
  @DeleteMapping("/admins/{username}")
  public ResponseEntity<Void> removeAdmin(
      @RequestHeader(REMOTE_USER_HEADER) String user, @PathVariable String username) {
    adminAllowlistService.requireAdmin(user);
    adminAllowlistService.remove(username);
    return ResponseEntity.noContent().build();
  }
}
