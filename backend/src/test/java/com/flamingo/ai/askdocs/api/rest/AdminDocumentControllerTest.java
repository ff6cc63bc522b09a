package com.flamingo.ai.askdocs.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.askdocs.domain.entity.AdminUser;
import com.flamingo.ai.askdocs.domain.enums.IngestionStatus;
import com.flamingo.ai.askdocs.domain.enums.IngestionStep;
import com.flamingo.ai.askdocs.exception.AdminAccessDeniedException;
import com.flamingo.ai.askdocs.exception.ConcurrentIngestionException;
import com.flamingo.ai.askdocs.exception.DocumentNotFoundException;
import com.flamingo.ai.askdocs.exception.EmbeddingFailedException;
import com.flamingo.ai.askdocs.exception.EmbeddingServiceException;
import com.flamingo.ai.askdocs.exception.GlobalExceptionHandler;
import com.flamingo.ai.askdocs.exception.LastAdminRemovalException;
import com.flamingo.ai.askdocs.exception.StagedFileNotFoundException;
import com.flamingo.ai.askdocs.service.admin.AdminAllowlistService;
import com.flamingo.ai.askdocs.service.document.DocumentCatalogService;
import com.flamingo.ai.askdocs.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.askdocs.service.ingestion.IngestionResult;
import com.flamingo.ai.askdocs.service.ingestion.RemovalResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.multipart.MultipartFile;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdminDocumentController Tests")
class AdminDocumentControllerTest {

  private static final String ADMIN = "alice";

  private MockMvc mockMvc;

  @Mock private DocumentIngestionService documentIngestionService;
  @Mock private DocumentCatalogService documentCatalogService;
  @Mock private AdminAllowlistService adminAllowlistService;

  @BeforeEach
  void setUp() {
    AdminDocumentController controller =
        new AdminDocumentController(
            documentIngestionService, documentCatalogService, adminAllowlistService);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  private static IngestionResult ready(String fileName) {
    return new IngestionResult(
        fileName, "upload_1_abcd1234.pdf", "run-1", 3, 3, IngestionStatus.READY);
  }

  @Nested
  @DisplayName("Access control")
  class AccessControl {

    @Test
    @DisplayName("Should return 403 without a caller header")
    void shouldRejectAnonymousCaller() throws Exception {
      mockMvc
          .perform(post("/api/admin/documents/reprocess").param("fileName", "a.pdf"))
          .andExpect(status().isForbidden())
          .andExpect(jsonPath("$.code").value("ADMIN_001"));

      verifyNoInteractions(documentIngestionService);
    }

    @Test
    @DisplayName("Should return 403 for a caller outside the allowlist")
    void shouldRejectNonAdmin() throws Exception {
      doThrow(new AdminAccessDeniedException("mallory"))
          .when(adminAllowlistService)
          .requireAdmin("mallory");

      mockMvc
          .perform(
              post("/api/admin/documents/reprocess")
                  .header(AskController.REMOTE_USER_HEADER, "mallory")
                  .param("fileName", "a.pdf"))
          .andExpect(status().isForbidden());

      verifyNoInteractions(documentIngestionService);
    }
  }

  @Nested
  @DisplayName("Documents")
  class Documents {

    @Test
    @DisplayName("Should ingest an uploaded file and return 201")
    void shouldUploadDocument() throws Exception {
      when(documentIngestionService.ingestUpload(any(MultipartFile.class)))
          .thenReturn(ready("a.pdf"));
      MockMultipartFile file =
          new MockMultipartFile("file", "a.pdf", "application/pdf", new byte[] {1, 2, 3});

      mockMvc
          .perform(
              multipart("/api/admin/documents")
                  .file(file)
                  .header(AskController.REMOTE_USER_HEADER, ADMIN))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.fileName").value("a.pdf"))
          .andExpect(jsonPath("$.status").value("READY"));

      verify(adminAllowlistService).requireAdmin(ADMIN);
    }

    @Test
    @DisplayName("Should reprocess a staged file")
    void shouldReprocessDocument() throws Exception {
      when(documentIngestionService.ingestExisting("a.pdf")).thenReturn(ready("a.pdf"));

      mockMvc
          .perform(
              post("/api/admin/documents/reprocess")
                  .header(AskController.REMOTE_USER_HEADER, ADMIN)
                  .param("fileName", "a.pdf"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.chunkCount").value(3));
    }

    @Test
    @DisplayName("Should return 404 when the staged file is missing")
    void shouldReturnNotFoundForMissingStagedFile() throws Exception {
      when(documentIngestionService.ingestExisting("a.pdf"))
          .thenThrow(new StagedFileNotFoundException("a.pdf"));

      mockMvc
          .perform(
              post("/api/admin/documents/reprocess")
                  .header(AskController.REMOTE_USER_HEADER, ADMIN)
                  .param("fileName", "a.pdf"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value("DOCUMENT_002"));
    }

    @Test
    @DisplayName("Should return 409 while the file is being processed")
    void shouldReturnConflictForConcurrentRun() throws Exception {
      when(documentIngestionService.ingestExisting("a.pdf"))
          .thenThrow(new ConcurrentIngestionException("a.pdf"));

      mockMvc
          .perform(
              post("/api/admin/documents/reprocess")
                  .header(AskController.REMOTE_USER_HEADER, ADMIN)
                  .param("fileName", "a.pdf"))
          .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Should name the failed step when ingestion fails")
    void shouldReportFailedStep() throws Exception {
      when(documentIngestionService.embedPending("a.pdf"))
          .thenThrow(
              new EmbeddingFailedException(
                  "a.pdf", "Failed to embed chunks", new EmbeddingServiceException("quota")));

      mockMvc
          .perform(
              post("/api/admin/documents/embed")
                  .header(AskController.REMOTE_USER_HEADER, ADMIN)
                  .param("fileName", "a.pdf"))
          .andExpect(status().isUnprocessableEntity())
          .andExpect(jsonPath("$.code").value("INGEST_" + IngestionStep.EMBED.name()));
    }

    @Test
    @DisplayName("Should return 504 when an ingestion step timed out")
    void shouldReturnGatewayTimeoutForTimedOutStep() throws Exception {
      when(documentIngestionService.embedPending("a.pdf"))
          .thenThrow(
              new EmbeddingFailedException(
                  "a.pdf", "Failed to embed chunks", new TimeoutException("slow")));

      mockMvc
          .perform(
              post("/api/admin/documents/embed")
                  .header(AskController.REMOTE_USER_HEADER, ADMIN)
                  .param("fileName", "a.pdf"))
          .andExpect(status().isGatewayTimeout());
    }

    @Test
    @DisplayName("Should remove a document")
    void shouldRemoveDocument() throws Exception {
      when(documentIngestionService.remove("a.pdf"))
          .thenReturn(new RemovalResult("a.pdf", 3, true, true));

      mockMvc
          .perform(
              delete("/api/admin/documents")
                  .header(AskController.REMOTE_USER_HEADER, ADMIN)
                  .param("fileName", "a.pdf"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.chunksRemoved").value(3))
          .andExpect(jsonPath("$.stagedFileRemoved").value(true));
    }

    @Test
    @DisplayName("Should return 400 when the file name is missing")
    void shouldRequireFileName() throws Exception {
      mockMvc
          .perform(delete("/api/admin/documents").header(AskController.REMOTE_USER_HEADER, ADMIN))
          .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should return 404 for the text of an unknown document")
    void shouldReturnNotFoundForUnknownText() throws Exception {
      when(documentCatalogService.getDocumentText("x.pdf"))
          .thenThrow(new DocumentNotFoundException("x.pdf"));

      mockMvc
          .perform(
              get("/api/admin/documents/text")
                  .header(AskController.REMOTE_USER_HEADER, ADMIN)
                  .param("fileName", "x.pdf"))
          .andExpect(status().isNotFound());
    }
  }

  @Nested
  @DisplayName("Admins")
  class Admins {

    @Test
    @DisplayName("Should add an admin and return 201")
    void shouldAddAdmin() throws Exception {
      when(adminAllowlistService.add("bob", ADMIN))
          .thenReturn(AdminUser.builder().username("bob").addedBy(ADMIN).build());

      mockMvc
          .perform(
              post("/api/admin/admins")
                  .header(AskController.REMOTE_USER_HEADER, ADMIN)
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"username\": \"bob\"}"))
          .andExpect(status().isCreated())
          .andExpect(jsonPath("$.username").value("bob"))
          .andExpect(jsonPath("$.addedBy").value(ADMIN));
    }

    @Test
    @DisplayName("Should return 400 when removing the last admin")
    void shouldRejectRemovingLastAdmin() throws Exception {
      doThrow(new LastAdminRemovalException(ADMIN)).when(adminAllowlistService).remove(ADMIN);

      mockMvc
          .perform(
              delete("/api/admin/admins/{username}", ADMIN)
                  .header(AskController.REMOTE_USER_HEADER, ADMIN))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("ADMIN_002"));
    }
  }
}
