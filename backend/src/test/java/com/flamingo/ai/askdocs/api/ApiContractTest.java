package com.flamingo.ai.askdocs.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.askdocs.api.rest.AdminDocumentController;
import com.flamingo.ai.askdocs.api.rest.AskController;
import com.flamingo.ai.askdocs.api.rest.HealthController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the controller base paths.
 *
 * <ul>
 *   <li>POST /api/ask, GET /api/files, GET /api/history
 *   <li>/api/admin/documents, /api/admin/stats, /api/admin/admins
 *   <li>GET /health
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("AskController API contract")
  class AskControllerContract {

    @Test
    @DisplayName("should be mapped to /api")
    void shouldBeMappedToApi() {
      RequestMapping mapping = AskController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }

    @Test
    @DisplayName("should read the caller from X-Remote-User")
    void shouldUseRemoteUserHeader() {
      assertThat(AskController.REMOTE_USER_HEADER).isEqualTo("X-Remote-User");
    }
  }

  @Nested
  @DisplayName("AdminDocumentController API contract")
  class AdminDocumentControllerContract {

    @Test
    @DisplayName("should be mapped to /api/admin")
    void shouldBeMappedToApiAdmin() {
      RequestMapping mapping = AdminDocumentController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/admin");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
