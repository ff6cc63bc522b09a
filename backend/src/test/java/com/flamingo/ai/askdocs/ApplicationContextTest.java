package com.flamingo.ai.askdocs;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.askdocs.agent.GroundedAnswerAgent;
import com.flamingo.ai.askdocs.service.admin.AdminAllowlistService;
import com.flamingo.ai.askdocs.service.document.DocumentCatalogService;
import com.flamingo.ai.askdocs.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.askdocs.service.rag.answer.AnswerService;
import com.flamingo.ai.askdocs.service.rag.model.LanguageModelProvider;
import com.flamingo.ai.askdocs.service.rag.retrieval.RetrievalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. External services (OpenAI, Elasticsearch) are
 * replaced with mocks so the test runs without them.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private LanguageModelProvider languageModelProvider;
  @MockitoBean private GroundedAnswerAgent groundedAnswerAgent;
  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DocumentIngestionService.class)).isNotNull();
    assertThat(applicationContext.getBean(RetrievalService.class)).isNotNull();
    assertThat(applicationContext.getBean(AnswerService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentCatalogService.class)).isNotNull();
  }

  @Test
  @DisplayName("Admin allowlist should be seeded from configuration")
  void adminAllowlistShouldBeSeeded() {
    assertThat(applicationContext.getBean(AdminAllowlistService.class).isAdmin("alice")).isTrue();
  }
}
