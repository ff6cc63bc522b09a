package com.flamingo.ai.askdocs.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.askdocs.config.RagConfig;
import com.flamingo.ai.askdocs.exception.EmbeddingServiceException;
import com.flamingo.ai.askdocs.service.rag.model.LanguageModelProvider;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private LanguageModelProvider languageModelProvider;
  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private RagConfig ragConfig;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);
    lenient().when(languageModelProvider.embeddingModel(anyString())).thenReturn(embeddingModel);

    ragConfig = new RagConfig();
    embeddingService = new EmbeddingService(languageModelProvider, ragConfig, meterRegistry);
  }

  private static Response<List<Embedding>> vectors(int count) {
    return Response.from(
        IntStream.range(0, count)
            .mapToObj(i -> Embedding.from(new float[] {i, i + 0.5f}))
            .toList());
  }

  @Test
  @DisplayName("Should embed a query with the configured model")
  void shouldEmbedQueryWithConfiguredModel() {
    when(embeddingModel.embedAll(anyList())).thenReturn(vectors(1));

    List<Float> result = embeddingService.embedQuery("What is a rocket?");

    assertThat(result).containsExactly(0f, 0.5f);
    verify(languageModelProvider).embeddingModel("text-embedding-3-small");
    verify(meterRegistry.counter("embedding.requests.success", "type", "query")).increment();
  }

  @Test
  @DisplayName("Should embed passages in batches and keep their order")
  @SuppressWarnings("unchecked")
  void shouldEmbedPassagesInBatches() {
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(inv -> vectors(((List<TextSegment>) inv.getArgument(0)).size()));
    List<String> passages = IntStream.range(0, 130).mapToObj(i -> "passage " + i).toList();

    List<List<Float>> result = embeddingService.embedPassages(passages);

    assertThat(result).hasSize(130);
    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel, times(3)).embedAll(captor.capture());
    assertThat(captor.getAllValues()).extracting(List::size).containsExactly(64, 64, 2);
    assertThat(captor.getAllValues().get(2).get(1).text()).isEqualTo("passage 129");
  }

  @Test
  @DisplayName("Should truncate text longer than the input limit")
  @SuppressWarnings("unchecked")
  void shouldTruncateLongText() {
    ragConfig.getEmbedding().setMaxInputChars(100);
    when(embeddingModel.embedAll(anyList())).thenReturn(vectors(1));

    embeddingService.embedQuery("a".repeat(500));

    ArgumentCaptor<List<TextSegment>> captor = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(captor.capture());
    assertThat(captor.getValue().get(0).text()).hasSize(100);
  }

  @Test
  @DisplayName("Should wrap model failures and keep timeout information")
  void shouldWrapModelFailures() {
    when(embeddingModel.embedAll(anyList()))
        .thenThrow(new RuntimeException("gateway", new HttpTimeoutException("read timed out")));

    assertThatThrownBy(() -> embeddingService.embedQuery("question"))
        .isInstanceOf(EmbeddingServiceException.class)
        .satisfies(e -> assertThat(((EmbeddingServiceException) e).isTimedOut()).isTrue());
  }

  @Test
  @DisplayName("Should reject a response with the wrong number of vectors")
  void shouldRejectMismatchedResponse() {
    when(embeddingModel.embedAll(anyList())).thenReturn(vectors(1));

    assertThatThrownBy(() -> embeddingService.embedPassages(List.of("one", "two")))
        .isInstanceOf(EmbeddingServiceException.class)
        .hasMessageContaining("returned 1 vectors for 2 inputs");
  }
}
