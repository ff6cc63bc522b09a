package com.flamingo.ai.askdocs.config;

import com.flamingo.ai.askdocs.domain.enums.ParseMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion and answering pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Embedding embedding = new Embedding();
  private Completion completion = new Completion();
  private Parsing parsing = new Parsing();
  private Staging staging = new Staging();
  private Verification verification = new Verification();
  private Admin admin = new Admin();

  @Getter
  @Setter
  public static class Chunking {
    /** Number of consecutive lines grouped into one window. */
    private int linesPerChunk = 40;

    /** A window is kept only when its joined text is strictly longer than this. */
    private int minChunkLength = 80;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private int neighborRadius = 1;

    /** kNN candidates fetched per anchor before exact re-ranking. */
    private int candidatesMultiplier = 4;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Used for both passages and questions so the vector spaces match. */
    private String modelName = "text-embedding-3-small";

    private int dimensions = 1024;
    private int maxInputChars = 8000;
  }

  @Getter
  @Setter
  public static class Completion {
    private String modelName = "gpt-4o-mini";
    private int maxCompletionTokens = 1024;
  }

  @Getter
  @Setter
  public static class Parsing {
    private ParseMode mode = ParseMode.OCR;
    private Duration timeout = Duration.ofSeconds(120);
  }

  @Getter
  @Setter
  public static class Staging {
    private String directory = "data/stage";
    private String uploadDirectory = "data/uploads";
    private Duration uploadMaxAge = Duration.ofHours(24);
  }

  @Getter
  @Setter
  public static class Verification {
    /** Check that the sources cited by the completion were part of the supplied context. */
    private boolean enabled = true;
  }

  @Getter
  @Setter
  public static class Admin {
    /** Seeded into the allowlist when it is empty at startup. */
    private List<String> defaultAdmins = new ArrayList<>();
  }
}
