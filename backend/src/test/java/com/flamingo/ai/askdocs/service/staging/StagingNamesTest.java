package com.flamingo.ai.askdocs.service.staging;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StagingNames Tests")
class StagingNamesTest {

  private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

  @Test
  @DisplayName("Should build upload name from time, random suffix and extension")
  void shouldBuildUploadName() {
    String name = StagingNames.uploadName("Quarterly Report.PDF", clock);

    assertThat(name).matches("upload_1700000000000_[0-9a-f]{8}\\.pdf");
  }

  @Test
  @DisplayName("Should give distinct names within the same millisecond")
  void shouldGiveDistinctNames() {
    assertThat(StagingNames.uploadName("a.txt", clock))
        .isNotEqualTo(StagingNames.uploadName("a.txt", clock));
  }

  @Test
  @DisplayName("Should drop missing or unsafe extensions")
  void shouldDropUnsafeExtensions() {
    assertThat(StagingNames.extensionOf("README")).isEmpty();
    assertThat(StagingNames.extensionOf("trailing.")).isEmpty();
    assertThat(StagingNames.extensionOf("evil.p/df")).isEmpty();
    assertThat(StagingNames.extensionOf("long.abcdefghijk")).isEmpty();
    assertThat(StagingNames.extensionOf("notes.docx")).isEqualTo(".docx");
  }
}
