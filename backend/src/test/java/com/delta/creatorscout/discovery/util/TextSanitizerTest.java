package com.delta.creatorscout.discovery.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextSanitizerTest {

  @Test
  void decodesEntitiesAndStripsTags() {
    assertThat(TextSanitizer.clean("Fitness &amp; food <b>tips</b> daily")).isEqualTo("Fitness & food tips daily");
  }

  @Test
  void blankBecomesNull() {
    assertThat(TextSanitizer.clean("   ")).isNull();
    assertThat(TextSanitizer.clean(null)).isNull();
  }
}
