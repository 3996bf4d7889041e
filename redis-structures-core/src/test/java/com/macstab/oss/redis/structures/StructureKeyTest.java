/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.structures;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("StructureKey")
class StructureKeyTest {

  @Test
  @DisplayName("toString joins namespace and name with a colon")
  void toString_JoinsWithColon() {
    assertThat(StructureKey.of("queue", "t1")).hasToString("queue:t1");
  }

  @Test
  @DisplayName("name may itself contain colons; namespace stays first")
  void nameWithColon_KeepsOrdering() {
    final var key = StructureKey.of("jobs", "eu:west:1");

    assertThat(key).hasToString("jobs:eu:west:1");
    assertThat(key.getNamespace()).isEqualTo("jobs");
    assertThat(key.getName()).isEqualTo("eu:west:1");
  }

  @Test
  @DisplayName("equal parts give equal keys")
  void equality() {
    assertThat(StructureKey.of("a", "b")).isEqualTo(StructureKey.of("a", "b"));
    assertThat(StructureKey.of("a", "b")).isNotEqualTo(StructureKey.of("b", "a"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "  "})
  @DisplayName("blank namespace or name is a ConfigurationException")
  void blankParts_AreRejected(final String blank) {
    assertThatThrownBy(() -> StructureKey.of(blank, "x"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("namespace");
    assertThatThrownBy(() -> StructureKey.of("x", blank))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("name");
  }

  @Test
  @DisplayName("null parts are rejected")
  void nullParts_AreRejected() {
    assertThatThrownBy(() -> StructureKey.of(null, "x")).isInstanceOf(NullPointerException.class);
  }
}
