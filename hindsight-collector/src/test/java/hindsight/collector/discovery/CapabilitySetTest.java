/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.collector.discovery;

import java.time.Instant;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilitySetTest {
  static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  @Test void create_sortsAndDropsEmptyNames() {
    CapabilitySet capabilities =
      CapabilitySet.create("s1", Arrays.asList("Kv", "", null, "Echo", "Kv"), NOW);

    assertThat(capabilities.serviceNames()).containsExactly("Echo", "Kv");
  }

  @Test void serviceNames_unmodifiable() {
    CapabilitySet capabilities = CapabilitySet.create("s1", Arrays.asList("Echo"), NOW);

    assertThatThrownBy(() -> capabilities.serviceNames().add("Kv"))
      .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test void empty() {
    CapabilitySet capabilities = CapabilitySet.empty("s1", NOW);

    assertThat(capabilities.isEmpty()).isTrue();
    assertThat(capabilities.supports("Echo")).isFalse();
    assertThat(capabilities).isEqualTo(CapabilitySet.create("s1", Arrays.asList(""), NOW));
  }

  @Test void create_nullSessionId() {
    assertThatThrownBy(() -> CapabilitySet.create(null, Arrays.asList("Echo"), NOW))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("sessionId == null");
  }
}
