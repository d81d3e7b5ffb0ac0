/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceTypeTest {
  @Test void toString_readable() {
    assertThat(TraceType.GENERIC).hasToString("Generic");
    assertThat(TraceType.MIXED).hasToString("Mixed");
    assertThat(TraceType.framework("picante")).hasToString("Framework(picante)");
  }

  @Test void framework_equalsByName() {
    assertThat(TraceType.framework("picante"))
      .isEqualTo(TraceType.framework("picante"))
      .isNotEqualTo(TraceType.framework("rapace"));
  }

  @Test void framework_rejectsEmpty() {
    assertThatThrownBy(() -> TraceType.framework(""))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
