/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import org.junit.jupiter.api.Test;

import static hindsight.TestObjects.DB;
import static hindsight.TestObjects.MILLIS;
import static hindsight.TestObjects.ROOT;
import static hindsight.TestObjects.TODAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpanTest {
  @Test void build_requiresIds() {
    assertThatThrownBy(() -> Span.newBuilder().build())
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("Missing : traceId id");
  }

  @Test void durationNanos() {
    assertThat(DB.durationNanos()).isEqualTo(20 * MILLIS);
  }

  @Test void openSpan_hasNoEndTimeOrDuration() {
    Span open = ROOT.toBuilder().endTime(0L).build();

    assertThat(open.isOpen()).isTrue();
    assertThat(open.endTime()).isNull();
    assertThat(open.durationNanos()).isNull();
  }

  @Test void parentId_zeroMeansRoot() {
    assertThat(DB.toBuilder().parentId(0L).build().parentId()).isNull();
  }

  @Test void events_areSortedByTimestamp() {
    Span span = ROOT.toBuilder()
      .addEvent(TODAY + 2, "second")
      .addEvent(TODAY + 1, "first")
      .build();

    assertThat(span.events()).extracting(SpanEvent::name).containsExactly("first", "second");
  }

  @Test void attributes_areTyped() {
    Span span = ROOT.toBuilder()
      .putAttribute("count", 3L)
      .putAttribute("ratio", 0.5)
      .putAttribute("cached", true)
      .build();

    assertThat(span.attributes().get("count").longValue()).isEqualTo(3L);
    assertThat(span.attributes().get("ratio").doubleValue()).isEqualTo(0.5);
    assertThat(span.attributes().get("cached").booleanValue()).isTrue();
    assertThatThrownBy(() -> span.attributes().get("count").stringValue())
      .isInstanceOf(IllegalStateException.class);
  }

  @Test void toBuilder_equalsOriginal() {
    assertThat(DB.toBuilder().build()).isEqualTo(DB).hasSameHashCodeAs(DB);
  }

  @Test void status() {
    Span failed = DB.toBuilder().status(SpanStatus.error("timeout")).build();

    assertThat(failed.status().isError()).isTrue();
    assertThat(failed.status().message()).isEqualTo("timeout");
    assertThat(DB.status()).isSameAs(SpanStatus.OK);
  }
}
