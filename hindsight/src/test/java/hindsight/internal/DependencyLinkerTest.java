/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.internal;

import hindsight.DependencyLink;
import hindsight.Span;
import hindsight.SpanStatus;
import hindsight.Trace;
import hindsight.TraceAssembler;
import java.util.List;
import org.junit.jupiter.api.Test;

import static hindsight.TestObjects.BACKEND;
import static hindsight.TestObjects.DB;
import static hindsight.TestObjects.ROOT;
import static hindsight.TestObjects.TRACE;
import static hindsight.TestObjects.TRACE_ID;
import static org.assertj.core.api.Assertions.assertThat;

class DependencyLinkerTest {
  @Test void linksParentToChildServices() {
    assertThat(new DependencyLinker().putTrace(trace(TRACE)).link()).containsExactly(
      DependencyLink.create("backend", "db", 1, 0),
      DependencyLink.create("frontend", "backend", 1, 0)
    );
  }

  @Test void countsChildErrors() {
    Span failed = DB.toBuilder().status(SpanStatus.error("deadlock")).build();

    assertThat(new DependencyLinker().putTrace(trace(List.of(ROOT, BACKEND, failed))).link())
      .contains(DependencyLink.create("backend", "db", 1, 1));
  }

  @Test void skipsSameServiceAndUnnamed() {
    Span local = BACKEND.toBuilder().serviceName("frontend").build();
    Span unnamed = DB.toBuilder().serviceName("").build();

    assertThat(new DependencyLinker().putTrace(trace(List.of(ROOT, local, unnamed))).link())
      .isEmpty();
  }

  @Test void peerService_addsUninstrumentedCallee() {
    Span callsCache = DB.toBuilder().putAttribute("peer.service", "redis").build();

    assertThat(new DependencyLinker().putTrace(trace(List.of(ROOT, BACKEND, callsCache))).link())
      .containsExactly(
        DependencyLink.create("backend", "db", 1, 0),
        DependencyLink.create("db", "redis", 1, 0),
        DependencyLink.create("frontend", "backend", 1, 0)
      );
  }

  @Test void peerService_notDoubleCountedWhenCalleeReported() {
    Span client = BACKEND.toBuilder().putAttribute("peer.service", "db").build();

    assertThat(new DependencyLinker().putTrace(trace(List.of(ROOT, client, DB))).link())
      .contains(DependencyLink.create("backend", "db", 1, 0));
  }

  @Test void aggregatesAcrossTraces() {
    DependencyLinker linker = new DependencyLinker();
    linker.putTrace(trace(TRACE));
    linker.putTrace(trace(TRACE));

    assertThat(linker.link()).contains(DependencyLink.create("frontend", "backend", 2, 0));
  }

  static Trace trace(List<Span> spans) {
    return TraceAssembler.assemble(TRACE_ID, spans);
  }
}
