/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.classify;

import hindsight.AttributeValue;
import hindsight.Span;
import hindsight.Trace;
import hindsight.TraceAssembler;
import hindsight.TraceType;
import java.util.List;
import org.junit.jupiter.api.Test;

import static hindsight.TestObjects.BACKEND;
import static hindsight.TestObjects.DB;
import static hindsight.TestObjects.ROOT;
import static hindsight.TestObjects.TRACE;
import static hindsight.TestObjects.TRACE_ID;
import static org.assertj.core.api.Assertions.assertThat;

class TraceClassifierTest {
  TraceClassifier classifier = TraceClassifier.create();

  @Test void generic_whenNoRuleMatches() {
    assertThat(classifier.classify(trace(TRACE))).isEqualTo(TraceType.GENERIC);
  }

  @Test void framework_whenOneFrameworkMatches() {
    Span query = DB.toBuilder().putAttribute("picante.query", true).build();

    assertThat(classifier.classify(trace(List.of(ROOT, BACKEND, query))))
      .isEqualTo(TraceType.framework("picante"));
  }

  @Test void framework_manyMarkersOfSameFramework() {
    Span root = ROOT.toBuilder().putAttribute("rapace.method", "Echo").build();
    Span backend = BACKEND.toBuilder().putAttribute("rapace.channel", 3L).build();

    assertThat(classifier.classify(trace(List.of(root, backend, DB))))
      .isEqualTo(TraceType.framework("rapace"));
  }

  @Test void mixed_whenSecondFrameworkAppears() {
    Span query = DB.toBuilder().putAttribute("picante.query", true).build();
    Trace picante = trace(List.of(ROOT, BACKEND, query));
    assertThat(classifier.classify(picante)).isEqualTo(TraceType.framework("picante"));

    Span build = BACKEND.toBuilder().putAttribute("dodeca.build", "site").build();
    Trace mixed = trace(List.of(ROOT, build, query));

    assertThat(classifier.classify(mixed)).isEqualTo(TraceType.MIXED);
  }

  @Test void classify_isDeterministic() {
    Trace trace = trace(List.of(ROOT, BACKEND.toBuilder().putAttribute("picante.x", 1L).build()));

    TraceType first = classifier.classify(trace);
    for (int i = 0; i < 10; i++) {
      assertThat(classifier.classify(trace)).isEqualTo(first);
    }
  }

  @Test void marker_matchesOnlyExpectedType() {
    TraceClassifier markers = TraceClassifier.newBuilder()
      .addRule(ClassificationRule.marker("framework.id", AttributeValue.Type.LONG, "custom"))
      .build();

    Span wrongType = ROOT.toBuilder().putAttribute("framework.id", "7").build();
    Span rightType = ROOT.toBuilder().putAttribute("framework.id", 7L).build();

    assertThat(markers.classify(trace(List.of(wrongType)))).isEqualTo(TraceType.GENERIC);
    assertThat(markers.classify(trace(List.of(rightType))))
      .isEqualTo(TraceType.framework("custom"));
  }

  @Test void throwingPredicate_isNonMatch() {
    TraceClassifier custom = TraceClassifier.newBuilder()
      .addRule(ClassificationRule.create("strict",
        (key, value) -> key.equals("http.method") && value.booleanValue()))
      .build();

    // http.method is a string, so booleanValue() throws
    assertThat(custom.classify(trace(TRACE))).isEqualTo(TraceType.GENERIC);
  }

  @Test void customRulesExtendDefaults() {
    TraceClassifier extended = TraceClassifier.newBuilder()
      .addRules(TraceClassifier.DEFAULT_RULES)
      .addRule(ClassificationRule.keyPrefix("acme.", "acme"))
      .build();

    Span acme = DB.toBuilder().putAttribute("acme.region", "eu").build();

    assertThat(extended.classify(trace(List.of(ROOT, BACKEND, acme))))
      .isEqualTo(TraceType.framework("acme"));
  }

  static Trace trace(List<Span> spans) {
    return TraceAssembler.assemble(TRACE_ID, spans);
  }
}
