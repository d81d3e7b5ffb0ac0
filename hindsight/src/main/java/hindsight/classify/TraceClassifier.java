/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.classify;

import hindsight.AttributeValue;
import hindsight.Span;
import hindsight.Trace;
import hindsight.TraceType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tags a trace with the framework whose conventions it follows, using an ordered table of {@link
 * ClassificationRule rules}.
 *
 * <p>Every rule is evaluated against every attribute of every span. No match is {@link
 * TraceType#GENERIC}, one framework is {@link TraceType#framework(String)}, and more than one is
 * {@link TraceType#MIXED}. Classification is pure: it has no state and the same trace always
 * yields the same type.
 */
public final class TraceClassifier {
  /** Frameworks recognized out of the box, by attribute key prefix. */
  public static final List<ClassificationRule> DEFAULT_RULES = List.of(
    ClassificationRule.keyPrefix("picante.", "picante"),
    ClassificationRule.keyPrefix("rapace.", "rapace"),
    ClassificationRule.keyPrefix("dodeca.", "dodeca")
  );

  public static TraceClassifier create() {
    return newBuilder().addRules(DEFAULT_RULES).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    final List<ClassificationRule> rules = new ArrayList<>();

    public Builder addRule(ClassificationRule rule) {
      if (rule == null) throw new NullPointerException("rule == null");
      rules.add(rule);
      return this;
    }

    public Builder addRules(Iterable<ClassificationRule> rules) {
      for (ClassificationRule rule : rules) addRule(rule);
      return this;
    }

    public TraceClassifier build() {
      return new TraceClassifier(this);
    }

    Builder() {
    }
  }

  final List<ClassificationRule> rules;

  TraceClassifier(Builder builder) {
    this.rules = Collections.unmodifiableList(new ArrayList<>(builder.rules));
  }

  public List<ClassificationRule> rules() {
    return rules;
  }

  public TraceType classify(Trace trace) {
    if (trace == null) throw new NullPointerException("trace == null");
    Set<String> matched = new LinkedHashSet<>();
    for (Span span : trace.spans()) {
      for (Map.Entry<String, AttributeValue> entry : span.attributes().entrySet()) {
        for (ClassificationRule rule : rules) {
          if (matched.contains(rule.framework())) continue;
          if (rule.matches(entry.getKey(), entry.getValue())) matched.add(rule.framework());
        }
        if (matched.size() > 1) return TraceType.MIXED;
      }
    }
    if (matched.isEmpty()) return TraceType.GENERIC;
    return TraceType.framework(matched.iterator().next());
  }

  @Override public String toString() {
    return "TraceClassifier{rules=" + rules + "}";
  }
}
