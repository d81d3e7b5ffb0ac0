/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.classify;

import hindsight.AttributeValue;

/**
 * Associates a framework with an attribute predicate. A trace follows the framework's conventions
 * when any attribute of any of its spans matches.
 */
// @Immutable
public final class ClassificationRule {
  /** Matches any attribute whose key starts with {@code keyPrefix}, such as "picante.". */
  public static ClassificationRule keyPrefix(String keyPrefix, String framework) {
    if (keyPrefix == null) throw new NullPointerException("keyPrefix == null");
    if (keyPrefix.isEmpty()) throw new IllegalArgumentException("keyPrefix is empty");
    return new ClassificationRule(framework, (key, value) -> key.startsWith(keyPrefix),
      "keyPrefix(" + keyPrefix + ")");
  }

  /** Matches an attribute named {@code key} holding a value of {@code type}. */
  public static ClassificationRule marker(String key, AttributeValue.Type type, String framework) {
    if (key == null) throw new NullPointerException("key == null");
    if (type == null) throw new NullPointerException("type == null");
    return new ClassificationRule(framework,
      (k, value) -> k.equals(key) && value.type() == type, "marker(" + key + ":" + type + ")");
  }

  public static ClassificationRule create(String framework, AttributePredicate predicate) {
    if (predicate == null) throw new NullPointerException("predicate == null");
    return new ClassificationRule(framework, predicate, predicate.toString());
  }

  final String framework;
  final AttributePredicate predicate;
  final String description;

  ClassificationRule(String framework, AttributePredicate predicate, String description) {
    if (framework == null) throw new NullPointerException("framework == null");
    if (framework.isEmpty()) throw new IllegalArgumentException("framework is empty");
    this.framework = framework;
    this.predicate = predicate;
    this.description = description;
  }

  public String framework() {
    return framework;
  }

  /** A predicate that throws, for example on an unexpected value type, does not match. */
  public boolean matches(String key, AttributeValue value) {
    try {
      return predicate.test(key, value);
    } catch (RuntimeException e) {
      return false;
    }
  }

  @Override public String toString() {
    return "ClassificationRule{framework=" + framework + ", " + description + "}";
  }
}
