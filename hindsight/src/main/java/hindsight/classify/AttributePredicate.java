/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.classify;

import hindsight.AttributeValue;

/** Tests a single span attribute. */
@FunctionalInterface
public interface AttributePredicate {
  boolean test(String key, AttributeValue value);
}
