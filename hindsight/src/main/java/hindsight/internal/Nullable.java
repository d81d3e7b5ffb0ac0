/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.internal;

/**
 * Marks a field, parameter or return value that may be null. Named {@code Nullable} so tools that
 * look for any annotation with that simple name pick it up without a jsr305 dependency.
 */
@java.lang.annotation.Documented
@java.lang.annotation.Retention(java.lang.annotation.RetentionPolicy.RUNTIME)
public @interface Nullable {
}
