/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

import java.io.Closeable;
import java.io.IOException;

/**
 * Components are the long-lived parts of a hindsight service, such as storage, which are checked
 * for health and closed on shutdown.
 */
public abstract class Component implements Closeable {

  /**
   * Answers the question: Are operations on this component likely to succeed?
   *
   * <p>Implementations should use the least resources possible to establish a meaningful result,
   * and be safe to call many times, even concurrently.
   *
   * @see CheckResult#OK
   */
  public CheckResult check() {
    return CheckResult.OK;
  }

  /** Releases threads or buffers created by this component. */
  @Override public void close() throws IOException {
  }
}
