/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import hindsight.stream.EventBroadcaster;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("hindsight.stream")
class HindsightStreamProperties {
  /** Events buffered per subscriber before the oldest are dropped. */
  private int queueCapacity = EventBroadcaster.DEFAULT_QUEUE_CAPACITY;

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }
}
