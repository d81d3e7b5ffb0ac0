/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("hindsight.storage")
class HindsightStorageProperties {
  /** How long a trace stays queryable after its last write. */
  private Duration ttl = Duration.ofHours(1);
  /** How often expired traces are removed. Zero disables the background sweep. */
  private Duration sweepInterval = Duration.ofSeconds(30);
  /** When true, a handful of sample traces are stored at startup, for UI development. */
  private boolean seedData = false;

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public void setSweepInterval(Duration sweepInterval) {
    this.sweepInterval = sweepInterval;
  }

  public boolean isSeedData() {
    return seedData;
  }

  public void setSeedData(boolean seedData) {
    this.seedData = seedData;
  }
}
