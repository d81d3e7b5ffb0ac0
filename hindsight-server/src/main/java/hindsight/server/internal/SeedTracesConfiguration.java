/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import hindsight.collector.Collector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Loads sample traces at startup when {@code hindsight.storage.seed-data=true}. */
@Configuration
@ConditionalOnProperty(value = "hindsight.storage.seed-data", havingValue = "true")
public class SeedTracesConfiguration {

  @Bean SeedTraces seedTraces(Collector collector) {
    return new SeedTraces(collector);
  }
}
