/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import hindsight.Call;
import hindsight.CheckResult;
import hindsight.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

final class HindsightHealthIndicator implements HealthIndicator {
  static final Logger LOG = LoggerFactory.getLogger(HindsightHealthIndicator.class);

  final Component component;

  HindsightHealthIndicator(Component component) {
    this.component = component;
  }

  @Override public Health health() {
    Throwable error = null;
    try {
      CheckResult result = component.check();
      if (!result.ok()) error = result.error();
    } catch (Throwable unexpected) {
      Call.propagateIfFatal(unexpected);
      error = unexpected;
    }
    if (error == null) return Health.up().withDetail("component", component.toString()).build();

    // Like withException, but without the distracting ": null" when there is no message.
    String message = error.getMessage();
    String detail = error.getClass().getSimpleName() + (message != null ? ": " + message : "");
    LOG.debug("{} is down: {}", component, detail);
    return Health.down()
      .withDetail("component", component.toString())
      .withDetail("error", detail)
      .build();
  }
}
