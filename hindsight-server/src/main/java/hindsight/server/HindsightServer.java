/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server;

import hindsight.server.internal.EnableHindsightServer;
import org.slf4j.bridge.SLF4JBridgeHandler;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Runs the hub as a long-lived service. Transports that accept producer connections are wired
 * against the {@link HindsightService} bean.
 *
 * <p>Settings are read from {@code hindsight-server.yml}, and can be overridden with the usual
 * Spring Boot mechanisms, ex {@code HINDSIGHT_STORAGE_TTL=30m}.
 */
@SpringBootConfiguration
@EnableAutoConfiguration
@EnableHindsightServer
public class HindsightServer {
  static {
    // the core library logs with java.util.logging
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
  }

  public static void main(String[] args) {
    new SpringApplicationBuilder(HindsightServer.class)
      .logStartupInfo(false)
      .properties("spring.config.name=hindsight-server").run(args);
  }
}
