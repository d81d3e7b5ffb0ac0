/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.collector.discovery;

import hindsight.Call;
import java.util.List;

/**
 * Asks a connected producer which named services it exposes. Implemented by the transport, which
 * must honor {@link Call#cancel()} so timed out requests don't linger.
 */
public interface IntrospectionClient {
  Call<List<String>> listServices();
}
