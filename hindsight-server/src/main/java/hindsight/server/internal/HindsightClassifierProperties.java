/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight.server.internal;

import hindsight.classify.ClassificationRule;
import hindsight.classify.TraceClassifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties("hindsight.classifier")
class HindsightClassifierProperties {
  /**
   * Framework name to the attribute key prefix its producers write, ex {@code picante: picante.}.
   * When empty, {@link TraceClassifier#DEFAULT_RULES} apply.
   */
  private Map<String, String> frameworks = new LinkedHashMap<>();

  public Map<String, String> getFrameworks() {
    return frameworks;
  }

  public void setFrameworks(Map<String, String> frameworks) {
    this.frameworks = frameworks;
  }

  TraceClassifier toClassifier() {
    if (frameworks.isEmpty()) return TraceClassifier.create();
    List<ClassificationRule> rules = new ArrayList<>();
    for (Map.Entry<String, String> entry : frameworks.entrySet()) {
      rules.add(ClassificationRule.keyPrefix(entry.getValue(), entry.getKey()));
    }
    return TraceClassifier.newBuilder().addRules(rules).build();
  }
}
