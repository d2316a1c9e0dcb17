package io.grafcet.api.scenario;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

public final class ScenarioRunResult implements Serializable {
   private final List<ScenarioResult> results;
   private final String loadedFilePath;
   private final int totalScenarios;

   public ScenarioRunResult(List<ScenarioResult> results, String loadedFilePath, int totalScenarios) {
      this.results = Collections.unmodifiableList(results);
      this.loadedFilePath = loadedFilePath;
      this.totalScenarios = totalScenarios;
   }

   public List<ScenarioResult> results() {
      return results;
   }

   public String loadedFilePath() {
      return loadedFilePath;
   }

   public int totalScenarios() {
      return totalScenarios;
   }
}
