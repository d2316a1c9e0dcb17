package io.grafcet.core.json;

import java.util.List;

import io.grafcet.api.compiler.Diagnostic;
import io.grafcet.api.scenario.ScenarioResult;
import io.grafcet.api.scenario.ScenarioRunResult;
import io.grafcet.api.simulation.FiredAction;
import io.grafcet.api.simulation.StepResult;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * JSON rendering of compiler diagnostics and simulation traces.
 */
public final class ResultJson {
   private ResultJson() {
   }

   public static JsonObject toJson(ScenarioRunResult run) {
      JsonArray results = new JsonArray();
      for (ScenarioResult result : run.results()) {
         results.add(toJson(result));
      }
      return new JsonObject()
            .put("loadedFilePath", run.loadedFilePath())
            .put("totalScenarios", run.totalScenarios())
            .put("results", results);
   }

   public static JsonObject toJson(ScenarioResult result) {
      return new JsonObject()
            .put("name", result.name())
            .put("stepNumber", result.stepNumber())
            .put("activeSteps", new JsonArray(result.activeSteps()))
            .put("activeActions", new JsonArray(result.activeActions()))
            .put("variablesApplied", new JsonObject(result.variablesApplied()))
            .put("success", result.success());
   }

   public static JsonObject toJson(StepResult result) {
      JsonArray actions = new JsonArray();
      for (FiredAction action : result.actions()) {
         actions.add(new JsonObject()
               .put("variable", action.variable())
               .put("value", true)
               .put("type", action.type()));
      }
      return new JsonObject()
            .put("activeSteps", new JsonArray(result.state().activeStepList()))
            .put("actions", actions)
            .put("firedTransitions", new JsonArray(result.firedTransitions()))
            .put("ignoredInputs", new JsonArray(result.ignoredInputs()));
   }

   public static JsonArray toJson(List<Diagnostic> diagnostics) {
      JsonArray array = new JsonArray();
      for (Diagnostic diagnostic : diagnostics) {
         JsonObject json = new JsonObject()
               .put("type", diagnostic.type().tag())
               .put("severity", diagnostic.severity().name().toLowerCase())
               .put("message", diagnostic.message());
         if (diagnostic.element() != null) {
            json.put("element", diagnostic.element());
         }
         if (diagnostic.line() > 0) {
            json.put("line", diagnostic.line());
         }
         array.add(json);
      }
      return array;
   }
}
