package io.grafcet.core.json;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.grafcet.api.diagram.ActionBlock;
import io.grafcet.api.diagram.ActionQualifier;
import io.grafcet.api.diagram.Connection;
import io.grafcet.api.diagram.Element;
import io.grafcet.api.diagram.ElementVisitor;
import io.grafcet.api.diagram.Gate;
import io.grafcet.api.diagram.GateRole;
import io.grafcet.api.diagram.GateType;
import io.grafcet.api.diagram.GrafcetDiagram;
import io.grafcet.api.diagram.Orientation;
import io.grafcet.api.diagram.Point;
import io.grafcet.api.diagram.Segment;
import io.grafcet.api.diagram.Size;
import io.grafcet.api.diagram.Step;
import io.grafcet.api.diagram.StepType;
import io.grafcet.api.diagram.Transition;
import io.grafcet.core.compiler.LayoutConstants;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Reads and writes the persisted diagram document {@code {id, title, version, elements: [...]}}.
 * <p>
 * Older documents kept steps and transitions (and sometimes actions, gates and connections) in separate arrays
 * and stored actions inline in their step. These are normalized on load into the single {@code elements} array,
 * inline actions becoming action-block elements.
 */
public final class DiagramCodec {
   private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");
   private static final String[] LEGACY_COLLECTIONS = { "steps", "transitions", "actions", "gates", "connections" };

   private DiagramCodec() {
   }

   public static JsonObject toJson(GrafcetDiagram diagram) {
      JsonArray elements = new JsonArray();
      ElementWriter writer = new ElementWriter();
      for (Element element : diagram.elements()) {
         elements.add(element.accept(writer));
      }
      return new JsonObject()
            .put("id", diagram.id())
            .put("title", diagram.title())
            .put("version", diagram.version())
            .put("elements", elements);
   }

   public static GrafcetDiagram fromJson(String text) {
      JsonObject document;
      try {
         document = new JsonObject(text);
      } catch (DecodeException e) {
         throw new DiagramFormatException("Diagram document is not valid JSON: " + e.getMessage(), e);
      }
      return fromJson(document);
   }

   public static GrafcetDiagram fromJson(JsonObject document) {
      try {
         List<Element> elements = new ArrayList<>();
         Object unified = document.getValue("elements");
         if (unified != null && !(unified instanceof JsonArray)) {
            throw new DiagramFormatException("'elements' must be an array");
         }
         boolean legacy = false;
         for (String collection : LEGACY_COLLECTIONS) {
            JsonArray array = document.getJsonArray(collection);
            if (array != null) {
               legacy = true;
               readElements(array, defaultType(collection), elements);
            }
         }
         if (unified != null) {
            readElements((JsonArray) unified, null, elements);
         } else if (!legacy) {
            throw new DiagramFormatException("Document has neither 'elements' nor 'steps'");
         }
         return new GrafcetDiagram(document.getString("id", UUID.randomUUID().toString()),
               document.getString("title", "Untitled"), document.getString("version", GrafcetDiagram.CURRENT_VERSION), elements);
      } catch (ClassCastException | IllegalArgumentException e) {
         throw new DiagramFormatException("Malformed diagram document: " + e.getMessage(), e);
      }
   }

   private static String defaultType(String collection) {
      switch (collection) {
         case "steps":
            return "step";
         case "transitions":
            return "transition";
         case "actions":
            return "action-block";
         case "connections":
            return "connection";
         default:
            return null;
      }
   }

   private static void readElements(JsonArray array, String defaultType, List<Element> elements) {
      for (Object item : array) {
         if (!(item instanceof JsonObject)) {
            throw new DiagramFormatException("Element must be an object: " + item);
         }
         JsonObject json = (JsonObject) item;
         String type = json.getString("type", defaultType);
         if (type == null) {
            throw new DiagramFormatException("Element without type: " + json.encode());
         }
         switch (type) {
            case "step":
               readStep(json, elements);
               break;
            case "transition":
               elements.add(readTransition(json, elements));
               break;
            case "action-block":
            case "action":
               elements.add(readAction(json, json.getString("parentId"), json.getInteger("index", 0), point(json), size(json)));
               break;
            case "and-gate":
            case "or-gate":
               elements.add(new Gate(required(json, "id"), GateType.fromTag(type), GateRole.fromTag(json.getString("gateMode", "divergence")),
                     json.getInteger("branchCount", 0), point(json), size(json)));
               break;
            case "connection":
               elements.add(new Connection(json.getString("id", "connection-" + elements.size()), required(json, "sourceId"),
                     required(json, "targetId"), segments(json)));
               break;
            default:
               throw new DiagramFormatException("Unknown element type '" + type + "'");
         }
      }
   }

   private static void readStep(JsonObject json, List<Element> elements) {
      String name = json.getString("name");
      Integer number = json.getInteger("number");
      if (number == null && name != null) {
         Matcher m = TRAILING_NUMBER.matcher(name);
         if (m.find()) {
            number = Integer.parseInt(m.group(1));
         }
      }
      if (number == null) {
         number = (int) elements.stream().filter(Step.class::isInstance).count();
      }
      String id = json.getString("id", "step-" + number);
      StepType stepType = StepType.fromTag(json.getString("stepType", "normal"));
      if (stepType == null) {
         throw new DiagramFormatException("Unknown step type '" + json.getString("stepType") + "' of step " + id);
      }
      if (json.getBoolean("initial", false)) {
         stepType = StepType.INITIAL;
      }
      Point position = point(json);
      Size size = size(json);
      List<String> actionIds = new ArrayList<>();
      List<ActionBlock> inline = new ArrayList<>();
      JsonArray ids = json.getJsonArray("actionIds");
      if (ids != null) {
         for (Object actionId : ids) {
            actionIds.add((String) actionId);
         }
      }
      JsonArray actions = json.getJsonArray("actions");
      if (actions != null) {
         LayoutConstants constants = LayoutConstants.defaults();
         for (int i = 0; i < actions.size(); ++i) {
            Object action = actions.getValue(i);
            if (action instanceof String) {
               actionIds.add((String) action);
               continue;
            }
            JsonObject actionJson = (JsonObject) action;
            if (!actionJson.containsKey("id")) {
               actionJson = actionJson.copy().put("id", id + "-action-" + i);
            }
            Point actionPosition = new Point(position.x() + size.width() + constants.actionGap() + i * constants.actionWidth(), position.y());
            ActionBlock block = readAction(actionJson, id, i, actionPosition, new Size(constants.actionWidth(), constants.actionHeight()));
            actionIds.add(block.id());
            inline.add(block);
         }
      }
      elements.add(new Step(id, number, name, stepType, position, size, actionIds));
      elements.addAll(inline);
   }

   private static Transition readTransition(JsonObject json, List<Element> elements) {
      int number = json.getInteger("number", (int) elements.stream().filter(Transition.class::isInstance).count());
      return new Transition(json.getString("id", "transition-" + number), number, json.getString("condition", ""), point(json), size(json));
   }

   private static ActionBlock readAction(JsonObject json, String parentId, int index, Point position, Size size) {
      String label = json.getString("label");
      if (label == null) {
         label = json.getString("variable", json.getString("content", json.getString("name")));
      }
      if (label == null) {
         throw new DiagramFormatException("Action without label: " + json.encode());
      }
      String token = json.getString("qualifier");
      ActionQualifier qualifier = ActionQualifier.fromToken(token);
      if (qualifier == null) {
         throw new DiagramFormatException("Unknown action qualifier '" + token + "'");
      }
      String kind = json.getString("actionType", json.getString("type"));
      return new ActionBlock(required(json, "id"), parentId, label, qualifier, json.getString("condition"),
            json.getString("duration"), "temporal".equals(kind), json.getInteger("index", index), position, size);
   }

   private static List<Segment> segments(JsonObject json) {
      List<Segment> segments = new ArrayList<>();
      JsonArray array = json.getJsonArray("segments");
      if (array != null) {
         for (Object item : array) {
            JsonObject segment = (JsonObject) item;
            Orientation orientation = Orientation.fromTag(segment.getString("orientation"));
            segments.add(new Segment(orientation, point(segment.getJsonObject("from")), point(segment.getJsonObject("to"))));
         }
      }
      JsonArray points = json.getJsonArray("points");
      if (segments.isEmpty() && points != null && points.size() > 1) {
         for (int i = 1; i < points.size(); ++i) {
            Point from = point(points.getJsonObject(i - 1));
            Point to = point(points.getJsonObject(i));
            segments.add(new Segment(Double.compare(from.x(), to.x()) == 0 ? Orientation.VERTICAL : Orientation.HORIZONTAL, from, to));
         }
      }
      if (segments.isEmpty()) {
         // geometry-less legacy connection
         segments.add(Segment.vertical(0, 0, 0));
      }
      return segments;
   }

   private static String required(JsonObject json, String field) {
      String value = json.getString(field);
      if (value == null) {
         throw new DiagramFormatException("Missing '" + field + "' in " + json.encode());
      }
      return value;
   }

   private static Point point(JsonObject json) {
      JsonObject position = json == null ? null : json.containsKey("position") ? json.getJsonObject("position") : json;
      if (position == null) {
         return new Point(0, 0);
      }
      return new Point(position.getDouble("x", 0.0), position.getDouble("y", 0.0));
   }

   private static Size size(JsonObject json) {
      JsonObject size = json.getJsonObject("size");
      if (size == null) {
         return new Size(0, 0);
      }
      return new Size(size.getDouble("width", 0.0), size.getDouble("height", 0.0));
   }

   private static JsonObject point(Point point) {
      return new JsonObject().put("x", point.x()).put("y", point.y());
   }

   private static JsonObject common(Element element) {
      return new JsonObject()
            .put("id", element.id())
            .put("type", element.tag())
            .put("position", point(element.position()))
            .put("size", new JsonObject().put("width", element.size().width()).put("height", element.size().height()));
   }

   private static class ElementWriter implements ElementVisitor<JsonObject> {
      @Override
      public JsonObject visit(Step step) {
         return common(step)
               .put("number", step.number())
               .put("name", step.name())
               .put("stepType", step.stepType().tag())
               .put("actionIds", new JsonArray(new ArrayList<>(step.actionIds())));
      }

      @Override
      public JsonObject visit(Transition transition) {
         return common(transition)
               .put("number", transition.number())
               .put("condition", transition.condition());
      }

      @Override
      public JsonObject visit(ActionBlock action) {
         return common(action)
               .put("parentId", action.parentId())
               .put("label", action.label())
               .put("qualifier", action.qualifier().name())
               .put("condition", action.condition())
               .put("duration", action.duration())
               .put("actionType", action.isTemporal() ? "temporal" : "normal")
               .put("index", action.index());
      }

      @Override
      public JsonObject visit(Gate gate) {
         return common(gate)
               .put("gateMode", gate.role().tag())
               .put("branchCount", gate.branchCount());
      }

      @Override
      public JsonObject visit(Connection connection) {
         JsonArray segments = new JsonArray();
         for (Segment segment : connection.segments()) {
            segments.add(new JsonObject()
                  .put("orientation", segment.orientation().tag())
                  .put("from", point(segment.from()))
                  .put("to", point(segment.to())));
         }
         return new JsonObject()
               .put("id", connection.id())
               .put("type", connection.tag())
               .put("sourceId", connection.sourceId())
               .put("targetId", connection.targetId())
               .put("segments", segments);
      }
   }
}
