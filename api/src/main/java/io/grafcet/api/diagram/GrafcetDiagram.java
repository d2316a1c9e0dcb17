package io.grafcet.api.diagram;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compiled chart: a flat collection of positioned elements plus title and version.
 * Element order is the order in which the compiler emitted them; connections leaving
 * a divergence gate are therefore listed in branch order.
 */
public class GrafcetDiagram implements Serializable {
   public static final String CURRENT_VERSION = "1.0";

   private final String id;
   private final String title;
   private final String version;
   private final List<Element> elements;
   private final Map<String, Element> elementMap;
   private final Map<String, List<Connection>> incoming = new HashMap<>();
   private final Map<String, List<Connection>> outgoing = new HashMap<>();

   public GrafcetDiagram(String id, String title, String version, List<? extends Element> elements) {
      this.id = id;
      this.title = title;
      this.version = version == null ? CURRENT_VERSION : version;
      this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
      Map<String, Element> map = new LinkedHashMap<>();
      for (Element element : elements) {
         if (map.put(element.id(), element) != null) {
            throw new IllegalArgumentException("Duplicate element id '" + element.id() + "'");
         }
         if (element instanceof Connection) {
            Connection c = (Connection) element;
            outgoing.computeIfAbsent(c.sourceId(), k -> new ArrayList<>()).add(c);
            incoming.computeIfAbsent(c.targetId(), k -> new ArrayList<>()).add(c);
         }
      }
      this.elementMap = Collections.unmodifiableMap(map);
   }

   public String id() {
      return id;
   }

   public String title() {
      return title;
   }

   public String version() {
      return version;
   }

   public List<Element> elements() {
      return elements;
   }

   public Element element(String id) {
      return elementMap.get(id);
   }

   public <E extends Element> E element(String id, Class<E> clazz) {
      Element element = elementMap.get(id);
      return clazz.isInstance(element) ? clazz.cast(element) : null;
   }

   public boolean contains(String id) {
      return elementMap.containsKey(id);
   }

   public List<Step> steps() {
      return ofType(Step.class);
   }

   public List<Transition> transitions() {
      return ofType(Transition.class);
   }

   public List<Gate> gates() {
      return ofType(Gate.class);
   }

   public List<Connection> connections() {
      return ofType(Connection.class);
   }

   public List<ActionBlock> actionBlocks() {
      return ofType(ActionBlock.class);
   }

   public List<Step> initialSteps() {
      return steps().stream().filter(Step::isInitial).collect(Collectors.toList());
   }

   public Step stepByNumber(int number) {
      for (Element element : elements) {
         if (element instanceof Step && ((Step) element).number() == number) {
            return (Step) element;
         }
      }
      return null;
   }

   /**
    * Actions owned by the step: those referenced from the step first, then any action block
    * pointing at the step through its parent id.
    */
   public List<ActionBlock> actionsOf(Step step) {
      List<ActionBlock> actions = new ArrayList<>();
      for (String actionId : step.actionIds()) {
         ActionBlock action = element(actionId, ActionBlock.class);
         if (action != null) {
            actions.add(action);
         }
      }
      for (Element element : elements) {
         if (element instanceof ActionBlock && step.id().equals(((ActionBlock) element).parentId()) && !actions.contains(element)) {
            actions.add((ActionBlock) element);
         }
      }
      return actions;
   }

   public List<Connection> incoming(String elementId) {
      return incoming.getOrDefault(elementId, Collections.emptyList());
   }

   public List<Connection> outgoing(String elementId) {
      return outgoing.getOrDefault(elementId, Collections.emptyList());
   }

   /**
    * @return Connections whose source or target is not an element of this diagram.
    */
   public List<Connection> danglingConnections() {
      return connections().stream()
            .filter(c -> !elementMap.containsKey(c.sourceId()) || !elementMap.containsKey(c.targetId()))
            .collect(Collectors.toList());
   }

   private <E extends Element> List<E> ofType(Class<E> clazz) {
      return elements.stream().filter(clazz::isInstance).map(clazz::cast).collect(Collectors.toList());
   }
}
