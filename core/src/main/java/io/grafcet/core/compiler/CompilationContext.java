package io.grafcet.core.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.grafcet.api.compiler.Diagnostic;
import io.grafcet.api.diagram.Element;
import io.grafcet.api.diagram.GateType;
import io.grafcet.api.diagram.GrafcetDiagram;
import io.grafcet.api.diagram.Step;

/**
 * State of a single compilation: the growing element list, the id counters, the jumps still waiting for their
 * targets and the diagnostics. One instance is created per {@link LayoutCompiler#compile} call and is handed
 * to the {@link JumpResolver} before the diagram is {@link #build(String) built}.
 */
public class CompilationContext {
   private final LayoutConstants constants;
   private final String title;
   private final List<Element> elements = new ArrayList<>();
   private final Map<Integer, Step> stepsByNumber = new HashMap<>();
   private final List<PendingJump> pendingJumps = new ArrayList<>();
   private final List<Diagnostic> diagnostics = new ArrayList<>();
   private double currentY;
   private int transitionCounter;
   private int gateCounter;
   private int connectionCounter;
   private boolean jumpsResolved;

   CompilationContext(LayoutConstants constants, String title) {
      this.constants = constants;
      this.title = title;
      this.currentY = constants.startY();
   }

   public LayoutConstants constants() {
      return constants;
   }

   /**
    * @return Title declared in the source, possibly {@code null}.
    */
   public String title() {
      return title;
   }

   public List<Element> elements() {
      return Collections.unmodifiableList(elements);
   }

   void add(Element element) {
      elements.add(element);
      if (element instanceof Step) {
         Step step = (Step) element;
         stepsByNumber.put(step.number(), step);
      }
   }

   public Step step(int number) {
      return stepsByNumber.get(number);
   }

   public Element element(String id) {
      for (Element element : elements) {
         if (element.id().equals(id)) {
            return element;
         }
      }
      return null;
   }

   /**
    * @return Bottom of the lowest element placed so far.
    */
   public double currentY() {
      return currentY;
   }

   void advanceTo(double y) {
      currentY = Math.max(currentY, y);
   }

   int nextTransitionNumber() {
      return transitionCounter++;
   }

   String nextGateId(GateType type) {
      return type.tag() + "-" + gateCounter++;
   }

   String nextConnectionId() {
      return "connection-" + connectionCounter++;
   }

   void addPendingJump(PendingJump jump) {
      pendingJumps.add(jump);
   }

   public List<PendingJump> pendingJumps() {
      return Collections.unmodifiableList(pendingJumps);
   }

   void markJumpsResolved() {
      jumpsResolved = true;
   }

   public boolean jumpsResolved() {
      return jumpsResolved || pendingJumps.isEmpty();
   }

   void addDiagnostic(Diagnostic diagnostic) {
      diagnostics.add(diagnostic);
   }

   public List<Diagnostic> diagnostics() {
      return Collections.unmodifiableList(diagnostics);
   }

   public boolean hasErrors() {
      return diagnostics.stream().anyMatch(Diagnostic::isError);
   }

   /**
    * @param title Diagram title; when {@code null} the title from the source is used.
    * @throws IllegalStateException when jumps were not resolved yet.
    */
   public GrafcetDiagram build(String title) {
      if (!jumpsResolved()) {
         throw new IllegalStateException("Jumps must be resolved before the diagram is built: " + pendingJumps);
      }
      String effectiveTitle = title != null ? title : this.title != null ? this.title : "Untitled";
      return new GrafcetDiagram(UUID.randomUUID().toString(), effectiveTitle, GrafcetDiagram.CURRENT_VERSION, elements);
   }
}
