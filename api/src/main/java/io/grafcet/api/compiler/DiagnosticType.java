package io.grafcet.api.compiler;

public enum DiagnosticType {
   SYNTAX("syntax"),
   AND_DIVERGENCE("and-divergence"),
   OR_DIVERGENCE("or-divergence"),
   SEQUENCE("sequence"),
   DANGLING_REFERENCE("dangling-reference"),
   INITIAL_STEP("initial-step"),
   AMBIGUOUS_LABEL("ambiguous-label");

   private final String tag;

   DiagnosticType(String tag) {
      this.tag = tag;
   }

   public String tag() {
      return tag;
   }
}
