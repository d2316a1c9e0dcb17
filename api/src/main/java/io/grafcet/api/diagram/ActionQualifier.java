package io.grafcet.api.diagram;

/**
 * IEC 61131-3 action qualifiers understood by the simulator.
 */
public enum ActionQualifier {
   /** Non-stored: output while the step is active. */
   N,
   /** Set (stored). */
   S,
   /** Reset a stored output. */
   R,
   /** Pulse: only on the evaluation that activated the step. */
   P,
   /** Time limited. */
   L,
   /** Time delayed. */
   D,
   /** Stored and delayed. */
   SD,
   /** Delayed and stored. */
   DS,
   /** Stored and limited. */
   SL;

   public boolean isStored() {
      return this == S || this == SD || this == DS || this == SL;
   }

   public static ActionQualifier fromToken(String token) {
      if (token == null || token.isEmpty()) {
         return N;
      }
      for (ActionQualifier qualifier : values()) {
         if (qualifier.name().equalsIgnoreCase(token)) {
            return qualifier;
         }
      }
      return null;
   }
}
