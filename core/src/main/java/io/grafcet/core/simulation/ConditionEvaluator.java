package io.grafcet.core.simulation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Evaluates transition guards and action conditions.
 * <p>
 * Grammar, loosest binding first:
 * <pre>
 * or         := and (('OR' | '+') and)*
 * and        := unary (('AND' | '*' | '.') unary)*
 * unary      := ('NOT' | '!' | '/') unary | ('RE' | 'FE') unary | comparison
 * comparison := primary (('&gt;' | '&lt;' | '&gt;=' | '&lt;=' | '=' | '!=') primary)?
 * primary    := '(' or ')' | number | time | 'TRUE' | 'FALSE' | name | 'X'n | 'X'n'.t'
 * </pre>
 * Names resolve through the {@link Scope}; unknown names are false. Malformed expressions evaluate to false,
 * the evaluator never throws.
 */
public final class ConditionEvaluator {
   private static final Logger log = LogManager.getLogger(ConditionEvaluator.class);
   private static final Pattern DURATION = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)\\s*(ms|s|sec|min|h)?\\s*$", Pattern.CASE_INSENSITIVE);
   private static final Pattern STEP_VARIABLE = Pattern.compile("^X(\\d+)(\\.t)?$", Pattern.CASE_INSENSITIVE);
   static final int MAX_DEPTH = 100;

   private ConditionEvaluator() {
   }

   public interface Scope {
      /**
       * @return Current value of the variable or {@code null} if unknown.
       */
      Object variable(String name);

      /**
       * @return Value of the variable in the previous evaluation or {@code null}.
       */
      Object previous(String name);

      boolean isStepActive(int number);

      /**
       * @return Seconds since the step was activated, 0 when it is not active.
       */
      double stepElapsed(int number);
   }

   public static boolean evaluate(String expression, Scope scope) {
      if (expression == null || expression.isBlank()) {
         return false;
      }
      try {
         Evaluation evaluation = new Evaluation(tokenize(expression), scope);
         Object value = evaluation.or();
         if (!evaluation.atEnd()) {
            throw new IllegalArgumentException("Unexpected '" + evaluation.peek() + "'");
         }
         return truthy(value);
      } catch (IllegalArgumentException e) {
         log.debug("Cannot evaluate '{}': {}", expression, e.getMessage());
         return false;
      }
   }

   public static boolean truthy(Object value) {
      if (value instanceof Boolean) {
         return (Boolean) value;
      } else if (value instanceof Number) {
         return ((Number) value).doubleValue() != 0;
      }
      return false;
   }

   /**
    * Parses {@code 5s}, {@code 200ms}, {@code 1.5min}, {@code 2h} or a plain number of seconds.
    *
    * @return Duration in seconds or {@link Double#NaN} when the text is not a duration.
    */
   public static double parseDuration(String text) {
      if (text == null) {
         return Double.NaN;
      }
      Matcher m = DURATION.matcher(text);
      if (!m.matches()) {
         return Double.NaN;
      }
      double value = Double.parseDouble(m.group(1));
      String unit = m.group(2) == null ? "s" : m.group(2).toLowerCase(Locale.ROOT);
      switch (unit) {
         case "ms":
            return value / 1000;
         case "min":
            return value * 60;
         case "h":
            return value * 3600;
         default:
            return value;
      }
   }

   static List<String> tokenize(String expression) {
      List<String> tokens = new ArrayList<>();
      int i = 0;
      int n = expression.length();
      while (i < n) {
         char c = expression.charAt(i);
         if (Character.isWhitespace(c)) {
            ++i;
         } else if (Character.isDigit(c)) {
            int start = i;
            while (i < n && (Character.isDigit(expression.charAt(i)) || expression.charAt(i) == '.'
                  && i + 1 < n && Character.isDigit(expression.charAt(i + 1)))) {
               ++i;
            }
            while (i < n && Character.isLetter(expression.charAt(i))) {
               ++i;
            }
            tokens.add(expression.substring(start, i));
         } else if (Character.isLetter(c) || c == '_') {
            int start = i;
            while (i < n && (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '_')) {
               ++i;
            }
            String word = expression.substring(start, i);
            if (i + 1 < n && expression.charAt(i) == '.' && Character.toLowerCase(expression.charAt(i + 1)) == 't'
                  && (i + 2 == n || !Character.isLetterOrDigit(expression.charAt(i + 2)))
                  && STEP_VARIABLE.matcher(word).matches()) {
               word = word + ".t";
               i += 2;
            }
            tokens.add(word);
         } else if ((c == '>' || c == '<' || c == '!' || c == '=') && i + 1 < n && expression.charAt(i + 1) == '=') {
            tokens.add(expression.substring(i, i + 2));
            i += 2;
         } else if (c == '&' && i + 1 < n && expression.charAt(i + 1) == '&' || c == '|' && i + 1 < n && expression.charAt(i + 1) == '|') {
            tokens.add(c == '&' ? "*" : "+");
            i += 2;
         } else if ("()+*.!/<>=".indexOf(c) >= 0) {
            tokens.add(String.valueOf(c));
            ++i;
         } else if (c == '↑') {
            tokens.add("RE");
            ++i;
         } else if (c == '↓') {
            tokens.add("FE");
            ++i;
         } else {
            throw new IllegalArgumentException("Unexpected character '" + c + "'");
         }
      }
      return tokens;
   }

   private static final class Evaluation {
      private final List<String> tokens;
      private final Scope scope;
      private int position;
      private int depth;
      private boolean previous;

      Evaluation(List<String> tokens, Scope scope) {
         this.tokens = tokens;
         this.scope = scope;
      }

      boolean atEnd() {
         return position >= tokens.size();
      }

      String peek() {
         return atEnd() ? null : tokens.get(position);
      }

      private boolean accept(String... candidates) {
         String token = peek();
         if (token == null) {
            return false;
         }
         for (String candidate : candidates) {
            if (candidate.equalsIgnoreCase(token)) {
               ++position;
               return true;
            }
         }
         return false;
      }

      Object or() {
         Object first = and();
         if (!"OR".equalsIgnoreCase(peek()) && !"+".equals(peek())) {
            return first;
         }
         boolean value = truthy(first);
         while (accept("OR", "+")) {
            // both sides are evaluated so that the cursor advances
            boolean right = truthy(and());
            value = value || right;
         }
         return value;
      }

      Object and() {
         Object first = unary();
         if (!"AND".equalsIgnoreCase(peek()) && !"*".equals(peek()) && !".".equals(peek())) {
            return first;
         }
         boolean value = truthy(first);
         while (accept("AND", "*", ".")) {
            boolean right = truthy(unary());
            value = value && right;
         }
         return value;
      }

      Object unary() {
         if (++depth > MAX_DEPTH) {
            throw new IllegalArgumentException("Expression is nested deeper than " + MAX_DEPTH + " levels");
         }
         try {
            return unaryOrComparison();
         } finally {
            --depth;
         }
      }

      private Object unaryOrComparison() {
         if (accept("NOT", "!", "/")) {
            return !truthy(unary());
         } else if ("RE".equalsIgnoreCase(peek()) || "FE".equalsIgnoreCase(peek())) {
            boolean rising = "RE".equalsIgnoreCase(tokens.get(position++));
            int start = position;
            boolean wasPrevious = previous;
            boolean now = truthy(unary());
            int end = position;
            position = start;
            previous = true;
            boolean before = truthy(unary());
            previous = wasPrevious;
            position = end;
            return rising ? now && !before : !now && before;
         }
         return comparison();
      }

      Object comparison() {
         Object left = primary();
         String operator = peek();
         if (operator == null || !(operator.equals(">") || operator.equals("<") || operator.equals(">=") || operator.equals("<=")
               || operator.equals("=") || operator.equals("==") || operator.equals("!="))) {
            return left;
         }
         ++position;
         Object right = primary();
         double l = number(left);
         double r = number(right);
         if (Double.isNaN(l) || Double.isNaN(r)) {
            return false;
         }
         switch (operator) {
            case ">":
               return l > r;
            case "<":
               return l < r;
            case ">=":
               return l >= r;
            case "<=":
               return l <= r;
            case "!=":
               return l != r;
            default:
               return l == r;
         }
      }

      Object primary() {
         String token = peek();
         if (token == null) {
            throw new IllegalArgumentException("Unexpected end of expression");
         }
         ++position;
         if (token.equals("(")) {
            Object value = or();
            if (!accept(")")) {
               throw new IllegalArgumentException("Missing ')'");
            }
            return value;
         } else if (token.equalsIgnoreCase("TRUE")) {
            return Boolean.TRUE;
         } else if (token.equalsIgnoreCase("FALSE")) {
            return Boolean.FALSE;
         } else if (Character.isDigit(token.charAt(0))) {
            double value = parseDuration(token);
            if (Double.isNaN(value)) {
               throw new IllegalArgumentException("Invalid number '" + token + "'");
            }
            return value;
         } else if (Character.isLetter(token.charAt(0)) || token.charAt(0) == '_') {
            if (isKeyword(token)) {
               throw new IllegalArgumentException("Unexpected '" + token + "'");
            }
            return name(token);
         }
         throw new IllegalArgumentException("Unexpected '" + token + "'");
      }

      private Object name(String token) {
         Object value = previous ? scope.previous(token) : scope.variable(token);
         if (value != null) {
            return value;
         }
         Matcher m = STEP_VARIABLE.matcher(token);
         if (m.matches()) {
            int number = Integer.parseInt(m.group(1));
            return m.group(2) == null ? (Object) scope.isStepActive(number) : (Object) scope.stepElapsed(number);
         }
         return null;
      }

      private static boolean isKeyword(String token) {
         switch (token.toUpperCase(Locale.ROOT)) {
            case "AND":
            case "OR":
            case "NOT":
            case "RE":
            case "FE":
               return true;
            default:
               return false;
         }
      }

      private static double number(Object value) {
         if (value instanceof Number) {
            return ((Number) value).doubleValue();
         } else if (value instanceof Boolean) {
            return (Boolean) value ? 1 : 0;
         } else if (value instanceof String) {
            try {
               return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
               return Double.NaN;
            }
         }
         return Double.NaN;
      }
   }
}
