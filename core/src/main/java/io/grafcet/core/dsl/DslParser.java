package io.grafcet.core.dsl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.grafcet.api.diagram.ActionQualifier;
import io.grafcet.api.diagram.GateType;
import io.grafcet.api.diagram.StepType;
import io.grafcet.core.parser.ParserException;
import io.grafcet.internal.Properties;

/**
 * Line-oriented parser for the chart language:
 * <pre>
 * SFC "Title"
 * Step 0 (Initial)
 *    Action "Motor" S
 * Transition "start"
 * Divergence AND
 *    Branch
 *       Step 1
 *    EndBranch
 *    ...
 * EndDivergence
 * Jump 0
 * </pre>
 */
public class DslParser {
   private static final Logger log = LogManager.getLogger(DslParser.class);
   private static final boolean DEBUG_PARSER = Properties.getBoolean(Properties.PARSER_DEBUG);

   private static final Pattern HEADER = Pattern.compile("^SFC(?:\\s+(.*))?$", Pattern.CASE_INSENSITIVE);
   private static final Pattern STEP = Pattern.compile("^Step\\s+(\\S+?)\\s*(?:\\(\\s*(\\w+)\\s*\\))?$", Pattern.CASE_INSENSITIVE);
   private static final Pattern ACTION = Pattern.compile(
         "^Action\\s+(?:\"([^\"]*)\"|([^\\s(]+))\\s*([A-Za-z]+)?\\s*(?:\\((.*)\\))?$", Pattern.CASE_INSENSITIVE);
   private static final Pattern TRANSITION = Pattern.compile("^Transition(?:\\s+(.*))?$", Pattern.CASE_INSENSITIVE);
   private static final Pattern JUMP = Pattern.compile("^Jump(?:\\s+(\\S+))?$", Pattern.CASE_INSENSITIVE);
   private static final Pattern DIVERGENCE = Pattern.compile("^Divergence(?:\\s+(\\S+))?$", Pattern.CASE_INSENSITIVE);
   private static final Pattern BRANCH = Pattern.compile("^Branch$", Pattern.CASE_INSENSITIVE);
   private static final Pattern END_BRANCH = Pattern.compile("^EndBranch$", Pattern.CASE_INSENSITIVE);
   private static final Pattern END_DIVERGENCE = Pattern.compile("^(?:EndDivergence|Converge)$", Pattern.CASE_INSENSITIVE);
   private static final Pattern ATTRIBUTE = Pattern.compile("(\\w+)\\s*=\\s*(?:\"([^\"]*)\"|([^,\\s]+))");
   private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");

   private final Deque<Frame> frames = new ArrayDeque<>();
   private final List<Statement> main = new ArrayList<>();
   private final Map<Integer, Integer> explicitNumbers = new HashMap<>();
   private final Set<Integer> usedNumbers = new HashSet<>();
   private String title;
   private int nextAuto;

   private DslParser() {
   }

   /**
    * Parses chart source text.
    *
    * @param text Source, lines separated by LF or CRLF.
    * @return Statement tree.
    * @throws ParserException on the first malformed or mis-nested statement.
    */
   public static ParserInput parse(String text) throws ParserException {
      return new DslParser().parseText(text == null ? "" : text);
   }

   private ParserInput parseText(String text) throws ParserException {
      String[] lines = text.split("\\r?\\n", -1);
      collectExplicitNumbers(lines);
      for (int i = 0; i < lines.length; ++i) {
         String raw = lines[i];
         String line = raw.trim();
         if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) {
            continue;
         }
         parseLine(i + 1, column(raw), line);
      }
      if (!frames.isEmpty()) {
         Frame frame = frames.peek();
         if (frame.open != null) {
            throw new ParserException(frame.open.line(), frame.column, "Branch is never closed with EndBranch");
         }
         throw new ParserException(frame.line, frame.column, "Divergence " + frame.gateType + " is never closed with EndDivergence");
      }
      return new ParserInput(title, main);
   }

   private void collectExplicitNumbers(String[] lines) throws ParserException {
      for (int i = 0; i < lines.length; ++i) {
         Matcher m = STEP.matcher(lines[i].trim());
         if (!m.matches()) {
            continue;
         }
         Integer number = explicitNumber(m.group(1));
         if (number == null) {
            continue;
         }
         Integer previous = explicitNumbers.putIfAbsent(number, i + 1);
         if (previous != null) {
            throw new ParserException(i + 1, column(lines[i]),
                  "Duplicate step number " + number + " (first declared on line " + previous + ")");
         }
      }
      usedNumbers.addAll(explicitNumbers.keySet());
   }

   private void parseLine(int line, int column, String text) throws ParserException {
      Matcher m;
      if ((m = HEADER.matcher(text)).matches()) {
         if (!main.isEmpty() || !frames.isEmpty()) {
            throw new ParserException(line, column, "SFC header must precede all statements");
         }
         title = m.group(1) == null ? null : unquote(m.group(1).trim());
      } else if ((m = STEP.matcher(text)).matches()) {
         String label = m.group(1);
         StepType stepType = StepType.NORMAL;
         if (m.group(2) != null) {
            stepType = StepType.fromTag(m.group(2));
            if (stepType == null) {
               throw new ParserException(line, column, "Unknown step kind '" + m.group(2) + "', expected Initial, Normal, Task or Macro");
            }
         }
         Integer number = explicitNumber(label);
         if (number == null) {
            number = nextAutoNumber();
         }
         add(line, column, new StepStatement(line, column, label, number, stepType));
      } else if ((m = ACTION.matcher(text)).matches()) {
         parseAction(line, column, m);
      } else if ((m = TRANSITION.matcher(text)).matches()) {
         String condition = m.group(1) == null ? "" : unquote(m.group(1).trim());
         if (condition.isEmpty()) {
            throw new ParserException(line, column, "Transition requires a condition or label");
         }
         add(line, column, new TransitionStatement(line, column, condition));
      } else if ((m = JUMP.matcher(text)).matches()) {
         Integer target = m.group(1) == null ? null : explicitNumber(m.group(1));
         if (target == null) {
            throw new ParserException(line, column, "Jump requires a target step number");
         }
         add(line, column, new JumpStatement(line, column, target));
      } else if ((m = DIVERGENCE.matcher(text)).matches()) {
         String kind = m.group(1);
         if (kind == null || !(kind.equalsIgnoreCase("AND") || kind.equalsIgnoreCase("OR"))) {
            throw new ParserException(line, column, "Divergence requires a type: AND or OR");
         }
         if (!frames.isEmpty() && frames.peek().open == null) {
            throw new ParserException(line, column, "Divergence must be placed inside a Branch");
         }
         frames.push(new Frame(line, column, GateType.fromTag(kind)));
      } else if (BRANCH.matcher(text).matches()) {
         Frame frame = frames.peek();
         if (frame == null) {
            throw new ParserException(line, column, "Branch outside of a Divergence");
         }
         if (frame.open != null) {
            throw new ParserException(line, column, "Branch opened on line " + frame.open.line() + " is not closed with EndBranch");
         }
         frame.open = new Branch(line);
      } else if (END_BRANCH.matcher(text).matches()) {
         Frame frame = frames.peek();
         if (frame == null || frame.open == null) {
            throw new ParserException(line, column, "EndBranch without a matching Branch");
         }
         frame.branches.add(frame.open);
         frame.open = null;
      } else if (END_DIVERGENCE.matcher(text).matches()) {
         Frame frame = frames.peek();
         if (frame == null) {
            throw new ParserException(line, column, text + " without a matching Divergence");
         }
         if (frame.open != null) {
            throw new ParserException(line, column, "Branch opened on line " + frame.open.line() + " is not closed with EndBranch");
         }
         frames.pop();
         DivergenceStatement divergence = new DivergenceStatement(frame.line, frame.column, frame.gateType, frame.branches);
         current(line, column).add(divergence);
         debug(divergence);
      } else {
         throw new ParserException(line, column, "Unrecognized statement: " + text);
      }
   }

   private void parseAction(int line, int column, Matcher m) throws ParserException {
      List<Statement> sequence = current(line, column);
      if (sequence.isEmpty() || !(sequence.get(sequence.size() - 1) instanceof StepStatement)) {
         throw new ParserException(line, column, "Action must follow a Step");
      }
      String label = m.group(1) != null ? m.group(1) : m.group(2);
      if (label.isEmpty()) {
         throw new ParserException(line, column, "Action requires a label");
      }
      String qualifierToken = m.group(3);
      String condition = null;
      String duration = null;
      boolean temporal = false;
      if (m.group(4) != null) {
         Matcher attr = ATTRIBUTE.matcher(m.group(4));
         while (attr.find()) {
            String value = attr.group(2) != null ? attr.group(2) : attr.group(3);
            switch (attr.group(1).toLowerCase(Locale.ROOT)) {
               case "condition":
                  condition = value;
                  break;
               case "duration":
                  duration = value;
                  break;
               case "type":
                  temporal = "temporal".equalsIgnoreCase(value);
                  break;
               case "qualifier":
                  qualifierToken = value;
                  break;
               default:
                  throw new ParserException(line, column, "Unknown action attribute '" + attr.group(1) + "'");
            }
         }
      }
      ActionQualifier qualifier = ActionQualifier.fromToken(qualifierToken);
      if (qualifier == null) {
         throw new ParserException(line, column, "Unknown action qualifier '" + qualifierToken + "'");
      }
      StepStatement step = (StepStatement) sequence.get(sequence.size() - 1);
      ActionStatement action = new ActionStatement(line, label, qualifier, condition, duration, temporal);
      step.addAction(action);
      debug(action);
   }

   private void add(int line, int column, Statement statement) throws ParserException {
      current(line, column).add(statement);
      debug(statement);
   }

   private List<Statement> current(int line, int column) throws ParserException {
      Frame frame = frames.peek();
      if (frame == null) {
         return main;
      }
      if (frame.open == null) {
         throw new ParserException(line, column, "Statement must be placed inside a Branch of the Divergence opened on line " + frame.line);
      }
      return frame.open.mutableStatements();
   }

   private int nextAutoNumber() {
      while (usedNumbers.contains(nextAuto)) {
         ++nextAuto;
      }
      usedNumbers.add(nextAuto);
      return nextAuto;
   }

   private static Integer explicitNumber(String label) {
      Matcher m = TRAILING_NUMBER.matcher(label);
      if (!m.find()) {
         return null;
      }
      try {
         return Integer.parseInt(m.group(1));
      } catch (NumberFormatException e) {
         return null;
      }
   }

   private static String unquote(String text) {
      if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
         return text.substring(1, text.length() - 1);
      }
      return text;
   }

   private static int column(String raw) {
      int i = 0;
      while (i < raw.length() && Character.isWhitespace(raw.charAt(i))) {
         ++i;
      }
      return i + 1;
   }

   private static void debug(Object statement) {
      if (DEBUG_PARSER) {
         log.info("Parsed {}", statement);
      }
   }

   private static class Frame {
      final int line;
      final int column;
      final GateType gateType;
      final List<Branch> branches = new ArrayList<>();
      Branch open;

      Frame(int line, int column, GateType gateType) {
         this.line = line;
         this.column = column;
         this.gateType = gateType;
      }
   }
}
