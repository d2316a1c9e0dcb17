package io.grafcet.core.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.grafcet.api.compiler.CompileResult;
import io.grafcet.api.compiler.Diagnostic;
import io.grafcet.api.compiler.DiagnosticType;
import io.grafcet.api.diagram.GrafcetDiagram;
import io.grafcet.core.dsl.DslParser;
import io.grafcet.core.dsl.ParserInput;
import io.grafcet.core.parser.ParserException;

/**
 * Entry point of the compiler: parse, validate, lay out, resolve jumps and build. Problems are reported in the
 * returned {@link CompileResult}; nothing is thrown to the caller.
 */
public class SfcCompiler {
   private static final Logger log = LogManager.getLogger(SfcCompiler.class);

   private final StructuralValidator validator = new StructuralValidator();
   private final LayoutCompiler layoutCompiler;

   public SfcCompiler() {
      this(LayoutConstants.fromProperties());
   }

   public SfcCompiler(LayoutConstants constants) {
      this.layoutCompiler = new LayoutCompiler(constants);
   }

   /**
    * @param code  Chart source.
    * @param title Diagram title; when {@code null} or blank the title from the {@code SFC} header is used.
    */
   public CompileResult compile(String code, String title) {
      ParserInput input;
      try {
         input = DslParser.parse(code);
      } catch (ParserException e) {
         log.debug("Cannot parse chart", e);
         return CompileResult.failure(Collections.singletonList(
               Diagnostic.error(DiagnosticType.SYNTAX, e.getMessage(), null, e.line())));
      }
      List<Diagnostic> diagnostics = new ArrayList<>(validator.validate(input));
      if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
         return fail(diagnostics);
      }
      CompilationContext context = layoutCompiler.compile(input);
      JumpResolver.resolveJumps(context);
      diagnostics.addAll(context.diagnostics());
      if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
         return fail(diagnostics);
      }
      GrafcetDiagram diagram = context.build(title == null || title.isBlank() ? null : title);
      for (Diagnostic warning : diagnostics) {
         log.warn("{}", warning.format());
      }
      log.debug("Compiled '{}': {} steps, {} transitions, {} connections", diagram.title(), diagram.steps().size(),
            diagram.transitions().size(), diagram.connections().size());
      return CompileResult.success(diagram, diagnostics);
   }

   private static CompileResult fail(List<Diagnostic> diagnostics) {
      if (log.isDebugEnabled()) {
         log.debug("Compilation failed: {}", diagnostics.stream().map(Diagnostic::format).collect(Collectors.joining("; ")));
      }
      return CompileResult.failure(diagnostics);
   }
}
