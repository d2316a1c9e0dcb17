package io.grafcet.core.test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import io.grafcet.api.compiler.CompileResult;
import io.grafcet.api.diagram.GrafcetDiagram;
import io.grafcet.core.compiler.LayoutConstants;
import io.grafcet.core.compiler.SfcCompiler;

public class TestUtil {

   public static String resource(String file) {
      try (InputStream stream = TestUtil.class.getClassLoader().getResourceAsStream(file)) {
         if (stream == null) {
            throw new IllegalArgumentException("Cannot load file " + file + " from current classloader.");
         }
         return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
      } catch (IOException e) {
         throw new UncheckedIOException(e);
      }
   }

   public static GrafcetDiagram compile(String code) {
      CompileResult result = new SfcCompiler(LayoutConstants.defaults()).compile(code, null);
      if (!result.isSuccess()) {
         throw new AssertionError("Compilation failed: " + result.error());
      }
      return result.generatedSFC();
   }

   public static GrafcetDiagram compileResource(String file) {
      return compile(resource(file));
   }
}
