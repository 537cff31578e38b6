package hdlrefine.refine;

import hdlrefine.TestDesignBuilder;
import hdlrefine.design.Design;
import hdlrefine.design.DesignException;
import hdlrefine.semantics.DeclarationResolver;
import hdlrefine.ui.RefineConfig;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DesignChecksTest {

  static String design(String readerSensitivity, boolean nonBlocking, String writerFlavour) {
    return "modules:\n"
        + "  - name: top\n"
        + "    ports:\n"
        + "      - {name: clk, dir: in}\n"
        + "      - {name: q, dir: out}\n"
        + "    signals:\n"
        + "      - {name: sig}\n"
        + "    processes:\n"
        + "      - name: p1\n"
        + "        flavour: " + writerFlavour + "\n"
        + "        sensitivity: [clk]\n"
        + "        body:\n"
        + "          - {assign: sig, value: 1, nonblocking: " + nonBlocking + "}\n"
        + "      - name: p2\n"
        + "        sensitivity: [" + readerSensitivity + "]\n"
        + "        body:\n"
        + "          - {assign: q, value: sig, nonblocking: true}\n";
  }

  static RefinementContext check(String yaml) {
    Design design = TestDesignBuilder.parse(yaml);
    DeclarationResolver.resolve(design);
    RefinementContext ctx = new RefinementContext(design, new RefineConfig());
    DesignChecks.check(ctx);
    return ctx;
  }

  @Test
  void testMissingSensitivityIsReported() {
    RefinementContext ctx = check(design("clk", false, "always"));
    Assertions.assertEquals(Set.of("sig"), ctx.getWarnings().getSubjects(DesignChecks.SENSITIVITY_WARNING));
  }

  @ParameterizedTest
  @CsvSource({"'clk, sig', false, always",
              "clk, true, always",
              "clk, false, initial"})
  void testNoReport(String sensitivity, boolean nonBlocking, String flavour) {
    RefinementContext ctx = check(design(sensitivity, nonBlocking, flavour));
    Assertions.assertTrue(ctx.getWarnings().isEmpty());
  }

  @Test
  void testUnknownNameIsFatal() {
    Design design = TestDesignBuilder.parse(design("clk, nothing", false, "always"));
    Assertions.assertThrows(DesignException.class, () -> DeclarationResolver.resolve(design));
  }
}
