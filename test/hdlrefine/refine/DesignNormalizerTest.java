package hdlrefine.refine;

import static hdlrefine.TestDesignBuilder.decl;
import static hdlrefine.TestDesignBuilder.module;
import static hdlrefine.TestDesignBuilder.parse;
import static hdlrefine.TestDesignBuilder.procedure;
import static hdlrefine.TestDesignBuilder.process;

import hdlrefine.HdlRefine;
import hdlrefine.TestDesignBuilder;
import hdlrefine.design.Assign;
import hdlrefine.design.Design;
import hdlrefine.design.Identifier;
import hdlrefine.design.Process;
import hdlrefine.design.Signal;
import hdlrefine.design.Variable;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.util.DesignPrinter;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DesignNormalizerTest {

  static RefinementContext prepare(Design design) {
    return new HdlRefine().prepare(design);
  }

  @Test
  void testUnreferencedSignalBecomesVariable() {
    Design design = parse("modules:\n"
                          + "  - name: top\n"
                          + "    signals:\n"
                          + "      - {name: unused, type: logic, init: 0}\n");
    prepare(design);
    Variable unused = (Variable)decl(design, "top", "unused");
    Assertions.assertEquals("logic", unused.getType());
    Assertions.assertEquals("0", DesignPrinter.expr(unused.getInitialValue()));
  }

  @Test
  void testOutputPortOfSubModuleIsWrittenByProcess() {
    Design design = parse(TestDesignBuilder.ROLES);
    RefinementContext ctx = prepare(design);
    Assertions.assertTrue(module(design, "sub").getContinuous().isEmpty());
    Process proc = process(design, "sub", "yo_assign_process");
    Assertions.assertEquals(Process.Flavour.ALWAYS, proc.getFlavour());
    Assertions.assertEquals("xi", ((Identifier)proc.getSensitivity().get(0)).getName());
    Assertions.assertEquals("yo <= xi;", DesignPrinter.toShortString(proc.getBody().get(0)));
    Assertions.assertEquals(Set.of("sub.yo"), ctx.getWarnings().getSubjects(DesignNormalizer.OUTPUT_PORT_WARNING));
    Assertions.assertEquals(Phase.RESOLVED, ctx.getPhase());
  }

  @Test
  void testConstantOutputBecomesInitialProcess() {
    Design design = parse("modules:\n"
                          + "  - name: top\n"
                          + "    ports:\n"
                          + "      - {name: q, dir: out}\n"
                          + "    continuous:\n"
                          + "      - {assign: q, value: 0}\n");
    RefinementContext ctx = prepare(design);
    Process proc = process(design, "top", "q_assign_process");
    Assertions.assertEquals(Process.Flavour.INITIAL, proc.getFlavour());
    Assertions.assertEquals(1, proc.getBody().size());
    // Top level ports are not reported.
    Assertions.assertFalse(ctx.getWarnings().contains(DesignNormalizer.OUTPUT_PORT_WARNING));
  }

  @Test
  void testReadOutputPortGetsShadowSignal() {
    Design design = parse("modules:\n"
                          + "  - name: top\n"
                          + "    ports:\n"
                          + "      - {name: a, dir: in}\n"
                          + "      - {name: q, dir: out}\n"
                          + "    signals:\n"
                          + "      - {name: r}\n"
                          + "    continuous:\n"
                          + "      - {assign: q, value: a}\n"
                          + "    processes:\n"
                          + "      - name: p\n"
                          + "        sensitivity: [a]\n"
                          + "        body:\n"
                          + "          - {assign: r, value: q, nonblocking: true}\n");
    RefinementContext ctx = prepare(design);
    Signal shadow = (Signal)decl(design, "top", "q_out_sig");
    Assign binding = module(design, "top").getContinuous().get(0);
    Assertions.assertSame(shadow, ((Identifier)binding.getTarget()).getDeclaration());
    Assign read = (Assign)process(design, "top", "p").getBody().get(0);
    Assertions.assertSame(shadow, ((Identifier)read.getValue()).getDeclaration());

    Process update = process(design, "top", "q_update_process");
    Assertions.assertEquals("q_out_sig", ((Identifier)update.getSensitivity().get(0)).getName());
    Assertions.assertEquals("q <= q_out_sig;", DesignPrinter.toShortString(update.getBody().get(0)));
    // The reference map knows the new declaration.
    Assertions.assertEquals(4, ctx.getRefs().get(shadow).size());
  }

  @Test
  void testNonBlockingWritesOfVariablesAreDowngraded() {
    Design design = parse("modules:\n"
                          + "  - name: top\n"
                          + "    variables:\n"
                          + "      - {name: v}\n"
                          + "    procedures:\n"
                          + "      - name: t\n"
                          + "        parameters: [{name: pp}]\n"
                          + "        body:\n"
                          + "          - {assign: pp, value: 1, nonblocking: true}\n"
                          + "    processes:\n"
                          + "      - name: p\n"
                          + "        body:\n"
                          + "          - {assign: v, value: 0, nonblocking: true}\n"
                          + "          - {call: t}\n");
    RefinementContext ctx = prepare(design);
    Assertions.assertFalse(((Assign)process(design, "top", "p").getBody().get(0)).isNonBlocking());
    Assertions.assertFalse(((Assign)procedure(design, "top", "t").getBody().get(0)).isNonBlocking());
    Assertions.assertEquals(Set.of("v"), ctx.getWarnings().getSubjects(DesignNormalizer.VARIABLE_WARNING));
    Assertions.assertEquals(Set.of("pp"), ctx.getWarnings().getSubjects(DesignNormalizer.PARAMETER_WARNING));
  }

  @Test
  void testNormalizeOnlyBeforeClassification() {
    Design design = parse(TestDesignBuilder.CONE_READ);
    RefinementContext ctx = TestDesignBuilder.runUntil(design, Phase.CLASSIFIED);
    Assertions.assertThrows(IllegalStateException.class, () -> DesignNormalizer.normalize(ctx));
  }
}
