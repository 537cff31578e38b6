package hdlrefine.refine;

import static hdlrefine.TestDesignBuilder.decl;
import static hdlrefine.TestDesignBuilder.module;
import static hdlrefine.TestDesignBuilder.parse;
import static hdlrefine.TestDesignBuilder.process;

import hdlrefine.HdlRefine;
import hdlrefine.TestDesignBuilder;
import hdlrefine.design.Action;
import hdlrefine.design.Assign;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Declaration;
import hdlrefine.design.Design;
import hdlrefine.design.Identifier;
import hdlrefine.design.IfStmt;
import hdlrefine.design.Procedure;
import hdlrefine.design.ProcedureCall;
import hdlrefine.design.Process;
import hdlrefine.design.Signal;
import hdlrefine.design.Variable;
import hdlrefine.ui.RefineConfig;
import hdlrefine.util.DesignPrinter;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DualStorageMaterializerTest {
  /** x is written blocking and non-blocking but has no binding. */
  static final String LAZY = "modules:\n"
                             + "  - name: top\n"
                             + "    ports:\n"
                             + "      - {name: clk, dir: in}\n"
                             + "      - {name: a, dir: in}\n"
                             + "      - {name: q, dir: out}\n"
                             + "    signals:\n"
                             + "      - {name: x}\n"
                             + "    processes:\n"
                             + "      - name: p\n"
                             + "        posedge: [clk]\n"
                             + "        body:\n"
                             + "          - {assign: x, value: a, nonblocking: true}\n"
                             + "      - name: r\n"
                             + "        sensitivity: [a]\n"
                             + "        body:\n"
                             + "          - {assign: x, value: a}\n"
                             + "          - {assign: q, value: x, nonblocking: true}\n";

  static final String DELAYED = "modules:\n"
                                + "  - name: top\n"
                                + "    ports:\n"
                                + "      - {name: a, dir: in}\n"
                                + "      - {name: q, dir: out}\n"
                                + "    signals:\n"
                                + "      - {name: x}\n"
                                + "    processes:\n"
                                + "      - name: w\n"
                                + "        sensitivity: [a]\n"
                                + "        body:\n"
                                + "          - {assign: x, value: {call: compute, args: [a]}, delay: 5}\n"
                                + "      - name: r\n"
                                + "        sensitivity: [x]\n"
                                + "        body:\n"
                                + "          - {assign: q, value: x, nonblocking: true}\n";

  /** g is driven by a function only and therefore a leaf driver with variable storage. */
  static final String VARIABLE_LEAF = "modules:\n"
                                      + "  - name: top\n"
                                      + "    ports:\n"
                                      + "      - {name: d, dir: out}\n"
                                      + "    signals:\n"
                                      + "      - {name: g}\n"
                                      + "    continuous:\n"
                                      + "      - {assign: g, value: {call: '$random'}}\n"
                                      + "      - {assign: d, value: g}\n";

  static String text(Action action) { return DesignPrinter.toShortString(action); }

  static List<String> coneNames(Design design) {
    return module(design, "top")
        .getDeclarations()
        .stream()
        .filter(decl -> decl instanceof Procedure && ((Procedure)decl).isCone())
        .map(Declaration::getName)
        .collect(Collectors.toList());
  }

  @Test
  void testLazyCone() {
    Design design = parse(LAZY);
    RefinementContext ctx = new HdlRefine(TestDesignBuilder.rawConfig()).refine(design);
    DataDeclaration x = decl(design, "top", "x");
    Assertions.assertTrue(x instanceof Signal);
    Assertions.assertTrue(decl(design, "top", "x_sig_var") instanceof Variable);

    Cone cone = ctx.getCone(x);
    Assertions.assertTrue(cone.isLazy());
    Assertions.assertTrue(cone.getCaptured().isEmpty());
    Assertions.assertEquals(1, cone.getProcedure().getBody().size());
    IfStmt sync = (IfStmt)cone.getProcedure().getBody().get(0);
    Assertions.assertEquals("x != old_x", DesignPrinter.expr(sync.getAlts().get(0).getCondition()));
    Assertions.assertEquals("x_sig_var = old_x;", text(sync.getAlts().get(0).getActions().get(1)));

    var r = process(design, "top", "r").getBody();
    Assertions.assertEquals(5, r.size());
    Assertions.assertTrue(r.get(0) instanceof ProcedureCall);
    Assertions.assertEquals("x_sig_var = a;", text(r.get(1)));
    Assertions.assertEquals("x = x_sig_var;", text(r.get(2)));
    Assertions.assertTrue(r.get(3) instanceof ProcedureCall);
    Assertions.assertEquals("q = x_sig_var;", text(r.get(4)));

    var p = process(design, "top", "p").getBody();
    Assertions.assertTrue(p.get(0) instanceof ProcedureCall);
    Assertions.assertSame(x, ((Identifier)((Assign)p.get(1)).getTarget()).getDeclaration());

    // Without leaf drivers there is nothing to synchronize.
    Assertions.assertTrue(module(design, "top").getProcesses().stream().map(Process::getName).noneMatch(name -> name.endsWith("_sync_process")));
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void testLazyConesAreSortedWithTheOthers(boolean sortCones) {
    Design design = parse(LAZY.replace("      - {name: x}\n", "      - {name: x}\n      - {name: z}\n    continuous:\n      - {assign: z, value: a}\n")
                          + "      - name: s\n"
                          + "        sensitivity: [z]\n"
                          + "        body:\n"
                          + "          - {assign: q, value: z, nonblocking: true}\n");
    RefineConfig cfg = TestDesignBuilder.rawConfig();
    cfg.sort_cones = sortCones;
    RefinementContext ctx = new HdlRefine(cfg).refine(design);
    Assertions.assertTrue(ctx.getCone(decl(design, "top", "x")).isLazy());
    Assertions.assertFalse(ctx.getCone(decl(design, "top", "z")).isLazy());
    if (sortCones)
      Assertions.assertEquals(List.of("hif_cone_x", "hif_cone_z"), coneNames(design));
    else
      Assertions.assertEquals(List.of("hif_cone_z", "hif_cone_x"), coneNames(design));
  }

  @Test
  void testDelayedWriteKeepsItsValue() {
    Design design = parse(DELAYED);
    RefinementContext ctx = new HdlRefine(TestDesignBuilder.rawConfig()).refine(design);
    var w = process(design, "top", "w").getBody();
    Assertions.assertEquals(2, w.size());
    Assertions.assertEquals("x_sig_var = #5 compute(a);", text(w.get(0)));
    Assertions.assertEquals("x = #5 compute(a);", text(w.get(1)));
    Assertions.assertEquals(Set.of("x"), ctx.getWarnings().getSubjects(DualStorageMaterializer.DELAY_WARNING));
    Assertions.assertEquals("q = x_sig_var;", text(process(design, "top", "r").getBody().get(0)));
    Assertions.assertEquals("x", ((Identifier)process(design, "top", "r").getSensitivity().get(0)).getName());
  }

  @Test
  void testStandardCallIsNoSideEffect() {
    Design design = parse(DELAYED.replace("call: compute", "call: '$clog2'"));
    RefinementContext ctx = new HdlRefine(TestDesignBuilder.rawConfig()).refine(design);
    Assertions.assertFalse(ctx.getWarnings().contains(DualStorageMaterializer.DELAY_WARNING));
  }

  @Test
  void testBindWarning() {
    Design design = parse(TestDesignBuilder.ROLES);
    RefinementContext ctx = new HdlRefine(TestDesignBuilder.rawConfig()).refine(design);
    Assertions.assertEquals(Set.of("b"), ctx.getWarnings().getSubjects(DualStorageMaterializer.BIND_WARNING));

    RefineConfig cfg = TestDesignBuilder.rawConfig();
    cfg.warn_on_bindings = false;
    design = parse(TestDesignBuilder.ROLES);
    ctx = new HdlRefine(cfg).refine(design);
    Assertions.assertFalse(ctx.getWarnings().contains(DualStorageMaterializer.BIND_WARNING));
  }

  @Test
  void testVariableLeafIsLeftOutOfSync() {
    Design design = parse(VARIABLE_LEAF);
    RefinementContext ctx = new HdlRefine(TestDesignBuilder.rawConfig()).refine(design);
    Assertions.assertTrue(decl(design, "top", "g") instanceof Variable);
    Process sync = process(design, "top", "d_sig_var_d_sync_process");
    Assertions.assertTrue(sync.getSensitivity().isEmpty());
    Assertions.assertEquals(Set.of("g"), ctx.getWarnings().getSubjects(DualStorageMaterializer.SYNC_LEAF_WARNING));
  }
}
