package hdlrefine;

import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Design;
import hdlrefine.design.Module;
import hdlrefine.design.Procedure;
import hdlrefine.design.Process;
import hdlrefine.refine.RefinementContext;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.refine.RefinementStage;
import hdlrefine.ui.RefineConfig;
import hdlrefine.util.DesignFormatException;
import hdlrefine.util.DesignReader;

/**
 * Builds test designs from YAML text and runs the refinement up to a given phase.
 */
public class TestDesignBuilder {
  private TestDesignBuilder() {}

  public static Design parse(String yaml) {
    try {
      return DesignReader.read(yaml);
    } catch (DesignFormatException e) {
      throw new AssertionError("Test design does not parse: " + e.getMessage(), e);
    }
  }

  /** Prepares the design and runs all stages until the context reaches <code>phase</code>. */
  public static RefinementContext runUntil(Design design, RefineConfig cfg, Phase phase) {
    RefinementContext ctx = new HdlRefine(cfg).prepare(design);
    for (RefinementStage stage : HdlRefine.stages()) {
      if (ctx.getPhase() == phase)
        break;
      stage.run(ctx);
    }
    ctx.requirePhase(phase);
    return ctx;
  }

  public static RefinementContext runUntil(Design design, Phase phase) { return runUntil(design, new RefineConfig(), phase); }

  public static RefineConfig rawConfig() {
    RefineConfig cfg = new RefineConfig();
    cfg.normalize = false;
    cfg.check_original_design = false;
    return cfg;
  }

  public static Module module(Design design, String name) {
    return design.findModule(name).orElseThrow(() -> new AssertionError("No module " + name));
  }

  public static DataDeclaration decl(Design design, String moduleName, String name) {
    return module(design, moduleName)
        .findDeclaration(name)
        .filter(DataDeclaration.class::isInstance)
        .map(DataDeclaration.class::cast)
        .orElseThrow(() -> new AssertionError("No data declaration " + name));
  }

  public static Procedure procedure(Design design, String moduleName, String name) {
    return module(design, moduleName)
        .streamProcedures()
        .filter(proc -> proc.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("No procedure " + name));
  }

  public static Process process(Design design, String moduleName, String name) {
    return module(design, moduleName).findProcess(name).orElseThrow(() -> new AssertionError("No process " + name));
  }

  // Scenario designs shared by several tests.

  /** <code>d = e</code>, with d read by a clocked process. */
  public static final String CONE_READ =
      "modules:\n"
      + "  - name: top\n"
      + "    ports:\n"
      + "      - {name: clk, dir: in, type: logic}\n"
      + "      - {name: e, dir: in, type: logic}\n"
      + "      - {name: q, dir: out, type: logic}\n"
      + "    signals:\n"
      + "      - {name: d, type: logic}\n"
      + "    continuous:\n"
      + "      - {assign: d, value: e}\n"
      + "    processes:\n"
      + "      - name: p\n"
      + "        posedge: [clk]\n"
      + "        body:\n"
      + "          - {assign: q, value: d, nonblocking: true}\n";

  /** Output port d driven by <code>e &amp; f</code> and read back by another binding. */
  public static final String OUTPUT_READ_BACK =
      "modules:\n"
      + "  - name: top\n"
      + "    ports:\n"
      + "      - {name: e, dir: in, type: logic}\n"
      + "      - {name: f, dir: in, type: logic}\n"
      + "      - {name: d, dir: out, type: logic}\n"
      + "    signals:\n"
      + "      - {name: s, type: logic}\n"
      + "    continuous:\n"
      + "      - {assign: d, value: {op: '&', args: [e, f]}}\n"
      + "      - {assign: s, value: d}\n";

  /** Signal d driven by <code>d = e</code> and by a non-blocking write in a clocked process, read by another process. */
  public static final String MIXED_WRITE =
      "modules:\n"
      + "  - name: top\n"
      + "    ports:\n"
      + "      - {name: clk, dir: in, type: logic}\n"
      + "      - {name: e, dir: in, type: logic}\n"
      + "      - {name: a, dir: in, type: logic}\n"
      + "      - {name: q, dir: out, type: logic}\n"
      + "    signals:\n"
      + "      - {name: d, type: logic}\n"
      + "    continuous:\n"
      + "      - {assign: d, value: e}\n"
      + "    processes:\n"
      + "      - name: p\n"
      + "        posedge: [clk]\n"
      + "        body:\n"
      + "          - {assign: d, value: a, nonblocking: true}\n"
      + "      - name: r\n"
      + "        sensitivity: [d]\n"
      + "        body:\n"
      + "          - {assign: q, value: d, nonblocking: true}\n";

  /** Chain <code>s1 = a; s2 = s1 | b; o = s2</code> where only s2 is read procedurally. */
  public static final String CHAIN =
      "modules:\n"
      + "  - name: top\n"
      + "    ports:\n"
      + "      - {name: a, dir: in, type: logic}\n"
      + "      - {name: b, dir: in, type: logic}\n"
      + "      - {name: q, dir: out, type: logic}\n"
      + "    signals:\n"
      + "      - {name: s1, type: logic}\n"
      + "      - {name: s2, type: logic}\n"
      + "    continuous:\n"
      + "      - {assign: s1, value: a}\n"
      + "      - {assign: s2, value: {op: '|', args: [s1, b]}}\n"
      + "    processes:\n"
      + "      - name: p\n"
      + "        sensitivity: [s2]\n"
      + "        body:\n"
      + "          - {assign: q, value: s2, nonblocking: true}\n";

  /** One use of every role: port bindings, bind arguments, wait lists and conditions, all kinds of writes. */
  public static final String ROLES =
      "modules:\n"
      + "  - name: sub\n"
      + "    ports:\n"
      + "      - {name: xi, dir: in}\n"
      + "      - {name: yo, dir: out}\n"
      + "    continuous:\n"
      + "      - {assign: yo, value: xi}\n"
      + "  - name: top\n"
      + "    ports:\n"
      + "      - {name: clk, dir: in}\n"
      + "      - {name: a, dir: in}\n"
      + "    signals:\n"
      + "      - {name: w}\n"
      + "      - {name: s}\n"
      + "      - {name: b}\n"
      + "      - {name: nb}\n"
      + "      - {name: c}\n"
      + "    continuous:\n"
      + "      - {assign: c, value: a}\n"
      + "    processes:\n"
      + "      - name: p\n"
      + "        posedge: [clk]\n"
      + "        body:\n"
      + "          - {wait: {sensitivity: [w], until: {op: '==', args: [s, 1]}}}\n"
      + "          - {assign: b, value: c}\n"
      + "          - {assign: nb, value: b, nonblocking: true}\n"
      + "    instances:\n"
      + "      - {name: u0, module: sub, bindings: {xi: {op: '+', args: [a, b]}, yo: w}}\n";
}
