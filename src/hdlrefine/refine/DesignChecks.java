package hdlrefine.refine;

import hdlrefine.design.Assign;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Expr;
import hdlrefine.design.Identifier;
import hdlrefine.design.Node;
import hdlrefine.design.Port;
import hdlrefine.design.Process;
import hdlrefine.design.Signal;
import hdlrefine.semantics.Semantics;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks on the unrefined design.
 * <p>
 * A signal written by a blocking assignment in one process and read by another process that is not sensitive to it
 * makes the result depend on process scheduling:
 * <pre>
 * p1: always @(clk) sig = expr;
 * p2: always @(clk) out = sig;
 * </pre>
 */
public class DesignChecks {
  protected static final Logger logger = LogManager.getLogger();

  public static final String SENSITIVITY_WARNING = "Found at least one signal or port written by a blocking assignment and read by "
                                                   + "a process which does not have it in its sensitivity. This could lead to a "
                                                   + "non-equivalent design.";

  private DesignChecks() {}

  /** @return the number of declarations warned about */
  public static int check(RefinementContext ctx) {
    Map<DataDeclaration, Set<Process>> writers = new LinkedHashMap<>();
    for (DataDeclaration decl : ctx.getRefs().declarations()) {
      if (!(decl instanceof Signal) && !(decl instanceof Port))
        continue;
      if (decl instanceof Port && ((Port)decl).getDirection() == Port.Direction.IN)
        continue;
      for (Node use : ctx.getRefs().get(decl)) {
        Process proc = checkedProcess(use);
        if (proc == null || !Semantics.isInLeftHandSide(use))
          continue;
        if (use.getNearestParent(Assign.class).isNonBlocking())
          continue;
        writers.computeIfAbsent(decl, key -> new LinkedHashSet<>()).add(proc);
      }
    }

    int count = 0;
    for (Map.Entry<DataDeclaration, Set<Process>> entry : writers.entrySet()) {
      DataDeclaration decl = entry.getKey();
      for (Node use : ctx.getRefs().get(decl)) {
        Process proc = checkedProcess(use);
        if (proc == null || entry.getValue().contains(proc) || Semantics.isInLeftHandSide(use))
          continue;
        if (sensitivityNames(proc).contains(decl.getName()))
          continue;
        ctx.getWarnings().add(SENSITIVITY_WARNING, decl.getName());
        ++count;
        break;
      }
    }
    ctx.getWarnings().report();
    return count;
  }

  /** @return the always-process whose body holds the use, or null */
  private static Process checkedProcess(Node use) {
    Process proc = use.getNearestParent(Process.class);
    if (proc == null || proc.getFlavour() == Process.Flavour.INITIAL)
      return null;
    if (Semantics.getSensitivityList(use, false) != null)
      return null;
    return proc;
  }

  /** @return the names in all three sensitivity lists of a process */
  static Set<String> sensitivityNames(Process proc) {
    Set<String> ret = new HashSet<>();
    for (List<Expr> list : List.of(proc.getSensitivity(), proc.getSensitivityPos(), proc.getSensitivityNeg())) {
      for (Expr entry : list) {
        for (Identifier id : Semantics.collectIdentifiers(entry))
          ret.add(id.getName());
      }
    }
    return ret;
  }
}
