package hdlrefine.refine;

import hdlrefine.analysis.DependencyGraph;
import hdlrefine.analysis.ReferenceClassifier;
import hdlrefine.analysis.ReferenceRole;
import hdlrefine.analysis.UsageInfo;
import hdlrefine.analysis.UsageMap;
import hdlrefine.design.Assign;
import hdlrefine.design.BinaryExpr;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Declaration;
import hdlrefine.design.DesignException;
import hdlrefine.design.Identifier;
import hdlrefine.design.IfStmt;
import hdlrefine.design.Module;
import hdlrefine.design.Node;
import hdlrefine.design.Port;
import hdlrefine.design.Procedure;
import hdlrefine.design.Variable;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.semantics.Semantics;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates a cone procedure for every dataflow-driven declaration that is used outside of dataflow bindings.
 * <p>
 * A cone holds copies of the declaration's bindings, preceded by the bindings of all transitive
 * dataflow-driven predecessors that are not written procedurally (in sequence order). Predecessors that are
 * also written procedurally keep their own cone, which the {@link CallInserter} calls from this cone.
 * If the declaration itself is written procedurally, the cone forwards a value only when it changed:
 * <pre>
 * tmp_d = expr;
 * if (old_d != tmp_d) { old_d = tmp_d; d = tmp_d; }
 * </pre>
 */
public class ConeGenerator extends RefinementStage {
  @Override
  public Phase requires() {
    return Phase.SEQUENCED;
  }
  @Override
  public Phase produces() {
    return Phase.CONES_GENERATED;
  }

  @Override
  protected void apply(RefinementContext ctx) {
    UsageMap usage = ctx.getUsage();
    List<DataDeclaration> sequence = ctx.getSequence();
    for (DataDeclaration decl : sequence) {
      if (!ReferenceClassifier.isClassified(decl))
        continue;
      UsageInfo info = usage.get(decl);
      if (!info.hasContinuousWrite())
        continue;
      if (isOnlyInContinuousAssignments(decl, info)) {
        logger.trace("{} is only used by dataflow bindings, no cone", decl.getName());
        continue;
      }
      Cone cone = generate(ctx, decl, info);
      ctx.getCones().put(decl, cone);
      logger.debug("Created {} absorbing {}", cone, cone.getAbsorbed().stream().map(DataDeclaration::getName).collect(Collectors.toList()));
    }

    if (ctx.getConfig().sort_cones)
      sortCones(ctx);

    // Uses inside the cones are classified only now, so the copies do not change the mixed state seen above.
    for (Cone cone : ctx.getCones().values())
      ctx.getRefs().collectInto(cone.getProcedure());
    int count = ReferenceClassifier.classify(ctx.getRefs(), usage, true);
    logger.debug("Classified {} uses inside {} cones", count, ctx.getCones().size());
  }

  /**
   * @return true iff the declaration is no connection and all its uses are reads and writes of dataflow bindings
   */
  public static boolean isOnlyInContinuousAssignments(DataDeclaration decl, UsageInfo info) {
    return !(decl instanceof Port) && !info.has(ReferenceRole.PORT_BINDING) && info.isOnlyInContinuousAssignments();
  }

  /** Lists the distinct bindings writing a declaration, in design order. */
  public static List<Assign> bindingsOf(UsageInfo info) {
    LinkedHashSet<Assign> ret = new LinkedHashSet<>();
    for (Node write : info.get(ReferenceRole.CONTINUOUS_WRITE)) {
      Assign binding = write.getNearestParent(Assign.class);
      if (binding == null)
        throw new DesignException("Cannot find the binding of a continuous write", write);
      ret.add(binding);
    }
    return ret.stream()
        .sorted(Comparator.comparingInt((Assign binding) -> binding.getOwnerList() == null ? -1 : binding.getOwnerList().indexOfNode(binding)))
        .collect(Collectors.toList());
  }

  private Cone generate(RefinementContext ctx, DataDeclaration decl, UsageInfo info) {
    Module module = Semantics.requireModule(decl);
    Procedure proc = new Procedure(ctx.getNames().freshName(ctx.getConfig().cone_prefix + decl.getName()), true);
    module.getDeclarations().add(proc);
    Cone cone = new Cone(decl, proc);

    Set<DataDeclaration> absorbed = collectAbsorbed(ctx, decl);
    for (DataDeclaration pred : ctx.getSequence()) {
      if (!absorbed.contains(pred))
        continue;
      cone.absorb(pred);
      for (Assign binding : bindingsOf(ctx.getUsage().get(pred))) {
        proc.getBody().add(binding.copy());
        cone.capture(binding);
      }
    }

    List<Assign> ownCopies = new ArrayList<>();
    for (Assign binding : bindingsOf(info)) {
      Assign copy = binding.copy();
      proc.getBody().add(copy);
      ownCopies.add(copy);
      cone.capture(binding);
    }

    DependencyGraph graph = ctx.getGraph();
    for (DataDeclaration pred : cone.getAbsorbed())
      graph.promoteDrivers(decl, pred);

    if (info.isMixed())
      addDirtyCheck(ctx, cone, ownCopies);
    return cone;
  }

  /** Collects the transitive predecessors whose bindings are inlined: dataflow-driven and not written procedurally. */
  private Set<DataDeclaration> collectAbsorbed(RefinementContext ctx, DataDeclaration decl) {
    Set<DataDeclaration> ret = new LinkedHashSet<>();
    Deque<DataDeclaration> stack = new ArrayDeque<>();
    stack.push(decl);
    while (!stack.isEmpty()) {
      DataDeclaration cur = stack.pop();
      for (DataDeclaration pred : ctx.getGraph().getDrivers(cur)) {
        if (pred == decl || ret.contains(pred) || !ReferenceClassifier.isClassified(pred))
          continue;
        UsageInfo predInfo = ctx.getUsage().get(pred);
        if (!predInfo.hasContinuousWrite() || predInfo.isMixed())
          continue;
        ret.add(pred);
        stack.push(pred);
      }
    }
    return ret;
  }

  private void addDirtyCheck(RefinementContext ctx, Cone cone, List<Assign> ownCopies) {
    DataDeclaration decl = cone.getDeclaration();
    Procedure proc = cone.getProcedure();

    Variable old = new Variable(ctx.getNames().freshName("old_" + decl.getName()), decl.getType(), decl.copyInitialValue());
    Semantics.addDeclarationAfter(decl, old);
    Variable tmp = new Variable(ctx.getNames().freshName("tmp_" + decl.getName()), decl.getType(), decl.copyInitialValue());
    proc.getLocals().add(tmp);

    for (Assign copy : ownCopies) {
      if (!(copy.getTarget() instanceof Identifier))
        throw new DesignException("Unexpected binding target", copy);
      copy.setTarget(new Identifier(tmp));
    }
    proc.getBody().add(new IfStmt(new BinaryExpr(new Identifier(old), "!=", new Identifier(tmp)),
                                  List.of(new Assign(new Identifier(old), new Identifier(tmp)), new Assign(new Identifier(decl), new Identifier(tmp)))));
    cone.setDirtyChecked(true);
  }

  /** Orders the cone procedures of every module that owns a cone by name, after its other declarations. */
  static void sortCones(RefinementContext ctx) {
    Set<Module> modules = new LinkedHashSet<>();
    for (Cone cone : ctx.getCones().values())
      modules.add(Semantics.requireModule(cone.getProcedure()));
    for (Module module : modules) {
      List<Declaration> coneProcs = module.getDeclarations()
                                        .stream()
                                        .filter(decl -> decl instanceof Procedure && ((Procedure)decl).isCone())
                                        .sorted(Comparator.comparing(Declaration::getName))
                                        .collect(Collectors.toList());
      coneProcs.forEach(Node::detach);
      module.getDeclarations().addAll(coneProcs);
    }
  }
}
