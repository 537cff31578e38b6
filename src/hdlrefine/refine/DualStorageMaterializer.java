package hdlrefine.refine;

import hdlrefine.analysis.ReferenceRole;
import hdlrefine.analysis.StorageClass;
import hdlrefine.analysis.UsageInfo;
import hdlrefine.design.Assign;
import hdlrefine.design.BinaryExpr;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.DesignException;
import hdlrefine.design.Identifier;
import hdlrefine.design.IfStmt;
import hdlrefine.design.Module;
import hdlrefine.design.Node;
import hdlrefine.design.Port;
import hdlrefine.design.Procedure;
import hdlrefine.design.ProcedureCall;
import hdlrefine.design.Process;
import hdlrefine.design.Signal;
import hdlrefine.design.Variable;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.semantics.ReferenceMap;
import hdlrefine.semantics.Semantics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gives every port and signal its final storage.
 * <ul>
 * <li>signal only: unchanged</li>
 * <li>variable only, or neither: the signal is replaced by a variable of the same name</li>
 * <li>both: a variable twin <code>d_sig_var</code> takes the procedural writes and all reads,
 *     and a synchronization process copies the twin into the signal when a leaf driver changes</li>
 * </ul>
 */
public class DualStorageMaterializer extends RefinementStage {
  public static final String BIND_WARNING = "Found at least one declaration appearing in a port binding and written through "
                                            + "blocking or continuous assignments. This could lead to a non-equivalent design.";
  public static final String DELAY_WARNING = "Found at least one delayed write whose value contains a function call. If the call "
                                             + "has side effects, the refined design is not equivalent.";
  public static final String SYNC_LEAF_WARNING = "Found at least one leaf driver that is no signal. It is left out of the "
                                                 + "synchronization process sensitivity.";

  @Override
  public Phase requires() {
    return Phase.BINDINGS_ERASED;
  }
  @Override
  public Phase produces() {
    return Phase.MATERIALIZED;
  }

  @Override
  protected void apply(RefinementContext ctx) {
    Map<DataDeclaration, StorageClass> classes = new LinkedHashMap<>();
    ctx.getUsage().asMap().forEach((decl, info) -> classes.put(decl, StorageClass.of(decl, info)));

    int variables = 0, duals = 0;
    int cones = ctx.getCones().size();
    for (Map.Entry<DataDeclaration, StorageClass> entry : classes.entrySet()) {
      DataDeclaration decl = entry.getKey();
      StorageClass storage = entry.getValue();
      if (decl.isDetached())
        continue;
      if (storage.isSignalOnly())
        continue;
      if (storage.isVariableStorage()) {
        toVariable(ctx, decl);
        ++variables;
      } else {
        materializeDual(ctx, decl, storage, classes);
        ++duals;
      }
    }
    // Lazy cones were appended after the sorted ones.
    if (ctx.getConfig().sort_cones && ctx.getCones().size() > cones)
      ConeGenerator.sortCones(ctx);
    logger.debug("Refined {} declarations to variables and {} to signal/variable pairs", variables, duals);
  }

  private void toVariable(RefinementContext ctx, DataDeclaration decl) {
    if (!(decl instanceof Signal))
      throw new DesignException("Only signals can be refined to variables", decl);
    Variable var = new Variable(decl.getName(), decl.getType(), decl.setInitialValue(null));
    decl.replace(var);
    for (Node ref : ctx.getRefs().get(decl)) {
      if (ref instanceof Identifier)
        ((Identifier)ref).setDeclaration(var);
    }
    ctx.getRefs().replaceDeclaration(decl, var);
    logger.trace("{} is now a variable", var.getName());
  }

  private void materializeDual(RefinementContext ctx, DataDeclaration decl, StorageClass storage, Map<DataDeclaration, StorageClass> classes) {
    UsageInfo info = ctx.getUsage().get(decl);
    if (storage.connection() && info.has(ReferenceRole.BIND_ARGUMENT) && ctx.getConfig().warn_on_bindings)
      ctx.getWarnings().add(BIND_WARNING, decl.getName());
    if (info.hasContinuousWrite())
      throw new DesignException("Unexpected dataflow binding left for " + decl.getName(), decl);

    Module module = Semantics.requireModule(decl);
    Variable twin = new Variable(ctx.getNames().freshName(decl.getName(), "_sig_var"), decl.getType(), decl.copyInitialValue());
    Semantics.addDeclarationAfter(decl, twin);

    for (Node ref : new ArrayList<>(info.get(ReferenceRole.BLOCKING_WRITE)))
      splitBlockingWrite(ctx, decl, asIdentifier(ref), twin);

    List<Node> reads = new ArrayList<>(info.get(ReferenceRole.PLAIN_READ));
    reads.addAll(info.get(ReferenceRole.CONTINUOUS_READ));
    for (Node ref : reads)
      redirect(ctx, decl, asIdentifier(ref), twin);

    Cone cone = ctx.getCone(decl);
    if (info.has(ReferenceRole.NON_BLOCKING_WRITE)) {
      if (cone == null) {
        Procedure proc = new Procedure(ctx.getNames().freshName(ctx.getConfig().cone_prefix + decl.getName()), true);
        module.getDeclarations().add(proc);
        cone = new Cone(decl, proc);
        cone.setLazy(true);
        ctx.getCones().put(decl, cone);
        CallInserter.insertCalls(ctx, cone);
      }
      Variable old = new Variable(ctx.getNames().freshName("old_" + decl.getName()), decl.getType(), decl.copyInitialValue());
      Semantics.addDeclarationAfter(decl, old);
      cone.getProcedure().getBody().add(
          0, new IfStmt(new BinaryExpr(new Identifier(decl), "!=", new Identifier(old)),
                        List.of(new Assign(new Identifier(old), new Identifier(decl)), new Assign(new Identifier(twin), new Identifier(old)))));
    }

    Set<DataDeclaration> leaves = ctx.getLeafDrivers(decl);
    if (!leaves.isEmpty()) {
      Process sync = new Process(ctx.getNames().freshName(twin.getName() + "_" + decl.getName() + "_sync_process"));
      if (cone != null)
        sync.getBody().add(new ProcedureCall(cone.getProcedure()));
      sync.getBody().add(new Assign(new Identifier(decl), new Identifier(twin)));
      for (DataDeclaration leaf : leaves) {
        StorageClass leafClass = classes.get(leaf);
        if (leaf instanceof Port || (leafClass != null && leafClass.signal()))
          sync.getSensitivity().add(new Identifier(leaf));
        else
          ctx.getWarnings().add(SYNC_LEAF_WARNING, leaf.getName());
      }
      module.getProcesses().add(sync);
    }
    logger.trace("{} is a signal with variable twin {}", decl.getName(), twin.getName());
  }

  /**
   * <code>d = expr</code> becomes <code>twin = expr; d = twin;</code>, or <code>twin = expr; d = expr after delay;</code>
   * for delayed writes. Inside cones only the twin is written.
   */
  private void splitBlockingWrite(RefinementContext ctx, DataDeclaration decl, Identifier ref, Variable twin) {
    Assign assign = ref.getNearestParent(Assign.class);
    if (assign == null)
      throw new DesignException("Cannot find the assignment of a blocking write", ref);
    Assign sigAssign = assign.copy();
    redirect(ctx, decl, ref, twin);
    if (assign.getDelay() == null)
      sigAssign.setValue(assign.getTarget().copy());
    else if (Semantics.containsSideEffectCall(assign.getValue()))
      ctx.getWarnings().add(DELAY_WARNING, decl.getName());

    if (Semantics.getEnclosingCone(ref) != null)
      return;
    if (assign.getOwnerList() == null)
      throw new DesignException("Blocking write is not part of a statement list", assign);
    assign.getOwnerList().addAfter(assign, sigAssign);
    ReferenceMap.collectUses(sigAssign).forEach(ctx.getRefs()::add);
  }

  private static void redirect(RefinementContext ctx, DataDeclaration decl, Identifier ref, Variable twin) {
    ref.redirect(twin);
    ctx.getRefs().remove(decl, ref);
    ctx.getRefs().add(ref);
  }

  private static Identifier asIdentifier(Node ref) {
    if (!(ref instanceof Identifier))
      throw new DesignException("Expected an identifier", ref);
    return (Identifier)ref;
  }
}
