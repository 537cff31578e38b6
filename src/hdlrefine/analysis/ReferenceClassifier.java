package hdlrefine.analysis;

import hdlrefine.design.Assign;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Node;
import hdlrefine.design.Port;
import hdlrefine.design.PortBinding;
import hdlrefine.design.Signal;
import hdlrefine.design.WaitStmt;
import hdlrefine.refine.RefinementContext;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.refine.RefinementStage;
import hdlrefine.semantics.ReferenceMap;
import hdlrefine.semantics.Semantics;
import java.util.Set;

/**
 * Puts every use of every port and signal into its {@link UsageInfo} bucket.
 * Runs in consuming mode: the non-blocking marker of a classified non-blocking write is removed.
 */
public class ReferenceClassifier extends RefinementStage {
  @Override
  public Phase requires() {
    return Phase.RESOLVED;
  }
  @Override
  public Phase produces() {
    return Phase.CLASSIFIED;
  }

  @Override
  protected void apply(RefinementContext ctx) {
    int count = classify(ctx.getRefs(), ctx.getUsage(), true);
    logger.debug("Classified {} uses of {} declarations", count, ctx.getUsage().asMap().size());
  }

  /** @return true iff uses of the declaration are classified */
  public static boolean isClassified(DataDeclaration decl) { return decl instanceof Port || decl instanceof Signal; }

  /**
   * Classifies all uses of ports and signals that are not classified yet.
   * @param consuming whether non-blocking markers are removed from classified non-blocking writes
   * @return the number of newly classified uses
   */
  public static int classify(ReferenceMap refs, UsageMap usage, boolean consuming) {
    int count = 0;
    for (DataDeclaration decl : refs.declarations()) {
      if (!isClassified(decl))
        continue;
      UsageInfo info = usage.get(decl);
      for (Node ref : refs.get(decl)) {
        if (classify(ref, info, consuming))
          ++count;
      }
    }
    return count;
  }

  /**
   * Classifies the given uses of one declaration.
   * @return the number of newly classified uses
   */
  public static int classify(DataDeclaration decl, Set<? extends Node> uses, UsageMap usage, boolean consuming) {
    if (!isClassified(decl))
      return 0;
    UsageInfo info = usage.get(decl);
    int count = 0;
    for (Node ref : uses) {
      if (classify(ref, info, consuming))
        ++count;
    }
    return count;
  }

  private static boolean classify(Node ref, UsageInfo info, boolean consuming) {
    if (info.contains(ref))
      return false;
    ReferenceRole role = roleOf(ref);
    if (role == ReferenceRole.NON_BLOCKING_WRITE && consuming)
      ref.getNearestParent(Assign.class).setNonBlocking(false);
    info.add(ref, role);
    logger.trace("{} -> {}", ref, role);
    return true;
  }

  /** Computes the syntactic role of a use by the priority rule. */
  public static ReferenceRole roleOf(Node ref) {
    if (ref instanceof PortBinding)
      return ReferenceRole.PORT_BINDING;
    if (Semantics.getSensitivityList(ref, false) != null)
      return ReferenceRole.SENSITIVITY;
    if (ref.getNearestParent(PortBinding.class) != null)
      return ReferenceRole.BIND_ARGUMENT;
    if (ref.getNearestParent(WaitStmt.class) != null && (Semantics.getSensitivityList(ref, true) != null || Semantics.isInWaitCondition(ref)))
      return ReferenceRole.WAIT;
    Assign assign = ref.getNearestParent(Assign.class);
    if (assign != null) {
      boolean target = Semantics.isInLeftHandSide(ref);
      if (assign.isContinuous())
        return target ? ReferenceRole.CONTINUOUS_WRITE : ReferenceRole.CONTINUOUS_READ;
      if (target)
        return assign.isNonBlocking() ? ReferenceRole.NON_BLOCKING_WRITE : ReferenceRole.BLOCKING_WRITE;
    }
    return ReferenceRole.PLAIN_READ;
  }
}
