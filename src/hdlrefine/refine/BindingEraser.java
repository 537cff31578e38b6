package hdlrefine.refine;

import hdlrefine.design.Assign;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Node;
import hdlrefine.design.RemovalQueue;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.semantics.ReferenceMap;

/**
 * Removes the dataflow bindings captured by cones along with their uses.
 * Bindings that no cone captured stay in place.
 */
public class BindingEraser extends RefinementStage {
  @Override
  public Phase requires() {
    return Phase.SENSITIVITIES_REWRITTEN;
  }
  @Override
  public Phase produces() {
    return Phase.BINDINGS_ERASED;
  }

  @Override
  protected void apply(RefinementContext ctx) {
    RemovalQueue queue = new RemovalQueue();
    for (Cone cone : ctx.getCones().values()) {
      for (Assign binding : cone.getCaptured()) {
        if (queue.isPending(binding) || binding.isDetached())
          continue;
        for (Node use : ReferenceMap.collectUses(binding)) {
          DataDeclaration decl = ReferenceMap.declarationOf(use);
          ctx.getRefs().remove(decl, use);
          ctx.getUsage().remove(decl, use);
        }
        queue.schedule(binding);
      }
    }
    int removed = queue.drain();
    logger.debug("Erased {} dataflow bindings", removed);
  }
}
