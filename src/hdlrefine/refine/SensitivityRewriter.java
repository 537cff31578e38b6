package hdlrefine.refine;

import hdlrefine.analysis.ReferenceRole;
import hdlrefine.analysis.UsageInfo;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.DesignException;
import hdlrefine.design.Expr;
import hdlrefine.design.Identifier;
import hdlrefine.design.Node;
import hdlrefine.design.NodeList;
import hdlrefine.design.Port;
import hdlrefine.design.Signal;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.semantics.ReferenceMap;
import hdlrefine.semantics.Semantics;
import java.util.ArrayList;
import java.util.Set;

/**
 * Replaces sensitivity entries naming a cone-backed declaration by its leaf drivers,
 * since the declaration itself no longer changes on its own.
 * Wait conditions keep reading the declaration.
 */
public class SensitivityRewriter extends RefinementStage {
  @Override
  public Phase requires() {
    return Phase.CALLS_INSERTED;
  }
  @Override
  public Phase produces() {
    return Phase.SENSITIVITIES_REWRITTEN;
  }

  @Override
  protected void apply(RefinementContext ctx) {
    int count = 0;
    for (DataDeclaration decl : ctx.getCones().keySet()) {
      Set<DataDeclaration> leaves = ctx.getGraph().collectLeafDrivers(decl, ctx.getCones().keySet());
      ctx.setLeafDrivers(decl, leaves);
      UsageInfo info = ctx.getUsage().get(decl);
      for (Node ref : new ArrayList<>(info.get(ReferenceRole.SENSITIVITY))) {
        rewrite(ctx, decl, ref, leaves, ReferenceRole.SENSITIVITY);
        ++count;
      }
      for (Node ref : new ArrayList<>(info.get(ReferenceRole.WAIT))) {
        if (Semantics.getSensitivityList(ref, true) == null)
          continue;
        rewrite(ctx, decl, ref, leaves, ReferenceRole.WAIT);
        ++count;
      }
    }
    logger.debug("Rewrote {} sensitivity entries", count);
  }

  @SuppressWarnings("unchecked")
  private void rewrite(RefinementContext ctx, DataDeclaration decl, Node ref, Set<DataDeclaration> leaves, ReferenceRole role) {
    NodeList<?> list = Semantics.getSensitivityList(ref, role == ReferenceRole.WAIT);
    if (list == null || list.getElementType() != Expr.class)
      throw new DesignException("Cannot find the sensitivity list of " + decl.getName(), ref);
    NodeList<Expr> sensitivity = (NodeList<Expr>)list;

    Node entry = Semantics.getExpressionRoot(ref);
    for (Node use : ReferenceMap.collectUses(entry)) {
      DataDeclaration useDecl = ReferenceMap.declarationOf(use);
      ctx.getRefs().remove(useDecl, use);
      ctx.getUsage().remove(useDecl, use);
    }
    entry.detach();

    for (DataDeclaration leaf : leaves) {
      if (!(leaf instanceof Signal) && !(leaf instanceof Port))
        continue;
      Identifier leafRef = new Identifier(leaf);
      if (Semantics.addUniqueByName(sensitivity, leafRef)) {
        ctx.getUsage().get(leaf).add(leafRef, role);
        ctx.getRefs().add(leafRef);
      }
    }
    logger.trace("Replaced {} by its leaf drivers in {}", decl.getName(), sensitivity.getOwner());
  }
}
