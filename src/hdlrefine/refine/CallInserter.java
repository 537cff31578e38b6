package hdlrefine.refine;

import hdlrefine.analysis.ReferenceRole;
import hdlrefine.analysis.UsageInfo;
import hdlrefine.design.Action;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.DesignException;
import hdlrefine.design.Node;
import hdlrefine.design.Procedure;
import hdlrefine.design.ProcedureCall;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.semantics.Semantics;
import java.util.ArrayList;
import java.util.List;

/**
 * Calls the cone of a declaration before every statement that reads or procedurally writes it.
 */
public class CallInserter extends RefinementStage {
  @Override
  public Phase requires() {
    return Phase.CONES_GENERATED;
  }
  @Override
  public Phase produces() {
    return Phase.CALLS_INSERTED;
  }

  @Override
  protected void apply(RefinementContext ctx) {
    int count = 0;
    for (Cone cone : ctx.getCones().values())
      count += insertCalls(ctx, cone);
    logger.debug("Inserted {} cone calls", count);
  }

  /**
   * Inserts the calls of one cone.
   * At most one call is added per statement, and at most one per enclosing cone. Inside another cone the call
   * precedes the first top-level statement of that cone which uses the declaration.
   * @return the number of inserted calls
   * @throws DesignException if a use is not part of any statement
   */
  public static int insertCalls(RefinementContext ctx, Cone cone) {
    DataDeclaration decl = cone.getDeclaration();
    Procedure proc = cone.getProcedure();
    UsageInfo info = ctx.getUsage().get(decl);
    List<Node> uses = new ArrayList<>(info.get(ReferenceRole.PLAIN_READ));
    uses.addAll(info.get(ReferenceRole.BLOCKING_WRITE));
    uses.addAll(info.get(ReferenceRole.NON_BLOCKING_WRITE));

    int count = 0;
    for (Node use : uses) {
      if (use.isSubNodeOf(proc))
        continue;
      Procedure enclosing = Semantics.getEnclosingCone(use);
      if (enclosing != null) {
        Cone enclosingCone = ctx.findCone(enclosing);
        if (enclosingCone != null && enclosingCone.absorbs(decl))
          continue;
        if (!ctx.recordCall(enclosing, proc))
          continue;
        Action anchor = firstTopLevelUse(enclosing, uses);
        enclosing.getBody().addBefore(anchor, new ProcedureCall(proc));
        ctx.recordCall(anchor, proc);
        ++count;
        continue;
      }
      Action stmt = Semantics.getEnclosingStatement(use);
      if (stmt == null)
        throw new DesignException("Cannot find the statement of a use of " + decl.getName(), use);
      if (!ctx.recordCall(stmt, proc))
        continue;
      stmt.getOwnerList().addBefore(stmt, new ProcedureCall(proc));
      logger.trace("Call of {} before {}", proc.getName(), stmt);
      ++count;
    }
    return count;
  }

  /** Finds the earliest top-level body statement of <code>enclosing</code> containing one of the uses. */
  private static Action firstTopLevelUse(Procedure enclosing, List<Node> uses) {
    Action best = null;
    int bestIdx = Integer.MAX_VALUE;
    for (Node use : uses) {
      if (!use.isSubNodeOf(enclosing))
        continue;
      Node cur = use;
      while (cur != null && cur.getOwnerList() != enclosing.getBody())
        cur = cur.getParent();
      if (cur == null)
        continue;
      int idx = enclosing.getBody().indexOfNode(cur);
      if (idx < bestIdx) {
        bestIdx = idx;
        best = (Action)cur;
      }
    }
    if (best == null)
      throw new DesignException("Cannot find the statement of a use inside the cone", enclosing);
    return best;
  }
}
