package hdlrefine.design;

import java.util.List;

/** <code>wait on a, b until cond</code>. Both the sensitivity list and the condition are optional. */
public class WaitStmt extends Action {
  private final NodeList<Expr> sensitivity = new NodeList<>(this, Expr.class);
  private Expr condition = null;

  public WaitStmt() {}

  public NodeList<Expr> getSensitivity() { return sensitivity; }
  public Expr getCondition() { return condition; }

  public void setCondition(Expr condition) {
    orphan(this.condition);
    this.condition = adopt(condition);
  }

  @Override
  protected void replaceChild(Node oldChild, Node newChild) {
    if (oldChild == condition)
      setCondition((Expr)newChild);
    else
      super.replaceChild(oldChild, newChild);
  }

  @Override
  public List<Node> getChildren() {
    return childList(sensitivity, condition);
  }

  @Override
  public WaitStmt copy() {
    WaitStmt ret = new WaitStmt();
    ret.sensitivity.addCopies(sensitivity);
    ret.setCondition(copyOrNull(condition, Expr.class));
    return ret;
  }
}
