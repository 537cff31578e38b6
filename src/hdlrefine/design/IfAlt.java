package hdlrefine.design;

import java.util.List;

/** One guarded branch of an {@link IfStmt}. */
public class IfAlt extends Node {
  private Expr condition;
  private final NodeList<Action> actions = new NodeList<>(this, Action.class);

  public IfAlt(Expr condition) { this.condition = adopt(condition); }

  public Expr getCondition() { return condition; }
  public NodeList<Action> getActions() { return actions; }

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
    return childList(condition, actions);
  }

  @Override
  public IfAlt copy() {
    IfAlt ret = new IfAlt(condition.copy());
    ret.actions.addCopies(actions);
    return ret;
  }
}
