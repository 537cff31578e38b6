package hdlrefine.design;

import java.util.List;

public class BinaryExpr extends Expr {
  private final String op;
  private Expr lhs;
  private Expr rhs;

  public BinaryExpr(Expr lhs, String op, Expr rhs) {
    this.op = op;
    this.lhs = adopt(lhs);
    this.rhs = adopt(rhs);
  }

  public String getOp() { return op; }
  public Expr getLhs() { return lhs; }
  public Expr getRhs() { return rhs; }

  public void setLhs(Expr lhs) {
    orphan(this.lhs);
    this.lhs = adopt(lhs);
  }
  public void setRhs(Expr rhs) {
    orphan(this.rhs);
    this.rhs = adopt(rhs);
  }

  @Override
  protected void replaceChild(Node oldChild, Node newChild) {
    if (oldChild == lhs)
      setLhs((Expr)newChild);
    else if (oldChild == rhs)
      setRhs((Expr)newChild);
    else
      super.replaceChild(oldChild, newChild);
  }

  @Override
  public List<Node> getChildren() {
    return childList(lhs, rhs);
  }

  @Override
  public BinaryExpr copy() {
    return new BinaryExpr(lhs.copy(), op, rhs.copy());
  }
}
