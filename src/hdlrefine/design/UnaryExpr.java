package hdlrefine.design;

import java.util.List;

public class UnaryExpr extends Expr {
  private final String op;
  private Expr operand;

  public UnaryExpr(String op, Expr operand) {
    this.op = op;
    this.operand = adopt(operand);
  }

  public String getOp() { return op; }
  public Expr getOperand() { return operand; }

  public void setOperand(Expr operand) {
    orphan(this.operand);
    this.operand = adopt(operand);
  }

  @Override
  protected void replaceChild(Node oldChild, Node newChild) {
    if (oldChild == operand)
      setOperand((Expr)newChild);
    else
      super.replaceChild(oldChild, newChild);
  }

  @Override
  public List<Node> getChildren() {
    return childList(operand);
  }

  @Override
  public UnaryExpr copy() {
    return new UnaryExpr(op, operand.copy());
  }
}
