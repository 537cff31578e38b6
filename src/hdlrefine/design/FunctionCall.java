package hdlrefine.design;

import java.util.List;

/**
 * Call of a function inside an expression.
 * Calls of standard library functions (e.g. <code>$signed</code>) are known to be free of side effects.
 */
public class FunctionCall extends Expr {
  private final String name;
  private final boolean standard;
  private final NodeList<Expr> arguments = new NodeList<>(this, Expr.class);

  public FunctionCall(String name, boolean standard) {
    this.name = name;
    this.standard = standard;
  }

  public String getName() { return name; }
  public boolean isStandard() { return standard; }
  public NodeList<Expr> getArguments() { return arguments; }

  @Override
  public List<Node> getChildren() {
    return childList(arguments);
  }

  @Override
  public FunctionCall copy() {
    FunctionCall ret = new FunctionCall(name, standard);
    ret.arguments.addCopies(arguments);
    return ret;
  }
}
