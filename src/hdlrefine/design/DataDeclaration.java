package hdlrefine.design;

import java.util.List;

/**
 * Declaration of a piece of storage: port, signal, variable or parameter.
 * The type is kept as opaque text (e.g. <code>logic [7:0]</code>); the refinement only copies it.
 */
public abstract class DataDeclaration extends Declaration {
  protected String type;
  protected Expr initialValue;

  protected DataDeclaration(String name, String type, Expr initialValue) {
    super(name);
    this.type = type;
    this.initialValue = adopt(initialValue);
  }

  public String getType() { return type; }
  /** @return the initial value, or null */
  public Expr getInitialValue() { return initialValue; }

  /**
   * Sets the initial value.
   * @return the previous initial value, now detached
   */
  public Expr setInitialValue(Expr initialValue) {
    Expr prev = this.initialValue;
    orphan(prev);
    this.initialValue = adopt(initialValue);
    return prev;
  }

  /** @return a detached copy of the initial value, or null */
  public Expr copyInitialValue() { return copyOrNull(initialValue, Expr.class); }

  @Override
  protected void replaceChild(Node oldChild, Node newChild) {
    if (oldChild == initialValue)
      setInitialValue((Expr)newChild);
    else
      super.replaceChild(oldChild, newChild);
  }

  @Override
  public List<Node> getChildren() {
    return childList(initialValue);
  }

  @Override
  public abstract DataDeclaration copy();
}
