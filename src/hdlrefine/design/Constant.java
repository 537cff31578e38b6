package hdlrefine.design;

import java.util.List;

/** Literal value, kept in its textual form (e.g. <code>0</code>, <code>8'hff</code>, <code>'1'</code>). */
public class Constant extends Expr {
  private final String value;

  public Constant(String value) { this.value = value; }

  public String getValue() { return value; }

  @Override
  public List<Node> getChildren() {
    return List.of();
  }

  @Override
  public Constant copy() {
    return new Constant(value);
  }
}
