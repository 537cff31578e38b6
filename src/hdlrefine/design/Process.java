package hdlrefine.design;

import java.util.List;

/**
 * Concurrent process of a module. Triggered by changes of the expressions in its sensitivity lists
 * (level, rising edge, falling edge), or run once for {@link Flavour#INITIAL}.
 */
public class Process extends Node {
  public enum Flavour {
    ALWAYS("always"),
    INITIAL("initial");

    public final String serialName;
    private Flavour(String serialName) { this.serialName = serialName; }

    public static Flavour fromSerialName(String serialName) {
      for (Flavour flavour : values()) {
        if (flavour.serialName.equals(serialName))
          return flavour;
      }
      throw new IllegalArgumentException("Unknown process flavour '" + serialName + "'");
    }
  }

  private final String name;
  private final Flavour flavour;
  private final NodeList<Expr> sensitivity = new NodeList<>(this, Expr.class);
  private final NodeList<Expr> sensitivityPos = new NodeList<>(this, Expr.class);
  private final NodeList<Expr> sensitivityNeg = new NodeList<>(this, Expr.class);
  private final NodeList<Variable> locals = new NodeList<>(this, Variable.class);
  private final NodeList<Action> body = new NodeList<>(this, Action.class);

  public Process(String name) { this(name, Flavour.ALWAYS); }

  public Process(String name, Flavour flavour) {
    this.name = name;
    this.flavour = flavour;
  }

  public String getName() { return name; }
  public Flavour getFlavour() { return flavour; }
  public NodeList<Expr> getSensitivity() { return sensitivity; }
  public NodeList<Expr> getSensitivityPos() { return sensitivityPos; }
  public NodeList<Expr> getSensitivityNeg() { return sensitivityNeg; }
  public NodeList<Variable> getLocals() { return locals; }
  public NodeList<Action> getBody() { return body; }

  /** @return true iff the list is one of the three sensitivity lists of this process */
  public boolean isSensitivityList(NodeList<?> list) {
    return list == sensitivity || list == sensitivityPos || list == sensitivityNeg;
  }

  @Override
  public List<Node> getChildren() {
    return childList(sensitivity, sensitivityPos, sensitivityNeg, locals, body);
  }

  @Override
  public Process copy() {
    Process ret = new Process(name, flavour);
    ret.sensitivity.addCopies(sensitivity);
    ret.sensitivityPos.addCopies(sensitivityPos);
    ret.sensitivityNeg.addCopies(sensitivityNeg);
    ret.locals.addCopies(locals);
    ret.body.addCopies(body);
    return ret;
  }
}
