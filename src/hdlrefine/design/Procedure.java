package hdlrefine.design;

import java.util.List;

/**
 * Callable unit declared inside a module: a task of the source design, or a generated cone.
 */
public class Procedure extends Declaration {
  private final boolean cone;
  private final NodeList<Parameter> parameters = new NodeList<>(this, Parameter.class);
  private final NodeList<Variable> locals = new NodeList<>(this, Variable.class);
  private final NodeList<Action> body = new NodeList<>(this, Action.class);

  public Procedure(String name) { this(name, false); }

  public Procedure(String name, boolean cone) {
    super(name);
    this.cone = cone;
  }

  /** @return true iff this procedure was generated to recompute dataflow bindings */
  public boolean isCone() { return cone; }
  public NodeList<Parameter> getParameters() { return parameters; }
  public NodeList<Variable> getLocals() { return locals; }
  public NodeList<Action> getBody() { return body; }

  @Override
  public List<Node> getChildren() {
    return childList(parameters, locals, body);
  }

  @Override
  public Procedure copy() {
    Procedure ret = new Procedure(name, cone);
    ret.parameters.addCopies(parameters);
    ret.locals.addCopies(locals);
    ret.body.addCopies(body);
    return ret;
  }
}
