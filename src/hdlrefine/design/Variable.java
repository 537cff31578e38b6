package hdlrefine.design;

/** Immediate storage: writes are visible to the next statement. */
public class Variable extends DataDeclaration {
  public Variable(String name, String type, Expr initialValue) { super(name, type, initialValue); }

  @Override
  public Variable copy() {
    return new Variable(name, type, copyInitialValue());
  }
}
