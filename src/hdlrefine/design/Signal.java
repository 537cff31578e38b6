package hdlrefine.design;

/** Delta-delayed storage: writes become visible after the current delta cycle. */
public class Signal extends DataDeclaration {
  public Signal(String name, String type, Expr initialValue) { super(name, type, initialValue); }

  @Override
  public Signal copy() {
    return new Signal(name, type, copyInitialValue());
  }
}
