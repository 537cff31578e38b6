package hdlrefine.design;

/** Formal parameter of a {@link Procedure}. */
public class Parameter extends DataDeclaration {
  public Parameter(String name, String type) { super(name, type, null); }

  @Override
  public Parameter copy() {
    return new Parameter(name, type);
  }
}
