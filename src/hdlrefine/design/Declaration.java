package hdlrefine.design;

/** Named entity owned by a scope (module, process or procedure). */
public abstract class Declaration extends Node {
  protected String name;

  protected Declaration(String name) { this.name = name; }

  public String getName() { return name; }
}
