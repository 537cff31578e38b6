package hdlrefine.design;

/** Base class of all value expressions. */
public abstract class Expr extends Node {
  @Override
  public abstract Expr copy();
}
