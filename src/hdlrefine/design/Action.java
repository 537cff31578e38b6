package hdlrefine.design;

/** Base class of all statements that can appear in a process, procedure or branch body. */
public abstract class Action extends Node {
  @Override
  public abstract Action copy();
}
