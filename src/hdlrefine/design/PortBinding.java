package hdlrefine.design;

import java.util.List;

/**
 * Binding <code>.port(actual)</code> of an {@link Instance}.
 * The binding itself is a reference to the formal port of the instantiated module.
 */
public class PortBinding extends Node {
  private final String portName;
  private Port port = null;
  private Expr actual;

  public PortBinding(String portName, Expr actual) {
    this.portName = portName;
    this.actual = adopt(actual);
  }

  public String getPortName() { return portName; }
  /** @return the formal port, or null if not resolved yet */
  public Port getPort() { return port; }
  public Expr getActual() { return actual; }

  public void setPort(Port port) { this.port = port; }

  public void setActual(Expr actual) {
    orphan(this.actual);
    this.actual = adopt(actual);
  }

  @Override
  protected void replaceChild(Node oldChild, Node newChild) {
    if (oldChild == actual)
      setActual((Expr)newChild);
    else
      super.replaceChild(oldChild, newChild);
  }

  @Override
  public List<Node> getChildren() {
    return childList(actual);
  }

  @Override
  public PortBinding copy() {
    PortBinding ret = new PortBinding(portName, copyOrNull(actual, Expr.class));
    ret.port = port;
    return ret;
  }
}
