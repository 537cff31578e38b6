package hdlrefine.design;

import java.util.List;

/**
 * Assignment <code>target = value</code>.
 * Inside {@link Module#getContinuous()} it is a dataflow binding, elsewhere a procedural assignment.
 * Procedural assignments carry a non-blocking marker that the reference classifier may consume.
 */
public class Assign extends Action {
  private Expr target;
  private Expr value;
  private Expr delay = null;
  private boolean nonBlocking;

  public Assign(Expr target, Expr value) { this(target, value, false); }

  public Assign(Expr target, Expr value, boolean nonBlocking) {
    this.target = adopt(target);
    this.value = adopt(value);
    this.nonBlocking = nonBlocking;
  }

  public Expr getTarget() { return target; }
  public Expr getValue() { return value; }
  /** @return the scheduling delay (e.g. <code>#5</code>), or null */
  public Expr getDelay() { return delay; }
  public boolean isNonBlocking() { return nonBlocking; }

  public void setNonBlocking(boolean nonBlocking) { this.nonBlocking = nonBlocking; }

  /** @return true iff this assignment is a dataflow binding of a module */
  public boolean isContinuous() { return parent instanceof Module && ownerList != null; }

  public void setTarget(Expr target) {
    orphan(this.target);
    this.target = adopt(target);
  }
  public void setValue(Expr value) {
    orphan(this.value);
    this.value = adopt(value);
  }
  public void setDelay(Expr delay) {
    orphan(this.delay);
    this.delay = adopt(delay);
  }

  @Override
  protected void replaceChild(Node oldChild, Node newChild) {
    if (oldChild == target)
      setTarget((Expr)newChild);
    else if (oldChild == value)
      setValue((Expr)newChild);
    else if (oldChild == delay)
      setDelay((Expr)newChild);
    else
      super.replaceChild(oldChild, newChild);
  }

  @Override
  public List<Node> getChildren() {
    return childList(target, value, delay);
  }

  @Override
  public Assign copy() {
    Assign ret = new Assign(target.copy(), value.copy(), nonBlocking);
    ret.setDelay(copyOrNull(delay, Expr.class));
    return ret;
  }
}
