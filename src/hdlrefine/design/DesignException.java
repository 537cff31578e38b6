package hdlrefine.design;

/**
 * Internal consistency failure of the design graph, e.g. a reference without declaration
 * or an assignment target that cannot be located. Aborts the refinement.
 */
public class DesignException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient Node context;

  public DesignException(String message, Node context) {
    super(context == null ? message : (message + " (at " + context + ")"));
    this.context = context;
  }

  /** @return the node the failure was detected at, or null */
  public Node getContext() { return context; }
}
