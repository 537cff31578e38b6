package hdlrefine.analysis;

/**
 * Syntactic role of a use of a port or signal. Every use has exactly one role.
 * The constants are listed in classification priority order.
 */
public enum ReferenceRole {
  /** The use is a port binding naming the formal port. */
  PORT_BINDING,
  /** Entry of a process sensitivity list (level, rising or falling edge). */
  SENSITIVITY,
  /** Inside the actual expression of a port binding. */
  BIND_ARGUMENT,
  /** Inside the sensitivity list or the condition of a wait statement. */
  WAIT,
  CONTINUOUS_READ,
  CONTINUOUS_WRITE,
  NON_BLOCKING_WRITE,
  BLOCKING_WRITE,
  /** Any other read: procedural right-hand sides, conditions, call arguments. */
  PLAIN_READ;

  public boolean isWrite() {
    return this == CONTINUOUS_WRITE || this == NON_BLOCKING_WRITE || this == BLOCKING_WRITE;
  }
}
