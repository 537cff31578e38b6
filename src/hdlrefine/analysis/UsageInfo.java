package hdlrefine.analysis;

import hdlrefine.design.Node;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Uses of one port or signal, bucketed by {@link ReferenceRole}.
 * A use is held by at most one bucket.
 */
public class UsageInfo {
  private final EnumMap<ReferenceRole, LinkedHashSet<Node>> buckets = new EnumMap<>(ReferenceRole.class);
  private final HashMap<Node, ReferenceRole> roles = new HashMap<>();
  private boolean wasContinuousWrite = false;
  private boolean constantDriven = false;

  public UsageInfo() {
    for (ReferenceRole role : ReferenceRole.values())
      buckets.put(role, new LinkedHashSet<>());
  }

  /**
   * Puts a use into a bucket.
   * @return false if the use already has a bucket, which is then kept
   */
  public boolean add(Node ref, ReferenceRole role) {
    if (roles.containsKey(ref))
      return false;
    roles.put(ref, role);
    buckets.get(role).add(ref);
    if (role == ReferenceRole.CONTINUOUS_WRITE)
      wasContinuousWrite = true;
    return true;
  }

  /**
   * Drops a use from its bucket.
   * @return the role the use had, or null
   */
  public ReferenceRole remove(Node ref) {
    ReferenceRole role = roles.remove(ref);
    if (role != null)
      buckets.get(role).remove(ref);
    return role;
  }

  public boolean contains(Node ref) { return roles.containsKey(ref); }

  /** @return the role of a use, or null if unknown */
  public ReferenceRole roleOf(Node ref) { return roles.get(ref); }

  public Set<Node> get(ReferenceRole role) { return Collections.unmodifiableSet(buckets.get(role)); }

  public boolean has(ReferenceRole role) { return !buckets.get(role).isEmpty(); }

  public int size() { return roles.size(); }

  /** @return true iff the declaration was ever the target of a dataflow binding */
  public boolean wasContinuousWrite() { return wasContinuousWrite; }

  public boolean isConstantDriven() { return constantDriven; }

  /**
   * Marks the declaration as driven by constants only. Its bindings stay in the design as one-shot bindings
   * and its continuous writes no longer count for classification or cone generation.
   */
  public void markConstantDriven() {
    constantDriven = true;
    wasContinuousWrite = false;
  }

  /** @return true iff the declaration has continuous writes that take part in the refinement */
  public boolean hasContinuousWrite() { return !constantDriven && has(ReferenceRole.CONTINUOUS_WRITE); }

  /** @return true iff the declaration is also written outside of dataflow bindings */
  public boolean isMixed() { return has(ReferenceRole.BLOCKING_WRITE) || has(ReferenceRole.NON_BLOCKING_WRITE); }

  /**
   * @return true iff all uses are dataflow binding reads or writes
   *         (port bindings of the formal port do not count)
   */
  public boolean isOnlyInContinuousAssignments() {
    return !has(ReferenceRole.SENSITIVITY) && !has(ReferenceRole.BIND_ARGUMENT) && !has(ReferenceRole.WAIT) &&
        !has(ReferenceRole.NON_BLOCKING_WRITE) && !has(ReferenceRole.BLOCKING_WRITE) && !has(ReferenceRole.PLAIN_READ);
  }

  /** @return a copy with independent buckets */
  public UsageInfo snapshot() {
    UsageInfo ret = new UsageInfo();
    buckets.forEach((role, refs) -> ret.buckets.get(role).addAll(refs));
    ret.roles.putAll(roles);
    ret.wasContinuousWrite = wasContinuousWrite;
    ret.constantDriven = constantDriven;
    return ret;
  }

  @Override
  public String toString() {
    StringBuilder ret = new StringBuilder("UsageInfo{");
    buckets.forEach((role, refs) -> {
      if (!refs.isEmpty())
        ret.append(role).append('=').append(refs.size()).append(' ');
    });
    if (wasContinuousWrite)
      ret.append("wasContinuousWrite ");
    if (constantDriven)
      ret.append("constantDriven ");
    return ret.append('}').toString();
  }
}
