package hdlrefine.analysis;

import hdlrefine.design.DataDeclaration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Dataflow dependencies between declarations. An edge leads from the target of a dataflow binding
 * to each declaration the binding reads (its drivers). Reverse adjacency (readers) is kept in sync.
 */
public class DependencyGraph {
  private final LinkedHashMap<DataDeclaration, LinkedHashSet<DataDeclaration>> drivers = new LinkedHashMap<>();
  private final LinkedHashMap<DataDeclaration, LinkedHashSet<DataDeclaration>> readers = new LinkedHashMap<>();
  private final LinkedHashSet<DataDeclaration> constantDriven = new LinkedHashSet<>();

  /** Adds a node without edges. Does nothing if the node exists. */
  public void addNode(DataDeclaration decl) {
    drivers.computeIfAbsent(decl, key -> new LinkedHashSet<>());
    readers.computeIfAbsent(decl, key -> new LinkedHashSet<>());
  }

  /** Adds the edge <code>target -> source</code>. */
  public void addEdge(DataDeclaration target, DataDeclaration source) {
    if (target == source)
      throw new IllegalArgumentException("Self dependency of " + target.getName());
    addNode(target);
    addNode(source);
    drivers.get(target).add(source);
    readers.get(source).add(target);
  }

  public boolean contains(DataDeclaration decl) { return drivers.containsKey(decl); }

  /** @return all nodes in insertion order */
  public Set<DataDeclaration> getNodes() { return Collections.unmodifiableSet(drivers.keySet()); }

  /** @return the declarations read by the bindings of <code>decl</code> */
  public Set<DataDeclaration> getDrivers(DataDeclaration decl) {
    var set = drivers.get(decl);
    return set == null ? Set.of() : Collections.unmodifiableSet(set);
  }

  /** @return the declarations whose bindings read <code>decl</code> */
  public Set<DataDeclaration> getReaders(DataDeclaration decl) {
    var set = readers.get(decl);
    return set == null ? Set.of() : Collections.unmodifiableSet(set);
  }

  public int edgeCount() { return drivers.values().stream().mapToInt(Set::size).sum(); }

  public void markConstantDriven(DataDeclaration decl) { constantDriven.add(decl); }

  /** @return the declarations whose bindings read no refinable declaration */
  public Set<DataDeclaration> getConstantDriven() { return Collections.unmodifiableSet(constantDriven); }

  /**
   * Makes the drivers of <code>absorbed</code> drivers of <code>decl</code> as well,
   * after the bindings of <code>absorbed</code> were inlined into the cone of <code>decl</code>.
   */
  public void promoteDrivers(DataDeclaration decl, DataDeclaration absorbed) {
    for (DataDeclaration grandParent : new LinkedHashSet<>(getDrivers(absorbed))) {
      if (grandParent != decl)
        addEdge(decl, grandParent);
    }
  }

  /**
   * Collects the transitive drivers of <code>decl</code> that have no drivers of their own.
   * @return the leaf drivers in discovery order (empty if <code>decl</code> has no drivers)
   */
  public Set<DataDeclaration> collectLeafDrivers(DataDeclaration decl) { return collectLeafDrivers(decl, Set.of()); }

  /**
   * Like {@link #collectLeafDrivers(DataDeclaration)}, but declarations in <code>coneBacked</code> are never leaves.
   * The walk continues through their drivers instead.
   */
  public Set<DataDeclaration> collectLeafDrivers(DataDeclaration decl, Set<DataDeclaration> coneBacked) {
    LinkedHashSet<DataDeclaration> leaves = new LinkedHashSet<>();
    Set<DataDeclaration> visited = new HashSet<>();
    Deque<DataDeclaration> stack = new ArrayDeque<>();
    visited.add(decl);
    stack.push(decl);
    while (!stack.isEmpty()) {
      DataDeclaration cur = stack.pop();
      for (DataDeclaration driver : getDrivers(cur)) {
        if (!visited.add(driver))
          continue;
        if (getDrivers(driver).isEmpty() && !coneBacked.contains(driver))
          leaves.add(driver);
        else
          stack.push(driver);
      }
    }
    return leaves;
  }
}
