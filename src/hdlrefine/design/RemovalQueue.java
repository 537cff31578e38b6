package hdlrefine.design;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Deferred removal of nodes. Rewrites that traverse the tree schedule nodes here
 * and the queue is drained once no traversal refers to the scheduled nodes anymore.
 */
public class RemovalQueue {
  private final Set<Node> pending = Collections.newSetFromMap(new IdentityHashMap<>());
  private final LinkedHashSet<Node> order = new LinkedHashSet<>();

  /** Marks a node for removal. Scheduling a node twice has no effect. */
  public void schedule(Node node) {
    if (pending.add(node))
      order.add(node);
  }

  /** @return true iff the node is logically removed but still attached */
  public boolean isPending(Node node) { return pending.contains(node); }

  public int size() { return pending.size(); }

  /**
   * Detaches all scheduled nodes.
   * @return the number of detached nodes
   */
  public int drain() {
    int count = 0;
    for (Node node : order) {
      if (!node.isDetached()) {
        node.detach();
        ++count;
      }
    }
    pending.clear();
    order.clear();
    return count;
  }
}
