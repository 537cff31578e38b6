package hdlrefine.design;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import hdlrefine.util.DesignPrinter;

/**
 * Base class of every object in the design graph.
 * A node has at most one parent. It is either held by a {@link NodeList} of its parent or by a single-valued slot
 * (e.g. the target of an {@link Assign}).
 * Nodes use identity equality, so they can be used as keys in hash based collections while being rewritten.
 */
public abstract class Node {
  Node parent = null;
  NodeList<?> ownerList = null;

  public Node getParent() { return parent; }

  /** Returns the list holding this node, or null if the node is detached or held by a single-valued slot. */
  public NodeList<?> getOwnerList() { return ownerList; }

  public boolean isDetached() { return parent == null; }

  /**
   * Returns the nearest strict ancestor that is an instance of the given class.
   * @param cls the requested node class
   * @return the ancestor, or null if none exists
   */
  public <T extends Node> T getNearestParent(Class<T> cls) {
    for (Node cur = parent; cur != null; cur = cur.parent) {
      if (cls.isInstance(cur))
        return cls.cast(cur);
    }
    return null;
  }

  /** Optional variant of {@link #getNearestParent(Class)}. */
  public <T extends Node> Optional<T> findNearestParent(Class<T> cls) { return Optional.ofNullable(getNearestParent(cls)); }

  /** @return true iff this node is <code>ancestor</code> or lies somewhere below it */
  public boolean isSubNodeOf(Node ancestor) {
    if (ancestor == null)
      return false;
    for (Node cur = this; cur != null; cur = cur.parent) {
      if (cur == ancestor)
        return true;
    }
    return false;
  }

  /** Lists the direct children in source order. Null slots are skipped. */
  public abstract List<Node> getChildren();

  /** Deep copy of this subtree. The copy is detached; references keep pointing to the same declarations. */
  public abstract Node copy();

  /**
   * Replaces a direct child held by a single-valued slot.
   * Children held by a NodeList are replaced through {@link NodeList#set(int, Node)}.
   */
  protected void replaceChild(Node oldChild, Node newChild) {
    throw new IllegalArgumentException("Node " + this + " has no single-valued slot holding " + oldChild);
  }

  /**
   * Replaces this node inside its parent.
   * @param replacement the new node, must be detached (or null to clear a single-valued slot)
   */
  public void replace(Node replacement) {
    if (parent == null)
      throw new IllegalStateException("Cannot replace a detached node");
    if (ownerList != null) {
      if (replacement == null) {
        ownerList.removeNode(this);
        return;
      }
      ownerList.setNode(ownerList.indexOfNode(this), replacement);
    } else
      parent.replaceChild(this, replacement);
  }

  /** Detaches this node from its parent. */
  public void detach() {
    if (parent == null)
      return;
    replace(null);
  }

  /** Pre-order stream over this node and all nodes below it. */
  public Stream<Node> streamSubtree() {
    List<Node> result = new ArrayList<>();
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      Node cur = stack.pop();
      result.add(cur);
      List<Node> children = cur.getChildren();
      for (int i = children.size() - 1; i >= 0; --i)
        stack.push(children.get(i));
    }
    return result.stream();
  }

  /** Pre-order stream over all nodes below this one of the given class. */
  public <T extends Node> Stream<T> streamSubtree(Class<T> cls) {
    return streamSubtree().filter(cls::isInstance).map(cls::cast);
  }

  /** Takes ownership of a child for a single-valued slot. */
  protected <T extends Node> T adopt(T child) {
    if (child == null)
      return null;
    if (child.parent != null)
      throw new IllegalArgumentException("Node " + child + " already belongs to " + child.parent);
    child.parent = this;
    child.ownerList = null;
    return child;
  }

  /** Releases a child from a single-valued slot. */
  protected void orphan(Node child) {
    if (child != null && child.parent == this) {
      child.parent = null;
      child.ownerList = null;
    }
  }

  protected static <T extends Node> T copyOrNull(T node, Class<T> cls) {
    return node == null ? null : cls.cast(node.copy());
  }

  protected static List<Node> childList(Object... children) {
    List<Node> ret = new ArrayList<>();
    for (Object child : children) {
      if (child instanceof Node)
        ret.add((Node)child);
      else if (child instanceof NodeList)
        ret.addAll((NodeList<?>)child);
    }
    return ret;
  }

  @Override
  public String toString() {
    return DesignPrinter.toShortString(this);
  }
}
