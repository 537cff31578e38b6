package hdlrefine.design;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.RandomAccess;

/**
 * Ordered child list of a node. Keeps the parent and owner links of its elements up to date.
 * An element can only be added if it is detached, i.e. every node belongs to exactly one list or slot.
 * Element lookups use identity, not equals.
 */
public class NodeList<T extends Node> extends AbstractList<T> implements RandomAccess {
  private final Node owner;
  private final Class<T> elementType;
  private final ArrayList<T> inner = new ArrayList<>();

  public NodeList(Node owner, Class<T> elementType) {
    this.owner = owner;
    this.elementType = elementType;
  }

  public Node getOwner() { return owner; }
  public Class<T> getElementType() { return elementType; }

  @Override
  public T get(int index) {
    return inner.get(index);
  }

  @Override
  public int size() {
    return inner.size();
  }

  @Override
  public void add(int index, T element) {
    claim(element);
    inner.add(index, element);
  }

  @Override
  public T set(int index, T element) {
    T prev = inner.get(index);
    if (prev == element)
      return prev;
    claim(element);
    inner.set(index, element);
    release(prev);
    return prev;
  }

  @Override
  public T remove(int index) {
    T prev = inner.remove(index);
    release(prev);
    return prev;
  }

  @Override
  public boolean remove(Object o) {
    int idx = indexOfNode(o);
    if (idx == -1)
      return false;
    remove(idx);
    return true;
  }

  @Override
  public int indexOf(Object o) {
    return indexOfNode(o);
  }

  @Override
  public boolean contains(Object o) {
    return indexOfNode(o) != -1;
  }

  /** Identity based index lookup. */
  public int indexOfNode(Object o) {
    for (int i = 0; i < inner.size(); ++i) {
      if (inner.get(i) == o)
        return i;
    }
    return -1;
  }

  /** Moves all elements of another list to the end of this list, keeping their order. */
  public void takeAll(NodeList<? extends T> other) {
    var moved = new ArrayList<T>(other);
    other.clear();
    addAll(moved);
  }

  /** Adds copies of the given nodes to the end of this list. */
  public void addCopies(Collection<? extends T> nodes) {
    for (T node : nodes)
      add(elementType.cast(node.copy()));
  }

  /**
   * Inserts a node right before an element of this list.
   * @param anchor an element of this list
   * @param node the detached node to insert, must match the element type
   */
  public void addBefore(Node anchor, Node node) {
    int idx = indexOfNode(anchor);
    if (idx == -1)
      throw new IllegalArgumentException("Anchor " + anchor + " is not an element of this list");
    add(idx, checkType(node));
  }

  /**
   * Inserts a node right after an element of this list.
   * @param anchor an element of this list
   * @param node the detached node to insert, must match the element type
   */
  public void addAfter(Node anchor, Node node) {
    int idx = indexOfNode(anchor);
    if (idx == -1)
      throw new IllegalArgumentException("Anchor " + anchor + " is not an element of this list");
    add(idx + 1, checkType(node));
  }

  void setNode(int index, Node node) { set(index, checkType(node)); }

  void removeNode(Node node) {
    if (!remove(node))
      throw new IllegalArgumentException("Node " + node + " is not an element of this list");
  }

  private T checkType(Node node) {
    if (!elementType.isInstance(node))
      throw new IllegalArgumentException("Node " + node + " cannot be stored in a list of " + elementType.getSimpleName());
    return elementType.cast(node);
  }

  private void claim(T element) {
    if (element == null)
      throw new IllegalArgumentException("A NodeList cannot hold null");
    if (element.parent != null)
      throw new IllegalArgumentException("Node " + element + " already belongs to " + element.parent);
    element.parent = owner;
    element.ownerList = this;
  }

  private void release(T element) {
    if (element != null && element.ownerList == this) {
      element.parent = null;
      element.ownerList = null;
    }
  }
}
