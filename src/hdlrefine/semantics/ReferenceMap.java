package hdlrefine.semantics;

import hdlrefine.design.DataDeclaration;
import hdlrefine.design.DesignException;
import hdlrefine.design.Identifier;
import hdlrefine.design.Node;
import hdlrefine.design.PortBinding;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Whole-design map from each data declaration to its syntactic uses.
 * A use is an {@link Identifier} or a {@link PortBinding} naming a formal port.
 * Iteration follows declaration order (design order of modules, ports, then body declarations).
 * Expressions of initial values and port bindings of black-box instances are not uses.
 */
public class ReferenceMap {
  private final LinkedHashMap<DataDeclaration, LinkedHashSet<Node>> refs = new LinkedHashMap<>();

  /**
   * Collects all declarations (referenced or not) and all uses below the given root.
   */
  public static ReferenceMap collect(Node root) {
    ReferenceMap ret = new ReferenceMap();
    ret.collectInto(root);
    return ret;
  }

  /** Adds all declarations and uses found below the given root. */
  public void collectInto(Node root) {
    root.streamSubtree().forEach(node -> {
      if (node instanceof DataDeclaration)
        refs.computeIfAbsent((DataDeclaration)node, decl -> new LinkedHashSet<>());
    });
    collectUses(root).forEach(this::add);
  }

  /** Lists the uses below the given root in source order. */
  public static List<Node> collectUses(Node root) {
    return root.streamSubtree()
        .filter(node -> node instanceof Identifier || (node instanceof PortBinding && ((PortBinding)node).getPort() != null))
        .filter(node -> node.getNearestParent(DataDeclaration.class) == null)
        .collect(Collectors.toList());
  }

  /** @return the declaration a use refers to */
  public static DataDeclaration declarationOf(Node ref) {
    if (ref instanceof Identifier)
      return Semantics.lookup((Identifier)ref);
    if (ref instanceof PortBinding) {
      PortBinding binding = (PortBinding)ref;
      if (binding.getPort() == null)
        throw new DesignException("Formal port '" + binding.getPortName() + "' not resolved", binding);
      return binding.getPort();
    }
    throw new DesignException("Node is no reference", ref);
  }

  /** Registers a use under the declaration it refers to. */
  public void add(Node ref) {
    refs.computeIfAbsent(declarationOf(ref), decl -> new LinkedHashSet<>()).add(ref);
  }

  /** Removes a use. Does nothing if the use is unknown. */
  public void remove(Node ref) {
    for (var entry : refs.values()) {
      if (entry.remove(ref))
        return;
    }
  }

  /** Removes a use registered under the given declaration. */
  public void remove(DataDeclaration decl, Node ref) {
    var set = refs.get(decl);
    if (set != null)
      set.remove(ref);
  }

  /** @return the uses of a declaration (unmodifiable, may be empty) */
  public Set<Node> get(DataDeclaration decl) {
    var set = refs.get(decl);
    return set == null ? Set.of() : Collections.unmodifiableSet(set);
  }

  public boolean contains(DataDeclaration decl) { return refs.containsKey(decl); }

  /** @return the declarations in declaration order */
  public Set<DataDeclaration> declarations() { return Collections.unmodifiableSet(refs.keySet()); }

  public Stream<Map.Entry<DataDeclaration, Set<Node>>> stream() {
    return refs.entrySet().stream().map(entry -> Map.entry(entry.getKey(), Collections.unmodifiableSet(entry.getValue())));
  }

  /**
   * Moves all uses of <code>oldDecl</code> to <code>newDecl</code>, keeping the position of the entry.
   * Does not touch the uses themselves.
   */
  public void replaceDeclaration(DataDeclaration oldDecl, DataDeclaration newDecl) {
    var uses = refs.get(oldDecl);
    if (uses == null)
      throw new DesignException("Declaration is not part of the reference map", oldDecl);
    LinkedHashMap<DataDeclaration, LinkedHashSet<Node>> rebuilt = new LinkedHashMap<>();
    refs.forEach((decl, set) -> rebuilt.put(decl == oldDecl ? newDecl : decl, set));
    refs.clear();
    refs.putAll(rebuilt);
  }

  /** @return the position of a declaration in declaration order, or -1 */
  public int orderOf(DataDeclaration decl) {
    int i = 0;
    for (DataDeclaration cur : refs.keySet()) {
      if (cur == decl)
        return i;
      ++i;
    }
    return -1;
  }
}
