package hdlrefine.semantics;

import hdlrefine.design.Action;
import hdlrefine.design.Assign;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Declaration;
import hdlrefine.design.DesignException;
import hdlrefine.design.Expr;
import hdlrefine.design.FunctionCall;
import hdlrefine.design.Identifier;
import hdlrefine.design.Module;
import hdlrefine.design.Node;
import hdlrefine.design.NodeList;
import hdlrefine.design.Port;
import hdlrefine.design.Procedure;
import hdlrefine.design.Process;
import hdlrefine.design.WaitStmt;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Language semantics queries on the design graph.
 */
public final class Semantics {
  private Semantics() {}

  /** @return true iff the node lies inside the target of its nearest enclosing assignment */
  public static boolean isInLeftHandSide(Node ref) {
    Assign assign = ref.getNearestParent(Assign.class);
    return assign != null && ref.isSubNodeOf(assign.getTarget());
  }

  /**
   * Returns the nearest enclosing statement that is held by an action list,
   * i.e. the position a new statement can be inserted before.
   * @return the statement, or null if the node is not part of any statement list
   */
  public static Action getEnclosingStatement(Node node) {
    for (Node cur = node.getParent(); cur != null; cur = cur.getParent()) {
      if (cur instanceof Action && cur.getOwnerList() != null)
        return (Action)cur;
    }
    return null;
  }

  /** Returns the outermost expression containing the node (the node itself if its parent is no expression). */
  public static Node getExpressionRoot(Node node) {
    Node cur = node;
    while (cur.getParent() instanceof Expr)
      cur = cur.getParent();
    return cur;
  }

  /**
   * Returns the sensitivity list that holds the expression containing <code>ref</code>.
   * @param includeWait whether the sensitivity list of a wait statement counts
   * @return the list, or null
   */
  public static NodeList<?> getSensitivityList(Node ref, boolean includeWait) {
    Node root = getExpressionRoot(ref);
    NodeList<?> list = root.getOwnerList();
    if (list == null)
      return null;
    Node owner = list.getOwner();
    if (owner instanceof Process && ((Process)owner).isSensitivityList(list))
      return list;
    if (includeWait && owner instanceof WaitStmt && ((WaitStmt)owner).getSensitivity() == list)
      return list;
    return null;
  }

  /** @return true iff the node lies inside the condition of its nearest wait statement */
  public static boolean isInWaitCondition(Node ref) {
    WaitStmt wait = ref.getNearestParent(WaitStmt.class);
    return wait != null && wait.getCondition() != null && ref.isSubNodeOf(wait.getCondition());
  }

  /** Lists all identifiers below (and including) the node in source order. */
  public static List<Identifier> collectIdentifiers(Node node) {
    return node.streamSubtree(Identifier.class).collect(Collectors.toList());
  }

  /** @return true iff the subtree calls a function outside of the standard library */
  public static boolean containsSideEffectCall(Node node) {
    return node != null && node.streamSubtree(FunctionCall.class).anyMatch(call -> !call.isStandard());
  }

  /** @return the module the node belongs to, or null for detached nodes */
  public static Module getModule(Node node) {
    if (node instanceof Module)
      return (Module)node;
    return node.getNearestParent(Module.class);
  }

  /** @return the module the node belongs to */
  public static Module requireModule(Node node) {
    Module module = getModule(node);
    if (module == null)
      throw new DesignException("Cannot find the enclosing module", node);
    return module;
  }

  /** @return the generated cone enclosing the node, or null */
  public static Procedure getEnclosingCone(Node node) {
    for (Procedure proc = node.getNearestParent(Procedure.class); proc != null; proc = proc.getNearestParent(Procedure.class)) {
      if (proc.isCone())
        return proc;
    }
    return null;
  }

  /** @return the declaration a reference (identifier) resolves to */
  public static DataDeclaration lookup(Identifier ref) {
    if (ref.getDeclaration() == null)
      throw new DesignException("Declaration not found for '" + ref.getName() + "'", ref);
    return ref.getDeclaration();
  }

  /**
   * Adds a module level declaration right after <code>anchor</code>.
   * If the anchor is a port, the new declaration becomes the first body declaration of the module.
   */
  public static void addDeclarationAfter(DataDeclaration anchor, Declaration newDecl) {
    Module module = requireModule(anchor);
    if (anchor instanceof Port)
      module.getDeclarations().add(0, newDecl);
    else if (anchor.getOwnerList() == module.getDeclarations())
      module.getDeclarations().addAfter(anchor, newDecl);
    else
      throw new DesignException("Declaration is not placed at module level", anchor);
  }

  /**
   * Adds an identifier to a sensitivity list unless an entry with the same name exists.
   * @return true iff the identifier was added
   */
  public static boolean addUniqueByName(NodeList<Expr> list, Identifier entry) {
    boolean present = list.stream().anyMatch(expr -> expr instanceof Identifier && ((Identifier)expr).getName().equals(entry.getName()));
    if (present)
      return false;
    list.add(entry);
    return true;
  }
}
