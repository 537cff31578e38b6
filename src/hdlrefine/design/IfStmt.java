package hdlrefine.design;

import java.util.List;

/** <code>if / else if / else</code> statement. */
public class IfStmt extends Action {
  private final NodeList<IfAlt> alts = new NodeList<>(this, IfAlt.class);
  private final NodeList<Action> defaults = new NodeList<>(this, Action.class);

  public IfStmt() {}

  /** Convenience constructor for a single guarded branch without else. */
  public IfStmt(Expr condition, List<? extends Action> thenActions) {
    IfAlt alt = new IfAlt(condition);
    alt.getActions().addAll(thenActions);
    alts.add(alt);
  }

  public NodeList<IfAlt> getAlts() { return alts; }
  public NodeList<Action> getDefaults() { return defaults; }

  @Override
  public List<Node> getChildren() {
    return childList(alts, defaults);
  }

  @Override
  public IfStmt copy() {
    IfStmt ret = new IfStmt();
    ret.alts.addCopies(alts);
    ret.defaults.addCopies(defaults);
    return ret;
  }
}
