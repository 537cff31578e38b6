package hdlrefine.refine;

import hdlrefine.design.Assign;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Procedure;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Generated update procedure of a dataflow-driven declaration, along with the bookkeeping
 * the later stages need: which declarations it absorbed and which bindings it captured.
 */
public class Cone {
  private final DataDeclaration decl;
  private final Procedure procedure;
  private final LinkedHashSet<DataDeclaration> absorbed = new LinkedHashSet<>();
  private final List<Assign> captured = new ArrayList<>();
  private boolean dirtyChecked = false;
  private boolean lazy = false;

  public Cone(DataDeclaration decl, Procedure procedure) {
    this.decl = decl;
    this.procedure = procedure;
  }

  public DataDeclaration getDeclaration() { return decl; }
  public Procedure getProcedure() { return procedure; }

  /** @return the declarations whose bindings were inlined into this cone */
  public Set<DataDeclaration> getAbsorbed() { return Collections.unmodifiableSet(absorbed); }
  public boolean absorbs(DataDeclaration other) { return absorbed.contains(other); }
  void absorb(DataDeclaration other) { absorbed.add(other); }

  /** @return the original bindings copied into this cone */
  public List<Assign> getCaptured() { return Collections.unmodifiableList(captured); }
  void capture(Assign binding) { captured.add(binding); }

  /** @return true iff the cone only forwards changed values to its declaration */
  public boolean isDirtyChecked() { return dirtyChecked; }
  void setDirtyChecked(boolean dirtyChecked) { this.dirtyChecked = dirtyChecked; }

  /** @return true iff the cone was created by the materializer without any binding */
  public boolean isLazy() { return lazy; }
  void setLazy(boolean lazy) { this.lazy = lazy; }

  @Override
  public String toString() {
    return "Cone(" + procedure.getName() + " for " + decl.getName() + ")";
  }
}
