package hdlrefine.design;

import java.util.List;

/** Zero-argument call statement, e.g. the call of a generated cone. */
public class ProcedureCall extends Action {
  private final String name;
  private Procedure procedure;

  public ProcedureCall(String name) {
    this.name = name;
    this.procedure = null;
  }

  public ProcedureCall(Procedure procedure) {
    this.name = procedure.getName();
    this.procedure = procedure;
  }

  public String getName() { return name; }
  public Procedure getProcedure() { return procedure; }
  public void setProcedure(Procedure procedure) { this.procedure = procedure; }

  @Override
  public List<Node> getChildren() {
    return List.of();
  }

  @Override
  public ProcedureCall copy() {
    ProcedureCall ret = new ProcedureCall(name);
    ret.procedure = procedure;
    return ret;
  }
}
