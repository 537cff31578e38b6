package hdlrefine.util;

import hdlrefine.design.Action;
import hdlrefine.design.Assign;
import hdlrefine.design.BinaryExpr;
import hdlrefine.design.Constant;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Declaration;
import hdlrefine.design.Design;
import hdlrefine.design.Expr;
import hdlrefine.design.FunctionCall;
import hdlrefine.design.Identifier;
import hdlrefine.design.IfAlt;
import hdlrefine.design.IfStmt;
import hdlrefine.design.Instance;
import hdlrefine.design.Module;
import hdlrefine.design.Node;
import hdlrefine.design.Parameter;
import hdlrefine.design.Port;
import hdlrefine.design.PortBinding;
import hdlrefine.design.Procedure;
import hdlrefine.design.ProcedureCall;
import hdlrefine.design.Process;
import hdlrefine.design.Signal;
import hdlrefine.design.UnaryExpr;
import hdlrefine.design.Variable;
import hdlrefine.design.WaitStmt;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints the design graph as a readable HDL-like listing.
 */
public class DesignPrinter {
  public String tab = "  ";

  private final StringBuilder out = new StringBuilder();
  private int nrTabs = 0;

  /** One-line description of a node, used for diagnostics. */
  public static String toShortString(Node node) {
    if (node == null)
      return "<null>";
    if (node instanceof Expr)
      return expr((Expr)node);
    if (node instanceof Assign)
      return assignText((Assign)node);
    if (node instanceof ProcedureCall)
      return "call " + ((ProcedureCall)node).getName();
    if (node instanceof IfStmt)
      return "if (" + ((IfStmt)node).getAlts().stream().map(alt -> expr(alt.getCondition())).collect(Collectors.joining(") ... else if (")) + ") ...";
    if (node instanceof IfAlt)
      return "if (" + expr(((IfAlt)node).getCondition()) + ") ...";
    if (node instanceof WaitStmt)
      return waitText((WaitStmt)node);
    if (node instanceof Declaration)
      return declKind((Declaration)node) + " " + ((Declaration)node).getName();
    if (node instanceof Process)
      return "process " + ((Process)node).getName();
    if (node instanceof Instance)
      return "instance " + ((Instance)node).getName();
    if (node instanceof PortBinding)
      return "." + ((PortBinding)node).getPortName() + "(" + expr(((PortBinding)node).getActual()) + ")";
    if (node instanceof Module)
      return "module " + ((Module)node).getName();
    return node.getClass().getSimpleName();
  }

  /** Prints the whole design. */
  public static String print(Design design) {
    DesignPrinter printer = new DesignPrinter();
    for (Module module : design.getModules())
      printer.printModule(module);
    return printer.out.toString();
  }

  /** Prints one module. */
  public static String print(Module module) {
    DesignPrinter printer = new DesignPrinter();
    printer.printModule(module);
    return printer.out.toString();
  }

  private void printModule(Module module) {
    line("module " + module.getName());
    ++nrTabs;
    for (Port port : module.getPorts())
      line(dataDecl(port) + ";");
    for (Declaration decl : module.getDeclarations()) {
      if (decl instanceof Procedure)
        printProcedure((Procedure)decl);
      else
        line(dataDecl((DataDeclaration)decl) + ";");
    }
    for (Assign binding : module.getContinuous())
      line("assign " + assignText(binding));
    for (Process proc : module.getProcesses())
      printProcess(proc);
    for (Instance instance : module.getInstances()) {
      line("instance " + instance.getName() + " : " + instance.getModuleName() + " (" +
           instance.getBindings().stream().map(DesignPrinter::toShortString).collect(Collectors.joining(", ")) + ");");
    }
    --nrTabs;
    line("endmodule");
    line("");
  }

  private void printProcedure(Procedure proc) {
    String params = proc.getParameters().stream().map(DesignPrinter::dataDecl).collect(Collectors.joining(", "));
    line((proc.isCone() ? "cone " : "procedure ") + proc.getName() + "(" + params + ")");
    printLocalsAndBody(proc.getLocals(), proc.getBody());
  }

  private void printProcess(Process proc) {
    List<String> sens = new ArrayList<>();
    proc.getSensitivity().forEach(expr -> sens.add(expr(expr)));
    proc.getSensitivityPos().forEach(expr -> sens.add("posedge " + expr(expr)));
    proc.getSensitivityNeg().forEach(expr -> sens.add("negedge " + expr(expr)));
    String header = proc.getFlavour().serialName + " " + proc.getName();
    if (!sens.isEmpty())
      header += " @(" + String.join(", ", sens) + ")";
    line(header);
    printLocalsAndBody(proc.getLocals(), proc.getBody());
  }

  private void printLocalsAndBody(List<Variable> locals, List<Action> body) {
    ++nrTabs;
    for (Variable local : locals)
      line(dataDecl(local) + ";");
    --nrTabs;
    line("begin");
    printActions(body);
    line("end");
  }

  private void printActions(List<Action> actions) {
    ++nrTabs;
    for (Action action : actions)
      printAction(action);
    --nrTabs;
  }

  private void printAction(Action action) {
    if (action instanceof IfStmt) {
      IfStmt ifStmt = (IfStmt)action;
      String prefix = "if";
      for (IfAlt alt : ifStmt.getAlts()) {
        line(prefix + " (" + expr(alt.getCondition()) + ") begin");
        printActions(alt.getActions());
        prefix = "end else if";
      }
      if (!ifStmt.getDefaults().isEmpty()) {
        line("end else begin");
        printActions(ifStmt.getDefaults());
      }
      line("end");
    } else if (action instanceof WaitStmt)
      line(waitText((WaitStmt)action));
    else
      line(toShortString(action) + (action instanceof ProcedureCall ? ";" : ""));
  }

  private void line(String text) {
    if (!text.isEmpty())
      out.append(tab.repeat(nrTabs)).append(text);
    out.append('\n');
  }

  private static String assignText(Assign assign) {
    String delay = assign.getDelay() == null ? "" : "#" + expr(assign.getDelay()) + " ";
    return expr(assign.getTarget()) + (assign.isNonBlocking() ? " <= " : " = ") + delay + expr(assign.getValue()) + ";";
  }

  private static String waitText(WaitStmt wait) {
    StringBuilder ret = new StringBuilder("wait");
    if (!wait.getSensitivity().isEmpty())
      ret.append(" on ").append(wait.getSensitivity().stream().map(DesignPrinter::expr).collect(Collectors.joining(", ")));
    if (wait.getCondition() != null)
      ret.append(" until ").append(expr(wait.getCondition()));
    return ret.append(';').toString();
  }

  private static String declKind(Declaration decl) {
    if (decl instanceof Port)
      return "port " + ((Port)decl).getDirection().serialName;
    if (decl instanceof Signal)
      return "signal";
    if (decl instanceof Variable)
      return "variable";
    if (decl instanceof Parameter)
      return "parameter";
    if (decl instanceof Procedure)
      return ((Procedure)decl).isCone() ? "cone" : "procedure";
    return "declaration";
  }

  private static String dataDecl(DataDeclaration decl) {
    String ret = declKind(decl) + " " + decl.getName();
    if (decl.getType() != null)
      ret += " : " + decl.getType();
    if (decl.getInitialValue() != null)
      ret += " = " + expr(decl.getInitialValue());
    return ret;
  }

  /** Expression text. Nested binary expressions are parenthesized. */
  public static String expr(Expr expr) {
    if (expr == null)
      return "<null>";
    if (expr instanceof Identifier)
      return ((Identifier)expr).getName();
    if (expr instanceof Constant)
      return ((Constant)expr).getValue();
    if (expr instanceof UnaryExpr)
      return ((UnaryExpr)expr).getOp() + operand(((UnaryExpr)expr).getOperand());
    if (expr instanceof BinaryExpr) {
      BinaryExpr bin = (BinaryExpr)expr;
      return operand(bin.getLhs()) + " " + bin.getOp() + " " + operand(bin.getRhs());
    }
    if (expr instanceof FunctionCall) {
      FunctionCall call = (FunctionCall)expr;
      return call.getName() + "(" + call.getArguments().stream().map(DesignPrinter::expr).collect(Collectors.joining(", ")) + ")";
    }
    return expr.getClass().getSimpleName();
  }

  private static String operand(Expr expr) {
    if (expr instanceof BinaryExpr || expr instanceof UnaryExpr)
      return "(" + expr(expr) + ")";
    return expr(expr);
  }
}
