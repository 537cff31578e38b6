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
import hdlrefine.design.Port;
import hdlrefine.design.PortBinding;
import hdlrefine.design.Procedure;
import hdlrefine.design.ProcedureCall;
import hdlrefine.design.Process;
import hdlrefine.design.Signal;
import hdlrefine.design.UnaryExpr;
import hdlrefine.design.Variable;
import hdlrefine.design.WaitStmt;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Writes a design in the YAML format understood by {@link DesignReader}.
 */
public class DesignWriter {
  private DesignWriter() {}

  public static String write(Design design) {
    return yaml().dump(toYaml(design));
  }

  public static void write(Design design, Writer out) throws IOException {
    yaml().dump(toYaml(design), out);
    out.flush();
  }

  private static Yaml yaml() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    return new Yaml(options);
  }

  static Map<String, Object> toYaml(Design design) {
    List<Object> modules = new ArrayList<>();
    for (Module module : design.getModules())
      modules.add(moduleToYaml(module));
    Map<String, Object> ret = new LinkedHashMap<>();
    ret.put("modules", modules);
    return ret;
  }

  private static Map<String, Object> moduleToYaml(Module module) {
    Map<String, Object> ret = new LinkedHashMap<>();
    ret.put("name", module.getName());
    List<Object> ports = new ArrayList<>();
    for (Port port : module.getPorts()) {
      Map<String, Object> portMap = dataDecl(port);
      portMap.put("dir", port.getDirection().serialName);
      ports.add(portMap);
    }
    putIfNotEmpty(ret, "ports", ports);

    List<Object> signals = new ArrayList<>();
    List<Object> variables = new ArrayList<>();
    List<Object> procedures = new ArrayList<>();
    for (Declaration decl : module.getDeclarations()) {
      if (decl instanceof Signal)
        signals.add(dataDecl((DataDeclaration)decl));
      else if (decl instanceof Variable)
        variables.add(dataDecl((DataDeclaration)decl));
      else if (decl instanceof Procedure)
        procedures.add(procedureToYaml((Procedure)decl));
    }
    putIfNotEmpty(ret, "signals", signals);
    putIfNotEmpty(ret, "variables", variables);
    putIfNotEmpty(ret, "procedures", procedures);
    putIfNotEmpty(ret, "continuous", actions(new ArrayList<>(module.getContinuous())));

    List<Object> processes = new ArrayList<>();
    for (Process proc : module.getProcesses()) {
      Map<String, Object> procMap = new LinkedHashMap<>();
      procMap.put("name", proc.getName());
      procMap.put("flavour", proc.getFlavour().serialName);
      putIfNotEmpty(procMap, "sensitivity", exprs(proc.getSensitivity()));
      putIfNotEmpty(procMap, "posedge", exprs(proc.getSensitivityPos()));
      putIfNotEmpty(procMap, "negedge", exprs(proc.getSensitivityNeg()));
      putIfNotEmpty(procMap, "variables", dataDecls(proc.getLocals()));
      procMap.put("body", actions(proc.getBody()));
      processes.add(procMap);
    }
    putIfNotEmpty(ret, "processes", processes);

    List<Object> instances = new ArrayList<>();
    for (Instance instance : module.getInstances()) {
      Map<String, Object> instMap = new LinkedHashMap<>();
      instMap.put("name", instance.getName());
      instMap.put("module", instance.getModuleName());
      Map<String, Object> bindings = new LinkedHashMap<>();
      for (PortBinding binding : instance.getBindings())
        bindings.put(binding.getPortName(), expr(binding.getActual()));
      if (!bindings.isEmpty())
        instMap.put("bindings", bindings);
      instances.add(instMap);
    }
    putIfNotEmpty(ret, "instances", instances);
    return ret;
  }

  private static Map<String, Object> procedureToYaml(Procedure proc) {
    Map<String, Object> ret = new LinkedHashMap<>();
    ret.put("name", proc.getName());
    if (proc.isCone())
      ret.put("cone", true);
    putIfNotEmpty(ret, "parameters", dataDecls(proc.getParameters()));
    putIfNotEmpty(ret, "variables", dataDecls(proc.getLocals()));
    ret.put("body", actions(proc.getBody()));
    return ret;
  }

  private static Map<String, Object> dataDecl(DataDeclaration decl) {
    Map<String, Object> ret = new LinkedHashMap<>();
    ret.put("name", decl.getName());
    if (decl.getType() != null)
      ret.put("type", decl.getType());
    if (decl.getInitialValue() != null)
      ret.put("init", expr(decl.getInitialValue()));
    return ret;
  }

  private static List<Object> dataDecls(List<? extends DataDeclaration> decls) {
    List<Object> ret = new ArrayList<>();
    decls.forEach(decl -> ret.add(dataDecl(decl)));
    return ret;
  }

  private static List<Object> actions(List<? extends Action> actions) {
    List<Object> ret = new ArrayList<>();
    actions.forEach(action -> ret.add(action(action)));
    return ret;
  }

  private static Object action(Action action) {
    Map<String, Object> ret = new LinkedHashMap<>();
    if (action instanceof Assign) {
      Assign assign = (Assign)action;
      ret.put("assign", expr(assign.getTarget()));
      ret.put("value", expr(assign.getValue()));
      if (assign.isNonBlocking())
        ret.put("nonblocking", true);
      if (assign.getDelay() != null)
        ret.put("delay", expr(assign.getDelay()));
    } else if (action instanceof IfStmt) {
      IfStmt ifStmt = (IfStmt)action;
      List<Object> elifs = new ArrayList<>();
      for (int i = 0; i < ifStmt.getAlts().size(); ++i) {
        IfAlt alt = ifStmt.getAlts().get(i);
        if (i == 0) {
          ret.put("if", expr(alt.getCondition()));
          ret.put("then", actions(alt.getActions()));
        } else {
          Map<String, Object> altMap = new LinkedHashMap<>();
          altMap.put("cond", expr(alt.getCondition()));
          altMap.put("then", actions(alt.getActions()));
          elifs.add(altMap);
        }
      }
      putIfNotEmpty(ret, "elif", elifs);
      putIfNotEmpty(ret, "else", actions(ifStmt.getDefaults()));
    } else if (action instanceof WaitStmt) {
      WaitStmt wait = (WaitStmt)action;
      Map<String, Object> waitMap = new LinkedHashMap<>();
      putIfNotEmpty(waitMap, "sensitivity", exprs(wait.getSensitivity()));
      if (wait.getCondition() != null)
        waitMap.put("until", expr(wait.getCondition()));
      ret.put("wait", waitMap);
    } else if (action instanceof ProcedureCall) {
      ret.put("call", ((ProcedureCall)action).getName());
    } else
      throw new IllegalArgumentException("Cannot serialize " + action);
    return ret;
  }

  private static List<Object> exprs(List<Expr> exprs) {
    List<Object> ret = new ArrayList<>();
    exprs.forEach(expr -> ret.add(expr(expr)));
    return ret;
  }

  static Object expr(Expr expr) {
    if (expr instanceof Identifier)
      return ((Identifier)expr).getName();
    if (expr instanceof Constant) {
      String value = ((Constant)expr).getValue();
      if (DesignReader.NAME.matcher(value).matches())
        return Map.of("const", value);
      return value;
    }
    Map<String, Object> ret = new LinkedHashMap<>();
    if (expr instanceof UnaryExpr) {
      ret.put("op", ((UnaryExpr)expr).getOp());
      ret.put("args", List.of(expr(((UnaryExpr)expr).getOperand())));
    } else if (expr instanceof BinaryExpr) {
      BinaryExpr bin = (BinaryExpr)expr;
      ret.put("op", bin.getOp());
      ret.put("args", List.of(expr(bin.getLhs()), expr(bin.getRhs())));
    } else if (expr instanceof FunctionCall) {
      FunctionCall call = (FunctionCall)expr;
      ret.put("call", call.getName());
      ret.put("args", exprs(call.getArguments()));
      ret.put("standard", call.isStandard());
    } else
      throw new IllegalArgumentException("Cannot serialize " + expr);
    return ret;
  }

  private static void putIfNotEmpty(Map<String, Object> map, String key, List<Object> list) {
    if (!list.isEmpty())
      map.put(key, list);
  }
}
