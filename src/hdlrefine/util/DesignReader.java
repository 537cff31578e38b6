package hdlrefine.util;

import hdlrefine.design.Action;
import hdlrefine.design.Assign;
import hdlrefine.design.BinaryExpr;
import hdlrefine.design.Constant;
import hdlrefine.design.Design;
import hdlrefine.design.Expr;
import hdlrefine.design.FunctionCall;
import hdlrefine.design.Identifier;
import hdlrefine.design.IfAlt;
import hdlrefine.design.IfStmt;
import hdlrefine.design.Instance;
import hdlrefine.design.Module;
import hdlrefine.design.NodeList;
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
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a design from its YAML description.
 * <pre>
 * modules:
 *   - name: top
 *     ports:      [{name: a, dir: in, type: logic}]
 *     signals:    [{name: s, type: logic, init: 0}]
 *     variables:  [...]
 *     procedures: [{name: t, parameters: [...], variables: [...], body: [...]}]
 *     continuous: [{assign: s, value: a}]
 *     processes:  [{name: p, flavour: always, sensitivity: [...], posedge: [clk], negedge: [...], variables: [...], body: [...]}]
 *     instances:  [{name: u0, module: sub, bindings: {x: a}}]
 * </pre>
 * Statements are <code>{assign, value, nonblocking, delay}</code>, <code>{if, then, elif: [{cond, then}], else}</code>,
 * <code>{wait: {sensitivity, until}}</code> and <code>{call}</code>.
 * Scalars that look like names are identifiers, all other scalars are constants (<code>{const: IDLE}</code> forces a constant).
 * Operators are <code>{op, args}</code> with one or two arguments, function calls <code>{call, args, standard}</code>.
 * Names are left unresolved.
 */
public class DesignReader {
  protected static final Logger logger = LogManager.getLogger();

  static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

  public static Design read(File file) throws DesignFormatException {
    try (InputStream in = new FileInputStream(file)) {
      return read(in);
    } catch (IOException e) {
      throw new DesignFormatException("Cannot read design file " + file, e);
    }
  }

  public static Design read(String yamlText) throws DesignFormatException {
    try {
      return fromYaml(new Yaml().load(yamlText));
    } catch (YAMLException e) {
      throw new DesignFormatException("Malformed YAML: " + e.getMessage(), e);
    }
  }

  public static Design read(InputStream in) throws DesignFormatException {
    try {
      return fromYaml(new Yaml().load(in));
    } catch (YAMLException e) {
      throw new DesignFormatException("Malformed YAML: " + e.getMessage(), e);
    }
  }

  private static Design fromYaml(Object root) throws DesignFormatException {
    Map<String, Object> rootMap = asMap(root, "design");
    Design design = new Design();
    for (Object moduleObj : asList(rootMap.get("modules"), "modules"))
      design.getModules().add(readModule(asMap(moduleObj, "module")));
    logger.debug("Read {} modules", design.getModules().size());
    return design;
  }

  private static Module readModule(Map<String, Object> map) throws DesignFormatException {
    Module module = new Module(requireString(map, "name", "module"));
    String ctxName = "module " + module.getName();
    for (Object portObj : asList(map.get("ports"), ctxName + " ports")) {
      Map<String, Object> portMap = asMap(portObj, "port");
      Port.Direction dir;
      try {
        dir = Port.Direction.fromSerialName(String.valueOf(portMap.getOrDefault("dir", "in")));
      } catch (IllegalArgumentException e) {
        throw new DesignFormatException(ctxName + ": " + e.getMessage(), e);
      }
      module.getPorts().add(new Port(requireString(portMap, "name", "port"), dir, typeOf(portMap), initOf(portMap)));
    }
    for (Object sigObj : asList(map.get("signals"), ctxName + " signals")) {
      Map<String, Object> sigMap = asMap(sigObj, "signal");
      module.getDeclarations().add(new Signal(requireString(sigMap, "name", "signal"), typeOf(sigMap), initOf(sigMap)));
    }
    readVariables(map.get("variables"), module.getDeclarations(), ctxName);
    for (Object procObj : asList(map.get("procedures"), ctxName + " procedures")) {
      Map<String, Object> procMap = asMap(procObj, "procedure");
      Procedure proc = new Procedure(requireString(procMap, "name", "procedure"), Boolean.TRUE.equals(procMap.get("cone")));
      for (Object parObj : asList(procMap.get("parameters"), "parameters")) {
        Map<String, Object> parMap = asMap(parObj, "parameter");
        proc.getParameters().add(new Parameter(requireString(parMap, "name", "parameter"), typeOf(parMap)));
      }
      readVariables(procMap.get("variables"), proc.getLocals(), "procedure " + proc.getName());
      readActions(procMap.get("body"), proc.getBody());
      module.getDeclarations().add(proc);
    }
    for (Object bindingObj : asList(map.get("continuous"), ctxName + " continuous")) {
      Action action = readAction(bindingObj);
      if (!(action instanceof Assign))
        throw new DesignFormatException(ctxName + ": continuous entries must be assignments");
      module.getContinuous().add((Assign)action);
    }
    for (Object procObj : asList(map.get("processes"), ctxName + " processes")) {
      Map<String, Object> procMap = asMap(procObj, "process");
      Process.Flavour flavour;
      try {
        flavour = Process.Flavour.fromSerialName(String.valueOf(procMap.getOrDefault("flavour", "always")));
      } catch (IllegalArgumentException e) {
        throw new DesignFormatException(ctxName + ": " + e.getMessage(), e);
      }
      Process proc = new Process(requireString(procMap, "name", "process"), flavour);
      readExprs(procMap.get("sensitivity"), proc.getSensitivity());
      readExprs(procMap.get("posedge"), proc.getSensitivityPos());
      readExprs(procMap.get("negedge"), proc.getSensitivityNeg());
      readVariables(procMap.get("variables"), proc.getLocals(), "process " + proc.getName());
      readActions(procMap.get("body"), proc.getBody());
      module.getProcesses().add(proc);
    }
    for (Object instObj : asList(map.get("instances"), ctxName + " instances")) {
      Map<String, Object> instMap = asMap(instObj, "instance");
      Instance instance = new Instance(requireString(instMap, "name", "instance"), requireString(instMap, "module", "instance"));
      Object bindings = instMap.get("bindings");
      if (bindings != null) {
        for (Map.Entry<String, Object> binding : asMap(bindings, "bindings").entrySet())
          instance.getBindings().add(new PortBinding(binding.getKey(), readExpr(binding.getValue())));
      }
      module.getInstances().add(instance);
    }
    return module;
  }

  private static void readVariables(Object listObj, NodeList<? super Variable> target, String ctxName) throws DesignFormatException {
    for (Object varObj : asList(listObj, ctxName + " variables")) {
      Map<String, Object> varMap = asMap(varObj, "variable");
      target.add(new Variable(requireString(varMap, "name", "variable"), typeOf(varMap), initOf(varMap)));
    }
  }

  private static void readActions(Object listObj, NodeList<Action> target) throws DesignFormatException {
    for (Object actionObj : asList(listObj, "body"))
      target.add(readAction(actionObj));
  }

  private static void readExprs(Object listObj, NodeList<Expr> target) throws DesignFormatException {
    for (Object exprObj : asList(listObj, "expression list"))
      target.add(readExpr(exprObj));
  }

  static Action readAction(Object obj) throws DesignFormatException {
    Map<String, Object> map = asMap(obj, "statement");
    if (map.containsKey("assign")) {
      if (!map.containsKey("value"))
        throw new DesignFormatException("Assignment without value: " + map);
      Assign assign = new Assign(readExpr(map.get("assign")), readExpr(map.get("value")), Boolean.TRUE.equals(map.get("nonblocking")));
      if (map.get("delay") != null)
        assign.setDelay(readExpr(map.get("delay")));
      return assign;
    }
    if (map.containsKey("if")) {
      IfStmt ifStmt = new IfStmt();
      IfAlt first = new IfAlt(readExpr(map.get("if")));
      readActions(map.get("then"), first.getActions());
      ifStmt.getAlts().add(first);
      for (Object altObj : asList(map.get("elif"), "elif")) {
        Map<String, Object> altMap = asMap(altObj, "elif");
        IfAlt alt = new IfAlt(readExpr(altMap.get("cond")));
        readActions(altMap.get("then"), alt.getActions());
        ifStmt.getAlts().add(alt);
      }
      readActions(map.get("else"), ifStmt.getDefaults());
      return ifStmt;
    }
    if (map.containsKey("wait")) {
      WaitStmt wait = new WaitStmt();
      Object waitObj = map.get("wait");
      if (waitObj != null) {
        Map<String, Object> waitMap = asMap(waitObj, "wait");
        readExprs(waitMap.get("sensitivity"), wait.getSensitivity());
        if (waitMap.get("until") != null)
          wait.setCondition(readExpr(waitMap.get("until")));
      }
      return wait;
    }
    if (map.containsKey("call"))
      return new ProcedureCall(requireString(map, "call", "call"));
    throw new DesignFormatException("Unknown statement: " + map);
  }

  static Expr readExpr(Object obj) throws DesignFormatException {
    if (obj == null)
      throw new DesignFormatException("Missing expression");
    if (obj instanceof Map) {
      Map<String, Object> map = asMap(obj, "expression");
      if (map.containsKey("const"))
        return new Constant(String.valueOf(map.get("const")));
      if (map.containsKey("op")) {
        String op = String.valueOf(map.get("op"));
        List<Object> args = asList(map.get("args"), "operator arguments");
        if (args.size() == 1)
          return new UnaryExpr(op, readExpr(args.get(0)));
        if (args.size() == 2)
          return new BinaryExpr(readExpr(args.get(0)), op, readExpr(args.get(1)));
        throw new DesignFormatException("Operator '" + op + "' needs one or two arguments, got " + args.size());
      }
      if (map.containsKey("call")) {
        String name = requireString(map, "call", "function call");
        Object standardObj = map.get("standard");
        boolean standard = standardObj == null ? name.startsWith("$") : Boolean.TRUE.equals(standardObj);
        FunctionCall call = new FunctionCall(name, standard);
        for (Object argObj : asList(map.get("args"), "call arguments"))
          call.getArguments().add(readExpr(argObj));
        return call;
      }
      throw new DesignFormatException("Unknown expression: " + map);
    }
    if (obj instanceof List)
      throw new DesignFormatException("Unexpected list in expression: " + obj);
    String text = String.valueOf(obj);
    if (obj instanceof String && NAME.matcher(text).matches())
      return new Identifier(text);
    return new Constant(text);
  }

  private static String typeOf(Map<String, Object> map) {
    Object type = map.get("type");
    return type == null ? null : String.valueOf(type);
  }

  private static Expr initOf(Map<String, Object> map) throws DesignFormatException {
    Object init = map.get("init");
    return init == null ? null : readExpr(init);
  }

  private static String requireString(Map<String, Object> map, String key, String what) throws DesignFormatException {
    Object value = map.get(key);
    if (value == null)
      throw new DesignFormatException("Missing '" + key + "' of " + what + ": " + map);
    return String.valueOf(value);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object obj, String what) throws DesignFormatException {
    if (!(obj instanceof Map))
      throw new DesignFormatException("Expected a mapping for " + what + ", got " + obj);
    return (Map<String, Object>)obj;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> asList(Object obj, String what) throws DesignFormatException {
    if (obj == null)
      return List.of();
    if (!(obj instanceof List))
      throw new DesignFormatException("Expected a list for " + what + ", got " + obj);
    return (List<Object>)obj;
  }
}
