package hdlrefine.design;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Design unit: ports plus a body of declarations, dataflow bindings, processes and instances.
 */
public class Module extends Node {
  private final String name;
  private final NodeList<Port> ports = new NodeList<>(this, Port.class);
  private final NodeList<Declaration> declarations = new NodeList<>(this, Declaration.class);
  private final NodeList<Assign> continuous = new NodeList<>(this, Assign.class);
  private final NodeList<Process> processes = new NodeList<>(this, Process.class);
  private final NodeList<Instance> instances = new NodeList<>(this, Instance.class);

  public Module(String name) { this.name = name; }

  public String getName() { return name; }
  public NodeList<Port> getPorts() { return ports; }
  /** Signals, variables and procedures of the module body. */
  public NodeList<Declaration> getDeclarations() { return declarations; }
  /** The always-active action list: every entry is a dataflow binding. */
  public NodeList<Assign> getContinuous() { return continuous; }
  public NodeList<Process> getProcesses() { return processes; }
  public NodeList<Instance> getInstances() { return instances; }

  /** Looks up a port or body declaration by name. */
  public Optional<Declaration> findDeclaration(String declName) {
    return Stream.concat(ports.stream(), declarations.stream()).filter(decl -> decl.getName().equals(declName)).findFirst();
  }

  public Optional<Port> findPort(String portName) {
    return ports.stream().filter(port -> port.getName().equals(portName)).findFirst();
  }

  public Optional<Process> findProcess(String processName) {
    return processes.stream().filter(process -> process.getName().equals(processName)).findFirst();
  }

  public Stream<Procedure> streamProcedures() {
    return declarations.stream().filter(Procedure.class::isInstance).map(Procedure.class::cast);
  }

  @Override
  public List<Node> getChildren() {
    return childList(ports, declarations, continuous, processes, instances);
  }

  @Override
  public Module copy() {
    Module ret = new Module(name);
    ret.ports.addCopies(ports);
    ret.declarations.addCopies(declarations);
    ret.continuous.addCopies(continuous);
    ret.processes.addCopies(processes);
    ret.instances.addCopies(instances);
    return ret;
  }
}
