package hdlrefine.design;

import java.util.List;

/** Instance of another module inside a module body. */
public class Instance extends Node {
  private final String name;
  private final String moduleName;
  private Module module = null;
  private final NodeList<PortBinding> bindings = new NodeList<>(this, PortBinding.class);

  public Instance(String name, String moduleName) {
    this.name = name;
    this.moduleName = moduleName;
  }

  public String getName() { return name; }
  public String getModuleName() { return moduleName; }
  /** @return the instantiated module, or null if it is not part of the design */
  public Module getModule() { return module; }
  public NodeList<PortBinding> getBindings() { return bindings; }

  public void setModule(Module module) { this.module = module; }

  @Override
  public List<Node> getChildren() {
    return childList(bindings);
  }

  @Override
  public Instance copy() {
    Instance ret = new Instance(name, moduleName);
    ret.module = module;
    ret.bindings.addCopies(bindings);
    return ret;
  }
}
