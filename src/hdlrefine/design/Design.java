package hdlrefine.design;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Root of the design graph. */
public class Design extends Node {
  private final NodeList<Module> modules = new NodeList<>(this, Module.class);

  public NodeList<Module> getModules() { return modules; }

  public Optional<Module> findModule(String name) {
    return modules.stream().filter(module -> module.getName().equals(name)).findFirst();
  }

  /** @return the modules that are not instantiated by any module of the design, in design order */
  public List<Module> findTopModules() {
    var instantiated = modules.stream()
                           .flatMap(module -> module.getInstances().stream())
                           .map(Instance::getModuleName)
                           .collect(Collectors.toSet());
    return modules.stream().filter(module -> !instantiated.contains(module.getName())).collect(Collectors.toList());
  }

  @Override
  public List<Node> getChildren() {
    return childList(modules);
  }

  @Override
  public Design copy() {
    Design ret = new Design();
    ret.modules.addCopies(modules);
    return ret;
  }
}
