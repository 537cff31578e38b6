package hdlrefine.semantics;

import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Declaration;
import hdlrefine.design.Design;
import hdlrefine.design.DesignException;
import hdlrefine.design.Identifier;
import hdlrefine.design.Instance;
import hdlrefine.design.Module;
import hdlrefine.design.Node;
import hdlrefine.design.PortBinding;
import hdlrefine.design.Procedure;
import hdlrefine.design.ProcedureCall;
import hdlrefine.design.Process;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Binds names to declarations: identifiers to data declarations of their scope,
 * procedure calls to procedures, instances to modules and port bindings to formal ports.
 * Lookup goes from the innermost scope (process or procedure) to the module.
 */
public class DeclarationResolver {
  protected static final Logger logger = LogManager.getLogger();

  private DeclarationResolver() {}

  /**
   * Resolves every name of the design. Already resolved links are left unchanged.
   * @throws DesignException if a name cannot be resolved
   */
  public static void resolve(Design design) {
    for (Module module : design.getModules()) {
      for (Instance instance : module.getInstances()) {
        if (instance.getModule() == null) {
          Module target = design.findModule(instance.getModuleName()).orElse(null);
          if (target == null) {
            // Black box: bindings stay unresolved and keep their actual expressions.
            logger.warn("Module '{}' of instance '{}' is not part of the design", instance.getModuleName(), instance.getName());
          }
          instance.setModule(target);
        }
      }
    }
    design.streamSubtree().forEach(node -> {
      if (node instanceof Identifier)
        resolveIdentifier((Identifier)node);
      else if (node instanceof ProcedureCall)
        resolveCall((ProcedureCall)node);
      else if (node instanceof PortBinding)
        resolveBinding((PortBinding)node);
    });
  }

  /** Looks a data declaration up from the scope of <code>context</code>. */
  public static Optional<DataDeclaration> lookup(Node context, String name) {
    for (Node cur = context.getParent(); cur != null; cur = cur.getParent()) {
      Optional<DataDeclaration> found = Optional.empty();
      if (cur instanceof Process)
        found = ((Process)cur).getLocals().stream().filter(var -> var.getName().equals(name)).map(DataDeclaration.class::cast).findFirst();
      else if (cur instanceof Procedure) {
        Procedure proc = (Procedure)cur;
        found = proc.getParameters().stream().filter(par -> par.getName().equals(name)).map(DataDeclaration.class::cast).findFirst();
        if (found.isEmpty())
          found = proc.getLocals().stream().filter(var -> var.getName().equals(name)).map(DataDeclaration.class::cast).findFirst();
      } else if (cur instanceof Module) {
        Optional<Declaration> decl = ((Module)cur).findDeclaration(name);
        return decl.filter(DataDeclaration.class::isInstance).map(DataDeclaration.class::cast);
      }
      if (found.isPresent())
        return found;
    }
    return Optional.empty();
  }

  private static void resolveIdentifier(Identifier id) {
    if (id.getDeclaration() != null)
      return;
    DataDeclaration decl = lookup(id, id.getName()).orElseThrow(() -> new DesignException("Unknown name '" + id.getName() + "'", id));
    id.setDeclaration(decl);
  }

  private static void resolveCall(ProcedureCall call) {
    if (call.getProcedure() != null)
      return;
    Module module = Semantics.requireModule(call);
    Procedure proc = module.streamProcedures()
                         .filter(candidate -> candidate.getName().equals(call.getName()))
                         .findFirst()
                         .orElseThrow(() -> new DesignException("Unknown procedure '" + call.getName() + "'", call));
    call.setProcedure(proc);
  }

  private static void resolveBinding(PortBinding binding) {
    if (binding.getPort() != null)
      return;
    Instance instance = binding.getNearestParent(Instance.class);
    if (instance == null || instance.getModule() == null)
      return;
    binding.setPort(instance.getModule().findPort(binding.getPortName()).orElseThrow(
        () -> new DesignException("Module '" + instance.getModuleName() + "' has no port '" + binding.getPortName() + "'", binding)));
  }
}
