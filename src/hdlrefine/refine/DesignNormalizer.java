package hdlrefine.refine;

import hdlrefine.design.Assign;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Identifier;
import hdlrefine.design.Module;
import hdlrefine.design.Node;
import hdlrefine.design.Parameter;
import hdlrefine.design.Port;
import hdlrefine.design.PortBinding;
import hdlrefine.design.Process;
import hdlrefine.design.Signal;
import hdlrefine.design.Variable;
import hdlrefine.semantics.Semantics;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Brings a design into the shape the refinement stages expect:
 * <ul>
 * <li>unreferenced signals become variables,</li>
 * <li>output ports are no direct targets of dataflow bindings or blocking writes,</li>
 * <li>variables and parameters are never written by non-blocking assignments.</li>
 * </ul>
 * Runs before classification and re-collects the references afterwards.
 */
public class DesignNormalizer {
  protected static final Logger logger = LogManager.getLogger();

  public static final String OUTPUT_PORT_WARNING = "Found at least one output port of a non-top module assigned by a continuous "
                                                   + "or blocking assignment. It is now written by a process. This could lead to a "
                                                   + "non-equivalent design.";
  public static final String PARAMETER_WARNING = "Found at least one procedure parameter assigned through a non-blocking assignment. "
                                                 + "The assignment is translated as blocking. This could lead to a non-equivalent design.";
  public static final String VARIABLE_WARNING = "Found at least one variable assigned through a non-blocking assignment. "
                                                + "The assignment is translated as blocking. This could lead to a non-equivalent design.";

  private DesignNormalizer() {}

  public static void normalize(RefinementContext ctx) {
    ctx.requirePhase(RefinementContext.Phase.RESOLVED);
    int unreferenced = fixUnreferenced(ctx);
    int ports = fixOutputPorts(ctx);
    int downgraded = downgradeNonBlocking(ctx);
    ctx.recollectReferences();
    logger.debug("Normalized design: {} unreferenced signals, {} output ports, {} non-blocking writes downgraded", unreferenced,
                 ports, downgraded);
    ctx.getWarnings().report();
  }

  private static int fixUnreferenced(RefinementContext ctx) {
    int count = 0;
    for (DataDeclaration decl : new ArrayList<>(ctx.getRefs().declarations())) {
      if (!(decl instanceof Signal) || !ctx.getRefs().get(decl).isEmpty() || decl.isDetached())
        continue;
      decl.replace(new Variable(decl.getName(), decl.getType(), decl.setInitialValue(null)));
      logger.trace("Unreferenced signal {} is now a variable", decl.getName());
      ++count;
    }
    return count;
  }

  private static int fixOutputPorts(RefinementContext ctx) {
    List<Module> topModules = ctx.getDesign().findTopModules();
    int count = 0;
    for (DataDeclaration decl : new ArrayList<>(ctx.getRefs().declarations())) {
      if (!(decl instanceof Port) || !((Port)decl).isOutput())
        continue;
      Port port = (Port)decl;
      List<Identifier> writes = new ArrayList<>();
      List<Identifier> nonBlockingWrites = new ArrayList<>();
      List<Identifier> reads = new ArrayList<>();
      for (Node use : ctx.getRefs().get(port)) {
        if (use instanceof PortBinding)
          continue;
        Identifier id = (Identifier)use;
        if (!Semantics.isInLeftHandSide(id)) {
          reads.add(id);
          continue;
        }
        Assign assign = id.getNearestParent(Assign.class);
        if (assign.isContinuous() || !assign.isNonBlocking())
          writes.add(id);
        else
          nonBlockingWrites.add(id);
      }
      // Written by non-blocking assignments only: reads see the deferred value anyway.
      if (writes.isEmpty())
        continue;
      ++count;

      Module module = Semantics.requireModule(port);
      if (reads.isEmpty()) {
        boolean inTop = topModules.contains(module);
        for (Identifier write : writes) {
          Assign assign = write.getNearestParent(Assign.class);
          if (!inTop)
            ctx.getWarnings().add(OUTPUT_PORT_WARNING, module.getName() + "." + port.getName());
          assign.setNonBlocking(true);
          if (assign.isContinuous())
            toProcess(ctx, module, assign, port);
        }
      } else {
        Signal sig = new Signal(ctx.getNames().freshName(port.getName(), "_out_sig"), port.getType(), port.copyInitialValue());
        Semantics.addDeclarationAfter(port, sig);
        for (List<Identifier> uses : List.of(writes, reads, nonBlockingWrites)) {
          for (Identifier use : uses)
            use.redirect(sig);
        }
        Process update = new Process(ctx.getNames().freshName(port.getName() + "_update_process"));
        update.getSensitivity().add(new Identifier(sig));
        update.getBody().add(new Assign(new Identifier(port), new Identifier(sig), true));
        module.getProcesses().add(update);
        logger.trace("Output port {} is now driven by {}", port.getName(), sig.getName());
      }
    }
    return count;
  }

  /** Moves a dataflow binding into a process sensitive to the ports and signals it reads. */
  private static void toProcess(RefinementContext ctx, Module module, Assign binding, Port port) {
    Process proc = new Process(ctx.getNames().freshName(port.getName() + "_assign_process"));
    List<Identifier> read = new ArrayList<>(Semantics.collectIdentifiers(binding.getValue()));
    if (binding.getDelay() != null)
      read.addAll(Semantics.collectIdentifiers(binding.getDelay()));
    for (Identifier id : read) {
      DataDeclaration source = Semantics.lookup(id);
      if (source instanceof Port || source instanceof Signal)
        Semantics.addUniqueByName(proc.getSensitivity(), new Identifier(source));
    }
    binding.detach();
    proc.getBody().add(binding);
    if (proc.getSensitivity().isEmpty()) {
      // Constant value: a one-shot process.
      Process initial = new Process(proc.getName(), Process.Flavour.INITIAL);
      initial.getBody().takeAll(proc.getBody());
      proc = initial;
    }
    module.getProcesses().add(proc);
  }

  private static int downgradeNonBlocking(RefinementContext ctx) {
    int count = 0;
    for (DataDeclaration decl : ctx.getRefs().declarations()) {
      if (!(decl instanceof Variable) && !(decl instanceof Parameter))
        continue;
      for (Node use : ctx.getRefs().get(decl)) {
        if (!Semantics.isInLeftHandSide(use))
          continue;
        Assign assign = use.getNearestParent(Assign.class);
        if (!assign.isNonBlocking())
          continue;
        assign.setNonBlocking(false);
        ctx.getWarnings().add(decl instanceof Parameter ? PARAMETER_WARNING : VARIABLE_WARNING, decl.getName());
        ++count;
      }
    }
    return count;
  }
}
