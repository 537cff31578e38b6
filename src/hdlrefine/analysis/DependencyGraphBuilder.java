package hdlrefine.analysis;

import hdlrefine.design.Assign;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.DesignException;
import hdlrefine.design.FunctionCall;
import hdlrefine.design.Identifier;
import hdlrefine.design.Node;
import hdlrefine.design.Port;
import hdlrefine.design.Signal;
import hdlrefine.refine.RefinementContext;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.refine.RefinementStage;
import hdlrefine.semantics.Semantics;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds the {@link DependencyGraph} from the dataflow bindings of all classified declarations
 * and marks constant-driven declarations.
 */
public class DependencyGraphBuilder extends RefinementStage {
  @Override
  public Phase requires() {
    return Phase.CLASSIFIED;
  }
  @Override
  public Phase produces() {
    return Phase.GRAPH_BUILT;
  }

  @Override
  protected void apply(RefinementContext ctx) {
    DependencyGraph graph = build(ctx.getUsage());
    ctx.setGraph(graph);
    logger.debug("Dependency graph: {} nodes, {} edges, {} constant-driven", graph.getNodes().size(), graph.edgeCount(),
                 graph.getConstantDriven().size());
  }

  /**
   * Builds the graph. Declarations without any refinable driver are marked constant-driven on their UsageInfo.
   * Sources are classified as they were before any marking, so the result does not depend on declaration order.
   */
  public static DependencyGraph build(UsageMap usage) {
    DependencyGraph graph = new DependencyGraph();
    Map<DataDeclaration, StorageClass> classes = new HashMap<>();
    usage.asMap().forEach((decl, info) -> classes.put(decl, StorageClass.of(decl, info)));
    for (Map.Entry<DataDeclaration, UsageInfo> entry : new ArrayList<>(usage.asMap().entrySet())) {
      DataDeclaration decl = entry.getKey();
      UsageInfo info = entry.getValue();
      if (!info.hasContinuousWrite())
        continue;
      boolean onlyConstantDrivers = true;
      for (Node write : info.get(ReferenceRole.CONTINUOUS_WRITE)) {
        Assign binding = write.getNearestParent(Assign.class);
        if (binding == null)
          throw new DesignException("Cannot find the binding of a continuous write", write);
        if (binding.streamSubtree(FunctionCall.class).findAny().isPresent())
          onlyConstantDrivers = false;
        for (Identifier id : Semantics.collectIdentifiers(binding)) {
          DataDeclaration source = Semantics.lookup(id);
          if (!(source instanceof Port) && !(source instanceof Signal)) {
            // Variables and parameters are no graph nodes but still make the value non-constant.
            onlyConstantDrivers = false;
            continue;
          }
          if (source instanceof Signal) {
            StorageClass sourceClass = classes.get(source);
            if (sourceClass == null)
              sourceClass = StorageClass.of(source, usage.get(source));
            if (!sourceClass.signal() && !sourceClass.variable())
              continue;
          }
          if (source == decl)
            continue;
          onlyConstantDrivers = false;
          graph.addEdge(decl, source);
        }
      }
      if (onlyConstantDrivers) {
        logger.trace("{} is constant-driven", decl.getName());
        info.markConstantDriven();
        graph.markConstantDriven(decl);
      } else
        graph.addNode(decl);
    }
    return graph;
  }
}
