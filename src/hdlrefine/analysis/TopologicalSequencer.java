package hdlrefine.analysis;

import hdlrefine.design.DataDeclaration;
import hdlrefine.design.DesignException;
import hdlrefine.refine.RefinementContext;
import hdlrefine.refine.RefinementContext.Phase;
import hdlrefine.refine.RefinementStage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Orders the dependency graph leaves first. Nodes that become ready at the same time keep declaration order.
 */
public class TopologicalSequencer extends RefinementStage {
  @Override
  public Phase requires() {
    return Phase.GRAPH_BUILT;
  }
  @Override
  public Phase produces() {
    return Phase.SEQUENCED;
  }

  @Override
  protected void apply(RefinementContext ctx) {
    List<DataDeclaration> declOrder = new ArrayList<>(ctx.getRefs().declarations());
    for (DataDeclaration node : ctx.getGraph().getNodes()) {
      if (!declOrder.contains(node))
        declOrder.add(node);
    }
    ctx.setSequence(sort(ctx.getGraph(), declOrder));
    logger.debug("Sequence: {}", ctx.getSequence().stream().map(DataDeclaration::getName).collect(Collectors.joining(", ")));
  }

  /**
   * Sorts the graph.
   * @param declOrder tie-break order, must contain every node of the graph
   * @throws DesignException naming the declarations on a cycle if the graph is cyclic
   */
  public static List<DataDeclaration> sort(DependencyGraph graph, List<DataDeclaration> declOrder) {
    HashMap<DataDeclaration, Integer> orderIndex = new HashMap<>();
    for (int i = 0; i < declOrder.size(); ++i)
      orderIndex.putIfAbsent(declOrder.get(i), i);
    for (DataDeclaration node : graph.getNodes()) {
      if (!orderIndex.containsKey(node))
        throw new IllegalArgumentException("Declaration order lacks " + node.getName());
    }

    HashMap<DataDeclaration, Integer> pendingDrivers = new HashMap<>();
    PriorityQueue<DataDeclaration> ready = new PriorityQueue<>(Comparator.comparingInt((DataDeclaration node) -> orderIndex.get(node)));
    for (DataDeclaration node : graph.getNodes()) {
      int count = graph.getDrivers(node).size();
      pendingDrivers.put(node, count);
      if (count == 0)
        ready.add(node);
    }

    List<DataDeclaration> ret = new ArrayList<>();
    while (!ready.isEmpty()) {
      DataDeclaration node = ready.poll();
      ret.add(node);
      for (DataDeclaration reader : graph.getReaders(node)) {
        int remaining = pendingDrivers.merge(reader, -1, Integer::sum);
        if (remaining == 0)
          ready.add(reader);
      }
    }

    if (ret.size() != graph.getNodes().size()) {
      Set<DataDeclaration> residual = graph.getNodes().stream().filter(node -> pendingDrivers.get(node) > 0).collect(Collectors.toSet());
      List<DataDeclaration> cycle = findCycle(graph, residual);
      throw new DesignException("Dependency cycle between dataflow bindings: " +
                                    cycle.stream().map(DataDeclaration::getName).collect(Collectors.joining(" -> ")),
                                cycle.get(0));
    }
    return ret;
  }

  /** Walks drivers inside the residual set until a node repeats. Every residual node lies on or leads to a cycle. */
  private static List<DataDeclaration> findCycle(DependencyGraph graph, Set<DataDeclaration> residual) {
    DataDeclaration start = graph.getNodes().stream().filter(residual::contains).findFirst().orElseThrow();
    LinkedHashSet<DataDeclaration> path = new LinkedHashSet<>();
    Set<DataDeclaration> seen = new HashSet<>();
    DataDeclaration cur = start;
    while (seen.add(cur)) {
      path.add(cur);
      cur = graph.getDrivers(cur).stream().filter(residual::contains).findFirst().orElseThrow();
    }
    List<DataDeclaration> pathList = new ArrayList<>(path);
    List<DataDeclaration> cycle = new ArrayList<>(pathList.subList(pathList.indexOf(cur), pathList.size()));
    cycle.add(cur);
    return cycle;
  }
}
