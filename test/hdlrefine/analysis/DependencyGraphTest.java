package hdlrefine.analysis;

import hdlrefine.design.Signal;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DependencyGraphTest {
  final Signal a = new Signal("a", null, null);
  final Signal b = new Signal("b", null, null);
  final Signal c = new Signal("c", null, null);
  final Signal d = new Signal("d", null, null);

  @Test
  void testLeafDrivers() {
    DependencyGraph graph = new DependencyGraph();
    graph.addEdge(d, c);
    graph.addEdge(d, b);
    graph.addEdge(c, a);
    graph.addEdge(b, a);
    Assertions.assertEquals(Set.of(a), graph.collectLeafDrivers(d));
    Assertions.assertEquals(Set.of(a), graph.collectLeafDrivers(c));
    Assertions.assertTrue(graph.collectLeafDrivers(a).isEmpty());
  }

  @Test
  void testLeafDriversKeepDiscoveryOrder() {
    DependencyGraph graph = new DependencyGraph();
    graph.addEdge(d, c);
    graph.addEdge(d, b);
    graph.addEdge(d, a);
    Assertions.assertEquals(List.of(c, b, a), List.copyOf(graph.collectLeafDrivers(d)));
  }

  @Test
  void testConeBackedDriversAreNoLeaves() {
    DependencyGraph graph = new DependencyGraph();
    graph.addEdge(d, c);
    graph.addEdge(d, b);
    graph.addEdge(b, a);
    Assertions.assertEquals(Set.of(c, a), graph.collectLeafDrivers(d));
    Assertions.assertEquals(Set.of(a), graph.collectLeafDrivers(d, Set.of(b, c)));
    Assertions.assertTrue(graph.collectLeafDrivers(b, Set.of(a)).isEmpty());
  }

  @Test
  void testPromoteDrivers() {
    DependencyGraph graph = new DependencyGraph();
    graph.addEdge(c, b);
    graph.addEdge(b, a);
    graph.addEdge(b, c);
    graph.promoteDrivers(c, b);
    Assertions.assertEquals(Set.of(b, a), graph.getDrivers(c));
    Assertions.assertTrue(graph.getReaders(a).contains(c));
  }

  @Test
  void testSelfEdgeIsRejected() {
    DependencyGraph graph = new DependencyGraph();
    Assertions.assertThrows(IllegalArgumentException.class, () -> graph.addEdge(a, a));
    Assertions.assertFalse(graph.contains(a));
  }

  @Test
  void testUnknownNodeHasNoNeighbours() {
    DependencyGraph graph = new DependencyGraph();
    graph.addNode(a);
    Assertions.assertTrue(graph.getDrivers(b).isEmpty());
    Assertions.assertTrue(graph.getReaders(a).isEmpty());
    Assertions.assertEquals(0, graph.edgeCount());
  }
}
