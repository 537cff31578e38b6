package hdlrefine.refine;

import hdlrefine.analysis.DependencyGraph;
import hdlrefine.analysis.UsageMap;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Design;
import hdlrefine.design.Node;
import hdlrefine.design.Procedure;
import hdlrefine.semantics.NameTable;
import hdlrefine.semantics.ReferenceMap;
import hdlrefine.ui.RefineConfig;
import hdlrefine.util.WarningList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working state shared by the refinement stages.
 * The phase records the last completed stage; every stage checks it before running.
 */
public class RefinementContext {
  public enum Phase {
    RESOLVED,
    CLASSIFIED,
    GRAPH_BUILT,
    SEQUENCED,
    CONES_GENERATED,
    CALLS_INSERTED,
    SENSITIVITIES_REWRITTEN,
    BINDINGS_ERASED,
    MATERIALIZED
  }

  private final Design design;
  private final RefineConfig config;
  private final NameTable names;
  private final WarningList warnings = new WarningList();

  private ReferenceMap refs;
  private final UsageMap usage = new UsageMap();
  private DependencyGraph graph = null;
  private List<DataDeclaration> sequence = new ArrayList<>();
  private final LinkedHashMap<DataDeclaration, Cone> cones = new LinkedHashMap<>();
  /** Procedures already called per triggering statement or enclosing cone. */
  private final HashMap<Node, Set<Procedure>> calls = new HashMap<>();
  private final LinkedHashMap<DataDeclaration, Set<DataDeclaration>> leafDrivers = new LinkedHashMap<>();

  private Phase phase = Phase.RESOLVED;

  /**
   * @param design a design with all names resolved
   */
  public RefinementContext(Design design, RefineConfig config) {
    this.design = design;
    this.config = config;
    this.names = NameTable.of(design);
    this.refs = ReferenceMap.collect(design);
  }

  public Design getDesign() { return design; }
  public RefineConfig getConfig() { return config; }
  public NameTable getNames() { return names; }
  public WarningList getWarnings() { return warnings; }
  public ReferenceMap getRefs() { return refs; }
  public UsageMap getUsage() { return usage; }
  public Phase getPhase() { return phase; }

  /** Re-collects the reference map after structural rewrites that happen before classification. */
  public void recollectReferences() {
    if (phase != Phase.RESOLVED)
      throw new IllegalStateException("References can only be recollected before classification");
    refs = ReferenceMap.collect(design);
  }

  public DependencyGraph getGraph() {
    if (graph == null)
      throw new IllegalStateException("The dependency graph has not been built yet");
    return graph;
  }
  public void setGraph(DependencyGraph graph) { this.graph = graph; }

  /** @return the declarations of the dependency graph, leaves first */
  public List<DataDeclaration> getSequence() { return Collections.unmodifiableList(sequence); }
  public void setSequence(List<DataDeclaration> sequence) { this.sequence = new ArrayList<>(sequence); }

  /** @return the cones by declaration, in creation order */
  public Map<DataDeclaration, Cone> getCones() { return cones; }

  public Cone getCone(DataDeclaration decl) { return cones.get(decl); }

  /** @return the cone that is the given procedure, or null */
  public Cone findCone(Procedure proc) {
    if (proc == null)
      return null;
    return cones.values().stream().filter(cone -> cone.getProcedure() == proc).findFirst().orElse(null);
  }

  /**
   * Records that <code>where</code> (a statement or an enclosing cone) calls <code>proc</code>.
   * @return true iff the call was not recorded before
   */
  public boolean recordCall(Node where, Procedure proc) {
    return calls.computeIfAbsent(where, key -> new HashSet<>()).add(proc);
  }

  public boolean hasCall(Node where, Procedure proc) {
    var set = calls.get(where);
    return set != null && set.contains(proc);
  }

  /** @return the leaf drivers of a cone-backed declaration (empty if none were computed) */
  public Set<DataDeclaration> getLeafDrivers(DataDeclaration decl) {
    return leafDrivers.getOrDefault(decl, Set.of());
  }
  public void setLeafDrivers(DataDeclaration decl, Set<DataDeclaration> leaves) {
    leafDrivers.put(decl, Collections.unmodifiableSet(new LinkedHashSet<>(leaves)));
  }

  /**
   * Moves on to the next phase.
   * @throws IllegalStateException if the current phase is not <code>expected</code>
   */
  void advance(Phase expected, Phase next) {
    if (phase != expected)
      throw new IllegalStateException("Stage producing " + next + " requires phase " + expected + ", current phase is " + phase);
    phase = next;
  }

  /** @throws IllegalStateException if the current phase is not <code>expected</code> */
  public void requirePhase(Phase expected) {
    if (phase != expected)
      throw new IllegalStateException("Expected phase " + expected + ", current phase is " + phase);
  }
}
