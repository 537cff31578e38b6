package hdlrefine;

import hdlrefine.analysis.DependencyGraphBuilder;
import hdlrefine.analysis.ReferenceClassifier;
import hdlrefine.analysis.TopologicalSequencer;
import hdlrefine.design.Design;
import hdlrefine.refine.BindingEraser;
import hdlrefine.refine.CallInserter;
import hdlrefine.refine.ConeGenerator;
import hdlrefine.refine.DesignChecks;
import hdlrefine.refine.DesignNormalizer;
import hdlrefine.refine.DualStorageMaterializer;
import hdlrefine.refine.RefinementContext;
import hdlrefine.refine.RefinementStage;
import hdlrefine.refine.SensitivityRewriter;
import hdlrefine.semantics.DeclarationResolver;
import hdlrefine.ui.RefineConfig;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point of the refinement: turns continuous, blocking and non-blocking assignments
 * into signals, variables and cone procedures. The design is modified in place.
 */
public class HdlRefine {
  protected static final Logger logger = LogManager.getLogger();

  private final RefineConfig cfg;

  public HdlRefine() { this(new RefineConfig()); }

  public HdlRefine(RefineConfig cfg) { this.cfg = cfg; }

  /** @return the stages of the refinement in execution order */
  public static List<RefinementStage> stages() {
    return List.of(new ReferenceClassifier(), new DependencyGraphBuilder(), new TopologicalSequencer(), new ConeGenerator(),
                   new CallInserter(), new SensitivityRewriter(), new BindingEraser(), new DualStorageMaterializer());
  }

  /**
   * Resolves names and creates the context without running any stage.
   */
  public RefinementContext prepare(Design design) {
    DeclarationResolver.resolve(design);
    RefinementContext ctx = new RefinementContext(design, cfg);
    if (cfg.check_original_design)
      DesignChecks.check(ctx);
    if (cfg.normalize)
      DesignNormalizer.normalize(ctx);
    return ctx;
  }

  /**
   * Runs the whole refinement.
   * @return the final context, holding the cones, leaf drivers and warnings
   * @throws hdlrefine.design.DesignException if the design violates a structural assumption
   */
  public RefinementContext refine(Design design) {
    RefinementContext ctx = prepare(design);
    for (RefinementStage stage : stages())
      stage.run(ctx);
    logger.info("Refinement done: {} cones, {} warning categories", ctx.getCones().size(), ctx.getWarnings().getMessages().size());
    return ctx;
  }
}
