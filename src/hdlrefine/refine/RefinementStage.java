package hdlrefine.refine;

import hdlrefine.refine.RefinementContext.Phase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One step of the refinement pipeline.
 * A stage runs on a context in phase {@link #requires()} and leaves it in phase {@link #produces()}.
 */
public abstract class RefinementStage {
  protected static final Logger logger = LogManager.getLogger();

  /** @return the phase the context must be in */
  public abstract Phase requires();

  /** @return the phase the context is in afterwards */
  public abstract Phase produces();

  /**
   * Runs the stage and reports its warnings.
   * @throws IllegalStateException if the stage runs out of order
   */
  public final void run(RefinementContext ctx) {
    ctx.requirePhase(requires());
    logger.debug("Running {}", getClass().getSimpleName());
    apply(ctx);
    ctx.advance(requires(), produces());
    ctx.getWarnings().report();
  }

  protected abstract void apply(RefinementContext ctx);
}
