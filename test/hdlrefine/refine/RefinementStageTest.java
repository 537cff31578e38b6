package hdlrefine.refine;

import hdlrefine.HdlRefine;
import hdlrefine.TestDesignBuilder;
import hdlrefine.design.Design;
import hdlrefine.refine.RefinementContext.Phase;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RefinementStageTest {

  @Test
  void testStagesFormAChain() {
    List<RefinementStage> stages = HdlRefine.stages();
    Assertions.assertEquals(Phase.RESOLVED, stages.get(0).requires());
    for (int i = 0; i + 1 < stages.size(); ++i)
      Assertions.assertEquals(stages.get(i).produces(), stages.get(i + 1).requires(), stages.get(i + 1).getClass().getSimpleName());
    Assertions.assertEquals(Phase.MATERIALIZED, stages.get(stages.size() - 1).produces());
    Assertions.assertEquals(Phase.values().length - 1, stages.size());
  }

  @Test
  void testStageOutOfOrderIsRejected() {
    Design design = TestDesignBuilder.parse(TestDesignBuilder.CONE_READ);
    RefinementContext ctx = new HdlRefine().prepare(design);
    Assertions.assertThrows(IllegalStateException.class, () -> new ConeGenerator().run(ctx));
    Assertions.assertEquals(Phase.RESOLVED, ctx.getPhase());
    Assertions.assertThrows(IllegalStateException.class, ctx::getGraph);
  }

  @Test
  void testStageRunsOnce() {
    Design design = TestDesignBuilder.parse(TestDesignBuilder.CONE_READ);
    RefinementContext ctx = TestDesignBuilder.runUntil(design, Phase.CLASSIFIED);
    Assertions.assertThrows(IllegalStateException.class, ctx::recollectReferences);
    Assertions.assertThrows(IllegalStateException.class, () -> ctx.advance(Phase.RESOLVED, Phase.CLASSIFIED));
    Assertions.assertEquals(Phase.CLASSIFIED, ctx.getPhase());
  }
}
