package hdlrefine.analysis;

import static hdlrefine.TestDesignBuilder.decl;

import hdlrefine.TestDesignBuilder;
import hdlrefine.design.Assign;
import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Design;
import hdlrefine.design.Node;
import hdlrefine.design.PortBinding;
import hdlrefine.refine.RefinementContext;
import hdlrefine.refine.RefinementContext.Phase;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReferenceClassifierTest {

  Design design;
  RefinementContext ctx;

  @BeforeEach
  void setUp() throws Exception {
    design = TestDesignBuilder.parse(TestDesignBuilder.ROLES);
    ctx = TestDesignBuilder.runUntil(design, TestDesignBuilder.rawConfig(), Phase.CLASSIFIED);
  }

  Set<ReferenceRole> rolesOf(String module, String name) {
    UsageInfo info = ctx.getUsage().get(decl(design, module, name));
    Set<ReferenceRole> ret = EnumSet.noneOf(ReferenceRole.class);
    for (ReferenceRole role : ReferenceRole.values()) {
      if (info.has(role))
        ret.add(role);
    }
    return ret;
  }

  @Test
  void testRolesByPriority() {
    Assertions.assertEquals(EnumSet.of(ReferenceRole.PORT_BINDING, ReferenceRole.CONTINUOUS_READ), rolesOf("sub", "xi"));
    Assertions.assertEquals(EnumSet.of(ReferenceRole.PORT_BINDING, ReferenceRole.CONTINUOUS_WRITE), rolesOf("sub", "yo"));
    Assertions.assertEquals(EnumSet.of(ReferenceRole.SENSITIVITY), rolesOf("top", "clk"));
    Assertions.assertEquals(EnumSet.of(ReferenceRole.WAIT, ReferenceRole.BIND_ARGUMENT), rolesOf("top", "w"));
    Assertions.assertEquals(EnumSet.of(ReferenceRole.WAIT), rolesOf("top", "s"));
    Assertions.assertEquals(EnumSet.of(ReferenceRole.CONTINUOUS_READ, ReferenceRole.BIND_ARGUMENT), rolesOf("top", "a"));
    Assertions.assertEquals(EnumSet.of(ReferenceRole.BLOCKING_WRITE, ReferenceRole.PLAIN_READ, ReferenceRole.BIND_ARGUMENT),
                            rolesOf("top", "b"));
    Assertions.assertEquals(EnumSet.of(ReferenceRole.NON_BLOCKING_WRITE), rolesOf("top", "nb"));
    Assertions.assertEquals(EnumSet.of(ReferenceRole.CONTINUOUS_WRITE, ReferenceRole.PLAIN_READ), rolesOf("top", "c"));
  }

  @Test
  void testPortBindingIsUseOfFormalPort() {
    DataDeclaration xi = decl(design, "sub", "xi");
    Node binding = ctx.getUsage().get(xi).get(ReferenceRole.PORT_BINDING).iterator().next();
    Assertions.assertTrue(binding instanceof PortBinding);
    Assertions.assertEquals("xi", ((PortBinding)binding).getPortName());
  }

  @Test
  void testNonBlockingMarkerIsConsumed() {
    DataDeclaration nb = decl(design, "top", "nb");
    Node write = ctx.getUsage().get(nb).get(ReferenceRole.NON_BLOCKING_WRITE).iterator().next();
    Assertions.assertFalse(write.getNearestParent(Assign.class).isNonBlocking());

    // A second pass keeps every use in the bucket it already has.
    Assertions.assertEquals(0, ReferenceClassifier.classify(ctx.getRefs(), ctx.getUsage(), true));
    Assertions.assertEquals(0, ReferenceClassifier.classify(ctx.getRefs(), ctx.getUsage(), false));
    Assertions.assertEquals(ReferenceRole.NON_BLOCKING_WRITE, ctx.getUsage().get(nb).roleOf(write));
    Assertions.assertEquals(ReferenceRole.BLOCKING_WRITE, ReferenceClassifier.roleOf(write));
  }

  @Test
  void testVariablesAreNotClassified() {
    Design vars = TestDesignBuilder.parse("modules:\n"
                                          + "  - name: top\n"
                                          + "    variables:\n"
                                          + "      - {name: v}\n"
                                          + "    processes:\n"
                                          + "      - name: p\n"
                                          + "        body:\n"
                                          + "          - {assign: v, value: 0}\n");
    RefinementContext varCtx = TestDesignBuilder.runUntil(vars, TestDesignBuilder.rawConfig(), Phase.CLASSIFIED);
    Assertions.assertFalse(ReferenceClassifier.isClassified(decl(vars, "top", "v")));
    Assertions.assertFalse(varCtx.getUsage().contains(decl(vars, "top", "v")));
  }

  @Test
  void testClassifyOutOfOrderFails() {
    Assertions.assertThrows(IllegalStateException.class, () -> new ReferenceClassifier().run(ctx));
  }
}
