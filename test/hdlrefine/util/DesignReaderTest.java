package hdlrefine.util;

import hdlrefine.TestDesignBuilder;
import hdlrefine.design.Assign;
import hdlrefine.design.BinaryExpr;
import hdlrefine.design.Constant;
import hdlrefine.design.Design;
import hdlrefine.design.FunctionCall;
import hdlrefine.design.Identifier;
import hdlrefine.design.IfStmt;
import hdlrefine.design.Module;
import hdlrefine.design.Port;
import hdlrefine.design.Procedure;
import hdlrefine.design.Process;
import hdlrefine.design.UnaryExpr;
import hdlrefine.design.WaitStmt;
import java.io.InputStream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DesignReaderTest {
  static final String STATEMENTS =
      "modules:\n"
      + "  - name: top\n"
      + "    ports:\n"
      + "      - {name: a, dir: in, type: 'logic [3:0]'}\n"
      + "      - {name: o, dir: inout}\n"
      + "    variables:\n"
      + "      - {name: st, init: {const: IDLE}}\n"
      + "    procedures:\n"
      + "      - name: t\n"
      + "        cone: true\n"
      + "        body:\n"
      + "          - {call: t}\n"
      + "    processes:\n"
      + "      - name: p\n"
      + "        flavour: initial\n"
      + "        body:\n"
      + "          - if: {op: '==', args: [a, 0]}\n"
      + "            then:\n"
      + "              - {assign: st, value: {op: '~', args: [a]}}\n"
      + "            elif:\n"
      + "              - {cond: {op: '==', args: [a, 1]}, then: [{assign: st, value: {call: $random}}]}\n"
      + "            else:\n"
      + "              - {assign: st, value: {call: pick, args: [a, 2]}, delay: 5}\n"
      + "          - {wait: {sensitivity: [a], until: st}}\n"
      + "          - {wait: }\n";

  @Test
  void testDeclarations() throws Exception {
    Design design = DesignReader.read(STATEMENTS);
    Module top = TestDesignBuilder.module(design, "top");
    Assertions.assertEquals("logic [3:0]", top.getPorts().get(0).getType());
    Assertions.assertEquals(Port.Direction.INOUT, top.getPorts().get(1).getDirection());
    Assertions.assertNull(top.getPorts().get(1).getType());
    Constant init = (Constant)TestDesignBuilder.decl(design, "top", "st").getInitialValue();
    Assertions.assertEquals("IDLE", init.getValue());
    Procedure cone = TestDesignBuilder.procedure(design, "top", "t");
    Assertions.assertTrue(cone.isCone());
    Assertions.assertEquals(Process.Flavour.INITIAL, TestDesignBuilder.process(design, "top", "p").getFlavour());
  }

  @Test
  void testStatements() throws Exception {
    Design design = DesignReader.read(STATEMENTS);
    Process proc = TestDesignBuilder.process(design, "top", "p");
    Assertions.assertEquals(3, proc.getBody().size());

    IfStmt ifStmt = (IfStmt)proc.getBody().get(0);
    Assertions.assertEquals(2, ifStmt.getAlts().size());
    Assertions.assertEquals(1, ifStmt.getDefaults().size());
    BinaryExpr cond = (BinaryExpr)ifStmt.getAlts().get(0).getCondition();
    Assertions.assertEquals("==", cond.getOp());
    Assertions.assertEquals("0", ((Constant)cond.getRhs()).getValue());

    Assign neg = (Assign)ifStmt.getAlts().get(0).getActions().get(0);
    Assertions.assertEquals("~", ((UnaryExpr)neg.getValue()).getOp());
    FunctionCall random = (FunctionCall)((Assign)ifStmt.getAlts().get(1).getActions().get(0)).getValue();
    Assertions.assertTrue(random.isStandard());
    Assign delayed = (Assign)ifStmt.getDefaults().get(0);
    FunctionCall pick = (FunctionCall)delayed.getValue();
    Assertions.assertFalse(pick.isStandard());
    Assertions.assertEquals(2, pick.getArguments().size());
    Assertions.assertEquals("5", ((Constant)delayed.getDelay()).getValue());

    WaitStmt wait = (WaitStmt)proc.getBody().get(1);
    Assertions.assertEquals("a", ((Identifier)wait.getSensitivity().get(0)).getName());
    Assertions.assertEquals("st", ((Identifier)wait.getCondition()).getName());
    WaitStmt bare = (WaitStmt)proc.getBody().get(2);
    Assertions.assertTrue(bare.getSensitivity().isEmpty());
    Assertions.assertNull(bare.getCondition());
  }

  @Test
  void testNamesStayUnresolved() throws Exception {
    Design design = DesignReader.read(TestDesignBuilder.CONE_READ);
    Assertions.assertTrue(design.streamSubtree(Identifier.class).allMatch(id -> id.getDeclaration() == null));
  }

  @Test
  void testReadExampleResource() throws Exception {
    try (InputStream in = DesignReaderTest.class.getResourceAsStream("/examples/counter.yaml")) {
      Assertions.assertNotNull(in);
      Design design = DesignReader.read(in);
      Assertions.assertEquals(1, design.getModules().size());
      Assertions.assertFalse(design.getModules().get(0).getContinuous().isEmpty());
    }
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "modules: [",
      "- just a list",
      "modules: [{ports: []}]",
      "modules: [{name: m, ports: [{name: a, dir: sideways}]}]",
      "modules: [{name: m, processes: [{name: p, flavour: final}]}]",
      "modules: [{name: m, continuous: [{call: f}]}]",
      "modules: [{name: m, continuous: [{assign: a}]}]",
      "modules: [{name: m, continuous: [{assign: a, value: {op: '?', args: [b, c, d]}}]}]",
      "modules: [{name: m, continuous: [{assign: a, value: [b]}]}]",
      "modules: [{name: m, processes: [{name: p, body: [{loop: a}]}]}]",
      "modules: [{name: m, signals: {name: s}}]"
  })
  void testMalformedInput(String yaml) {
    Assertions.assertThrows(DesignFormatException.class, () -> DesignReader.read(yaml));
  }
}
