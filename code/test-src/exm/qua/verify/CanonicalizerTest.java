package exm.qua.verify;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.qua.common.Logging;
import exm.qua.common.lang.VarType;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;
import exm.qua.frontend.Scope;
import exm.qua.frontend.stream.ResultSource;
import exm.qua.ir.stream.ResultAnalysis;
import exm.qua.ir.tree.IRInstructions.Save;
import exm.qua.ir.tree.IRTree.Program;

public class CanonicalizerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("CanonicalizerTest.qua.log", true);
  }

  /** Streams declared in the reverse of the order they are used */
  private static Program program() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      ResultSource first = q.declareStream();
      ResultSource second = q.declareStream();
      q.save(v, second);
      q.save(v, first);
      try (Scope sp = q.streamProcessing()) {
        second.save("b");
        first.save("a");
      }
    }
    return q.getProgram();
  }

  @Test
  public void testStripCounter() {
    assertEquals("r", Canonicalizer.stripCounter("r12"));
    assertEquals("atr_r", Canonicalizer.stripCounter("atr_r3"));
    assertEquals("input_stream_x", Canonicalizer.stripCounter(
                                        "input_stream_x"));
  }

  @Test
  public void testRenamesByFirstUse() {
    Program p = program();
    Map<String, String> renaming = Canonicalizer.streamRenaming(p);
    assertEquals("r1", renaming.get("r2"));
    assertEquals("r2", renaming.get("r1"));

    Program c = Canonicalizer.canonicalize(p);
    assertEquals("r1", ((Save)c.body().statements().get(0)).tag());
    assertEquals("r2", ((Save)c.body().statements().get(1)).tag());
    // terminals come back in tag order
    assertEquals("a", ResultAnalysis.tagOf(c.results().model().get(0)));
    assertEquals("b", ResultAnalysis.tagOf(c.results().model().get(1)));
  }

  @Test
  public void testDropsLocations() {
    Program p = program();
    assertNotNull(p.body().statements().get(0).loc());
    Program c = Canonicalizer.canonicalize(p);
    assertNull(c.body().statements().get(0).loc());
    assertTrue(c.isFrozen());
  }

  @Test
  public void testIdempotent() {
    Program c = Canonicalizer.canonicalize(program());
    assertEquals(c, Canonicalizer.canonicalize(c));
  }
}
