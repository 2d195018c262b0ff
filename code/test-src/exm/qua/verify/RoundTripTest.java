/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.qua.verify;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.qua.common.Logging;
import exm.qua.common.lang.Units.FrequencyUnits;
import exm.qua.common.lang.VarType;
import exm.qua.frontend.MeasureProcesses;
import exm.qua.frontend.PlayOptions;
import exm.qua.frontend.PlayPulse;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;
import exm.qua.frontend.Scope;
import exm.qua.frontend.stream.ResultSource;
import exm.qua.frontend.stream.StreamFunctions;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.script.QuaScriptGenerator;

/**
 * Programs built with the DSL must come back unchanged from their
 * generated scripts
 */
public class RoundTripTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("RoundTripTest.qua.log", true);
  }

  private static void assertRoundTrip(Program program) throws Exception {
    String script = new QuaScriptGenerator(4, false, 4).generate(program);
    RoundTripVerifier.Result result =
                          RoundTripVerifier.verify(program, script);
    assertTrue(script + "\noriginal:\n" + result.original().dump() +
               "\nrebuilt:\n" + result.rebuilt().dump(), result.matches());
  }

  @Test
  public void testDeepestExpression() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      QuaExpression e = v;
      for (int i = 1; i < Expr.MAX_DEPTH; i++) {
        e = e.add(i);
      }
      q.assign(v, e);
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testDeclarations() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      q.declare(VarType.INT);
      q.declare(VarType.FIXED, 0.25);
      q.declare(VarType.BOOL, true);
      q.declareArray(VarType.INT, 4);
      q.declareArray(VarType.FIXED, Arrays.asList(0.5, -1.5));
      QuaExpression in = q.declareInputStream(VarType.INT, "amp");
      q.advanceInputStream(in);
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testLoops() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression n = q.declare(VarType.INT);
      QuaExpression f = q.declare(VarType.FIXED);
      try (Scope loop = q.for_(n, 0, n.lt(100), n.add(2))) {
        try (Scope inner = q.while_(f.lt(0.5))) {
          q.assign(f, f.add(0.125));
        }
      }
      try (Scope loop = q.forEach_(f, Arrays.asList(0.1, 0.2, 0.3))) {
        q.play("pi", "q1");
      }
      try (Scope timing = q.strictTiming_()) {
        q.wait(4, "q1", "q2");
      }
      try (Scope loop = q.infiniteLoop_()) {
        q.pause();
      }
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testForEachOverArrays() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression a = q.declare(VarType.INT);
      QuaExpression b = q.declare(VarType.FIXED);
      QuaExpression as = q.declareArray(VarType.INT, Arrays.asList(1, 2));
      QuaExpression bs = q.declareArray(VarType.FIXED,
                                        Arrays.asList(0.5, 0.75));
      try (Scope loop = q.forEach_(Arrays.asList(a, b),
                                   Arrays.asList(as, bs))) {
        q.assign(as.get(a), a.add(1));
        q.assign(b, b.mul(bs.get(a)));
      }
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testConditionals() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      QuaExpression b = q.declare(VarType.BOOL);
      try (Scope s = q.if_(v.gt(3).and(b), true)) {
        q.resetPhase("q1");
      }
      try (Scope s = q.elif_(b.not())) {
        q.resetFrame("q1", "q2");
      }
      try (Scope s = q.else_()) {
      }
      try (Scope s = q.switch_(v)) {
        try (Scope c = q.case_(1)) {
          q.align("q1");
        }
        try (Scope c = q.case_(2)) {
          q.align();
        }
        try (Scope c = q.default_()) {
          q.rampToZero("q1");
          q.rampToZero("q2", 16);
        }
      }
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testPlayOptions() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression t = q.declare(VarType.INT, 20);
      QuaExpression a = q.declare(VarType.FIXED, 0.5);
      q.play(PlayPulse.of("pi").amp(a), "q1",
             PlayOptions.options().duration(t).condition(t.gt(10)));
      q.play(PlayPulse.of("x").amp(1, 0, 0, a), "q1",
             PlayOptions.options().chirp(25000, "Hz/nsec").truncate(t));
      q.play("y", "q2", PlayOptions.options()
             .chirp(Arrays.asList(100, 200), Arrays.asList(40), "mHz/nsec")
             .continueChirp(true).target("t0"));
      q.play(PlayPulse.ramp(0.25), "q2", PlayOptions.options().duration(8)
             .timestampStream("play_times"));
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testMeasure() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression i = q.declare(VarType.FIXED);
      QuaExpression qv = q.declare(VarType.FIXED);
      QuaExpression arr = q.declareArray(VarType.FIXED, 10);
      QuaExpression times = q.declareArray(VarType.INT, 10);
      QuaExpression count = q.declare(VarType.INT);
      q.measure("readout", "rr", "raw",
                MeasureProcesses.DEMOD.full("cos", i, "out1"),
                MeasureProcesses.DUAL_DEMOD.full("cos", "out1", "sin",
                                                 "out2", qv));
      q.measure("readout", "rr", null,
                MeasureProcesses.INTEGRATION.sliced("w", arr, 4),
                MeasureProcesses.DEMOD.movingWindow("w", arr, 4, 2));
      q.measure("readout", "rr", null,
                MeasureProcesses.TIME_TAGGING.analog(times, 500, count));
      q.measure("readout", "rr", null,
                MeasureProcesses.COUNTING.digital(count, 500, "out1"));
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testInstructions() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression f = q.declare(VarType.INT, 100000);
      QuaExpression c = q.declare(VarType.FIXED, 0.5);
      QuaExpression tag = q.declare(VarType.INT);
      q.waitForTrigger("q1", "trig", "q2", "out1", tag);
      q.waitForTrigger("q2");
      q.updateFrequency("q1", f);
      q.updateFrequency("q1", f.add(5), FrequencyUnits.MILLI_HZ, true);
      q.updateCorrection("q1", c, 0, 0, c.neg());
      q.setDcOffset("q1", "single", c);
      q.frameRotation(c, "q1");
      q.frameRotation2pi(0.25, "q1", "q2");
      q.fastFrameRotation(c, c.mul(c), "q1");
      q.wait(q.math().abs(f), "q1");
      q.assign(c, q.cast().toFixed(f));
      q.assign(f, q.util().cond(c.gt(0), 1, 2));
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testLegacySaves() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      try (Scope loop = q.for_(v, 0, v.lt(3), v.add(1))) {
        q.save(v, "res");
      }
      q.save(v, "res");
      q.save(v, "other");
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testStreamProcessing() throws Exception {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.FIXED);
      ResultSource r1 = q.declareStream();
      ResultSource r2 = q.declareStream();
      ResultSource adc = q.declareStream(true);
      q.measure("readout", "rr", adc);
      q.save(v, r1);
      q.save(v, r2);
      try (Scope sp = q.streamProcessing()) {
        r1.buffer(2, 5).average().save("avg");
        r1.timestamps().saveAll("times");
        r2.withTimestamps().skip(1).take(3).saveAll("some");
        r1.multiply(2).subtract(r2).save("diff");
        r1.zip(r2).save("pair");
        r2.autoReshape().map(StreamFunctions.dotProduct(
                                Arrays.asList(1, 0.5))).save("dot");
        r2.histogram(StreamFunctions.bins(0, 9, 2)).save("hist");
        adc.input1().bufferAndSkip(10, 2).flatten().save("adc1");
        adc.input2().skipLast(3).save("adc2");
      }
    }
    assertRoundTrip(q.getProgram());
  }

  @Test
  public void testStreamRenamingDoesNotMatter() throws Exception {
    QuaBuilder q1 = new QuaBuilder();
    try (Scope prog = q1.program()) {
      QuaExpression v = q1.declare(VarType.INT);
      q1.declareStream();
      ResultSource r = q1.declareStream();
      q1.save(v, r);
      try (Scope sp = q1.streamProcessing()) {
        r.save("x");
      }
    }
    QuaBuilder q2 = new QuaBuilder();
    try (Scope prog = q2.program()) {
      QuaExpression v = q2.declare(VarType.INT);
      ResultSource r = q2.declareStream();
      q2.save(v, r);
      try (Scope sp = q2.streamProcessing()) {
        r.save("x");
      }
    }
    assertTrue(Canonicalizer.canonicalize(q1.getProgram()).equals(
               Canonicalizer.canonicalize(q2.getProgram())));
    assertFalse(q1.getProgram().equals(q2.getProgram()));
  }
}
