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
package exm.qua.frontend.stream;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.DuplicateTagException;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.ScopeException;
import exm.qua.common.lang.VarType;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;
import exm.qua.frontend.Scope;
import exm.qua.ir.stream.ResultAnalysis;
import exm.qua.ir.stream.StreamToken;
import exm.qua.ir.tree.IRTree.Program;

public class ResultStreamTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ResultStreamTest.qua.log", true);
  }

  private static StreamToken.Array source(String name) {
    return StreamToken.array("@re", "0", name);
  }

  @Test
  public void testPipelineTokens() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.FIXED);
      ResultSource r = q.declareStream();
      q.save(v, r);
      try (Scope sp = q.streamProcessing()) {
        r.buffer(10).average().saveAll("avg");
      }
    }
    List<StreamToken.Array> model = q.getProgram().results().model();
    assertEquals(1, model.size());
    assertEquals(StreamToken.array("saveAll", "avg",
        StreamToken.array("average",
            StreamToken.array("buffer", "10", source("r1")))),
        model.get(0));
  }

  @Test
  public void testSourceModifiers() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      ResultSource adc = q.declareStream(true);
      assertEquals("atr_r1", adc.name());
      try (Scope sp = q.streamProcessing()) {
        adc.input1().timestamps().save("t1");
      }
    }
    StreamToken.Array terminal = q.getProgram().results().model().get(0);
    assertEquals(StreamToken.array("@macro_adc_trace",
        StreamToken.array("@macro_input", "1",
            StreamToken.array("@re", "1", "atr_r1"))),
        ResultAnalysis.pipelineOf(terminal));
  }

  @Test
  public void testArithmeticAndZip() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      ResultSource a = q.declareStream();
      ResultSource b = q.declareStream();
      try (Scope sp = q.streamProcessing()) {
        a.multiply(2).add(b).save("sum");
        a.zip(b).save("pairs");
      }
    }
    List<StreamToken.Array> model = q.getProgram().results().model();
    assertEquals(StreamToken.array("+",
        StreamToken.array("*", source("r1"), "2"), source("r2")),
        ResultAnalysis.pipelineOf(model.get(0)));
    assertEquals(StreamToken.array("zip", source("r2"), source("r1")),
        ResultAnalysis.pipelineOf(model.get(1)));
    assertEquals(Arrays.asList("r2", "r1"),
        ResultSource.sourceNames(ResultAnalysis.pipelineOf(model.get(1))));
  }

  @Test
  public void testMapFunctions() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      ResultSource r = q.declareStream();
      try (Scope sp = q.streamProcessing()) {
        r.buffer(4).map(StreamFunctions.dotProduct(
                            Arrays.asList(1, 0.5))).save("dot");
      }
    }
    StreamToken pipeline = ResultAnalysis.pipelineOf(
                              q.getProgram().results().model().get(0));
    assertEquals(StreamToken.array("map",
        StreamToken.array("dot", StreamToken.array("@array", "1", "0.5")),
        StreamToken.array("buffer", "4", source("r1"))), pipeline);
  }

  @Test
  public void testLegacySaveAutoTerminals() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      q.save(v, "res");
      q.save(v, "res");
    }
    Program p = q.getProgram();
    List<StreamToken.Array> model = p.results().model();
    assertEquals(2, model.size());
    assertEquals("res", ResultAnalysis.tagOf(model.get(0)));
    assertEquals("res_timestamps", ResultAnalysis.tagOf(model.get(1)));
    assertTrue(ResultAnalysis.isAuto(model.get(0)));
    assertEquals(2, p.body().statements().size());
  }

  @Test
  public void testShiftSavesToStream() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      ResultSource r = q.declareStream();
      r.binary("<<", v);
    }
    assertEquals(1, q.getProgram().body().statements().size());
  }

  @Test
  public void testComparisonRejected() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      ResultSource r = q.declareStream();
      exception.expect(QuaException.class);
      exception.expectMessage("Can't use < operator on results");
      r.binary("<", 1);
    }
  }

  @Test
  public void testSaveOutsideStreamProcessing() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      ResultSource r = q.declareStream();
      exception.expect(ScopeException.class);
      r.save("x");
    }
  }

  @Test
  public void testDuplicateTag() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      ResultSource r = q.declareStream();
      try (Scope sp = q.streamProcessing()) {
        r.save("x");
        exception.expect(DuplicateTagException.class);
        r.average().save("x");
      }
    }
  }

  @Test
  public void testBins() {
    assertEquals(Arrays.asList(Arrays.asList(0, 4), Arrays.asList(5, 9)),
                 StreamFunctions.bins(0, 9, 2));
  }
}
