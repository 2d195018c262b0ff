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
package exm.qua.script;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qua.common.Logging;
import exm.qua.common.Settings;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.lang.VarType;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;
import exm.qua.frontend.Scope;
import exm.qua.frontend.stream.ResultSource;
import exm.qua.ir.tree.IRTree.Program;

public class QuaScriptGeneratorTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("QuaScriptGeneratorTest.qua.log", true);
  }

  private static String header() {
    return QuaScriptGenerator.HEADER + Settings.get(Settings.QUA_VERSION) +
           "\n" + QuaScriptGenerator.SETUP + "\n\n";
  }

  private static Program simpleLoop() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      try (Scope loop = q.for_(v, 0, v.lt(10), v.add(1))) {
        q.play("pi", "q1");
      }
    }
    return q.getProgram();
  }

  @Test
  public void testSimpleProgram() {
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(simpleLoop());
    assertEquals(header() +
        "program prog:\n" +
        "    v1 = declare(int)\n" +
        "    for_(v1, 0, (v1<10), (v1+1)):\n" +
        "        play(\"pi\", \"q1\")\n", script);
  }

  @Test
  public void testIndentWidth() {
    String script = new QuaScriptGenerator(2, false, 4)
                                            .generate(simpleLoop());
    assertTrue(script.contains("\n  v1 = declare(int)\n" +
                               "  for_(v1, 0, (v1<10), (v1+1)):\n" +
                               "    play(\"pi\", \"q1\")\n"));
  }

  @Test
  public void testLegacySaveShorthand() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT, 3);
      q.save(v, "res");
    }
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(q.getProgram());
    assertEquals(header() +
        "program prog:\n" +
        "    v1 = declare(int, value=3)\n" +
        "    save(v1, \"res\")\n", script);
  }

  @Test
  public void testExplicitStreamProcessing() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.FIXED);
      ResultSource r = q.declareStream();
      q.save(v, r);
      try (Scope sp = q.streamProcessing()) {
        r.buffer(3).average().save("avg");
      }
    }
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(q.getProgram());
    assertEquals(header() +
        "program prog:\n" +
        "    v1 = declare(fixed)\n" +
        "    r1 = declare_stream()\n" +
        "    save(v1, r1)\n" +
        "    stream_processing():\n" +
        "        r1.buffer(3).average().save(\"avg\")\n", script);
  }

  @Test
  public void testFrameRotationUnits() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      q.frameRotation(Math.PI, "q1");
      QuaExpression angle = q.declare(VarType.FIXED);
      q.frameRotation(angle, "q1");
    }
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(q.getProgram());
    assertEquals(header() +
        "program prog:\n" +
        "    v1 = declare(fixed)\n" +
        "    frame_rotation_2pi(0.5, \"q1\")\n" +
        "    frame_rotation_2pi((v1*0.15915494309189535), \"q1\")\n",
        script);
  }

  @Test
  public void testEmptyBodies() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      try (Scope loop = q.infiniteLoop_()) {
      }
    }
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(q.getProgram());
    assertEquals(header() +
        "program prog:\n" +
        "    infinite_loop_():\n" +
        "        pass\n", script);
  }

  @Test
  public void testNoDiagnosticsForConditionals() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      try (Scope s = q.if_(v.gt(1))) {
        q.wait(16, "q1");
      }
      try (Scope s = q.elif_(v.eq(0))) {
        q.align("q1", "q2");
      }
      try (Scope s = q.else_()) {
        q.assign(v, v.mul(2));
      }
    }
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(q.getProgram());
    assertFalse(script, script.contains(QuaScriptGenerator.NOT_COMPLETE));
    assertFalse(script,
                script.contains(QuaScriptGenerator.VALIDATION_ERROR));
    assertTrue(script.contains("    if_((v1>1)):\n" +
                               "        wait(16, \"q1\")\n" +
                               "    elif_((v1==0)):\n" +
                               "        align(\"q1\", \"q2\")\n" +
                               "    else_():\n" +
                               "        assign(v1, (v1*2))\n"));
  }

  @Test
  public void testConfigBlock() {
    Map<String, Object> config = new LinkedHashMap<String, Object>();
    config.put("version", 1);
    String script = new QuaScriptGenerator(4, false, 4)
                                    .generate(simpleLoop(), config);
    assertTrue(script, script.endsWith("\nconfig = {\n" +
                                       "    \"version\": 1,\n" +
                                       "}\n"));
  }

  @Test
  public void testConfigError() {
    Map<String, Object> config = new LinkedHashMap<String, Object>();
    config.put("bad", Double.NaN);
    String script = new QuaScriptGenerator(4, false, 4)
                                    .generate(simpleLoop(), config);
    assertTrue(script, script.contains(QuaScriptGenerator.CONFIG_ERROR));
    assertFalse(script.contains("config = "));
  }

  @Test
  public void testLeafStatementsInOrder() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      q.play("pi", "q1");
      q.wait(100, "q1");
    }
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(q.getProgram());
    assertTrue(script, script.endsWith("program prog:\n" +
        "    play(\"pi\", \"q1\")\n" +
        "    wait(100, \"q1\")\n"));
  }

  @Test
  public void testSwitchRendersAsIfChain() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression x = q.declare(VarType.INT);
      try (Scope s = q.switch_(x)) {
        try (Scope c = q.case_(1)) {
          q.play("a", "q1");
        }
        try (Scope c = q.case_(2)) {
          q.play("b", "q1");
        }
        try (Scope c = q.default_()) {
          q.play("c", "q1");
        }
      }
    }
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(q.getProgram());
    assertTrue(script, script.endsWith("    v1 = declare(int)\n" +
        "    if_((v1==1)):\n" +
        "        play(\"a\", \"q1\")\n" +
        "    elif_((v1==2)):\n" +
        "        play(\"b\", \"q1\")\n" +
        "    else_():\n" +
        "        play(\"c\", \"q1\")\n"));
  }

  @Test
  public void testForEachOverHostLists() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression i = q.declare(VarType.INT);
      QuaExpression j = q.declare(VarType.INT);
      List<Object> values = new ArrayList<Object>();
      values.add(Arrays.asList(1, 2, 3));
      values.add(Arrays.asList(4, 5, 6));
      try (Scope loop = q.forEach_(Arrays.asList(i, j), values)) {
        q.assign(i, i.add(j));
      }
    }
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(q.getProgram());
    assertTrue(script, script.endsWith("    v1 = declare(int)\n" +
        "    v2 = declare(int)\n" +
        "    a1 = declare(int, value=[1, 2, 3])\n" +
        "    a2 = declare(int, value=[4, 5, 6])\n" +
        "    for_each_((v1, v2), (a1, a2)):\n" +
        "        assign(v1, (v1+v2))\n"));
  }

  @Test
  public void testStreamArithmetic() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      ResultSource a = q.declareStream();
      ResultSource b = q.declareStream();
      q.save(v, a);
      q.save(v, b);
      try (Scope sp = q.streamProcessing()) {
        a.add(b).save("s");
      }
    }
    String script = new QuaScriptGenerator(4, true, 4)
                                            .generate(q.getProgram());
    assertTrue(script, script.endsWith("    stream_processing():\n" +
        "        (r1.add(r2)).save(\"s\")\n"));
  }

  @Test
  public void testProgramStillBeingBuilt() {
    exception.expect(QuaException.class);
    new QuaScriptGenerator(4, false, 4).generate(new Program());
  }
}
