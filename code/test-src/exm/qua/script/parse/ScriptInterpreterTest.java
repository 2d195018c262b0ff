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
package exm.qua.script.parse;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.InvalidSyntaxException;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.ScopeException;
import exm.qua.common.lang.VarType;
import exm.qua.ir.tree.IRInstructions.Assign;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.ir.tree.IRTree.VarDeclaration;
import exm.qua.ir.tree.Loops.ForStatement;

public class ScriptInterpreterTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ScriptInterpreterTest.qua.log", true);
  }

  private static String script(String... body) {
    StringBuilder sb = new StringBuilder("use qua\n\nprogram prog:\n");
    for (String line: body) {
      sb.append("    ").append(line).append('\n');
    }
    return sb.toString();
  }

  @Test
  public void testBuildsProgram() throws Exception {
    Program p = ScriptInterpreter.run(script(
        "v1 = declare(int)",
        "a1 = declare(fixed, value=[0.5, 0.25])",
        "for_(v1, 0, (v1<10), (v1+1)):",
        "    assign(v1, (v1*2))"));
    assertTrue(p.isFrozen());
    List<VarDeclaration> vars = p.variables();
    assertEquals(2, vars.size());
    assertEquals("v1", vars.get(0).name());
    assertEquals(VarType.INT, vars.get(0).type());
    assertEquals("a1", vars.get(1).name());
    assertEquals(VarType.FIXED, vars.get(1).type());
    assertEquals(1, p.body().size());
    ForStatement loop = (ForStatement)p.body().last();
    Assign assign = (Assign)loop.body().last();
    assertEquals("(v1*2)", assign.value().toString());
  }

  @Test
  public void testBindings() throws Exception {
    Map<String, Object> env = ScriptInterpreter.bindings(
        "config = {\n" +
        "    \"offsets\": [0.0] * 3 + [0.5],\n" +
        "    \"port\": -1,\n" +
        "    \"name\": \"q\\\\1\",\n" +
        "}\n");
    @SuppressWarnings("unchecked")
    Map<String, Object> config = (Map<String, Object>)env.get("config");
    assertEquals(Arrays.asList(0.0, 0.0, 0.0, 0.5), config.get("offsets"));
    assertEquals(-1, config.get("port"));
    assertEquals("q\\1", config.get("name"));
  }

  @Test
  public void testNoProgram() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("does not define a program");
    ScriptInterpreter.run("use qua\nx = 1\n");
  }

  @Test
  public void testSyntaxError() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("line 5");
    ScriptInterpreter.run(script("pause()", "v1 = = 3"));
  }

  @Test
  public void testIntegerOutOfRange() throws Exception {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("out of range");
    ScriptInterpreter.run(script("v1 = declare(int, value=99999999999999999999)"));
  }

  @Test
  public void testUnknownName() throws Exception {
    exception.expect(QuaException.class);
    exception.expectMessage("name 'frobnicate' is not defined");
    ScriptInterpreter.run(script("frobnicate(1)"));
  }

  @Test
  public void testUnknownModule() throws Exception {
    exception.expect(QuaException.class);
    exception.expectMessage("unknown module");
    ScriptInterpreter.run("use numpy\n");
  }

  @Test
  public void testNotABlock() throws Exception {
    exception.expect(QuaException.class);
    exception.expectMessage("does not open a block");
    ScriptInterpreter.run(script("pause():", "    pause()"));
  }

  @Test
  public void testScopeErrorsPropagate() throws Exception {
    exception.expect(ScopeException.class);
    ScriptInterpreter.run(script("else_():", "    pause()"));
  }
}
