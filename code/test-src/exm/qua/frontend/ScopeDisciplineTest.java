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
package exm.qua.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.InvalidDeclarationException;
import exm.qua.common.exceptions.ScopeException;
import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.common.lang.VarType;
import exm.qua.ir.tree.Conditionals.IfStatement;
import exm.qua.ir.tree.IRInstructions.Play;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.ir.tree.Loops.ForEachStatement;
import exm.qua.ir.tree.Loops.ForStatement;

public class ScopeDisciplineTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ScopeDisciplineTest.qua.log", true);
  }

  @Test
  public void testDeclareOutsideProgram() {
    QuaBuilder q = new QuaBuilder();
    exception.expect(ScopeException.class);
    exception.expectMessage("Expecting program scope");
    q.declare(VarType.INT);
  }

  @Test
  public void testOneProgramPerBuilder() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      q.pause();
    }
    exception.expect(ScopeException.class);
    q.program();
  }

  @Test
  public void testProgramFrozenOnExit() {
    QuaBuilder q = new QuaBuilder();
    Scope prog = q.program();
    q.play("pi", "q1");
    assertFalse(q.getProgram().isFrozen());
    prog.close();
    assertTrue(q.getProgram().isFrozen());
    assertTrue(prog.isClosed());
  }

  @Test
  public void testCloseOutOfOrder() {
    QuaBuilder q = new QuaBuilder();
    Scope prog = q.program();
    q.infiniteLoop_();
    exception.expect(ScopeException.class);
    exception.expectMessage("Unexpected stack structure");
    prog.close();
  }

  @Test
  public void testNestedBlocks() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression n = q.declare(VarType.INT);
      try (Scope loop = q.for_(n, 0, n.lt(10), n.add(1))) {
        try (Scope branch = q.if_(n.eq(3))) {
          q.play("pi", "q1");
        }
        try (Scope other = q.else_()) {
          q.wait(4, "q1");
        }
      }
    }
    Program p = q.getProgram();
    assertEquals(1, p.body().size());
    ForStatement loop = (ForStatement)p.body().last();
    assertEquals("(v1<10)", loop.condition().toString());
    IfStatement ifStmt = (IfStatement)loop.body().last();
    assertTrue(ifStmt.hasElse());
    assertTrue(ifStmt.thenBlock().last() instanceof Play);
    assertEquals(1, ifStmt.elseBlock().size());
  }

  @Test
  public void testElifWithoutIf() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      q.play("pi", "q1");
      exception.expect(ScopeException.class);
      exception.expectMessage("'elif' statement must directly follow");
      q.elif_(true);
    }
  }

  @Test
  public void testElifAfterElse() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      try (Scope s = q.if_(true)) {
        q.pause();
      }
      try (Scope s = q.else_()) {
        q.pause();
      }
      exception.expect(ScopeException.class);
      q.elif_(false);
    }
  }

  @Test
  public void testSwitchDesugarsToIf() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      try (Scope sw = q.switch_(v)) {
        try (Scope c = q.case_(1)) {
          q.play("x90", "q1");
        }
        try (Scope c = q.case_(2)) {
          q.play("y90", "q1");
        }
        try (Scope d = q.default_()) {
          q.pause();
        }
      }
    }
    Program p = q.getProgram();
    assertEquals(1, p.body().size());
    IfStatement ifStmt = (IfStatement)p.body().last();
    assertEquals("(v1==1)", ifStmt.condition().toString());
    assertEquals(1, ifStmt.elseIfs().size());
    assertEquals("(v1==2)", ifStmt.elseIfs().get(0).condition().toString());
    assertTrue(ifStmt.hasElse());
    assertFalse(ifStmt.isUnsafe());
  }

  @Test
  public void testEmptySwitch() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      try (Scope sw = q.switch_(v)) {
        // no cases
      }
    }
    assertTrue(q.getProgram().body().isEmpty());
  }

  @Test
  public void testCaseOutsideSwitch() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      exception.expect(ScopeException.class);
      exception.expectMessage("Expecting switch scope");
      q.case_(1);
    }
  }

  @Test
  public void testStatementDirectlyInSwitch() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      try (Scope sw = q.switch_(v)) {
        exception.expect(ScopeException.class);
        q.pause();
      }
    }
  }

  @Test
  public void testDefaultTwice() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      try (Scope sw = q.switch_(v)) {
        try (Scope c = q.case_(1)) {
          q.pause();
        }
        try (Scope d = q.default_()) {
          q.pause();
        }
        exception.expect(ScopeException.class);
        q.default_();
      }
    }
  }

  @Test
  public void testCaseAfterDefault() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      try (Scope sw = q.switch_(v)) {
        try (Scope c = q.case_(1)) {
          q.pause();
        }
        try (Scope d = q.default_()) {
          q.pause();
        }
        exception.expect(ScopeException.class);
        exception.expectMessage("'case' must come before 'default'");
        q.case_(2);
      }
    }
  }

  @Test
  public void testStreamProcessingInsideLoop() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      try (Scope loop = q.infiniteLoop_()) {
        exception.expect(ScopeException.class);
        q.streamProcessing();
      }
    }
  }

  @Test
  public void testForEachOverHostList() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression x = q.declare(VarType.FIXED);
      try (Scope loop = q.forEach_(x, Arrays.asList(0.1, 0.2, 0.3))) {
        q.play("pi", "q1");
      }
    }
    Program p = q.getProgram();
    assertEquals(2, p.variables().size());
    assertEquals("a1", p.variables().get(1).name());
    assertEquals(VarType.FIXED, p.variables().get(1).type());
    ForEachStatement loop = (ForEachStatement)p.body().last();
    assertEquals("a1", loop.iterators().get(0).array().toString());
  }

  @Test
  public void testForEachMixedList() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression x = q.declare(VarType.INT);
      exception.expect(TypeMismatchException.class);
      q.forEach_(x, Arrays.<Object>asList(1, true));
    }
  }

  @Test
  public void testForEachLengthMismatch() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression x = q.declare(VarType.INT);
      QuaExpression y = q.declare(VarType.INT);
      exception.expect(TypeMismatchException.class);
      q.forEach_(Arrays.asList(x, y),
                 Arrays.<Object>asList(Arrays.asList(1, 2)));
    }
  }

  @Test
  public void testForSections() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression i = q.declare(VarType.INT);
      try (ForScope f = q.for_()) {
        try (Scope s = f.init()) {
          q.assign(i, 0);
        }
        f.condition(i.lt(3));
        try (Scope s = f.update()) {
          q.assign(i, i.add(1));
        }
        try (Scope s = f.body()) {
          q.play("pi", "q1");
        }
      }
    }
    ForStatement loop = (ForStatement)q.getProgram().body().last();
    assertEquals(1, loop.init().size());
    assertEquals("(v1<3)", loop.condition().toString());
    assertEquals(1, loop.body().size());
  }

  @Test
  public void testUnnamedInputStream() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      exception.expect(InvalidDeclarationException.class);
      q.declareInputStream(VarType.INT, "");
    }
  }

  @Test
  public void testInputStreamNaming() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression in = q.declareInputStream(VarType.FIXED, "amp");
      QuaExpression v = q.declare(VarType.INT);
      q.advanceInputStream(in);
      assertEquals("input_stream_amp", in.toString());
      // Input streams do not use up scalar names
      assertEquals("v1", v.toString());
    }
    assertEquals("amp",
                 q.getProgram().variables().get(0).inputStreamName());
  }

  @Test
  public void testAdvanceOrdinaryVariable() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      exception.expect(TypeMismatchException.class);
      q.advanceInputStream(v);
    }
  }

  @Test
  public void testEmptyArrayDeclaration() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      exception.expect(InvalidDeclarationException.class);
      q.declareArray(VarType.INT, 0);
    }
  }

  @Test
  public void testLocationsRecorded() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      q.pause();
    }
    String loc = q.getProgram().body().last().loc();
    assertTrue("location should name this test: " + loc,
               loc.contains("ScopeDisciplineTest"));
  }
}
