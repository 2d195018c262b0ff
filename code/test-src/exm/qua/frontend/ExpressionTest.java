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
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.qua.common.Logging;
import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.common.lang.Library;
import exm.qua.common.lang.VarType;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.IRTree.Program;
import exm.qua.ir.tree.IRTree.VarDeclaration;

public class ExpressionTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ExpressionTest.qua.log", true);
  }

  @Test
  public void testArithmetic() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      assertEquals("(v1+1)", v.add(1).toString());
      assertEquals("((v1*2)-v1)", v.mul(2).sub(v).toString());
      assertEquals("(v1*0.5)", v.mul(0.5).toString());
      assertEquals("(v1<=10)", v.le(10).toString());
      assertEquals("(v1<<2)", v.binary("<<", 2).toString());
    }
  }

  @Test
  public void testUnaryOperators() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      QuaExpression b = q.declare(VarType.BOOL);
      assertEquals("(0-v1)", v.neg().toString());
      assertEquals("(v2^true)", b.not().toString());
      assertEquals("((v1>0)&v2)", v.gt(0).and(b).toString());
    }
  }

  @Test
  public void testArrays() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression i = q.declare(VarType.INT);
      QuaExpression a = q.declareArray(VarType.FIXED, 3);
      assertTrue(a.isArray());
      assertEquals("a1[v1]", a.get(i).toString());
      assertEquals("a1[(v1+1)]", a.get(i.add(1)).toString());
      assertEquals("a1.length()", a.length().toString());
    }
  }

  @Test
  public void testIndexScalar() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      exception.expect(TypeMismatchException.class);
      v.get(0);
    }
  }

  @Test
  public void testNestingLimit() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression e = q.declare(VarType.INT);
      for (int i = 1; i < Expr.MAX_DEPTH; i++) {
        e = e.add(1);
      }
      assertEquals(Expr.MAX_DEPTH, e.expr().depth());
      exception.expect(QuaException.class);
      exception.expectMessage("nested deeper than 100 levels");
      e.add(1);
    }
  }

  @Test
  public void testHostBooleanRejected() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.BOOL);
      exception.expect(QuaException.class);
      exception.expectMessage("host logical operator");
      v.booleanValue();
    }
  }

  @Test
  public void testLibraryCalls() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.FIXED);
      assertEquals("Math.abs(v1)",
          q.callLibraryFunction(Library.MATH, "abs", v).toString());
      // Host lists become declared arrays
      assertEquals("Math.sum(a1)", q.callLibraryFunction(Library.MATH,
          "sum", Arrays.asList(1, 2, 3)).toString());
    }
    Program p = q.getProgram();
    VarDeclaration decl = p.variables().get(1);
    assertEquals("a1", decl.name());
    assertEquals(VarType.INT, decl.type());
    assertEquals(3, decl.size());
  }

  @Test
  public void testUnknownLibraryFunction() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.FIXED);
      exception.expect(TypeMismatchException.class);
      q.callLibraryFunction(Library.MATH, "tanh", v);
    }
  }

  @Test
  public void testIntWidensToFixed() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      q.declare(VarType.FIXED, 1);
    }
    VarDeclaration decl = q.getProgram().variables().get(0);
    assertEquals("1.0", decl.values().get(0).value());
  }

  @Test
  public void testFixedDoesNotNarrowToInt() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      exception.expect(TypeMismatchException.class);
      q.declare(VarType.INT, 1.5);
    }
  }

  @Test
  public void testHostStringRejected() {
    QuaBuilder q = new QuaBuilder();
    try (Scope prog = q.program()) {
      QuaExpression v = q.declare(VarType.INT);
      exception.expect(TypeMismatchException.class);
      v.add("one");
    }
  }
}
