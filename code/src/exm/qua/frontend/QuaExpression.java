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

import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.common.lang.Operators;
import exm.qua.common.lang.Operators.BinaryOp;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.Expr.ArrayLength;
import exm.qua.ir.tree.Expr.ArrayVar;
import exm.qua.ir.tree.Expr.ArrayCell;
import exm.qua.ir.tree.Expr.Binary;
import exm.qua.ir.tree.Expr.ExprKind;
import exm.qua.ir.tree.Expr.Literal;

/**
 * QUA expression as seen by user code.  Operator methods build new
 * expressions; operands may be other expressions or boolean, int and
 * double values.
 *
 * <pre>
 *   QuaExpression cond = x.add(1).lt(n);
 * </pre>
 */
public class QuaExpression {

  public static final QuaExpression IO1 = new QuaExpression(Expr.IO1);
  public static final QuaExpression IO2 = new QuaExpression(Expr.IO2);

  private final Expr expr;

  public QuaExpression(Expr expr) {
    assert(expr != null);
    this.expr = expr;
  }

  /**
   * Literal from boolean, int or double host value
   */
  public static QuaExpression literal(Object value) {
    return new QuaExpression(Literals.toLiteral(value));
  }

  public Expr expr() {
    return expr;
  }

  public boolean isArray() {
    return expr.kind() == ExprKind.ARRAY_VAR;
  }

  public boolean isVariable() {
    return expr.kind() == ExprKind.VARIABLE;
  }

  public QuaExpression add(Object other) {
    return binary(BinaryOp.ADD, other);
  }

  public QuaExpression sub(Object other) {
    return binary(BinaryOp.SUB, other);
  }

  public QuaExpression mul(Object other) {
    return binary(BinaryOp.MUL, other);
  }

  public QuaExpression div(Object other) {
    return binary(BinaryOp.DIV, other);
  }

  public QuaExpression lt(Object other) {
    return binary(BinaryOp.LT, other);
  }

  public QuaExpression le(Object other) {
    return binary(BinaryOp.LE, other);
  }

  public QuaExpression gt(Object other) {
    return binary(BinaryOp.GT, other);
  }

  public QuaExpression ge(Object other) {
    return binary(BinaryOp.GE, other);
  }

  public QuaExpression eq(Object other) {
    return binary(BinaryOp.EQ, other);
  }

  public QuaExpression and(Object other) {
    return binary(BinaryOp.AND, other);
  }

  public QuaExpression or(Object other) {
    return binary(BinaryOp.OR, other);
  }

  public QuaExpression xor(Object other) {
    return binary(BinaryOp.XOR, other);
  }

  public QuaExpression shl(Object other) {
    return binary(BinaryOp.SHL, other);
  }

  public QuaExpression shr(Object other) {
    return binary(BinaryOp.SHR, other);
  }

  /** 0 - this */
  public QuaExpression neg() {
    return new QuaExpression(new Binary(BinaryOp.SUB, Literal.createInt(0),
                                        expr));
  }

  /** this ^ true */
  public QuaExpression not() {
    return binary(BinaryOp.XOR, Boolean.TRUE);
  }

  /**
   * Apply operator given by its symbol, e.g. "<="
   */
  public QuaExpression binary(String symbol, Object other) {
    return binary(Operators.fromSymbol(symbol), other);
  }

  public QuaExpression binary(BinaryOp op, Object other) {
    return new QuaExpression(new Binary(op, expr, Literals.toExpr(other)));
  }

  /**
   * Array cell at index
   */
  public QuaExpression get(Object index) {
    if (!isArray()) {
      throw new TypeMismatchException(expr + " is not an array");
    }
    return new QuaExpression(new ArrayCell((ArrayVar)expr,
                             Literals.toScalar(index, "array index")));
  }

  public QuaExpression length() {
    if (!isArray()) {
      throw new TypeMismatchException(expr +
                              " is not an array: length() needs an array");
    }
    return new QuaExpression(new ArrayLength((ArrayVar)expr));
  }

  /**
   * A QUA expression has no value on the host.  Always throws.
   */
  public boolean booleanValue() {
    throw new QuaException("Attempted to use a host logical operator on a " +
        "QUA variable: " + expr + ". Use QUA operators such as and(), " +
        "or() and not() instead.");
  }

  @Override
  public String toString() {
    return expr.toString();
  }
}
