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

package exm.qua.ir.tree;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.qua.common.exceptions.QuaException;
import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.common.lang.Library;
import exm.qua.common.lang.Operators.BinaryOp;
import exm.qua.common.lang.VarType;

/**
 * QUA expression node.  Exactly one variant per node, identified by
 * {@link #kind()}.  The textual form from {@link #toString()} is the one
 * used in generated scripts.
 */
public abstract class Expr extends IRNode {

  private static final long serialVersionUID = 1L;

  public static enum ExprKind {
    VARIABLE, ARRAY_VAR, ARRAY_CELL, LITERAL, BINARY, LIB_CALL, ARRAY_LENGTH
  }

  /** Deepest nesting of operators, calls and indexing in one expression */
  public static final int MAX_DEPTH = 100;

  /** Reserved input registers */
  public static final Variable IO1 = new Variable("IO1");
  public static final Variable IO2 = new Variable("IO2");

  public abstract ExprKind kind();

  public abstract void appendTo(StringBuilder sb);

  /**
   * @return levels of nesting, 1 for variables and literals
   */
  public int depth() {
    return 1;
  }

  private static int nestedDepth(Expr... children) {
    int max = 0;
    for (Expr child: children) {
      max = Math.max(max, child.depth());
    }
    int depth = max + 1;
    if (depth > MAX_DEPTH) {
      throw new QuaException("Expression nested deeper than " + MAX_DEPTH +
                             " levels; assign parts of it to variables");
    }
    return depth;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendTo(sb);
    return sb.toString();
  }

  public boolean isArray() {
    return kind() == ExprKind.ARRAY_VAR;
  }

  /**
   * Scalar variable, also used for the IO registers
   */
  public static final class Variable extends Expr {
    private static final long serialVersionUID = 1L;
    private final String name;

    public Variable(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.VARIABLE;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append(name);
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(name);
    }
  }

  public static final class ArrayVar extends Expr {
    private static final long serialVersionUID = 1L;
    private final String name;

    public ArrayVar(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.ARRAY_VAR;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append(name);
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(name);
    }
  }

  public static final class ArrayCell extends Expr {
    private static final long serialVersionUID = 1L;
    private final ArrayVar array;
    private final Expr index;
    private final int depth;

    public ArrayCell(ArrayVar array, Expr index) {
      this.array = array;
      this.index = index;
      this.depth = nestedDepth(index);
    }

    @Override
    public int depth() {
      return depth;
    }

    public ArrayVar array() {
      return array;
    }

    public Expr index() {
      return index;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.ARRAY_CELL;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      array.appendTo(sb);
      sb.append('[');
      index.appendTo(sb);
      sb.append(']');
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(array, index);
    }
  }

  /**
   * Literal value, kept in its textual form
   */
  public static final class Literal extends Expr {
    private static final long serialVersionUID = 1L;
    private final String value;
    private final VarType type;

    private Literal(String value, VarType type) {
      this.value = value;
      this.type = type;
    }

    public static Literal createInt(int v) {
      return new Literal(Integer.toString(v), VarType.INT);
    }

    public static Literal createBool(boolean v) {
      return new Literal(Boolean.toString(v), VarType.BOOL);
    }

    public static Literal createFixed(double v) {
      if (Double.isNaN(v) || Double.isInfinite(v)) {
        throw new QuaRuntimeError("not a finite fixed point value: " + v);
      }
      return new Literal(Double.toString(v), VarType.FIXED);
    }

    public String value() {
      return value;
    }

    public VarType type() {
      return type;
    }

    public boolean isTrue() {
      return type == VarType.BOOL && Boolean.parseBoolean(value);
    }

    @Override
    public ExprKind kind() {
      return ExprKind.LITERAL;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append(value);
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(value, type);
    }
  }

  public static final class Binary extends Expr {
    private static final long serialVersionUID = 1L;
    private final BinaryOp op;
    private final Expr left;
    private final Expr right;
    private final int depth;

    public Binary(BinaryOp op, Expr left, Expr right) {
      this.op = op;
      this.left = left;
      this.right = right;
      this.depth = nestedDepth(left, right);
    }

    @Override
    public int depth() {
      return depth;
    }

    public BinaryOp op() {
      return op;
    }

    public Expr left() {
      return left;
    }

    public Expr right() {
      return right;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.BINARY;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append('(');
      left.appendTo(sb);
      sb.append(op.symbol());
      right.appendTo(sb);
      sb.append(')');
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(op, left, right);
    }
  }

  /**
   * Call into one of the controller's function libraries.
   * Arguments are scalars or declared arrays, never inline vectors.
   */
  public static final class LibCall extends Expr {
    private static final long serialVersionUID = 1L;
    private final Library library;
    private final String function;
    private final ImmutableList<Expr> args;
    private final int depth;

    public LibCall(Library library, String function, List<Expr> args) {
      library.checkFunction(function);
      this.library = library;
      this.function = function;
      this.args = ImmutableList.copyOf(args);
      this.depth = nestedDepth(this.args.toArray(new Expr[this.args.size()]));
    }

    @Override
    public int depth() {
      return depth;
    }

    public Library library() {
      return library;
    }

    public String function() {
      return function;
    }

    public ImmutableList<Expr> args() {
      return args;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.LIB_CALL;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      sb.append(library.scriptName());
      sb.append('.');
      sb.append(function);
      sb.append('(');
      Iterator<Expr> it = args.iterator();
      while (it.hasNext()) {
        it.next().appendTo(sb);
        if (it.hasNext()) {
          sb.append(", ");
        }
      }
      sb.append(')');
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(library, function, args);
    }
  }

  public static final class ArrayLength extends Expr {
    private static final long serialVersionUID = 1L;
    private final ArrayVar array;

    public ArrayLength(ArrayVar array) {
      this.array = array;
    }

    public ArrayVar array() {
      return array;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.ARRAY_LENGTH;
    }

    @Override
    public void appendTo(StringBuilder sb) {
      array.appendTo(sb);
      sb.append(".length()");
    }

    @Override
    protected List<Object> fields() {
      return Arrays.<Object>asList(array);
    }
  }
}
