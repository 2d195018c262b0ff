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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.primitives.Booleans;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;

import exm.qua.common.exceptions.InvalidDeclarationException;
import exm.qua.common.exceptions.TypeMismatchException;
import exm.qua.common.lang.VarType;
import exm.qua.ir.tree.Expr;
import exm.qua.ir.tree.Expr.ExprKind;
import exm.qua.ir.tree.Expr.Literal;

/**
 * Conversion of host values to QUA expressions.  Only boolean, int and
 * double host values become literals; anything else is rejected.
 */
public class Literals {

  /**
   * @param value a QuaExpression, Boolean, Integer or Double
   */
  public static Expr toExpr(Object value) {
    if (value instanceof QuaExpression) {
      return ((QuaExpression)value).expr();
    } else if (value instanceof Expr) {
      return (Expr)value;
    }
    return toLiteral(value);
  }

  public static Literal toLiteral(Object value) {
    if (value instanceof Boolean) {
      return Literal.createBool((Boolean)value);
    } else if (value instanceof Integer) {
      return Literal.createInt((Integer)value);
    } else if (value instanceof Double) {
      return Literal.createFixed((Double)value);
    }
    throw new TypeMismatchException(describe(value) +
        " can not be used as a QUA value: expected a boolean, int, double " +
        "or QUA expression");
  }

  /**
   * Convert where a single value is needed
   * @param what description for error message
   */
  public static Expr toScalar(Object value, String what) {
    Expr expr = toExpr(value);
    if (expr.kind() == ExprKind.ARRAY_VAR) {
      throw new TypeMismatchException(what + " must be a scalar, but " +
                                      expr + " is an array");
    }
    return expr;
  }

  public static Expr toScalarOrNull(Object value, String what) {
    return value == null ? null : toScalar(value, what);
  }

  /**
   * @return true if value is a host list or array of values
   */
  public static boolean isHostList(Object value) {
    return value instanceof List || value instanceof int[] ||
        value instanceof double[] || value instanceof boolean[] ||
        value instanceof Object[];
  }

  /**
   * @return elements of a host list or array
   */
  public static List<?> toHostList(Object value) {
    if (value instanceof List) {
      return (List<?>)value;
    } else if (value instanceof int[]) {
      return Ints.asList((int[])value);
    } else if (value instanceof double[]) {
      return Doubles.asList((double[])value);
    } else if (value instanceof boolean[]) {
      return Booleans.asList((boolean[])value);
    } else if (value instanceof Object[]) {
      return Arrays.asList((Object[])value);
    }
    throw new TypeMismatchException(describe(value) + " is not a list");
  }

  public static List<Literal> toLiterals(List<?> values) {
    List<Literal> res = new ArrayList<Literal>(values.size());
    for (Object v: values) {
      res.add(toLiteral(v));
    }
    return res;
  }

  /**
   * Type of an array declared from host values: bool if all are booleans,
   * fixed if any is a double, otherwise int.
   */
  public static VarType inferArrayType(List<?> values) {
    if (values.isEmpty()) {
      throw new InvalidDeclarationException("values cannot be empty");
    }
    boolean anyBool = false;
    boolean anyNumber = false;
    boolean anyFixed = false;
    for (Object v: values) {
      VarType t = VarType.ofHostValue(v);
      if (t == VarType.BOOL) {
        anyBool = true;
      } else {
        anyNumber = true;
        anyFixed = anyFixed || t == VarType.FIXED;
      }
    }
    if (anyBool && anyNumber) {
      throw new TypeMismatchException(
          "values can not contain both bool and number values");
    }
    if (anyBool) {
      return VarType.BOOL;
    }
    return anyFixed ? VarType.FIXED : VarType.INT;
  }

  static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    return "value " + value + " of type " + value.getClass().getSimpleName();
  }
}
