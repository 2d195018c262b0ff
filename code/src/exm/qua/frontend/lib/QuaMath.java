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

package exm.qua.frontend.lib;

import exm.qua.common.lang.Library;
import exm.qua.frontend.QuaBuilder;
import exm.qua.frontend.QuaExpression;

/**
 * Math library functions.  Arguments are QUA expressions or host
 * values; host lists are declared as arrays first.
 */
public class QuaMath {

  private final QuaBuilder builder;

  public QuaMath(QuaBuilder builder) {
    this.builder = builder;
  }

  /** Logarithm of x in base */
  public QuaExpression log(Object x, Object base) {
    return builder.callLibraryFunction(Library.MATH, "log", x, base);
  }

  /** base raised to x */
  public QuaExpression pow(Object base, Object x) {
    return builder.callLibraryFunction(Library.MATH, "pow", base, x);
  }

  /** x / y computed by the math library */
  public QuaExpression div(Object x, Object y) {
    return builder.callLibraryFunction(Library.MATH, "div", x, y);
  }

  public QuaExpression exp(Object x) {
    return builder.callLibraryFunction(Library.MATH, "exp", x);
  }

  public QuaExpression pow2(Object x) {
    return builder.callLibraryFunction(Library.MATH, "pow2", x);
  }

  public QuaExpression ln(Object x) {
    return builder.callLibraryFunction(Library.MATH, "ln", x);
  }

  public QuaExpression log2(Object x) {
    return builder.callLibraryFunction(Library.MATH, "log2", x);
  }

  public QuaExpression log10(Object x) {
    return builder.callLibraryFunction(Library.MATH, "log10", x);
  }

  public QuaExpression sqrt(Object x) {
    return builder.callLibraryFunction(Library.MATH, "sqrt", x);
  }

  public QuaExpression invSqrt(Object x) {
    return builder.callLibraryFunction(Library.MATH, "inv_sqrt", x);
  }

  public QuaExpression inv(Object x) {
    return builder.callLibraryFunction(Library.MATH, "inv", x);
  }

  /** Index of the most significant bit */
  public QuaExpression msb(Object x) {
    return builder.callLibraryFunction(Library.MATH, "msb", x);
  }

  public QuaExpression elu(Object x) {
    return builder.callLibraryFunction(Library.MATH, "elu", x);
  }

  public QuaExpression aelu(Object x) {
    return builder.callLibraryFunction(Library.MATH, "aelu", x);
  }

  public QuaExpression selu(Object x) {
    return builder.callLibraryFunction(Library.MATH, "selu", x);
  }

  public QuaExpression relu(Object x) {
    return builder.callLibraryFunction(Library.MATH, "relu", x);
  }

  /** Parametric leaky ReLU with slope a */
  public QuaExpression plrelu(Object x, Object a) {
    return builder.callLibraryFunction(Library.MATH, "plrelu", x, a);
  }

  public QuaExpression lrelu(Object x) {
    return builder.callLibraryFunction(Library.MATH, "lrelu", x);
  }

  /** sin(2 pi x) */
  public QuaExpression sin2pi(Object x) {
    return builder.callLibraryFunction(Library.MATH, "sin2pi", x);
  }

  /** cos(2 pi x) */
  public QuaExpression cos2pi(Object x) {
    return builder.callLibraryFunction(Library.MATH, "cos2pi", x);
  }

  public QuaExpression abs(Object x) {
    return builder.callLibraryFunction(Library.MATH, "abs", x);
  }

  public QuaExpression sin(Object x) {
    return builder.callLibraryFunction(Library.MATH, "sin", x);
  }

  public QuaExpression cos(Object x) {
    return builder.callLibraryFunction(Library.MATH, "cos", x);
  }

  /** Sum of an array */
  public QuaExpression sum(Object x) {
    return builder.callLibraryFunction(Library.MATH, "sum", x);
  }

  /** Largest element of an array */
  public QuaExpression max(Object x) {
    return builder.callLibraryFunction(Library.MATH, "max", x);
  }

  /** Smallest element of an array */
  public QuaExpression min(Object x) {
    return builder.callLibraryFunction(Library.MATH, "min", x);
  }

  /** Index of the largest element */
  public QuaExpression argmax(Object x) {
    return builder.callLibraryFunction(Library.MATH, "argmax", x);
  }

  /** Index of the smallest element */
  public QuaExpression argmin(Object x) {
    return builder.callLibraryFunction(Library.MATH, "argmin", x);
  }

  /** Dot product of two arrays */
  public QuaExpression dot(Object x, Object y) {
    return builder.callLibraryFunction(Library.MATH, "dot", x, y);
  }
}
