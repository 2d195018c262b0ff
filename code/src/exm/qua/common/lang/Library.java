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

package exm.qua.common.lang;

import com.google.common.collect.ImmutableSet;

import exm.qua.common.exceptions.TypeMismatchException;

/**
 * Library function namespaces available to QUA expressions.
 * The IR name is what the controller sees, the script name is
 * how the namespace is written in generated scripts.
 */
public enum Library {
  MATH("math", "Math", ImmutableSet.of(
      "log", "pow", "div", "exp", "pow2", "ln", "log2", "log10", "sqrt",
      "inv_sqrt", "inv", "msb", "elu", "aelu", "selu", "relu", "plrelu",
      "lrelu", "sin2pi", "cos2pi", "abs", "sin", "cos", "sum", "max", "min",
      "argmax", "argmin", "dot")),
  CAST("cast", "Cast", ImmutableSet.of(
      "mul_int_by_fixed", "mul_fixed_by_int", "to_int", "to_fixed",
      "to_bool", "unsafe_cast_int", "unsafe_cast_fixed", "unsafe_cast_bool")),
  UTIL("util", "Util", ImmutableSet.of("cond")),
  RANDOM("random", "Random", ImmutableSet.of("rand_int", "rand_fixed"));

  private final String irName;
  private final String scriptName;
  private final ImmutableSet<String> functions;

  private Library(String irName, String scriptName,
                  ImmutableSet<String> functions) {
    this.irName = irName;
    this.scriptName = scriptName;
    this.functions = functions;
  }

  public String irName() {
    return irName;
  }

  public String scriptName() {
    return scriptName;
  }

  public boolean hasFunction(String function) {
    return functions.contains(function);
  }

  public void checkFunction(String function) {
    if (!hasFunction(function)) {
      throw new TypeMismatchException("library " + irName +
                                      " has no function " + function);
    }
  }

  public static Library fromScriptName(String name) {
    for (Library l: values()) {
      if (l.scriptName.equals(name)) {
        return l;
      }
    }
    return null;
  }
}
