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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableMap;

import exm.qua.common.exceptions.QuaRuntimeError;
import exm.qua.frontend.stream.StreamFunctions;
import exm.qua.frontend.stream.TimestampMode;
import exm.qua.ir.stream.ResultAnalysis;
import exm.qua.ir.stream.StreamToken;

/**
 * Renders stream processing token arrays back into the fluent form
 * they were built with, e.g.
 * <pre>
 *   ["saveAll", "avg", ["average", ["buffer", "10", ["@re", "0", "r1"]]]]
 * </pre>
 * becomes
 * <pre>
 *   r1.buffer(10).average().save_all("avg")
 * </pre>
 * Any token shape not produced by the stream API is an internal error.
 */
public class StreamRenderer {

  private static final String SOURCE = "@re";
  private static final String MACRO_INPUT = "@macro_input";
  private static final String MACRO_AUTO_RESHAPE = "@macro_auto_reshape";
  private static final String MACRO_ADC_TRACE = "@macro_adc_trace";

  /** Stream method for each arithmetic token */
  private static final ImmutableMap<String, String> ARITHMETIC =
      ImmutableMap.of("+", "add", "-", "subtract", "*", "multiply",
                      "/", "divide");

  private StreamRenderer() {
  }

  /**
   * Render a terminal as a statement
   */
  public static String renderTerminal(StreamToken.Array terminal) {
    String head = terminal.head();
    String method;
    if (head.equals(ResultAnalysis.SAVE)) {
      method = "save";
    } else if (head.equals(ResultAnalysis.SAVE_ALL)) {
      method = "save_all";
    } else {
      throw unknown(terminal);
    }
    return renderPipeline(ResultAnalysis.pipelineOf(terminal)) + "." +
        method + "(" + ScriptStrings.quote(ResultAnalysis.tagOf(terminal)) +
        ")";
  }

  public static String renderPipeline(StreamToken token) {
    StreamToken.Array arr = token.asArray();
    String head = arr.head();
    if (head.equals(SOURCE) || head.equals(MACRO_INPUT) ||
        head.equals(MACRO_AUTO_RESHAPE) || head.equals(MACRO_ADC_TRACE)) {
      return renderSource(arr);
    } else if (ARITHMETIC.containsKey(head)) {
      checkSize(arr, 3);
      return "(" + renderPipeline(arr.get(1)) + "." + ARITHMETIC.get(head) +
             "(" + renderOperand(arr.get(2)) + "))";
    }

    String input = renderPipeline(arr.last());
    List<StreamToken> args = arr.items().subList(1, arr.size() - 1);
    if (head.equals("average") || head.equals("flatten")) {
      checkSize(arr, 2);
      return input + "." + head + "()";
    } else if (head.equals("buffer")) {
      if (args.isEmpty()) {
        throw unknown(arr);
      }
      return input + ".buffer(" + joinAtoms(args) + ")";
    } else if (head.equals("bufferAndSkip")) {
      checkSize(arr, 4);
      return input + ".buffer_and_skip(" + joinAtoms(args) + ")";
    } else if (head.equals("skip") || head.equals("take")) {
      checkSize(arr, 3);
      return input + "." + head + "(" + joinAtoms(args) + ")";
    } else if (head.equals("skipLast")) {
      checkSize(arr, 3);
      return input + ".skip_last(" + joinAtoms(args) + ")";
    } else if (head.equals("map")) {
      checkSize(arr, 3);
      return input + ".map(" + renderFunction(arr.get(1).asArray()) + ")";
    } else if (head.equals("histogram")) {
      checkSize(arr, 3);
      StreamToken.Array bins = arr.get(1).asArray();
      checkArray(bins);
      List<String> rendered = new ArrayList<String>();
      for (StreamToken bin: bins.items().subList(1, bins.size())) {
        rendered.add(renderNumbers(bin.asArray()));
      }
      return input + ".histogram([" + StringUtils.join(rendered, ", ") +
             "])";
    } else if (head.equals("zip")) {
      checkSize(arr, 3);
      return input + ".zip(" + renderPipeline(arr.get(1)) + ")";
    }
    throw unknown(arr);
  }

  /**
   * Stream name followed by its modifiers.  The adc trace flag is part of
   * the stream declaration and renders nothing here.
   */
  private static String renderSource(StreamToken.Array token) {
    String input = "";
    boolean autoReshape = false;
    StreamToken.Array arr = token;
    while (!arr.head().equals(SOURCE)) {
      if (arr.head().equals(MACRO_INPUT)) {
        checkSize(arr, 3);
        input = ".input" + arr.get(1).asAtom().value() + "()";
      } else if (arr.head().equals(MACRO_AUTO_RESHAPE)) {
        checkSize(arr, 2);
        autoReshape = true;
      } else if (arr.head().equals(MACRO_ADC_TRACE)) {
        checkSize(arr, 2);
      } else {
        throw unknown(arr);
      }
      arr = arr.last().asArray();
    }
    checkSize(arr, 3);
    StringBuilder sb = new StringBuilder();
    sb.append(arr.get(2).asAtom().value());
    sb.append(input);
    if (autoReshape) {
      sb.append(".auto_reshape()");
    }
    TimestampMode mode;
    try {
      mode = TimestampMode.fromCode(
                  Integer.parseInt(arr.get(1).asAtom().value()));
    } catch (IllegalArgumentException e) {
      throw new QuaRuntimeError("bad stream source " + token, e);
    }
    if (mode == TimestampMode.TIMESTAMPS) {
      sb.append(".timestamps()");
    } else if (mode == TimestampMode.VALUES_AND_TIMESTAMPS) {
      sb.append(".with_timestamps()");
    }
    return sb.toString();
  }

  /**
   * Right hand side of stream arithmetic: a stream, a number or a vector
   */
  private static String renderOperand(StreamToken token) {
    if (token.isAtom()) {
      return token.asAtom().value();
    }
    StreamToken.Array arr = token.asArray();
    if (arr.head().equals(StreamFunctions.ARRAY)) {
      return renderNumbers(arr);
    }
    return renderPipeline(arr);
  }

  /**
   * Inverse of the factories in {@link StreamFunctions}
   */
  public static String renderFunction(StreamToken.Array fn) {
    String head = fn.head();
    String call;
    if (head.equals("average")) {
      if (fn.size() == 1) {
        call = "average()";
      } else if (fn.get(1).isAtom()) {
        checkSize(fn, 2);
        call = "average(" + fn.get(1).asAtom().value() + ")";
      } else {
        checkSize(fn, 2);
        call = "average(" + renderNumbers(fn.get(1).asArray()) + ")";
      }
    } else if (head.equals("dot")) {
      if (fn.size() == 1) {
        call = "tuple_dot_product()";
      } else {
        checkSize(fn, 2);
        call = "dot_product(" + renderNumbers(fn.get(1).asArray()) + ")";
      }
    } else if (head.equals("smult")) {
      checkSize(fn, 2);
      call = "multiply_by(" + fn.get(1).asAtom().value() + ")";
    } else if (head.equals("vmult")) {
      checkSize(fn, 2);
      call = "multiply_by(" + renderNumbers(fn.get(1).asArray()) + ")";
    } else if (head.equals("tmult")) {
      checkSize(fn, 1);
      call = "tuple_multiply()";
    } else if (head.equals("conv")) {
      String mode = ScriptStrings.quote(fn.get(1).asAtom().value());
      if (fn.size() == 2) {
        call = "tuple_convolution(" + mode + ")";
      } else {
        checkSize(fn, 3);
        call = "convolution(" + renderNumbers(fn.get(2).asArray()) + ", " +
               mode + ")";
      }
    } else if (head.equals("fft")) {
      if (fn.size() == 1) {
        call = "fft()";
      } else {
        checkSize(fn, 2);
        call = "fft(" + ScriptStrings.quote(fn.get(1).asAtom().value()) + ")";
      }
    } else if (head.equals("booleancast")) {
      checkSize(fn, 1);
      call = "boolean_to_int()";
    } else if (head.equals("demod")) {
      if (fn.size() != 4 && fn.size() != 5) {
        throw unknown(fn);
      }
      StringBuilder sb = new StringBuilder("demod(");
      sb.append(fn.get(1).asAtom().value());
      for (int i = 2; i < 4; i++) {
        sb.append(", ").append(renderOperand(fn.get(i)));
      }
      if (fn.size() == 5) {
        sb.append(", ");
        sb.append(fn.get(4).asAtom().value().equals("1") ? "true" : "false");
      }
      sb.append(")");
      call = sb.toString();
    } else {
      throw unknown(fn);
    }
    return "FUNCTIONS." + call;
  }

  /**
   * ["@array", "1", "2"] as [1, 2]
   */
  private static String renderNumbers(StreamToken.Array arr) {
    checkArray(arr);
    return "[" + joinAtoms(arr.items().subList(1, arr.size())) + "]";
  }

  private static String joinAtoms(List<StreamToken> atoms) {
    List<String> values = new ArrayList<String>(atoms.size());
    for (StreamToken atom: atoms) {
      values.add(atom.asAtom().value());
    }
    return StringUtils.join(values, ", ");
  }

  private static void checkArray(StreamToken.Array arr) {
    if (!arr.head().equals(StreamFunctions.ARRAY)) {
      throw unknown(arr);
    }
  }

  private static void checkSize(StreamToken.Array arr, int size) {
    if (arr.size() != size) {
      throw unknown(arr);
    }
  }

  private static QuaRuntimeError unknown(StreamToken token) {
    return new QuaRuntimeError("Can not render stream expression: " + token);
  }
}
