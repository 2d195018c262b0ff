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

import java.util.HashMap;
import java.util.Map;

import exm.qua.common.exceptions.TypeMismatchException;

public class Operators {

  /**
   * Binary operators of the expression model.  Unary negation and
   * inversion are built from these.
   */
  public static enum BinaryOp {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"),
    OR("|"), AND("&"), XOR("^"),
    LT("<"), LE("<="), GT(">"), GE(">="), EQ("=="),
    SHL("<<"), SHR(">>");

    private final String symbol;

    private BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    public boolean isComparison() {
      return this == LT || this == LE || this == GT || this == GE ||
             this == EQ;
    }
  }

  private static final Map<String, BinaryOp> bySymbol =
                                        new HashMap<String, BinaryOp>();

  static {
    for (BinaryOp op: BinaryOp.values()) {
      bySymbol.put(op.symbol(), op);
    }
  }

  public static BinaryOp fromSymbol(String symbol) {
    BinaryOp op = bySymbol.get(symbol);
    if (op == null) {
      throw new TypeMismatchException("unsupported operator: " + symbol);
    }
    return op;
  }

  public static boolean isBinarySymbol(String symbol) {
    return bySymbol.containsKey(symbol);
  }
}
