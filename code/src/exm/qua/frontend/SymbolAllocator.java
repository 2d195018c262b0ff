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

import java.util.EnumMap;
import java.util.Map;

/**
 * Unique names for one program under construction.  Each kind of symbol
 * has its own counter; counters only increase.
 */
public class SymbolAllocator {

  public static enum SymbolKind {
    SCALAR("v"),
    ARRAY("a"),
    STREAM("r");

    private final String prefix;

    private SymbolKind(String prefix) {
      this.prefix = prefix;
    }

    public String prefix() {
      return prefix;
    }
  }

  /** Prefix marking streams of raw ADC samples */
  public static final String ADC_TRACE_PREFIX = "atr_";

  private final Map<SymbolKind, Integer> counters =
                    new EnumMap<SymbolKind, Integer>(SymbolKind.class);

  private int next(SymbolKind kind) {
    Integer count = counters.get(kind);
    int next = (count == null ? 0 : count) + 1;
    counters.put(kind, next);
    return next;
  }

  public String nextScalar() {
    return SymbolKind.SCALAR.prefix() + next(SymbolKind.SCALAR);
  }

  public String nextArray() {
    return SymbolKind.ARRAY.prefix() + next(SymbolKind.ARRAY);
  }

  public String nextStream(boolean adcTrace) {
    String name = SymbolKind.STREAM.prefix() + next(SymbolKind.STREAM);
    return adcTrace ? ADC_TRACE_PREFIX + name : name;
  }

  /**
   * @return number of names allocated so far of kind
   */
  public int count(SymbolKind kind) {
    Integer count = counters.get(kind);
    return count == null ? 0 : count;
  }
}
