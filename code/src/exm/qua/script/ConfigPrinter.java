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
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.common.primitives.Booleans;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Floats;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

import exm.qua.common.exceptions.ConfigSerializationException;

/**
 * Pretty prints a configuration value as a script literal.
 *
 * Maps print one entry per line, as do lists holding maps or lists.
 * Lists of scalars print on one line, with runs of a repeated value
 * compacted:
 * <pre>
 *   [0.0, 0.0, 0.0, 0.0, 0.0, 0.1, 0.2]  =>  [0.0] * 5 + [0.1, 0.2]
 * </pre>
 */
public class ConfigPrinter {

  public static final int MAX_DEPTH = 100;

  private final int indentWidth;

  /** Shortest run compacted */
  private final int minRun;

  public ConfigPrinter(int indentWidth, int minRun) {
    this.indentWidth = indentWidth;
    this.minRun = minRun;
  }

  public String print(Object value) throws ConfigSerializationException {
    StringBuilder sb = new StringBuilder();
    print(value, 0, sb);
    return sb.toString();
  }

  private void print(Object value, int depth, StringBuilder sb)
      throws ConfigSerializationException {
    if (depth > MAX_DEPTH) {
      throw new ConfigSerializationException("configuration nested deeper "
                                             + "than " + MAX_DEPTH + " levels");
    }
    if (value instanceof Map) {
      printMap((Map<?, ?>)value, depth, sb);
    } else if (isList(value)) {
      printList(toList(value), depth, sb);
    } else {
      sb.append(scalar(value));
    }
  }

  private void printMap(Map<?, ?> map, int depth, StringBuilder sb)
      throws ConfigSerializationException {
    if (map.isEmpty()) {
      sb.append("{}");
      return;
    }
    sb.append("{\n");
    for (Map.Entry<?, ?> e: map.entrySet()) {
      indent(depth + 1, sb);
      sb.append(key(e.getKey())).append(": ");
      print(e.getValue(), depth + 1, sb);
      sb.append(",\n");
    }
    indent(depth, sb);
    sb.append("}");
  }

  private void printList(List<?> list, int depth, StringBuilder sb)
      throws ConfigSerializationException {
    if (list.isEmpty()) {
      sb.append("[]");
      return;
    }
    boolean nested = false;
    for (Object item: list) {
      if (item instanceof Map || isList(item)) {
        nested = true;
        break;
      }
    }
    if (!nested) {
      List<String> items = new ArrayList<String>(list.size());
      for (Object item: list) {
        items.add(scalar(item));
      }
      sb.append(compact(items));
      return;
    }
    sb.append("[\n");
    for (Object item: list) {
      indent(depth + 1, sb);
      print(item, depth + 1, sb);
      sb.append(",\n");
    }
    indent(depth, sb);
    sb.append("]");
  }

  /**
   * Join items into [v] * n runs and plain [a, b] segments
   */
  String compact(List<String> items) {
    if (items.size() > 1 && allSame(items)) {
      return "[" + items.get(0) + "] * " + items.size();
    }
    List<String> segments = new ArrayList<String>();
    List<String> pending = new ArrayList<String>();
    int i = 0;
    while (i < items.size()) {
      int end = i + 1;
      while (end < items.size() && items.get(end).equals(items.get(i))) {
        end++;
      }
      int run = end - i;
      if (run >= minRun) {
        if (!pending.isEmpty()) {
          segments.add("[" + StringUtils.join(pending, ", ") + "]");
          pending.clear();
        }
        segments.add("[" + items.get(i) + "] * " + run);
      } else {
        pending.addAll(items.subList(i, end));
      }
      i = end;
    }
    if (!pending.isEmpty()) {
      segments.add("[" + StringUtils.join(pending, ", ") + "]");
    }
    return StringUtils.join(segments, " + ");
  }

  private static boolean allSame(List<String> items) {
    for (String item: items) {
      if (!item.equals(items.get(0))) {
        return false;
      }
    }
    return true;
  }

  private static String key(Object key) throws ConfigSerializationException {
    if (key instanceof String) {
      return ScriptStrings.quote((String)key);
    } else if (key instanceof Number || key instanceof Boolean) {
      return scalar(key);
    }
    throw new ConfigSerializationException("can not serialize " +
                                           "configuration key " + key);
  }

  private static String scalar(Object value)
      throws ConfigSerializationException {
    if (value == null) {
      return "null";
    } else if (value instanceof String) {
      return ScriptStrings.quote((String)value);
    } else if (value instanceof Boolean) {
      return value.toString();
    } else if (value instanceof Integer || value instanceof Long ||
               value instanceof Short || value instanceof Byte) {
      return Long.toString(((Number)value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number)value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new ConfigSerializationException("can not serialize " +
                                               "non-finite number " + d);
      }
      return Double.toString(d);
    }
    throw new ConfigSerializationException("can not serialize " +
        "configuration value " + value + " of type " +
        value.getClass().getName());
  }

  private static boolean isList(Object value) {
    return value instanceof List || value instanceof Object[] ||
        value instanceof int[] || value instanceof long[] ||
        value instanceof double[] || value instanceof float[] ||
        value instanceof boolean[];
  }

  private static List<?> toList(Object value) {
    if (value instanceof List) {
      return (List<?>)value;
    } else if (value instanceof Object[]) {
      return Arrays.asList((Object[])value);
    } else if (value instanceof int[]) {
      return Ints.asList((int[])value);
    } else if (value instanceof long[]) {
      return Longs.asList((long[])value);
    } else if (value instanceof double[]) {
      return Doubles.asList((double[])value);
    } else if (value instanceof float[]) {
      return Floats.asList((float[])value);
    }
    return Booleans.asList((boolean[])value);
  }

  private void indent(int depth, StringBuilder sb) {
    sb.append(StringUtils.repeat(' ', depth * indentWidth));
  }
}
